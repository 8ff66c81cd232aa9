package com.yunhwan.amqp.contract.domain.retry;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay, RetryMode mode) {

    public static RetryDecision retryAfter(Duration delay, RetryMode mode) {
        return new RetryDecision(true, delay, mode);
    }

    public static RetryDecision giveUp(RetryMode mode) {
        return new RetryDecision(false, Duration.ZERO, mode);
    }
}
