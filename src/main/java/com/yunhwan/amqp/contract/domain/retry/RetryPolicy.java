package com.yunhwan.amqp.contract.domain.retry;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;

/**
 * consumer 단위 재시도 정책.
 * <p>
 * maxAttempts는 최초 전달을 포함한 총 처리 시도 횟수이며, null이면 무제한이다.
 * 정책 자체가 없는 경우(legacy 모드)는 {@link RetryMode#LEGACY_UNBOUNDED}로 별도 취급한다.
 */
public record RetryPolicy(Integer maxAttempts, BackoffPolicy backoff, boolean jitter) {

    public RetryPolicy {
        backoff = backoff == null ? BackoffPolicy.defaults() : backoff;
    }

    public static RetryPolicy of(int maxAttempts, BackoffPolicy backoff) {
        return new RetryPolicy(maxAttempts, backoff, false);
    }

    public static RetryPolicy unbounded(BackoffPolicy backoff) {
        return new RetryPolicy(null, backoff, false);
    }

    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(maxAttempts, backoff, jitter);
    }

    public boolean isBounded() {
        return maxAttempts != null;
    }

    public RetryPolicy validate() {
        if (maxAttempts != null && maxAttempts < 1) {
            throw new ConsumerConfigurationException(
                    "Invalid maxAttempts: " + maxAttempts + ". Must be a positive integer.");
        }
        backoff.validate();
        return this;
    }
}
