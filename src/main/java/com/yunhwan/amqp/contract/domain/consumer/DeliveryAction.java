package com.yunhwan.amqp.contract.domain.consumer;

import java.time.Duration;

/**
 * 브로커에 돌려줄 처리 결정.
 */
public record DeliveryAction(
        Outcome outcome,
        int nextRetryCount,
        Duration delay,
        String reason,
        String lastError
) {
    public enum Outcome { ACK, RETRY, DEAD_LETTER }

    public static final String REASON_VALIDATION_FAILED = "validation failed";
    public static final String REASON_NON_RETRYABLE = "non-retryable error";
    public static final String REASON_MAX_ATTEMPTS = "max attempts exceeded";

    private static final DeliveryAction ACK = new DeliveryAction(Outcome.ACK, 0, Duration.ZERO, null, null);

    public static DeliveryAction ofAck() {
        return ACK;
    }

    public static DeliveryAction ofRetry(int nextRetryCount, Duration delay, String lastError) {
        return new DeliveryAction(Outcome.RETRY, nextRetryCount, delay, null, lastError);
    }

    public static DeliveryAction ofDeadLetter(String reason, String lastError) {
        return new DeliveryAction(Outcome.DEAD_LETTER, 0, Duration.ZERO, reason, lastError);
    }

    public boolean isAck() { return outcome == Outcome.ACK; }
    public boolean isRetry() { return outcome == Outcome.RETRY; }
    public boolean isDeadLetter() { return outcome == Outcome.DEAD_LETTER; }
}
