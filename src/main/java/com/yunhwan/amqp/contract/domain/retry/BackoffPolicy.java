package com.yunhwan.amqp.contract.domain.retry;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;

import java.time.Duration;

/**
 * 재시도 간격 계산 설정.
 *
 * @param type            fixed | exponential
 * @param initialInterval 첫 재시도 간격 (기본 1000ms)
 * @param maxInterval     간격 상한 (기본 60000ms)
 * @param coefficient     exponential 배수 (기본 2, exponential이면 1보다 커야 함)
 */
public record BackoffPolicy(
        BackoffType type,
        Duration initialInterval,
        Duration maxInterval,
        double coefficient
) {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(1_000);
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMillis(60_000);
    public static final double DEFAULT_COEFFICIENT = 2.0;

    public BackoffPolicy {
        type = type == null ? BackoffType.FIXED : type;
        initialInterval = initialInterval == null ? DEFAULT_INITIAL_INTERVAL : initialInterval;
        maxInterval = maxInterval == null ? DEFAULT_MAX_INTERVAL : maxInterval;
        coefficient = coefficient == 0 ? DEFAULT_COEFFICIENT : coefficient;
    }

    public static BackoffPolicy fixed(Duration interval) {
        return new BackoffPolicy(BackoffType.FIXED, interval, null, DEFAULT_COEFFICIENT);
    }

    public static BackoffPolicy exponential(Duration initialInterval, Duration maxInterval, double coefficient) {
        return new BackoffPolicy(BackoffType.EXPONENTIAL, initialInterval, maxInterval, coefficient);
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(BackoffType.FIXED, null, null, DEFAULT_COEFFICIENT);
    }

    public void validate() {
        if (initialInterval.isNegative()) {
            throw new ConsumerConfigurationException("Invalid backoff initialInterval: must not be negative");
        }
        if (maxInterval.isNegative()) {
            throw new ConsumerConfigurationException("Invalid backoff maxInterval: must not be negative");
        }
        if (type == BackoffType.EXPONENTIAL && !(coefficient > 1.0)) {
            throw new ConsumerConfigurationException(
                    "Invalid backoff coefficient: " + coefficient + ". Exponential backoff requires a coefficient greater than 1");
        }
    }
}
