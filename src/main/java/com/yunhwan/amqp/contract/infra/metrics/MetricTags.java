package com.yunhwan.amqp.contract.infra.metrics;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;

public final class MetricTags {

    private MetricTags() {}

    // 재시도 횟수는 1/2/3+만 유지(저카디널리티)
    public static String retryBucket(int retryCount) {
        if (retryCount <= 1) return MetricsConfig.RETRY_BUCKET_1;
        if (retryCount == 2) return MetricsConfig.RETRY_BUCKET_2;
        return MetricsConfig.RETRY_BUCKET_3PLUS;
    }

    public static String deadReason(String reason) {
        if (reason == null) return MetricsConfig.REASON_UNKNOWN;
        return switch (reason) {
            case DeliveryAction.REASON_VALIDATION_FAILED -> MetricsConfig.REASON_VALIDATION;
            case DeliveryAction.REASON_NON_RETRYABLE -> MetricsConfig.REASON_NON_RETRYABLE;
            case DeliveryAction.REASON_MAX_ATTEMPTS -> MetricsConfig.REASON_MAX_ATTEMPTS;
            default -> MetricsConfig.REASON_UNKNOWN;
        };
    }
}
