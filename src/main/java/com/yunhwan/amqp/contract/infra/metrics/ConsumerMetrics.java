package com.yunhwan.amqp.contract.infra.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * consumer 처리 결과 카운터.
 * 태그는 consumer/queue + 고정 값만 사용한다.
 */
@RequiredArgsConstructor
public class ConsumerMetrics {

    private final MeterRegistry meterRegistry;

    public void consumed(String consumer, String queue, String result) {
        // consume_rate 집계용(성공/재시도/DLQ/requeue)
        Counter.builder(MetricsConfig.METRIC_CONSUME)
                .tag(MetricsConfig.TAG_CONSUMER, consumer)
                .tag(MetricsConfig.TAG_QUEUE, queue)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry)
                .increment();
    }

    public void retryEnqueued(String consumer, String queue, int nextRetryCount) {
        Counter.builder(MetricsConfig.METRIC_RETRY_ENQUEUE)
                .tag(MetricsConfig.TAG_CONSUMER, consumer)
                .tag(MetricsConfig.TAG_QUEUE, queue)
                .tag(MetricsConfig.TAG_RETRY_BUCKET, MetricTags.retryBucket(nextRetryCount))
                .register(meterRegistry)
                .increment();
    }

    public void deadLettered(String consumer, String queue, String reason) {
        Counter.builder(MetricsConfig.METRIC_DLQ)
                .tag(MetricsConfig.TAG_CONSUMER, consumer)
                .tag(MetricsConfig.TAG_QUEUE, queue)
                .tag(MetricsConfig.TAG_REASON, MetricTags.deadReason(reason))
                .register(meterRegistry)
                .increment();
    }

    public void batchFlushed(String consumer, String queue, String trigger) {
        Counter.builder(MetricsConfig.METRIC_BATCH)
                .tag(MetricsConfig.TAG_CONSUMER, consumer)
                .tag(MetricsConfig.TAG_QUEUE, queue)
                .tag(MetricsConfig.TAG_TRIGGER, trigger)
                .register(meterRegistry)
                .increment();
    }

    public void consumerCancelled(String consumer, String queue) {
        Counter.builder(MetricsConfig.METRIC_CONSUMER_CANCELLED)
                .tag(MetricsConfig.TAG_CONSUMER, consumer)
                .tag(MetricsConfig.TAG_QUEUE, queue)
                .register(meterRegistry)
                .increment();
    }
}
