package com.yunhwan.amqp.contract.infra.logging;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

/**
 * 운영자가 DLQ/재시도 흐름을 추적할 수 있도록 구조화 이벤트 로그를 남긴다.
 */
@Slf4j
@RequiredArgsConstructor
public class ConsumerEventLogger {

    private final Clock clock;

    public void retryScheduled(String consumer, String queue, DeliveryEnvelope envelope, DeliveryAction action) {
        Map<String, Object> evt = createBaseEvent("consumer.retry_scheduled", consumer, queue, envelope);
        evt.put("retry", mapOfNonNull(
                "next_retry_count", action.nextRetryCount(),
                "delay_ms", action.delay() == null ? null : action.delay().toMillis(),
                "last_error", action.lastError()
        ));

        log.info("consumer_event {}", entries(evt));
    }

    public void deadLettered(String consumer, String queue, DeliveryEnvelope envelope, DeliveryAction action) {
        Map<String, Object> evt = createBaseEvent("consumer.dead_lettered", consumer, queue, envelope);
        evt.put("dead_letter", mapOfNonNull(
                "reason", action.reason(),
                "retry_count", envelope.retryCount(),
                "last_error", action.lastError()
        ));

        log.warn("consumer_event {}", entries(evt));
    }

    public void consumerCancelled(String consumer, String queue, String consumerTag) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", "consumer.cancelled");
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("consumer", consumer);
        evt.put("queue", queue);
        if (consumerTag != null) evt.put("consumer_tag", consumerTag);

        log.warn("consumer_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, String consumer, String queue, DeliveryEnvelope envelope) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("consumer", consumer);
        evt.put("queue", queue);
        evt.put("message", mapOfNonNull(
                "message_id", envelope.messageId(),
                "correlation_id", envelope.correlationId(),
                "routing_key", envelope.routingKey(),
                "delivery_tag", envelope.deliveryTag()
        ));
        return evt;
    }

    /**
     * Null-safe map builder (null 값은 put하지 않는다).
     */
    private Map<String, Object> mapOfNonNull(Object... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("kv length must be even. length=" + kv.length);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object k = kv[i];
            Object v = kv[i + 1];
            if (k == null) {
                throw new IllegalArgumentException("key must not be null");
            }
            if (v != null) {
                m.put(String.valueOf(k), v);
            }
        }
        return m;
    }
}
