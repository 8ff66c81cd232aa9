package com.yunhwan.amqp.contract.domain.topology;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * 큐 선언 정보.
 * <p>
 * 기본값은 durable quorum 큐이며, deadLetter가 있고 ttlBackoffRetry가 켜져 있으면
 * {@link Topology}에 추가될 때 TTL-backoff 재시도 인프라(wait 큐 + 바인딩 2개)가 함께 붙는다.
 */
@Value
@Builder(toBuilder = true)
public class QueueDefinition {

    String name;

    @Builder.Default
    QueueType type = QueueType.QUORUM;

    @Builder.Default
    boolean durable = true;

    boolean exclusive;

    boolean autoDelete;

    DeadLetterConfig deadLetter;

    /** x-message-ttl (큐 단위 TTL) */
    Duration messageTtl;

    /** x-delivery-limit, quorum 큐 전용 */
    Integer deliveryLimit;

    /** x-max-priority, classic 큐 전용 */
    Integer maxPriority;

    @Singular
    Map<String, Object> arguments;

    @Builder.Default
    boolean ttlBackoffRetry = true;

    /** consumer에 정책이 없을 때 사용하는 큐 단위 retry policy */
    RetryPolicy retryPolicy;

    public static QueueDefinition of(String name) {
        return QueueDefinition.builder().name(name).build();
    }

    public boolean hasDeadLetterExchange() {
        return deadLetter != null;
    }

    public boolean usesTtlBackoff() {
        return ttlBackoffRetry && deadLetter != null;
    }

    public QueueDefinition validate() {
        if (name == null || name.isBlank()) {
            throw new ConsumerConfigurationException("Queue name must not be blank");
        }
        if (type == QueueType.QUORUM) {
            if (!durable) {
                throw new ConsumerConfigurationException(
                        "Queue \"" + name + "\" is a quorum queue and cannot be non-durable. Use type CLASSIC.");
            }
            if (exclusive) {
                throw new ConsumerConfigurationException(
                        "Queue \"" + name + "\" is a quorum queue and cannot be exclusive. Use type CLASSIC.");
            }
            if (maxPriority != null) {
                throw new ConsumerConfigurationException(
                        "Queue \"" + name + "\" sets maxPriority, which is only supported by classic queues.");
            }
        }
        if (type == QueueType.CLASSIC && deliveryLimit != null) {
            throw new ConsumerConfigurationException(
                    "Queue \"" + name + "\" sets deliveryLimit, which is only supported by quorum queues.");
        }
        if (deliveryLimit != null && deliveryLimit < 1) {
            throw new ConsumerConfigurationException(
                    "Invalid deliveryLimit: " + deliveryLimit + ". Must be a positive integer.");
        }
        if (maxPriority != null && (maxPriority < 1 || maxPriority > 255)) {
            throw new ConsumerConfigurationException(
                    "Invalid maxPriority: " + maxPriority + ". Must be between 1 and 255. Recommended range: 1-10.");
        }
        if (messageTtl != null && messageTtl.isNegative()) {
            throw new ConsumerConfigurationException(
                    "Invalid messageTtl for queue \"" + name + "\": must not be negative");
        }
        if (retryPolicy != null) {
            retryPolicy.validate();
        }
        return this;
    }
}
