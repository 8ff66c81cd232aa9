package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.usecase.consumer.port.PayloadValidator;
import lombok.Builder;

import java.time.Duration;

/**
 * consumer 선언.
 * <p>
 * batchSize가 있으면 배치 모드. batchTimeout은 batchSize 없이 쓸 수 없고 둘 다 양수여야 한다.
 * retryPolicy가 없으면 큐의 retryPolicy를, 그것도 없으면 legacy(무한 재시도) 모드를 쓴다.
 */
@Builder(toBuilder = true)
public record ConsumerDefinition<T>(
        String name,
        QueueDefinition queue,
        PayloadValidator<T> validator,
        Integer prefetch,
        Integer batchSize,
        Duration batchTimeout,
        RetryPolicy retryPolicy
) {

    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofMillis(1_000);

    public boolean isBatchMode() {
        return batchSize != null;
    }

    public String queueName() {
        return queue.getName();
    }

    public Duration effectiveBatchTimeout() {
        return batchTimeout == null ? DEFAULT_BATCH_TIMEOUT : batchTimeout;
    }

    /**
     * 명시된 prefetch가 우선, 없으면 배치 모드는 batchSize, 그 외에는 기본값.
     */
    public int effectivePrefetch(int defaultPrefetch) {
        if (prefetch != null) {
            return prefetch;
        }
        if (batchSize != null) {
            return batchSize;
        }
        return defaultPrefetch;
    }

    public RetryPolicy effectiveRetryPolicy() {
        if (retryPolicy != null) {
            return retryPolicy;
        }
        return queue == null ? null : queue.getRetryPolicy();
    }

    public ConsumerDefinition<T> validate() {
        if (name == null || name.isBlank()) {
            throw new ConsumerConfigurationException("Consumer name must not be blank");
        }
        if (queue == null) {
            throw new ConsumerConfigurationException("Queue is not defined for consumer \"" + name + "\"");
        }
        queue.validate();
        if (validator == null) {
            throw new ConsumerConfigurationException("Payload validator is not defined for consumer \"" + name + "\"");
        }
        if (prefetch != null && prefetch < 1) {
            throw new ConsumerConfigurationException(
                    "Invalid prefetch value for \"" + name + "\": must be a positive integer");
        }
        if (batchSize != null && batchSize < 1) {
            throw new ConsumerConfigurationException(
                    "Invalid batchSize for \"" + name + "\": must be a positive integer");
        }
        if (batchTimeout != null) {
            if (batchSize == null) {
                throw new ConsumerConfigurationException(
                        "Invalid batchTimeout for \"" + name + "\": batchTimeout requires batchSize");
            }
            if (batchTimeout.isZero() || batchTimeout.isNegative()) {
                throw new ConsumerConfigurationException(
                        "Invalid batchTimeout for \"" + name + "\": must be a positive duration");
            }
        }
        if (retryPolicy != null) {
            retryPolicy.validate();
        }
        return this;
    }
}
