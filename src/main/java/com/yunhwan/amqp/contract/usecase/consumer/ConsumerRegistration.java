package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.usecase.consumer.handler.BatchMessageHandler;
import com.yunhwan.amqp.contract.usecase.consumer.handler.MessageHandler;

/**
 * consumer 선언 + 핸들러.
 * 단건 핸들러는 batchSize가 없어야 하고, 배치 핸들러는 batchSize가 있어야 한다.
 */
public record ConsumerRegistration<T>(
        ConsumerDefinition<T> definition,
        MessageHandler<T> handler,
        BatchMessageHandler<T> batchHandler
) {

    public static <T> ConsumerRegistration<T> single(ConsumerDefinition<T> definition, MessageHandler<T> handler) {
        return new ConsumerRegistration<>(definition, handler, null);
    }

    public static <T> ConsumerRegistration<T> batch(ConsumerDefinition<T> definition, BatchMessageHandler<T> handler) {
        return new ConsumerRegistration<>(definition, null, handler);
    }

    public String name() {
        return definition == null ? null : definition.name();
    }

    public ConsumerRegistration<T> withDefinition(ConsumerDefinition<T> newDefinition) {
        return new ConsumerRegistration<>(newDefinition, handler, batchHandler);
    }

    public ConsumerRegistration<T> validate() {
        if (definition == null) {
            throw new ConsumerConfigurationException("Consumer definition must not be null");
        }
        definition.validate();
        String name = definition.name();
        if (handler == null && batchHandler == null) {
            throw new ConsumerConfigurationException("Handler for \"" + name + "\" not provided");
        }
        if (handler != null && batchHandler != null) {
            throw new ConsumerConfigurationException(
                    "Consumer \"" + name + "\" has both a single and a batch handler");
        }
        if (definition.isBatchMode() && batchHandler == null) {
            throw new ConsumerConfigurationException(
                    "Consumer \"" + name + "\" sets batchSize but was given a single-message handler");
        }
        if (!definition.isBatchMode() && handler == null) {
            throw new ConsumerConfigurationException(
                    "Consumer \"" + name + "\" was given a batch handler but does not set batchSize");
        }
        return this;
    }
}
