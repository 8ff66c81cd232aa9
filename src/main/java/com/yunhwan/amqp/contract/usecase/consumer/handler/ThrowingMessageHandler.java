package com.yunhwan.amqp.contract.usecase.consumer.handler;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;

@FunctionalInterface
public interface ThrowingMessageHandler<T> {

    void handle(T payload, DeliveryEnvelope envelope) throws Exception;
}
