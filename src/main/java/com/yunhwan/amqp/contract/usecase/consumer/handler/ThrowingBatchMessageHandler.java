package com.yunhwan.amqp.contract.usecase.consumer.handler;

import com.yunhwan.amqp.contract.domain.consumer.ConsumedMessage;

import java.util.List;

@FunctionalInterface
public interface ThrowingBatchMessageHandler<T> {

    void handle(List<ConsumedMessage<T>> messages) throws Exception;
}
