package com.yunhwan.amqp.contract.usecase.consumer.handler;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;

/**
 * 단건 핸들러. 결과를 {@link HandlerOutcome}으로 돌려준다.
 * 예외를 던지는 스타일이 편하면 {@link Handlers#safe(ThrowingMessageHandler)}로 감싼다.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    HandlerOutcome handle(T payload, DeliveryEnvelope envelope);
}
