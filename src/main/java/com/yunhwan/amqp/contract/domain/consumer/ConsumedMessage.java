package com.yunhwan.amqp.contract.domain.consumer;

/**
 * 검증을 통과한 payload와 원본 envelope 쌍.
 */
public record ConsumedMessage<T>(T payload, DeliveryEnvelope envelope) {
}
