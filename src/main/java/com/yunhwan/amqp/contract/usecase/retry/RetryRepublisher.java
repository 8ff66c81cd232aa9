package com.yunhwan.amqp.contract.usecase.retry;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;

/**
 * 재시도 대상 메시지를 다시 브로커로 보낸다.
 * 실패하면 {@link com.yunhwan.amqp.contract.common.exception.BrokerOperationException}을 던지고,
 * 호출자는 원본을 ack하지 않고 requeue한다.
 */
public interface RetryRepublisher {

    void republish(DeliveryEnvelope envelope, DeliveryAction action);
}
