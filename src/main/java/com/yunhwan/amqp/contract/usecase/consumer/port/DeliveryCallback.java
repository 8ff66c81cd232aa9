package com.yunhwan.amqp.contract.usecase.consumer.port;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;

@FunctionalInterface
public interface DeliveryCallback {

    /**
     * @param envelope 전달된 메시지. 서버가 consumer를 취소한 경우 null.
     */
    void onDelivery(DeliveryEnvelope envelope);
}
