package com.yunhwan.amqp.contract.usecase.retry;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * DLX가 없는 큐용. default exchange("")로 큐에 바로 재발행한다(지연 없음).
 */
@RequiredArgsConstructor
public class DirectRequeueRetryRepublisher implements RetryRepublisher {

    static final String DEFAULT_EXCHANGE = "";

    private final BrokerChannel channel;
    private final Clock clock;
    private final String queueName;

    @Override
    public void republish(DeliveryEnvelope envelope, DeliveryAction action) {
        channel.publish(DEFAULT_EXCHANGE, queueName, RetryMessages.retryMessage(envelope, action, clock, null));
    }
}
