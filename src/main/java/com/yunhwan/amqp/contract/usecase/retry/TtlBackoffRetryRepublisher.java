package com.yunhwan.amqp.contract.usecase.retry;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import com.yunhwan.amqp.contract.usecase.topology.TtlBackoffInfrastructureSynthesizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * DLX로 &lt;queue&gt;-wait 라우팅 키와 per-message expiration(=delay)을 붙여 발행한다.
 * wait 큐에서 TTL이 만료되면 DLX를 거쳐 원래 큐로 돌아온다.
 */
@Slf4j
public class TtlBackoffRetryRepublisher implements RetryRepublisher {

    private final BrokerChannel channel;
    private final Clock clock;
    private final String exchange;
    private final String routingKey;

    public TtlBackoffRetryRepublisher(BrokerChannel channel, Clock clock, QueueDefinition queue) {
        if (!queue.hasDeadLetterExchange()) {
            throw new IllegalArgumentException("TTL-backoff retry requires a dead letter exchange. queue=" + queue.getName());
        }
        this.channel = channel;
        this.clock = clock;
        this.exchange = queue.getDeadLetter().exchange().name();
        this.routingKey = TtlBackoffInfrastructureSynthesizer.waitQueueName(queue.getName());
    }

    @Override
    public void republish(DeliveryEnvelope envelope, DeliveryAction action) {
        long delayMs = action.delay() == null ? 0L : Math.max(0L, action.delay().toMillis());
        channel.publish(exchange, routingKey,
                RetryMessages.retryMessage(envelope, action, clock, String.valueOf(delayMs)));

        log.debug("[TtlBackoffRetryRepublisher] retry scheduled. exchange={}, routingKey={}, retryCount={}, delayMs={}",
                exchange, routingKey, action.nextRetryCount(), delayMs);
    }
}
