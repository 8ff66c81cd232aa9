package com.yunhwan.amqp.contract.usecase.consumer.port;

import com.yunhwan.amqp.contract.domain.topology.ExchangeBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.ExchangeDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;

/**
 * 브로커 채널 포트.
 * <p>
 * 구현체는 여러 consumer가 동시에 호출해도 안전해야 한다(채널 다중화의 직렬화는 구현체 책임).
 * 실패는 {@link com.yunhwan.amqp.contract.common.exception.BrokerOperationException}으로 던진다.
 */
public interface BrokerChannel extends AutoCloseable {

    void declareExchange(ExchangeDefinition exchange);

    void declareQueue(QueueDefinition queue);

    void bindQueue(QueueBindingDefinition binding);

    void bindExchange(ExchangeBindingDefinition binding);

    /** 이후 subscribe하는 consumer의 미확인(unacked) 전달 수 상한 */
    void setPrefetch(int prefetch);

    /**
     * @return consumer tag
     */
    String subscribe(String queueName, DeliveryCallback callback);

    void cancel(String consumerTag);

    void ack(long deliveryTag);

    void reject(long deliveryTag, boolean requeue);

    void publish(String exchange, String routingKey, OutboundMessage message);

    @Override
    void close();
}
