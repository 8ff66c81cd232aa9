package com.yunhwan.amqp.contract.infra.messaging.rabbit;

import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * QueueDefinition -> RabbitMQ queue x-arguments.
 */
public final class RabbitQueueArguments {

    public static final String QUEUE_TYPE = "x-queue-type";
    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String DELIVERY_LIMIT = "x-delivery-limit";
    public static final String MAX_PRIORITY = "x-max-priority";

    private RabbitQueueArguments() {}

    public static Map<String, Object> of(QueueDefinition queue) {
        // 사용자 지정 인자 위에 정의에서 유도한 값을 덮어쓴다
        Map<String, Object> args = new LinkedHashMap<>(queue.getArguments());
        args.put(QUEUE_TYPE, queue.getType().amqpName());
        if (queue.hasDeadLetterExchange()) {
            args.put(DEAD_LETTER_EXCHANGE, queue.getDeadLetter().exchange().name());
            if (queue.getDeadLetter().routingKey() != null) {
                args.put(DEAD_LETTER_ROUTING_KEY, queue.getDeadLetter().routingKey());
            }
        }
        if (queue.getMessageTtl() != null) {
            args.put(MESSAGE_TTL, queue.getMessageTtl().toMillis());
        }
        if (queue.getDeliveryLimit() != null) {
            args.put(DELIVERY_LIMIT, queue.getDeliveryLimit());
        }
        if (queue.getMaxPriority() != null) {
            args.put(MAX_PRIORITY, queue.getMaxPriority());
        }
        return args;
    }
}
