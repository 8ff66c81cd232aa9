package com.yunhwan.amqp.contract.domain.topology;

import java.util.Map;
import java.util.Objects;

public record QueueBindingDefinition(
        QueueDefinition queue,
        ExchangeDefinition exchange,
        String routingKey,
        Map<String, Object> arguments
) implements BindingDefinition {

    public QueueBindingDefinition {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(exchange, "exchange");
        routingKey = routingKey == null ? "" : routingKey;
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static QueueBindingDefinition of(QueueDefinition queue, ExchangeDefinition exchange, String routingKey) {
        return new QueueBindingDefinition(queue, exchange, routingKey, Map.of());
    }
}
