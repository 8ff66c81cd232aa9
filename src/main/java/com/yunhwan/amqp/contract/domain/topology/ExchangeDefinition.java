package com.yunhwan.amqp.contract.domain.topology;

import java.util.Map;
import java.util.Objects;

public record ExchangeDefinition(
        String name,
        ExchangeType type,
        boolean durable,
        boolean autoDelete,
        boolean internal,
        Map<String, Object> arguments
) {

    public ExchangeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ExchangeDefinition topic(String name) {
        return new ExchangeDefinition(name, ExchangeType.TOPIC, true, false, false, Map.of());
    }

    public static ExchangeDefinition direct(String name) {
        return new ExchangeDefinition(name, ExchangeType.DIRECT, true, false, false, Map.of());
    }

    public static ExchangeDefinition fanout(String name) {
        return new ExchangeDefinition(name, ExchangeType.FANOUT, true, false, false, Map.of());
    }
}
