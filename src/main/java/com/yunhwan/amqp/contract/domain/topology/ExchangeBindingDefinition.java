package com.yunhwan.amqp.contract.domain.topology;

import java.util.Map;
import java.util.Objects;

public record ExchangeBindingDefinition(
        ExchangeDefinition destination,
        ExchangeDefinition source,
        String routingKey,
        Map<String, Object> arguments
) implements BindingDefinition {

    public ExchangeBindingDefinition {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(source, "source");
        routingKey = routingKey == null ? "" : routingKey;
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ExchangeBindingDefinition of(ExchangeDefinition destination, ExchangeDefinition source, String routingKey) {
        return new ExchangeBindingDefinition(destination, source, routingKey, Map.of());
    }
}
