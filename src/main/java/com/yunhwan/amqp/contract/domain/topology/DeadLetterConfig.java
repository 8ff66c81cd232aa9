package com.yunhwan.amqp.contract.domain.topology;

import java.util.Objects;

/**
 * 큐의 dead-letter 대상.
 * routingKey가 없으면 브로커는 원래 메시지의 routing key를 그대로 사용한다.
 */
public record DeadLetterConfig(ExchangeDefinition exchange, String routingKey) {

    public DeadLetterConfig {
        Objects.requireNonNull(exchange, "exchange");
    }

    public static DeadLetterConfig of(ExchangeDefinition exchange) {
        return new DeadLetterConfig(exchange, null);
    }

    public static DeadLetterConfig of(ExchangeDefinition exchange, String routingKey) {
        return new DeadLetterConfig(exchange, routingKey);
    }
}
