package com.yunhwan.amqp.contract.domain.topology;

public enum ExchangeType {
    DIRECT("direct"),
    FANOUT("fanout"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String amqpName;

    ExchangeType(String amqpName) {
        this.amqpName = amqpName;
    }

    public String amqpName() {
        return amqpName;
    }
}
