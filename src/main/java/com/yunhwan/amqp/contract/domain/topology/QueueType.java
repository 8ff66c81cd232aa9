package com.yunhwan.amqp.contract.domain.topology;

public enum QueueType {
    QUORUM("quorum"),
    CLASSIC("classic");

    private final String amqpName;

    QueueType(String amqpName) {
        this.amqpName = amqpName;
    }

    public String amqpName() {
        return amqpName;
    }
}
