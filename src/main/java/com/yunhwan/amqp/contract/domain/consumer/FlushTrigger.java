package com.yunhwan.amqp.contract.domain.consumer;

public enum FlushTrigger {
    SIZE("size"),
    TIMEOUT("timeout"),
    SHUTDOWN("shutdown");

    private final String tag;

    FlushTrigger(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
