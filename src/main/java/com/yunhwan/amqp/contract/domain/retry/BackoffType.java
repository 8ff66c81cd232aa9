package com.yunhwan.amqp.contract.domain.retry;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
