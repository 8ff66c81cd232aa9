package com.yunhwan.amqp.contract.common.exception;

/**
 * 브로커 채널 조작(declare/bind/publish/ack 등) 실패.
 */
public class BrokerOperationException extends RuntimeException {

    public BrokerOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
