package com.yunhwan.amqp.contract.common.exception;

/**
 * 잘못된 consumer/topology 설정 (prefetch, batchSize, batchTimeout, DLX 누락 등).
 * 메시지 처리 중이 아니라 기동 시점에만 발생하며, 해당 consumer의 시작을 중단시킨다.
 */
public class ConsumerConfigurationException extends RuntimeException {

    public ConsumerConfigurationException(String message) {
        super(message);
    }

    public ConsumerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
