package com.yunhwan.amqp.contract.common.exception;

/**
 * 재시도 가치가 있는(일시 장애) 케이스.
 * 예: 외부 API 타임아웃, 네트워크 오류, 일시적 DB 장애 등
 * <p>
 * 핸들러가 이 예외를 던지면 consumer의 retry policy에 따라 재시도된다.
 */
public class RetryableHandlerException extends RuntimeException {

    public RetryableHandlerException(String message) {
        super(message);
    }

    public RetryableHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
