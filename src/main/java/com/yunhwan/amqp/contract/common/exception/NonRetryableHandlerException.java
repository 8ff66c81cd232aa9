package com.yunhwan.amqp.contract.common.exception;

/**
 * 재시도해도 의미 없는(영구 실패) 케이스.
 * 예: 비즈니스 규칙 위반, 데이터 정합성 문제 등
 * <p>
 * 핸들러가 이 예외를 던지면 retry policy를 거치지 않고 즉시 DLQ로 보낸다.
 */
public class NonRetryableHandlerException extends RuntimeException {

    public NonRetryableHandlerException(String message) {
        super(message);
    }

    public NonRetryableHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
