package com.yunhwan.amqp.contract.domain.consumer;

import com.yunhwan.amqp.contract.common.exception.MessageValidationException;
import com.yunhwan.amqp.contract.common.exception.NonRetryableHandlerException;
import com.yunhwan.amqp.contract.common.exception.RetryableHandlerException;

/**
 * 핸들러 처리 결과.
 * <p>
 * 예외를 던지는 핸들러든 결과를 반환하는 핸들러든, dispatcher는 이 타입만 본다.
 */
public record HandlerOutcome(Type type, Throwable cause) {

    public enum Type { SUCCESS, RETRYABLE_ERROR, NON_RETRYABLE_ERROR, VALIDATION_FAILURE, UNKNOWN_ERROR }

    private static final HandlerOutcome SUCCESS = new HandlerOutcome(Type.SUCCESS, null);

    public static HandlerOutcome success() {
        return SUCCESS;
    }

    public static HandlerOutcome retryable(Throwable cause) {
        return new HandlerOutcome(Type.RETRYABLE_ERROR, cause);
    }

    public static HandlerOutcome nonRetryable(Throwable cause) {
        return new HandlerOutcome(Type.NON_RETRYABLE_ERROR, cause);
    }

    public static HandlerOutcome validationFailure(Throwable cause) {
        return new HandlerOutcome(Type.VALIDATION_FAILURE, cause);
    }

    public static HandlerOutcome unknown(Throwable cause) {
        return new HandlerOutcome(Type.UNKNOWN_ERROR, cause);
    }

    /**
     * 예외 타입으로 결과를 분류한다. 분류되지 않는 예외는 UNKNOWN(재시도 대상)이다.
     */
    public static HandlerOutcome fromThrowable(Throwable e) {
        if (e instanceof NonRetryableHandlerException) {
            return nonRetryable(e);
        }
        if (e instanceof RetryableHandlerException) {
            return retryable(e);
        }
        if (e instanceof MessageValidationException) {
            return validationFailure(e);
        }
        return unknown(e);
    }

    public boolean isSuccess() { return type == Type.SUCCESS; }
}
