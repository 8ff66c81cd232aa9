package com.yunhwan.amqp.contract.common.exception;

import lombok.Getter;

/**
 * payload가 스키마 검증을 통과하지 못한 경우.
 * 재전달해도 결과가 같으므로 절대 재시도하지 않는다.
 */
@Getter
public class MessageValidationException extends RuntimeException {

    private final String consumerName;
    private final Object issues;

    public MessageValidationException(String consumerName, Object issues) {
        super("Message validation failed. consumer=" + consumerName + ", issues=" + issues);
        this.consumerName = consumerName;
        this.issues = issues;
    }

    public MessageValidationException(String consumerName, Object issues, Throwable cause) {
        super("Message validation failed. consumer=" + consumerName + ", issues=" + issues, cause);
        this.consumerName = consumerName;
        this.issues = issues;
    }
}
