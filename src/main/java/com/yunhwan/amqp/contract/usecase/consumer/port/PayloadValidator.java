package com.yunhwan.amqp.contract.usecase.consumer.port;

/**
 * 스키마 검증 포트. 원본 payload를 파싱/검증해 값 또는 실패 상세를 돌려준다.
 * 예외를 던지지 않고 {@link ValidationResult}로 결과를 표현한다.
 */
@FunctionalInterface
public interface PayloadValidator<T> {

    ValidationResult<T> validate(byte[] rawPayload);
}
