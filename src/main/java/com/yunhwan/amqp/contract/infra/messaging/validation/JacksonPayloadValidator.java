package com.yunhwan.amqp.contract.infra.messaging.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.amqp.contract.usecase.consumer.port.PayloadValidator;
import com.yunhwan.amqp.contract.usecase.consumer.port.ValidationResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * JSON payload 파서 + Bean Validation 검증기.
 * <p>
 * JSON 파싱 실패, null payload, 제약 위반은 모두 {@link ValidationResult#error(Object)}로 돌려준다.
 * 위반 상세는 "path: message" 목록이다.
 */
public class JacksonPayloadValidator<T> implements PayloadValidator<T> {

    private final ObjectMapper objectMapper;
    private final JavaType type;
    private final Validator validator;

    public JacksonPayloadValidator(ObjectMapper objectMapper, JavaType type, Validator validator) {
        this.objectMapper = objectMapper;
        this.type = type;
        this.validator = validator;
    }

    public static <T> JacksonPayloadValidator<T> of(ObjectMapper objectMapper, Class<T> type) {
        return new JacksonPayloadValidator<>(objectMapper, objectMapper.constructType(type), null);
    }

    public static <T> JacksonPayloadValidator<T> of(ObjectMapper objectMapper, Class<T> type, Validator validator) {
        return new JacksonPayloadValidator<>(objectMapper, objectMapper.constructType(type), validator);
    }

    @Override
    public ValidationResult<T> validate(byte[] rawPayload) {
        T value;
        try {
            value = objectMapper.readValue(rawPayload, type);
        } catch (JsonProcessingException e) {
            return ValidationResult.error(List.of("invalid json: " + e.getOriginalMessage()));
        } catch (IOException e) {
            return ValidationResult.error(List.of("unreadable payload: " + e.getMessage()));
        }

        if (value == null) {
            return ValidationResult.error(List.of("payload must not be null"));
        }
        if (validator == null) {
            return ValidationResult.ok(value);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (violations.isEmpty()) {
            return ValidationResult.ok(value);
        }
        List<String> issues = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted(Comparator.naturalOrder())
                .toList();
        return ValidationResult.error(issues);
    }
}
