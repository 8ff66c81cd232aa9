package com.yunhwan.amqp.contract.usecase.consumer.port;

public record ValidationResult<T>(T value, Object issues) {

    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(value, null);
    }

    public static <T> ValidationResult<T> error(Object issues) {
        return new ValidationResult<>(null, issues == null ? "invalid payload" : issues);
    }

    public boolean isOk() {
        return issues == null;
    }
}
