package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;
import com.yunhwan.amqp.contract.domain.retry.RetryDecision;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.usecase.retry.RetryPolicyCalculator;
import lombok.RequiredArgsConstructor;

/**
 * 핸들러 결과 + 현재 retry-count → ack / retry / dead-letter 결정.
 * <p>
 * 입력 외의 상태를 갖지 않는다(jitter를 끈 정책이면 같은 입력에 항상 같은 결과).
 */
@RequiredArgsConstructor
public class DeliveryOutcomeResolver {

    private static final int MAX_ERROR_LENGTH = 300;

    private final RetryPolicyCalculator calculator;

    public DeliveryAction resolve(HandlerOutcome outcome, int currentRetryCount, RetryPolicy policy) {
        switch (outcome.type()) {
            case SUCCESS:
                return DeliveryAction.ofAck();
            case VALIDATION_FAILURE:
                // 형식 불량은 재전달해도 통과할 수 없음
                return DeliveryAction.ofDeadLetter(DeliveryAction.REASON_VALIDATION_FAILED, compactError(outcome.cause()));
            case NON_RETRYABLE_ERROR:
                return DeliveryAction.ofDeadLetter(DeliveryAction.REASON_NON_RETRYABLE, compactError(outcome.cause()));
            case RETRYABLE_ERROR:
            case UNKNOWN_ERROR:
            default:
                return resolveRetry(outcome, currentRetryCount, policy);
        }
    }

    private DeliveryAction resolveRetry(HandlerOutcome outcome, int currentRetryCount, RetryPolicy policy) {
        int retryCount = Math.max(0, currentRetryCount);
        String lastError = compactError(outcome.cause());

        RetryDecision decision = calculator.shouldRetry(retryCount, policy);
        if (!decision.retry()) {
            return DeliveryAction.ofDeadLetter(DeliveryAction.REASON_MAX_ATTEMPTS, lastError);
        }
        return DeliveryAction.ofRetry(retryCount + 1, decision.delay(), lastError);
    }

    static String compactError(Throwable e) {
        if (e == null) {
            return null;
        }
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) msg = e.getClass().getSimpleName();
        // 너무 길면 로그/헤더 폭발 방지
        return (msg.length() > MAX_ERROR_LENGTH) ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
