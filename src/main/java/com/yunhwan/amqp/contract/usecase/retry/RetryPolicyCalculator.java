package com.yunhwan.amqp.contract.usecase.retry;

import com.yunhwan.amqp.contract.domain.retry.BackoffPolicy;
import com.yunhwan.amqp.contract.domain.retry.BackoffType;
import com.yunhwan.amqp.contract.domain.retry.RetryDecision;
import com.yunhwan.amqp.contract.domain.retry.RetryMode;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * RetryPolicyCalculator
 * <p>
 * 역할:
 * - 이전 시도 횟수(attemptIndex, 최초 전달이면 0)와 정책으로 재시도 여부와 대기 시간을 계산한다.
 * - attemptIndex + 1 >= maxAttempts 이면 포기한다.
 * - fixed: initialInterval, exponential: min(initialInterval * coefficient^attemptIndex, maxInterval)
 * - 정책이 없으면 legacy 모드: 고정 1000ms로 무한 재시도.
 * <p>
 * jitter는 [delay/2, delay] 구간에서 균등하게 뽑으며 maxInterval을 넘지 않는다.
 */
public class RetryPolicyCalculator {

    public static final Duration LEGACY_DELAY = Duration.ofMillis(1_000);

    private final DoubleSupplier random;

    public RetryPolicyCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicyCalculator(DoubleSupplier random) {
        this.random = random;
    }

    public RetryDecision shouldRetry(int attemptIndex, RetryPolicy policy) {
        if (policy == null) {
            return RetryDecision.retryAfter(LEGACY_DELAY, RetryMode.LEGACY_UNBOUNDED);
        }

        int attempt = Math.max(0, attemptIndex);
        if (policy.isBounded() && attempt + 1 >= policy.maxAttempts()) {
            return RetryDecision.giveUp(RetryMode.POLICY);
        }

        long delayMs = backoffMillis(attempt, policy.backoff());
        if (policy.jitter()) {
            delayMs = applyJitter(delayMs, policy.backoff().maxInterval().toMillis());
        }
        return RetryDecision.retryAfter(Duration.ofMillis(delayMs), RetryMode.POLICY);
    }

    long backoffMillis(int attemptIndex, BackoffPolicy backoff) {
        long initial = backoff.initialInterval().toMillis();
        long max = backoff.maxInterval().toMillis();

        double raw = backoff.type() == BackoffType.FIXED
                ? initial
                : initial * Math.pow(backoff.coefficient(), attemptIndex);

        // Math.pow 결과가 Infinity/NaN이어도 상한으로 수렴
        if (Double.isNaN(raw) || raw > max) {
            return clamp(max, max);
        }
        return clamp((long) raw, max);
    }

    private long applyJitter(long delayMs, long maxMs) {
        double factor = 0.5 + random.getAsDouble() * 0.5;
        return clamp((long) Math.floor(delayMs * factor), maxMs);
    }

    private static long clamp(long value, long max) {
        return Math.max(0, Math.min(value, max));
    }
}
