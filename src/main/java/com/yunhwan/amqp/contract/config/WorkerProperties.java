package com.yunhwan.amqp.contract.config;

import com.yunhwan.amqp.contract.domain.retry.BackoffPolicy;
import com.yunhwan.amqp.contract.domain.retry.BackoffType;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.usecase.consumer.ConsumerDefinition;
import com.yunhwan.amqp.contract.usecase.consumer.ConsumerRegistration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "amqp-contract.worker")
public class WorkerProperties {

    /** 컨텍스트 시작 시 consumer 자동 구독 */
    private boolean autoStartup = true;

    /** 시작 시 Topology 빈을 브로커에 선언 */
    private boolean declareTopology = true;

    @Min(1)
    private int defaultPrefetch = 10;

    /** 정지 시 진행 중 핸들러 대기 상한 */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /** consumer 이름별 설정 덮어쓰기 */
    @Valid
    private Map<String, ConsumerOverride> consumers = new LinkedHashMap<>();

    public <T> ConsumerRegistration<T> applyOverrides(ConsumerRegistration<T> registration) {
        ConsumerOverride override = consumers.get(registration.name());
        if (override == null || registration.definition() == null) {
            return registration;
        }
        return registration.withDefinition(override.applyTo(registration.definition()));
    }

    @Getter @Setter
    public static class ConsumerOverride {
        @Min(1)
        private Integer prefetch;
        @Min(1)
        private Integer batchSize;
        private Duration batchTimeout;
        @Valid
        private Retry retry;

        <T> ConsumerDefinition<T> applyTo(ConsumerDefinition<T> definition) {
            ConsumerDefinition.ConsumerDefinitionBuilder<T> builder = definition.toBuilder();
            if (prefetch != null) builder.prefetch(prefetch);
            if (batchSize != null) builder.batchSize(batchSize);
            if (batchTimeout != null) builder.batchTimeout(batchTimeout);
            if (retry != null) builder.retryPolicy(retry.applyTo(definition.effectiveRetryPolicy()));
            return builder.build();
        }
    }

    @Getter @Setter
    public static class Retry {
        @Min(1)
        private Integer maxAttempts;
        private BackoffType backoffType;
        private Duration initialInterval;
        private Duration maxInterval;
        private Double coefficient;
        private Boolean jitter;

        RetryPolicy applyTo(RetryPolicy base) {
            RetryPolicy current = base == null ? RetryPolicy.unbounded(BackoffPolicy.defaults()) : base;
            BackoffPolicy backoff = current.backoff();
            BackoffPolicy merged = new BackoffPolicy(
                    backoffType != null ? backoffType : backoff.type(),
                    initialInterval != null ? initialInterval : backoff.initialInterval(),
                    maxInterval != null ? maxInterval : backoff.maxInterval(),
                    coefficient != null ? coefficient : backoff.coefficient()
            );
            return new RetryPolicy(
                    maxAttempts != null ? maxAttempts : current.maxAttempts(),
                    merged,
                    jitter != null ? jitter : current.jitter()
            );
        }
    }
}
