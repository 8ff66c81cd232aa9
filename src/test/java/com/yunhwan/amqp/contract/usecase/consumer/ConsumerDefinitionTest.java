package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;
import com.yunhwan.amqp.contract.domain.retry.BackoffPolicy;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.usecase.consumer.port.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsumerDefinitionTest {

    @Test
    @DisplayName("prefetch: 명시값 > batchSize > 기본값")
    void prefetch_우선순위() {
        assertThat(base().prefetch(4).batchSize(8).build().effectivePrefetch(10)).isEqualTo(4);
        assertThat(base().batchSize(8).build().effectivePrefetch(10)).isEqualTo(8);
        assertThat(base().build().effectivePrefetch(10)).isEqualTo(10);
    }

    @Test
    @DisplayName("batchTimeout 미지정 시 기본 1초")
    void 배치_타임아웃_기본값() {
        assertThat(base().batchSize(5).build().effectiveBatchTimeout()).isEqualTo(ConsumerDefinition.DEFAULT_BATCH_TIMEOUT);
    }

    @Test
    @DisplayName("retry policy: consumer > queue > 없음(legacy)")
    void retry_policy_우선순위() {
        RetryPolicy consumerPolicy = RetryPolicy.of(2, BackoffPolicy.defaults());
        RetryPolicy queuePolicy = RetryPolicy.of(7, BackoffPolicy.defaults());
        QueueDefinition queueWithPolicy = QueueDefinition.builder().name("q").retryPolicy(queuePolicy).build();

        assertThat(base().queue(queueWithPolicy).retryPolicy(consumerPolicy).build().effectiveRetryPolicy())
                .isEqualTo(consumerPolicy);
        assertThat(base().queue(queueWithPolicy).build().effectiveRetryPolicy()).isEqualTo(queuePolicy);
        assertThat(base().build().effectiveRetryPolicy()).isNull();
    }

    @Test
    @DisplayName("설정 오류 검증")
    void 설정_오류() {
        assertThatThrownBy(() -> base().name(" ").build().validate())
                .isInstanceOf(ConsumerConfigurationException.class);
        assertThatThrownBy(() -> base().validator(null).build().validate())
                .hasMessageContaining("validator");
        assertThatThrownBy(() -> base().prefetch(0).build().validate())
                .hasMessageContaining("prefetch");
        assertThatThrownBy(() -> base().batchTimeout(Duration.ofMillis(100)).build().validate())
                .hasMessageContaining("requires batchSize");
        assertThatThrownBy(() -> base().batchSize(2).batchTimeout(Duration.ZERO).build().validate())
                .hasMessageContaining("positive duration");
    }

    @Test
    @DisplayName("핸들러 종류와 배치 모드가 맞지 않으면 등록 실패")
    void 핸들러_모드_불일치() {
        ConsumerDefinition<String> batchDef = base().batchSize(3).build();
        ConsumerDefinition<String> singleDef = base().build();

        assertThatThrownBy(() -> ConsumerRegistration.single(batchDef, (p, e) -> HandlerOutcome.success()).validate())
                .hasMessageContaining("single-message handler");
        assertThatThrownBy(() -> ConsumerRegistration.batch(singleDef, messages -> HandlerOutcome.success()).validate())
                .hasMessageContaining("does not set batchSize");
        assertThatThrownBy(() -> ConsumerRegistration.<String>single(singleDef, null).validate())
                .hasMessageContaining("not provided");
    }

    private static ConsumerDefinition.ConsumerDefinitionBuilder<String> base() {
        return ConsumerDefinition.<String>builder()
                .name("orders")
                .queue(QueueDefinition.of("orders"))
                .validator(raw -> ValidationResult.ok("x"));
    }
}
