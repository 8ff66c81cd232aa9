package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.common.exception.NonRetryableHandlerException;
import com.yunhwan.amqp.contract.common.exception.RetryableHandlerException;
import com.yunhwan.amqp.contract.common.util.HeaderUtils;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;
import com.yunhwan.amqp.contract.domain.retry.BackoffPolicy;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.domain.topology.DeadLetterConfig;
import com.yunhwan.amqp.contract.domain.topology.ExchangeDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.infra.logging.ConsumerEventLogger;
import com.yunhwan.amqp.contract.infra.messaging.codec.ContentDecoder;
import com.yunhwan.amqp.contract.infra.metrics.ConsumerMetrics;
import com.yunhwan.amqp.contract.infra.metrics.MetricsConfig;
import com.yunhwan.amqp.contract.testsupport.messaging.InMemoryBrokerChannel;
import com.yunhwan.amqp.contract.testsupport.messaging.InMemoryBrokerChannel.Published;
import com.yunhwan.amqp.contract.usecase.consumer.handler.BatchMessageHandler;
import com.yunhwan.amqp.contract.usecase.consumer.handler.Handlers;
import com.yunhwan.amqp.contract.usecase.consumer.handler.MessageHandler;
import com.yunhwan.amqp.contract.usecase.consumer.port.PayloadValidator;
import com.yunhwan.amqp.contract.usecase.consumer.port.ValidationResult;
import com.yunhwan.amqp.contract.usecase.retry.RetryPolicyCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * dispatcher 전달 처리 검증.
 * <p>
 * InMemoryBrokerChannel로 ack/reject/publish를 관찰하고,
 * redeliverRetries를 켜면 TTL 만료 없이 retry가 바로 재전달된다.
 */
class ConsumerDispatcherTest {

    private static final String CONSUMER = "orders-consumer";
    private static final String QUEUE = "orders";
    private static final ExchangeDefinition DLX = ExchangeDefinition.topic("orders-dlx");

    private static final PayloadValidator<String> TEXT_VALIDATOR = raw -> {
        String text = new String(raw, StandardCharsets.UTF_8);
        return text.startsWith("invalid")
                ? ValidationResult.error(List.of("payload starts with 'invalid'"))
                : ValidationResult.ok(text);
    };

    private final InMemoryBrokerChannel broker = new InMemoryBrokerChannel();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final List<ConsumerDispatcher<?>> dispatchers = new ArrayList<>();

    private final DispatcherContext ctx = DispatcherContext.builder()
            .channel(broker)
            .resolver(new DeliveryOutcomeResolver(new RetryPolicyCalculator()))
            .contentDecoder(new ContentDecoder())
            .metrics(new ConsumerMetrics(registry))
            .eventLogger(new ConsumerEventLogger(Clock.systemUTC()))
            .batchTimer(timer)
            .clock(Clock.systemUTC())
            .defaultPrefetch(DispatcherContext.DEFAULT_PREFETCH)
            .build();

    @AfterEach
    void tearDown() {
        dispatchers.forEach(d -> d.stop(Duration.ofSeconds(1)));
        timer.shutdownNow();
    }

    @Nested
    @DisplayName("단건 모드")
    class SingleMode {

        @Test
        @DisplayName("성공하면 ack하고 success로 집계한다")
        void 성공_ack() {
            List<String> received = new CopyOnWriteArrayList<>();
            start(single(withDlx(), RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    (payload, env) -> {
                        received.add(payload);
                        return HandlerOutcome.success();
                    }));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(tag));
            assertThat(received).containsExactly("{\"id\":1}");
            assertThat(counter(MetricsConfig.METRIC_CONSUME, MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_SUCCESS))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("maxAttempts=3 + 항상 retryable 실패 -> 핸들러 정확히 3회 호출 후 DLQ")
        void 최대_시도_후_DLQ() {
            AtomicInteger invocations = new AtomicInteger();
            broker.redeliverRetries(true);
            start(single(withDlx(), RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    (payload, env) -> {
                        invocations.incrementAndGet();
                        return HandlerOutcome.retryable(new RetryableHandlerException("temporary"));
                    }));

            broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(5)).until(() -> broker.deadLetteredCount() == 1);
            assertThat(invocations.get()).isEqualTo(3);
            assertThat(broker.ackCount()).isEqualTo(2);

            // retry는 DLX -> <queue>-wait 로 TTL과 함께 발행
            List<Published> retries = broker.published();
            assertThat(retries).hasSize(2);
            assertThat(retries).allSatisfy(p -> {
                assertThat(p.exchange()).isEqualTo("orders-dlx");
                assertThat(p.routingKey()).isEqualTo("orders-wait");
                assertThat(p.message().expiration()).isEqualTo("10");
                assertThat(p.message().headers()).containsEntry(HeaderUtils.LAST_ERROR_HEADER, "temporary");
            });
            assertThat(retries.get(0).message().headers()).containsEntry(HeaderUtils.RETRY_HEADER, 1);
            assertThat(retries.get(1).message().headers()).containsEntry(HeaderUtils.RETRY_HEADER, 2);
            // 최초 실패 시각은 첫 재시도 값을 유지
            assertThat(retries.get(1).message().headers().get(HeaderUtils.FIRST_FAILURE_TIMESTAMP_HEADER))
                    .isEqualTo(retries.get(0).message().headers().get(HeaderUtils.FIRST_FAILURE_TIMESTAMP_HEADER));

            assertThat(counter(MetricsConfig.METRIC_DLQ, MetricsConfig.TAG_REASON, MetricsConfig.REASON_MAX_ATTEMPTS))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("non-retryable 실패는 1회 호출 후 즉시 DLQ, 재발행 없음")
        void nonRetryable_즉시_DLQ() {
            AtomicInteger invocations = new AtomicInteger();
            start(single(withDlx(), RetryPolicy.of(5, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    Handlers.safe((payload, env) -> {
                        invocations.incrementAndGet();
                        throw new NonRetryableHandlerException("bad state");
                    })));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.rejectedWithRequeue(tag) != null);
            assertThat(broker.rejectedWithRequeue(tag)).isFalse();
            assertThat(invocations.get()).isEqualTo(1);
            assertThat(broker.published()).isEmpty();
        }

        @Test
        @DisplayName("핸들러가 Error를 던져도 UNKNOWN으로 보고 정책대로 재시도한다")
        void 핸들러_Error는_재시도() {
            start(single(withDlx(), RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    (payload, env) -> {
                        throw new AssertionError("handler bug");
                    }));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(tag));
            assertThat(broker.rejectedWithRequeue(tag)).isNull();
            assertThat(broker.published()).singleElement().satisfies(p -> {
                assertThat(p.routingKey()).isEqualTo("orders-wait");
                assertThat(p.message().headers()).containsEntry(HeaderUtils.RETRY_HEADER, 1);
                assertThat(p.message().headers().get(HeaderUtils.LAST_ERROR_HEADER)).asString().contains("handler bug");
            });
        }

        @Test
        @DisplayName("validator가 Error를 던지면 전달 스레드로 올리지 않고 검증 실패로 DLQ")
        void validator_Error는_DLQ() {
            AtomicInteger invocations = new AtomicInteger();
            ConsumerDefinition<String> def = definition(withDlx(), null).toBuilder()
                    .validator(raw -> {
                        throw new NoClassDefFoundError("com/example/Missing");
                    })
                    .build();
            start(ConsumerRegistration.single(def, (payload, env) -> {
                invocations.incrementAndGet();
                return HandlerOutcome.success();
            }));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            assertThat(broker.rejectedWithRequeue(tag)).isFalse();
            assertThat(invocations.get()).isZero();
            assertThat(counter(MetricsConfig.METRIC_DLQ, MetricsConfig.TAG_REASON, MetricsConfig.REASON_VALIDATION))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("검증 실패 payload는 핸들러를 부르지 않고 DLQ")
        void 검증_실패는_핸들러_미호출() {
            AtomicInteger invocations = new AtomicInteger();
            start(single(withDlx(), null, (payload, env) -> {
                invocations.incrementAndGet();
                return HandlerOutcome.success();
            }));

            long tag = broker.deliver(QUEUE, "invalid-json");

            assertThat(broker.rejectedWithRequeue(tag)).isFalse();
            assertThat(invocations.get()).isZero();
            assertThat(counter(MetricsConfig.METRIC_DLQ, MetricsConfig.TAG_REASON, MetricsConfig.REASON_VALIDATION))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("gzip payload는 풀어서 검증/핸들러에 넘긴다")
        void gzip_해제() throws IOException {
            List<String> received = new CopyOnWriteArrayList<>();
            start(single(withDlx(), null, (payload, env) -> {
                received.add(payload);
                return HandlerOutcome.success();
            }));

            long tag = broker.deliver(QUEUE, gzip("{\"id\":7}"), Map.of(), "gzip");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(tag));
            assertThat(received).containsExactly("{\"id\":7}");
        }

        @Test
        @DisplayName("지원하지 않는 content-encoding은 검증 실패로 DLQ")
        void 미지원_인코딩() {
            AtomicInteger invocations = new AtomicInteger();
            start(single(withDlx(), null, (payload, env) -> {
                invocations.incrementAndGet();
                return HandlerOutcome.success();
            }));

            long tag = broker.deliver(QUEUE, "{}".getBytes(StandardCharsets.UTF_8), Map.of(), "br");

            assertThat(broker.rejectedWithRequeue(tag)).isFalse();
            assertThat(invocations.get()).isZero();
        }

        @Test
        @DisplayName("retry 발행이 실패하면 원본을 ack하지 않고 requeue")
        void retry_발행_실패시_requeue() {
            broker.failPublish(true);
            start(single(withDlx(), RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    (payload, env) -> HandlerOutcome.retryable(new RetryableHandlerException("temporary"))));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.rejectedWithRequeue(tag) != null);
            assertThat(broker.rejectedWithRequeue(tag)).isTrue();
            assertThat(broker.isAcked(tag)).isFalse();
        }

        @Test
        @DisplayName("DLX가 없는 큐는 default exchange로 큐에 바로 재발행한다(지연 없음)")
        void DLX_없는_큐_직접_재발행() {
            QueueDefinition plain = QueueDefinition.of(QUEUE);
            start(single(plain, RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    (payload, env) -> HandlerOutcome.retryable(new RetryableHandlerException("temporary"))));

            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(tag));
            Published retry = broker.published().get(0);
            assertThat(retry.exchange()).isEmpty();
            assertThat(retry.routingKey()).isEqualTo(QUEUE);
            assertThat(retry.message().expiration()).isNull();
            assertThat(retry.message().headers()).containsEntry(HeaderUtils.RETRY_HEADER, 1);
        }

        @Test
        @DisplayName("정지 후 도착한 메시지는 requeue한다")
        void 정지_후_도착분_requeue() {
            ConsumerDispatcher<String> dispatcher = start(single(withDlx(), null, (payload, env) -> HandlerOutcome.success()));
            dispatcher.stop(Duration.ofSeconds(1));

            dispatcher.onDelivery(DeliveryEnvelope.builder().deliveryTag(99L).body("{}".getBytes(StandardCharsets.UTF_8)).build());

            assertThat(broker.rejectedWithRequeue(99L)).isTrue();
            assertThat(broker.cancelled()).hasSize(1);
        }

        @Test
        @DisplayName("정지는 진행 중인 핸들러가 끝날 때까지 기다린다")
        void 정지_시_진행중_대기() {
            start(single(withDlx(), null, (payload, env) -> {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return HandlerOutcome.success();
            }));
            long tag = broker.deliver(QUEUE, "{\"id\":1}");

            dispatchers.get(0).stop(Duration.ofSeconds(5));

            assertThat(broker.isAcked(tag)).isTrue();
        }

        @Test
        @DisplayName("브로커 측 취소는 핸들러를 부르지 않고 cancelled로 집계한다")
        void 서버_취소() {
            AtomicInteger invocations = new AtomicInteger();
            start(single(withDlx(), null, (payload, env) -> {
                invocations.incrementAndGet();
                return HandlerOutcome.success();
            }));

            broker.cancelByServer(QUEUE);

            assertThat(invocations.get()).isZero();
            assertThat(registry.get(MetricsConfig.METRIC_CONSUMER_CANCELLED).counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("기본 prefetch 10, 동시 처리 수도 10")
        void 기본_prefetch() {
            ConsumerDispatcher<String> dispatcher = start(single(withDlx(), null, (payload, env) -> HandlerOutcome.success()));

            assertThat(broker.prefetches()).containsExactly(10);
            assertThat(dispatcher.concurrency()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("배치 모드")
    class BatchMode {

        @Test
        @DisplayName("batchSize 3에 7개 -> [3, 3, 1]로 처리되고 모두 ack")
        void 배치_분할() {
            List<Integer> sizes = new CopyOnWriteArrayList<>();
            start(batch(3, Duration.ofMillis(200), null, messages -> {
                sizes.add(messages.size());
                return HandlerOutcome.success();
            }));

            for (int i = 0; i < 7; i++) {
                broker.deliver(QUEUE, "{\"id\":" + i + "}");
            }

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.ackCount() == 7);
            assertThat(sizes).containsExactly(3, 3, 1);
            assertThat(counter(MetricsConfig.METRIC_BATCH, MetricsConfig.TAG_TRIGGER, "size")).isEqualTo(2.0);
            assertThat(counter(MetricsConfig.METRIC_BATCH, MetricsConfig.TAG_TRIGGER, "timeout")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("배치 결과 하나가 배치 내 모든 메시지에 적용된다")
        void 배치_일괄_DLQ() {
            start(batch(2, Duration.ofSeconds(10), null,
                    messages -> HandlerOutcome.nonRetryable(new NonRetryableHandlerException("batch failed"))));

            long first = broker.deliver(QUEUE, "{\"id\":1}");
            long second = broker.deliver(QUEUE, "{\"id\":2}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.deadLetteredCount() == 2);
            assertThat(broker.rejectedWithRequeue(first)).isFalse();
            assertThat(broker.rejectedWithRequeue(second)).isFalse();
        }

        @Test
        @DisplayName("배치 핸들러가 Error를 던져도 배치의 모든 메시지가 정산된다")
        void 배치_핸들러_Error() {
            start(batch(2, Duration.ofSeconds(10), RetryPolicy.of(3, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    messages -> {
                        throw new StackOverflowError();
                    }));

            long first = broker.deliver(QUEUE, "{\"id\":1}");
            long second = broker.deliver(QUEUE, "{\"id\":2}");

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(first) && broker.isAcked(second));
            assertThat(broker.published()).hasSize(2);
        }

        @Test
        @DisplayName("배치 재시도는 메시지별 retry-count로 판정한다")
        void 배치_메시지별_재시도_횟수() {
            start(batch(2, Duration.ofSeconds(10), RetryPolicy.of(2, BackoffPolicy.fixed(Duration.ofMillis(10))),
                    messages -> HandlerOutcome.retryable(new RetryableHandlerException("later"))));

            long fresh = broker.deliver(QUEUE, "{\"id\":1}".getBytes(StandardCharsets.UTF_8), Map.of(), null);
            long exhausted = broker.deliver(QUEUE, "{\"id\":2}".getBytes(StandardCharsets.UTF_8),
                    Map.of(HeaderUtils.RETRY_HEADER, 1), null);

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.isAcked(fresh) && broker.rejectedWithRequeue(exhausted) != null);
            assertThat(broker.rejectedWithRequeue(exhausted)).isFalse();
            assertThat(broker.published()).hasSize(1);
        }

        @Test
        @DisplayName("브로커 측 취소 시 누적 중인 부분 배치를 flush해 처리한다")
        void 취소_시_부분_배치_flush() {
            List<Integer> sizes = new CopyOnWriteArrayList<>();
            start(batch(5, Duration.ofSeconds(30), null, messages -> {
                sizes.add(messages.size());
                return HandlerOutcome.success();
            }));
            broker.deliver(QUEUE, "{\"id\":1}");
            broker.deliver(QUEUE, "{\"id\":2}");

            broker.cancelByServer(QUEUE);

            await().atMost(Duration.ofSeconds(3)).until(() -> broker.ackCount() == 2);
            assertThat(sizes).containsExactly(2);
        }

        @Test
        @DisplayName("정지 시 부분 배치를 flush하고 처리 완료를 기다린다")
        void 정지_시_부분_배치_flush() {
            List<Integer> sizes = new CopyOnWriteArrayList<>();
            start(batch(5, Duration.ofSeconds(30), null, messages -> {
                sizes.add(messages.size());
                return HandlerOutcome.success();
            }));
            broker.deliver(QUEUE, "{\"id\":1}");

            dispatchers.get(0).stop(Duration.ofSeconds(5));

            assertThat(sizes).containsExactly(1);
            assertThat(broker.ackCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("prefetch 미지정이면 batchSize가 prefetch, 동시 처리 수는 ceil(prefetch / batchSize)")
        void 배치_prefetch_동시성() {
            ConsumerDispatcher<String> byBatchSize = start(batch(5, null, null, m -> HandlerOutcome.success()));
            assertThat(byBatchSize.prefetch()).isEqualTo(5);
            assertThat(byBatchSize.concurrency()).isEqualTo(1);

            ConsumerDefinition<String> explicit = definition(withDlx(), null).toBuilder()
                    .name("explicit").prefetch(10).batchSize(3).build();
            ConsumerDispatcher<String> withPrefetch = new ConsumerDispatcher<>(
                    ConsumerRegistration.batch(explicit, m -> HandlerOutcome.success()), ctx);
            dispatchers.add(withPrefetch);
            assertThat(withPrefetch.concurrency()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("설정 검증")
    class Validation {

        @Test
        @DisplayName("batchSize 없이 batchTimeout만 주면 브로커 호출 전에 실패한다")
        void batchTimeout만_설정() {
            ConsumerDefinition<String> def = definition(withDlx(), null).toBuilder()
                    .batchTimeout(Duration.ofSeconds(1)).build();

            assertThatThrownBy(() -> new ConsumerDispatcher<>(
                    ConsumerRegistration.single(def, (p, e) -> HandlerOutcome.success()), ctx))
                    .isInstanceOf(ConsumerConfigurationException.class)
                    .hasMessageContaining("batchTimeout");
            assertThat(broker.prefetches()).isEmpty();
        }

        @Test
        @DisplayName("batchSize가 있는데 단건 핸들러를 주면 실패한다")
        void 핸들러_형태_불일치() {
            ConsumerDefinition<String> def = definition(withDlx(), null).toBuilder().batchSize(3).build();

            assertThatThrownBy(() -> new ConsumerDispatcher<>(
                    ConsumerRegistration.single(def, (p, e) -> HandlerOutcome.success()), ctx))
                    .isInstanceOf(ConsumerConfigurationException.class);
        }

        @Test
        @DisplayName("prefetch 0은 실패한다")
        void prefetch_0() {
            ConsumerDefinition<String> def = definition(withDlx(), null).toBuilder().prefetch(0).build();

            assertThatThrownBy(() -> new ConsumerDispatcher<>(
                    ConsumerRegistration.single(def, (p, e) -> HandlerOutcome.success()), ctx))
                    .isInstanceOf(ConsumerConfigurationException.class)
                    .hasMessageContaining("prefetch");
        }
    }

    // ===== helpers =====

    private static QueueDefinition withDlx() {
        return QueueDefinition.builder().name(QUEUE).deadLetter(DeadLetterConfig.of(DLX)).build();
    }

    private static ConsumerDefinition<String> definition(QueueDefinition queue, RetryPolicy policy) {
        return ConsumerDefinition.<String>builder()
                .name(CONSUMER)
                .queue(queue)
                .validator(TEXT_VALIDATOR)
                .retryPolicy(policy)
                .build();
    }

    private static ConsumerRegistration<String> single(QueueDefinition queue, RetryPolicy policy, MessageHandler<String> handler) {
        return ConsumerRegistration.single(definition(queue, policy), handler);
    }

    private static ConsumerRegistration<String> batch(
            int batchSize,
            Duration timeout,
            RetryPolicy policy,
            BatchMessageHandler<String> handler
    ) {
        ConsumerDefinition<String> def = definition(withDlx(), policy).toBuilder()
                .batchSize(batchSize)
                .batchTimeout(timeout)
                .build();
        return ConsumerRegistration.batch(def, handler);
    }

    private ConsumerDispatcher<String> start(ConsumerRegistration<String> registration) {
        ConsumerDispatcher<String> dispatcher = new ConsumerDispatcher<>(registration, ctx);
        dispatchers.add(dispatcher);
        dispatcher.start();
        return dispatcher;
    }

    private double counter(String name, String tagKey, String tagValue) {
        var counter = registry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
