package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.common.exception.MessageValidationException;
import com.yunhwan.amqp.contract.domain.consumer.Batch;
import com.yunhwan.amqp.contract.domain.consumer.ConsumedMessage;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.infra.metrics.MetricsConfig;
import com.yunhwan.amqp.contract.usecase.consumer.batch.BatchAccumulator;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import com.yunhwan.amqp.contract.usecase.consumer.port.DeliveryCallback;
import com.yunhwan.amqp.contract.usecase.consumer.port.ValidationResult;
import com.yunhwan.amqp.contract.usecase.retry.DirectRequeueRetryRepublisher;
import com.yunhwan.amqp.contract.usecase.retry.RetryRepublisher;
import com.yunhwan.amqp.contract.usecase.retry.TtlBackoffRetryRepublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * consumer 하나의 전달 처리기.
 * <p>
 * 흐름: 전달 -> content-encoding 해제 -> 스키마 검증 -> (단건) 핸들러 / (배치) 누적기 -> 결과 판정 -> ack / retry / DLQ
 * <ul>
 *     <li>동시 처리 수는 executor 크기로 제한한다(단건: prefetch, 배치: ceil(prefetch / batchSize)).</li>
 *     <li>retry는 DLX가 있으면 wait 큐로 TTL 발행, 없으면 큐에 바로 재발행한 뒤 원본을 ack한다.</li>
 *     <li>retry 발행이 실패하면 원본을 requeue한다(유실 방지).</li>
 *     <li>메시지 단위 실패는 밖으로 던지지 않는다.</li>
 * </ul>
 */
@Slf4j
public class ConsumerDispatcher<T> implements DeliveryCallback {

    private final ConsumerRegistration<T> registration;
    private final ConsumerDefinition<T> definition;
    private final DispatcherContext ctx;
    private final BrokerChannel channel;
    private final RetryPolicy retryPolicy;
    private final RetryRepublisher retryRepublisher;
    private final int prefetch;
    private final int concurrency;
    private final ExecutorService executor;
    private final BatchAccumulator<ConsumedMessage<T>> accumulator;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean accepting;
    private volatile String consumerTag;

    public ConsumerDispatcher(ConsumerRegistration<T> registration, DispatcherContext ctx) {
        // 브로커 호출 전에 설정 오류를 드러낸다
        this.registration = registration.validate();
        this.definition = registration.definition();
        this.ctx = ctx;
        this.channel = ctx.channel();
        this.retryPolicy = definition.effectiveRetryPolicy();
        this.prefetch = definition.effectivePrefetch(ctx.defaultPrefetch());
        this.concurrency = definition.isBatchMode()
                ? Math.max(1, (prefetch + definition.batchSize() - 1) / definition.batchSize())
                : prefetch;

        if (definition.queue().hasDeadLetterExchange()) {
            this.retryRepublisher = new TtlBackoffRetryRepublisher(channel, ctx.clock(), definition.queue());
        } else {
            log.warn("[ConsumerDispatcher] queue has no dead letter exchange; retries are republished to the queue without delay. consumer={}, queue={}",
                    definition.name(), definition.queueName());
            this.retryRepublisher = new DirectRequeueRetryRepublisher(channel, ctx.clock(), definition.queueName());
        }

        this.executor = Executors.newFixedThreadPool(concurrency,
                new CustomizableThreadFactory("amqp-worker-" + definition.name() + "-"));
        this.accumulator = definition.isBatchMode()
                ? new BatchAccumulator<>(
                        definition.name(),
                        definition.batchSize(),
                        definition.effectiveBatchTimeout(),
                        ctx.batchTimer(),
                        ctx.clock(),
                        this::submitBatch)
                : null;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer already started. consumer=" + definition.name());
        }
        channel.setPrefetch(prefetch);
        accepting = true;
        try {
            consumerTag = channel.subscribe(definition.queueName(), this);
        } catch (RuntimeException e) {
            accepting = false;
            throw e;
        }

        log.info("[ConsumerDispatcher] consumer started. consumer={}, queue={}, prefetch={}, concurrency={}, batchSize={}, consumerTag={}",
                definition.name(), definition.queueName(), prefetch, concurrency, definition.batchSize(), consumerTag);
    }

    @Override
    public void onDelivery(DeliveryEnvelope envelope) {
        if (envelope == null) {
            onCancelled();
            return;
        }
        if (!accepting) {
            // 종료 중 도착분은 다른 consumer가 받도록 되돌린다
            requeue(envelope, "shutting down");
            return;
        }

        ConsumedMessage<T> message = decodeAndValidate(envelope);
        if (message == null) {
            return;
        }

        if (accumulator != null) {
            try {
                accumulator.add(message);
            } catch (IllegalStateException e) {
                requeue(envelope, "accumulator closed");
            }
            return;
        }

        try {
            executor.execute(() -> handleSingle(message));
        } catch (RejectedExecutionException e) {
            requeue(envelope, "executor rejected");
        }
    }

    /**
     * 구독 취소 -> 누적기 flush -> 진행 중 핸들러 대기(timeout까지). 여러 번 호출해도 한 번만 수행한다.
     */
    public void stop(Duration timeout) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        accepting = false;

        String tag = consumerTag;
        consumerTag = null;
        if (tag != null) {
            try {
                channel.cancel(tag);
            } catch (RuntimeException e) {
                log.warn("[ConsumerDispatcher] cancel failed. consumer={}, consumerTag={}, err={}",
                        definition.name(), tag, e.getMessage());
            }
        }

        if (accumulator != null) {
            accumulator.close();
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[ConsumerDispatcher] in-flight handlers did not finish in time. consumer={}, timeout={}",
                        definition.name(), timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        log.info("[ConsumerDispatcher] consumer stopped. consumer={}, queue={}", definition.name(), definition.queueName());
    }

    public String name() {
        return definition.name();
    }

    public String queueName() {
        return definition.queueName();
    }

    public String consumerTag() {
        return consumerTag;
    }

    public int prefetch() {
        return prefetch;
    }

    public int concurrency() {
        return concurrency;
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    private ConsumedMessage<T> decodeAndValidate(DeliveryEnvelope envelope) {
        MessageValidationException failure;
        try {
            byte[] raw = ctx.contentDecoder().decode(envelope.body(), envelope.contentEncoding());
            ValidationResult<T> result = definition.validator().validate(raw);
            if (result.isOk()) {
                return new ConsumedMessage<>(result.value(), envelope);
            }
            failure = new MessageValidationException(definition.name(), result.issues());
        } catch (Throwable e) {
            // 압축 해제 실패 / 미지원 인코딩 / validator 예외(Error 포함) 모두 형식 불량으로 본다
            failure = new MessageValidationException(definition.name(), String.valueOf(e.getMessage()), e);
        }

        log.warn("[ConsumerDispatcher] invalid payload -> DLQ. consumer={}, messageId={}, err={}",
                definition.name(), envelope.messageId(), failure.getMessage());
        settle(envelope, HandlerOutcome.validationFailure(failure));
        return null;
    }

    private void handleSingle(ConsumedMessage<T> message) {
        HandlerOutcome outcome;
        try {
            outcome = registration.handler().handle(message.payload(), message.envelope());
        } catch (Throwable e) {
            // Error도 UNKNOWN으로 정산한다
            outcome = HandlerOutcome.fromThrowable(e);
        }
        settle(message.envelope(), orUnknown(outcome));
    }

    private void submitBatch(Batch<ConsumedMessage<T>> batch) {
        ctx.metrics().batchFlushed(definition.name(), definition.queueName(), batch.trigger().tag());
        try {
            executor.execute(() -> handleBatch(batch));
        } catch (RejectedExecutionException e) {
            batch.items().forEach(m -> requeue(m.envelope(), "executor rejected"));
        }
    }

    private void handleBatch(Batch<ConsumedMessage<T>> batch) {
        List<ConsumedMessage<T>> items = batch.items();
        log.debug("[ConsumerDispatcher] handling batch. consumer={}, size={}, trigger={}",
                definition.name(), items.size(), batch.trigger().tag());

        HandlerOutcome outcome;
        try {
            outcome = registration.batchHandler().handle(items);
        } catch (Throwable e) {
            outcome = HandlerOutcome.fromThrowable(e);
        }
        // 배치 결과 하나를 모든 메시지에 적용(재시도 횟수는 메시지별)
        HandlerOutcome resolved = orUnknown(outcome);
        for (ConsumedMessage<T> item : items) {
            settle(item.envelope(), resolved);
        }
    }

    private HandlerOutcome orUnknown(HandlerOutcome outcome) {
        if (outcome != null) {
            return outcome;
        }
        return HandlerOutcome.unknown(new IllegalStateException("Handler returned no outcome. consumer=" + definition.name()));
    }

    private void settle(DeliveryEnvelope envelope, HandlerOutcome outcome) {
        DeliveryAction action = ctx.resolver().resolve(outcome, envelope.retryCount(), retryPolicy);
        try {
            apply(envelope, action);
        } catch (RuntimeException e) {
            // 채널이 끊긴 경우 등: ack되지 않은 메시지는 브로커가 재전달한다
            log.error("[ConsumerDispatcher] failed to settle delivery. consumer={}, deliveryTag={}, action={}",
                    definition.name(), envelope.deliveryTag(), action.outcome(), e);
        }
    }

    private void apply(DeliveryEnvelope envelope, DeliveryAction action) {
        String consumer = definition.name();
        String queue = definition.queueName();

        switch (action.outcome()) {
            case ACK -> {
                channel.ack(envelope.deliveryTag());
                ctx.metrics().consumed(consumer, queue, MetricsConfig.RESULT_SUCCESS);
            }
            case RETRY -> {
                try {
                    retryRepublisher.republish(envelope, action);
                } catch (RuntimeException e) {
                    log.warn("[ConsumerDispatcher] retry publish failed -> requeue. consumer={}, messageId={}, err={}",
                            consumer, envelope.messageId(), e.getMessage());
                    requeue(envelope, "retry publish failed");
                    return;
                }
                channel.ack(envelope.deliveryTag());

                log.warn("[ConsumerDispatcher] RETRY -> consumer={}, messageId={}, nextRetryCount={}, delayMs={}, err={}",
                        consumer, envelope.messageId(), action.nextRetryCount(), action.delay().toMillis(), action.lastError());
                ctx.metrics().consumed(consumer, queue, MetricsConfig.RESULT_RETRY);
                ctx.metrics().retryEnqueued(consumer, queue, action.nextRetryCount());
                ctx.eventLogger().retryScheduled(consumer, queue, envelope, action);
            }
            case DEAD_LETTER -> {
                channel.reject(envelope.deliveryTag(), false);

                log.error("[ConsumerDispatcher] DEAD -> DLQ consumer={}, messageId={}, reason={}, err={}",
                        consumer, envelope.messageId(), action.reason(), action.lastError());
                ctx.metrics().consumed(consumer, queue, MetricsConfig.RESULT_DEAD);
                ctx.metrics().deadLettered(consumer, queue, action.reason());
                ctx.eventLogger().deadLettered(consumer, queue, envelope, action);
            }
        }
    }

    private void requeue(DeliveryEnvelope envelope, String reason) {
        try {
            channel.reject(envelope.deliveryTag(), true);
            ctx.metrics().consumed(definition.name(), definition.queueName(), MetricsConfig.RESULT_REQUEUE);
        } catch (RuntimeException e) {
            log.error("[ConsumerDispatcher] requeue failed. consumer={}, deliveryTag={}, reason={}",
                    definition.name(), envelope.deliveryTag(), reason, e);
        }
    }

    private void onCancelled() {
        String tag = consumerTag;
        consumerTag = null;

        log.warn("[ConsumerDispatcher] consumer cancelled by broker. consumer={}, queue={}, consumerTag={}",
                definition.name(), definition.queueName(), tag);
        ctx.metrics().consumerCancelled(definition.name(), definition.queueName());
        ctx.eventLogger().consumerCancelled(definition.name(), definition.queueName(), tag);

        // 이미 받은 메시지는 처리해서 정산한다
        if (accumulator != null) {
            accumulator.flush();
        }
    }
}
