package com.yunhwan.amqp.contract.usecase.consumer.batch;

import com.yunhwan.amqp.contract.domain.consumer.Batch;
import com.yunhwan.amqp.contract.domain.consumer.FlushTrigger;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * consumer 하나의 배치 누적기.
 * <p>
 * 상태: IDLE -(첫 도착, 타이머 시작)-> ACCUMULATING -(batchSize 도달 또는 deadline 경과)-> flush -> IDLE
 * <ul>
 *     <li>size flush 시 타이머를 취소한다.</li>
 *     <li>취소가 늦어 이미 실행된 타이머는 generation이 달라 무시된다(빈 flush / 이중 flush 방지).</li>
 *     <li>flush 리스너는 락 밖에서 호출되므로, 리스너 처리 중 도착한 메시지는 새 배치로 쌓인다.</li>
 * </ul>
 */
@Slf4j
public class BatchAccumulator<E> {

    private final String name;
    private final int batchSize;
    private final Duration batchTimeout;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final Consumer<Batch<E>> flushListener;

    private final Object lock = new Object();
    private List<E> current = new ArrayList<>();
    private ScheduledFuture<?> deadlineTask;
    private Instant deadline;
    private long generation;
    private boolean closed;

    public BatchAccumulator(
            String name,
            int batchSize,
            Duration batchTimeout,
            ScheduledExecutorService timer,
            Clock clock,
            Consumer<Batch<E>> flushListener
    ) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive. batchSize=" + batchSize);
        }
        if (batchTimeout.isZero() || batchTimeout.isNegative()) {
            throw new IllegalArgumentException("batchTimeout must be positive. batchTimeout=" + batchTimeout);
        }
        this.name = name;
        this.batchSize = batchSize;
        this.batchTimeout = batchTimeout;
        this.timer = timer;
        this.clock = clock;
        this.flushListener = flushListener;
    }

    public void add(E item) {
        Batch<E> ready = null;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("BatchAccumulator is closed. name=" + name);
            }
            if (current.isEmpty()) {
                armDeadline();
            }
            current.add(item);
            if (current.size() >= batchSize) {
                ready = drain(FlushTrigger.SIZE);
            }
        }
        if (ready != null) {
            deliver(ready);
        }
    }

    /**
     * 누적 중인 부분 배치를 즉시 내보낸다. 비어 있으면 아무것도 하지 않는다.
     *
     * @return flush 여부
     */
    public boolean flush() {
        Batch<E> ready;
        synchronized (lock) {
            if (current.isEmpty()) {
                return false;
            }
            ready = drain(FlushTrigger.SHUTDOWN);
        }
        deliver(ready);
        return true;
    }

    /**
     * 남은 부분 배치를 flush하고 이후 add를 거부한다.
     * 닫힘 표시와 drain은 한 번의 락 안에서 일어나므로 close 도중의 add는 배치에 들어가거나 거부된다.
     */
    public void close() {
        Batch<E> ready = null;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            cancelDeadline();
            if (!current.isEmpty()) {
                ready = drain(FlushTrigger.SHUTDOWN);
            }
        }
        if (ready != null) {
            deliver(ready);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return current.size();
        }
    }

    private void armDeadline() {
        generation++;
        long armedGeneration = generation;
        deadline = clock.instant().plus(batchTimeout);
        deadlineTask = timer.schedule(() -> onDeadline(armedGeneration), batchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onDeadline(long armedGeneration) {
        Batch<E> ready;
        synchronized (lock) {
            if (armedGeneration != generation || current.isEmpty()) {
                return;
            }
            deadlineTask = null;
            ready = drain(FlushTrigger.TIMEOUT);
        }
        deliver(ready);
    }

    private Batch<E> drain(FlushTrigger trigger) {
        cancelDeadline();
        Batch<E> batch = new Batch<>(current, deadline, trigger);
        current = new ArrayList<>();
        deadline = null;
        // 이전 사이클의 타이머가 늦게 실행돼도 무시되도록
        generation++;
        return batch;
    }

    private void cancelDeadline() {
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
            deadlineTask = null;
        }
    }

    private void deliver(Batch<E> batch) {
        try {
            flushListener.accept(batch);
        } catch (RuntimeException e) {
            log.error("[BatchAccumulator] flush listener failed. name={}, size={}, trigger={}",
                    name, batch.size(), batch.trigger(), e);
        }
    }
}
