package com.yunhwan.amqp.contract.usecase.worker;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.domain.topology.Topology;
import com.yunhwan.amqp.contract.usecase.consumer.ConsumerDispatcher;
import com.yunhwan.amqp.contract.usecase.consumer.ConsumerRegistration;
import com.yunhwan.amqp.contract.usecase.consumer.DispatcherContext;
import com.yunhwan.amqp.contract.usecase.topology.TopologyDeclarer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 워커 하나가 소유한 consumer 전체의 수명 관리.
 * <p>
 * start: (선택) topology 선언 -> 모든 dispatcher 생성/검증 -> 구독 시작. 중간 실패 시 이미 시작한 것은 정지.
 * stop: dispatcher별 graceful 정지 -> 소유한 채널이면 닫기. 멱등.
 */
@Slf4j
public class WorkerSupervisor {

    private final List<ConsumerRegistration<?>> registrations;
    private final DispatcherContext ctx;
    private final Topology topology;
    private final TopologyDeclarer topologyDeclarer;
    private final boolean declareTopology;
    private final Duration shutdownTimeout;
    private final boolean ownsChannel;

    private final Object lifecycleLock = new Object();
    private List<ConsumerDispatcher<?>> dispatchers = List.of();
    private boolean running;

    public WorkerSupervisor(
            List<ConsumerRegistration<?>> registrations,
            DispatcherContext ctx,
            Topology topology,
            TopologyDeclarer topologyDeclarer,
            boolean declareTopology,
            Duration shutdownTimeout,
            boolean ownsChannel
    ) {
        this.registrations = List.copyOf(registrations);
        this.ctx = ctx;
        this.topology = topology;
        this.topologyDeclarer = topologyDeclarer;
        this.declareTopology = declareTopology;
        this.shutdownTimeout = shutdownTimeout;
        this.ownsChannel = ownsChannel;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }

            // 구독 전에 설정 오류를 모두 드러낸다
            List<ConsumerDispatcher<?>> created = createDispatchers();

            List<ConsumerDispatcher<?>> startedDispatchers = new ArrayList<>();
            try {
                if (declareTopology && topology != null) {
                    topologyDeclarer.declare(ctx.channel(), topology);
                }
                for (ConsumerDispatcher<?> dispatcher : created) {
                    dispatcher.start();
                    startedDispatchers.add(dispatcher);
                }
            } catch (RuntimeException e) {
                log.error("[WorkerSupervisor] start failed -> rollback. started={}, total={}",
                        startedDispatchers.size(), created.size(), e);
                created.forEach(d -> d.stop(shutdownTimeout));
                throw e;
            }

            dispatchers = Collections.unmodifiableList(created);
            running = true;
            log.info("[WorkerSupervisor] worker started. consumers={}", dispatchers.size());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;

            for (ConsumerDispatcher<?> dispatcher : dispatchers) {
                try {
                    dispatcher.stop(shutdownTimeout);
                } catch (RuntimeException e) {
                    log.error("[WorkerSupervisor] consumer stop failed. consumer={}", dispatcher.name(), e);
                }
            }

            if (ownsChannel) {
                try {
                    ctx.channel().close();
                } catch (RuntimeException e) {
                    log.warn("[WorkerSupervisor] channel close failed. err={}", e.getMessage());
                }
            }
            log.info("[WorkerSupervisor] worker stopped. consumers={}", dispatchers.size());
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return running;
        }
    }

    public List<ConsumerDispatcher<?>> dispatchers() {
        synchronized (lifecycleLock) {
            return dispatchers;
        }
    }

    private List<ConsumerDispatcher<?>> createDispatchers() {
        Set<String> names = new HashSet<>();
        List<ConsumerDispatcher<?>> created = new ArrayList<>();
        try {
            for (ConsumerRegistration<?> registration : registrations) {
                if (!names.add(registration.name())) {
                    throw new ConsumerConfigurationException("Duplicate consumer name \"" + registration.name() + "\"");
                }
                created.add(newDispatcher(registration));
            }
        } catch (RuntimeException e) {
            // 생성된 executor 정리
            created.forEach(d -> d.stop(Duration.ZERO));
            throw e;
        }
        return created;
    }

    <T> ConsumerDispatcher<T> newDispatcher(ConsumerRegistration<T> registration) {
        return new ConsumerDispatcher<>(registration, ctx);
    }
}
