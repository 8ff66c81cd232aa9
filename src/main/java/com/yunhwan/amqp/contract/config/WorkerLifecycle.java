package com.yunhwan.amqp.contract.config;

import com.yunhwan.amqp.contract.usecase.worker.WorkerSupervisor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;

/**
 * 컨텍스트 기동/종료에 WorkerSupervisor를 묶는다.
 * 다른 빈보다 늦게 시작하고 먼저 정지한다.
 */
@RequiredArgsConstructor
public class WorkerLifecycle implements SmartLifecycle {

    static final int PHASE = Integer.MAX_VALUE - 1000;

    private final WorkerSupervisor supervisor;
    private final boolean autoStartup;

    @Override
    public void start() {
        supervisor.start();
    }

    @Override
    public void stop() {
        supervisor.stop();
    }

    @Override
    public boolean isRunning() {
        return supervisor.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
