package com.yunhwan.amqp.contract.config;

import com.yunhwan.amqp.contract.domain.topology.Topology;
import com.yunhwan.amqp.contract.infra.logging.ConsumerEventLogger;
import com.yunhwan.amqp.contract.infra.messaging.codec.ContentDecoder;
import com.yunhwan.amqp.contract.infra.messaging.rabbit.RabbitBrokerChannel;
import com.yunhwan.amqp.contract.infra.messaging.rabbit.RabbitDeclarablesFactory;
import com.yunhwan.amqp.contract.infra.metrics.ConsumerMetrics;
import com.yunhwan.amqp.contract.usecase.consumer.ConsumerRegistration;
import com.yunhwan.amqp.contract.usecase.consumer.DeliveryOutcomeResolver;
import com.yunhwan.amqp.contract.usecase.consumer.DispatcherContext;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import com.yunhwan.amqp.contract.usecase.retry.RetryPolicyCalculator;
import com.yunhwan.amqp.contract.usecase.topology.TopologyDeclarer;
import com.yunhwan.amqp.contract.usecase.topology.TtlBackoffInfrastructureSynthesizer;
import com.yunhwan.amqp.contract.usecase.worker.WorkerSupervisor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 워커 구성.
 * <p>
 * - ConsumerRegistration 빈을 모두 모아 설정 덮어쓰기를 적용한 뒤 WorkerSupervisor에 넘긴다.
 * - BrokerChannel 빈이 없으면 Spring AMQP ConnectionFactory로 채널을 직접 열고, 정지 시 닫는다.
 * - Topology 빈이 있으면 Declarables로도 노출한다(RabbitAdmin 선언용).
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(WorkerProperties.class)
@Import(TimeConfig.class)
public class WorkerConfig {

    @Bean
    public RetryPolicyCalculator retryPolicyCalculator() {
        return new RetryPolicyCalculator();
    }

    @Bean
    public DeliveryOutcomeResolver deliveryOutcomeResolver(RetryPolicyCalculator calculator) {
        return new DeliveryOutcomeResolver(calculator);
    }

    @Bean
    public ContentDecoder contentDecoder() {
        return new ContentDecoder();
    }

    @Bean
    public ConsumerMetrics consumerMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        // actuator가 없으면 로컬 레지스트리로 집계만 한다
        return new ConsumerMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public ConsumerEventLogger consumerEventLogger(Clock clock) {
        return new ConsumerEventLogger(clock);
    }

    @Bean
    public TtlBackoffInfrastructureSynthesizer ttlBackoffInfrastructureSynthesizer() {
        return new TtlBackoffInfrastructureSynthesizer();
    }

    @Bean
    public TopologyDeclarer topologyDeclarer() {
        return new TopologyDeclarer();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService amqpWorkerBatchTimer() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("amqp-worker-batch-timer-"));
    }

    @Bean
    public Declarables amqpContractDeclarables(ObjectProvider<Topology> topology) {
        Topology t = topology.getIfAvailable();
        return t == null ? new Declarables() : RabbitDeclarablesFactory.from(t);
    }

    @Bean
    public WorkerSupervisor workerSupervisor(
            WorkerProperties props,
            ObjectProvider<ConsumerRegistration<?>> registrations,
            ObjectProvider<BrokerChannel> brokerChannel,
            ObjectProvider<ConnectionFactory> connectionFactory,
            ObjectProvider<Topology> topology,
            DeliveryOutcomeResolver resolver,
            ContentDecoder contentDecoder,
            ConsumerMetrics metrics,
            ConsumerEventLogger eventLogger,
            ScheduledExecutorService amqpWorkerBatchTimer,
            TopologyDeclarer topologyDeclarer,
            Clock clock
    ) {
        BrokerChannel channel = brokerChannel.getIfAvailable();
        boolean ownsChannel = channel == null;
        if (ownsChannel) {
            channel = RabbitBrokerChannel.open(connectionFactory.getObject());
            log.info("[WorkerConfig] broker channel opened from ConnectionFactory");
        }

        List<ConsumerRegistration<?>> applied = registrations.orderedStream()
                .<ConsumerRegistration<?>>map(props::applyOverrides)
                .toList();

        DispatcherContext ctx = DispatcherContext.builder()
                .channel(channel)
                .resolver(resolver)
                .contentDecoder(contentDecoder)
                .metrics(metrics)
                .eventLogger(eventLogger)
                .batchTimer(amqpWorkerBatchTimer)
                .clock(clock)
                .defaultPrefetch(props.getDefaultPrefetch())
                .build();

        return new WorkerSupervisor(
                applied,
                ctx,
                topology.getIfAvailable(),
                topologyDeclarer,
                props.isDeclareTopology(),
                props.getShutdownTimeout(),
                ownsChannel
        );
    }

    @Bean
    public WorkerLifecycle workerLifecycle(WorkerSupervisor supervisor, WorkerProperties props) {
        return new WorkerLifecycle(supervisor, props.isAutoStartup());
    }
}
