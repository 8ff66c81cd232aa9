package com.yunhwan.amqp.contract.usecase.consumer;

import com.yunhwan.amqp.contract.infra.logging.ConsumerEventLogger;
import com.yunhwan.amqp.contract.infra.messaging.codec.ContentDecoder;
import com.yunhwan.amqp.contract.infra.metrics.ConsumerMetrics;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import lombok.Builder;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 모든 dispatcher가 공유하는 협력 객체.
 *
 * @param batchTimer 배치 deadline 타이머(consumer 간 공유)
 */
@Builder
public record DispatcherContext(
        BrokerChannel channel,
        DeliveryOutcomeResolver resolver,
        ContentDecoder contentDecoder,
        ConsumerMetrics metrics,
        ConsumerEventLogger eventLogger,
        ScheduledExecutorService batchTimer,
        Clock clock,
        int defaultPrefetch
) {

    public static final int DEFAULT_PREFETCH = 10;
}
