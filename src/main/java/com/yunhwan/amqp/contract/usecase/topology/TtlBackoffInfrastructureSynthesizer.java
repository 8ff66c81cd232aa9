package com.yunhwan.amqp.contract.usecase.topology;

import com.yunhwan.amqp.contract.common.exception.ConsumerConfigurationException;
import com.yunhwan.amqp.contract.domain.retry.BackoffPolicy;
import com.yunhwan.amqp.contract.domain.retry.RetryPolicy;
import com.yunhwan.amqp.contract.domain.topology.DeadLetterConfig;
import com.yunhwan.amqp.contract.domain.topology.ExchangeDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueType;
import com.yunhwan.amqp.contract.domain.topology.QueueWithTtlBackoffInfrastructure;

import java.time.Duration;
import java.util.function.Function;

/**
 * 메인 큐 하나에 대한 TTL-backoff 재시도 인프라를 만든다.
 * <ul>
 *     <li>wait 큐: &lt;main&gt;-wait, 만료 시 같은 DLX로 rk=&lt;main&gt; dead-letter</li>
 *     <li>wait 바인딩: wait &lt;- DLX (rk=&lt;main&gt;-wait)</li>
 *     <li>retry 바인딩: main &lt;- DLX (rk=&lt;main&gt;)</li>
 * </ul>
 * wait 큐 자신은 ttlBackoffRetry=false로 만들어 재귀 합성을 막는다.
 */
public class TtlBackoffInfrastructureSynthesizer implements Function<QueueDefinition, QueueWithTtlBackoffInfrastructure> {

    public static final String WAIT_QUEUE_SUFFIX = "-wait";

    /** wait 큐에 붙는 기본 정책(선언용 메타데이터, 동작에는 쓰이지 않음) */
    public static final RetryPolicy DEFAULT_WAIT_QUEUE_RETRY_POLICY = RetryPolicy.of(
            3,
            BackoffPolicy.exponential(Duration.ofMillis(1_000), Duration.ofMillis(30_000), 2.0)
    ).withJitter(true);

    public static String waitQueueName(String mainQueueName) {
        return mainQueueName + WAIT_QUEUE_SUFFIX;
    }

    @Override
    public QueueWithTtlBackoffInfrastructure apply(QueueDefinition queue) {
        return synthesize(queue);
    }

    public QueueWithTtlBackoffInfrastructure synthesize(QueueDefinition queue) {
        return synthesize(queue, null);
    }

    /**
     * @param waitQueueDurable null이면 메인 큐의 durable을 따른다
     */
    public QueueWithTtlBackoffInfrastructure synthesize(QueueDefinition queue, Boolean waitQueueDurable) {
        if (!queue.hasDeadLetterExchange()) {
            throw new ConsumerConfigurationException(
                    "Queue \"" + queue.getName() + "\" does not have a dead letter exchange configured. "
                            + "TTL-backoff retry requires deadLetter to be set on the queue definition.");
        }

        ExchangeDefinition dlx = queue.getDeadLetter().exchange();
        String waitName = waitQueueName(queue.getName());
        boolean durable = waitQueueDurable != null ? waitQueueDurable : queue.isDurable();

        QueueDefinition waitQueue = QueueDefinition.builder()
                .name(waitName)
                // quorum 큐는 non-durable 불가
                .type(durable ? QueueType.QUORUM : QueueType.CLASSIC)
                .durable(durable)
                .deadLetter(DeadLetterConfig.of(dlx, queue.getName()))
                .ttlBackoffRetry(false)
                .retryPolicy(DEFAULT_WAIT_QUEUE_RETRY_POLICY)
                .build();

        return new QueueWithTtlBackoffInfrastructure(
                queue,
                waitQueue,
                QueueBindingDefinition.of(waitQueue, dlx, waitName),
                QueueBindingDefinition.of(queue, dlx, queue.getName())
        );
    }
}
