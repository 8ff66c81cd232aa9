package com.yunhwan.amqp.contract.domain.topology;

import java.util.List;

/**
 * TTL-backoff 재시도 인프라.
 * <pre>
 * main --(retry publish, rk=&lt;main&gt;-wait)--&gt; DLX --&gt; wait --(TTL 만료, rk=&lt;main&gt;)--&gt; DLX --&gt; main
 * </pre>
 */
public record QueueWithTtlBackoffInfrastructure(
        QueueDefinition mainQueue,
        QueueDefinition waitQueue,
        QueueBindingDefinition waitQueueBinding,
        QueueBindingDefinition mainQueueRetryBinding
) {

    public ExchangeDefinition deadLetterExchange() {
        return mainQueue.getDeadLetter().exchange();
    }

    public List<QueueBindingDefinition> bindings() {
        return List.of(waitQueueBinding, mainQueueRetryBinding);
    }
}
