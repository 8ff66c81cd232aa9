package com.yunhwan.amqp.contract.domain.topology;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * exchange / queue / binding 선언 묶음.
 * <p>
 * 이름 기준으로 중복을 제거하고 선언 순서를 유지한다.
 * TTL-backoff 인프라 합성은 {@code TtlBackoffInfrastructureSynthesizer}가 담당하며,
 * {@link Builder#queue(QueueDefinition)}에 synthesizer를 넘겨주면 wait 큐와 바인딩이 자동으로 포함된다.
 */
public final class Topology {

    private final List<ExchangeDefinition> exchanges;
    private final List<QueueDefinition> queues;
    private final List<BindingDefinition> bindings;

    private Topology(List<ExchangeDefinition> exchanges, List<QueueDefinition> queues, List<BindingDefinition> bindings) {
        this.exchanges = Collections.unmodifiableList(exchanges);
        this.queues = Collections.unmodifiableList(queues);
        this.bindings = Collections.unmodifiableList(bindings);
    }

    public static Builder builder(Function<QueueDefinition, QueueWithTtlBackoffInfrastructure> synthesizer) {
        return new Builder(synthesizer);
    }

    public List<ExchangeDefinition> exchanges() {
        return exchanges;
    }

    public List<QueueDefinition> queues() {
        return queues;
    }

    public List<BindingDefinition> bindings() {
        return bindings;
    }

    public QueueDefinition queue(String name) {
        return queues.stream()
                .filter(q -> q.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    public static final class Builder {

        private final Function<QueueDefinition, QueueWithTtlBackoffInfrastructure> synthesizer;
        private final Map<String, ExchangeDefinition> exchanges = new LinkedHashMap<>();
        private final Map<String, QueueDefinition> queues = new LinkedHashMap<>();
        private final Map<String, BindingDefinition> bindings = new LinkedHashMap<>();

        private Builder(Function<QueueDefinition, QueueWithTtlBackoffInfrastructure> synthesizer) {
            this.synthesizer = synthesizer;
        }

        public Builder exchange(ExchangeDefinition exchange) {
            exchanges.putIfAbsent(exchange.name(), exchange);
            return this;
        }

        public Builder queue(QueueDefinition queue) {
            queue.validate();
            queues.put(queue.getName(), queue);
            if (queue.hasDeadLetterExchange()) {
                exchange(queue.getDeadLetter().exchange());
            }
            if (queue.usesTtlBackoff() && synthesizer != null) {
                QueueWithTtlBackoffInfrastructure infra = synthesizer.apply(queue);
                queues.putIfAbsent(infra.waitQueue().getName(), infra.waitQueue());
                binding(infra.waitQueueBinding());
                binding(infra.mainQueueRetryBinding());
            }
            return this;
        }

        public Builder queues(Collection<QueueDefinition> defs) {
            defs.forEach(this::queue);
            return this;
        }

        public Builder binding(BindingDefinition binding) {
            if (binding instanceof QueueBindingDefinition qb) {
                exchange(qb.exchange());
                queues.putIfAbsent(qb.queue().getName(), qb.queue());
                bindings.putIfAbsent(key(qb), qb);
            } else if (binding instanceof ExchangeBindingDefinition eb) {
                exchange(eb.source());
                exchange(eb.destination());
                bindings.putIfAbsent(key(eb), eb);
            } else {
                throw new IllegalArgumentException("Unsupported binding type: " + binding.getClass().getName());
            }
            return this;
        }

        public Topology build() {
            return new Topology(
                    new ArrayList<>(exchanges.values()),
                    new ArrayList<>(queues.values()),
                    new ArrayList<>(bindings.values())
            );
        }

        private static String key(QueueBindingDefinition b) {
            return "queue:" + b.queue().getName() + "<-" + b.exchange().name() + ":" + b.routingKey();
        }

        private static String key(ExchangeBindingDefinition b) {
            return "exchange:" + b.destination().name() + "<-" + b.source().name() + ":" + b.routingKey();
        }
    }
}
