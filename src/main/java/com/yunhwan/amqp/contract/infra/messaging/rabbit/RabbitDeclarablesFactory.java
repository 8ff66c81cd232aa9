package com.yunhwan.amqp.contract.infra.messaging.rabbit;

import com.yunhwan.amqp.contract.domain.topology.BindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.ExchangeBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.ExchangeDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.domain.topology.Topology;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Topology -> Spring AMQP {@link Declarables}.
 * RabbitAdmin에 선언을 맡기는 애플리케이션용.
 */
public final class RabbitDeclarablesFactory {

    private RabbitDeclarablesFactory() {}

    public static Declarables from(Topology topology) {
        List<Declarable> declarables = new ArrayList<>();
        topology.exchanges().forEach(e -> declarables.add(exchange(e)));
        topology.queues().forEach(q -> declarables.add(queue(q)));
        for (BindingDefinition binding : topology.bindings()) {
            declarables.add(binding(binding));
        }
        return new Declarables(declarables);
    }

    static Exchange exchange(ExchangeDefinition def) {
        ExchangeBuilder builder = new ExchangeBuilder(def.name(), def.type().amqpName())
                .durable(def.durable())
                .withArguments(def.arguments());
        if (def.autoDelete()) {
            builder.autoDelete();
        }
        if (def.internal()) {
            builder.internal();
        }
        return builder.build();
    }

    static Queue queue(QueueDefinition def) {
        QueueBuilder builder = def.isDurable()
                ? QueueBuilder.durable(def.getName())
                : QueueBuilder.nonDurable(def.getName());
        if (def.isExclusive()) {
            builder.exclusive();
        }
        if (def.isAutoDelete()) {
            builder.autoDelete();
        }
        return builder.withArguments(RabbitQueueArguments.of(def)).build();
    }

    static Binding binding(BindingDefinition def) {
        if (def instanceof QueueBindingDefinition qb) {
            return new Binding(qb.queue().getName(), Binding.DestinationType.QUEUE,
                    qb.exchange().name(), qb.routingKey(), qb.arguments());
        }
        if (def instanceof ExchangeBindingDefinition eb) {
            return new Binding(eb.destination().name(), Binding.DestinationType.EXCHANGE,
                    eb.source().name(), eb.routingKey(), eb.arguments());
        }
        throw new IllegalArgumentException("Unsupported binding type: " + def.getClass().getName());
    }
}
