package com.yunhwan.amqp.contract.usecase.topology;

import com.yunhwan.amqp.contract.domain.topology.BindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.ExchangeBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.Topology;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * exchange -> queue -> binding 순서로 선언한다.
 */
@Slf4j
public class TopologyDeclarer {

    public void declare(BrokerChannel channel, Topology topology) {
        topology.exchanges().forEach(channel::declareExchange);
        topology.queues().forEach(channel::declareQueue);
        for (BindingDefinition binding : topology.bindings()) {
            if (binding instanceof QueueBindingDefinition qb) {
                channel.bindQueue(qb);
            } else if (binding instanceof ExchangeBindingDefinition eb) {
                channel.bindExchange(eb);
            }
        }

        log.info("[TopologyDeclarer] topology declared. exchanges={}, queues={}, bindings={}",
                topology.exchanges().size(), topology.queues().size(), topology.bindings().size());
    }
}
