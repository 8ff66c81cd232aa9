package com.yunhwan.amqp.contract.domain.topology;

import java.util.Map;

/**
 * queue ← exchange 또는 exchange ← exchange 바인딩.
 */
public interface BindingDefinition {

    String routingKey();

    Map<String, Object> arguments();
}
