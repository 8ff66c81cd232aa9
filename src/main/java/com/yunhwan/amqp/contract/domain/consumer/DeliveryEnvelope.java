package com.yunhwan.amqp.contract.domain.consumer;

import com.yunhwan.amqp.contract.common.util.HeaderUtils;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 브로커가 전달한 원본 메시지.
 * <p>
 * deliveryTag는 ack/reject에 쓰는 불투명 토큰이다.
 * 재시도 republish 시 원본 속성을 보존하기 위해 AMQP properties 일부를 함께 들고 다닌다.
 */
@Builder(toBuilder = true)
public record DeliveryEnvelope(
        long deliveryTag,
        String consumerTag,
        String exchange,
        String routingKey,
        boolean redelivered,
        byte[] body,
        Map<String, Object> headers,
        String contentType,
        String contentEncoding,
        String messageId,
        String correlationId,
        Integer priority,
        boolean persistent
) {

    public DeliveryEnvelope {
        body = body == null ? new byte[0] : body;
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public int retryCount() {
        return HeaderUtils.getRetryCount(headers);
    }
}
