package com.yunhwan.amqp.contract.usecase.consumer.port;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * publish할 메시지와 AMQP properties.
 *
 * @param expiration per-message TTL(ms, 문자열). null이면 만료 없음.
 */
@Builder(toBuilder = true)
public record OutboundMessage(
        byte[] body,
        Map<String, Object> headers,
        String contentType,
        String contentEncoding,
        String messageId,
        String correlationId,
        Integer priority,
        boolean persistent,
        String expiration
) {

    public OutboundMessage {
        body = body == null ? new byte[0] : body;
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
