package com.yunhwan.amqp.contract.usecase.retry;

import com.yunhwan.amqp.contract.common.util.HeaderUtils;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryAction;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.usecase.consumer.port.OutboundMessage;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 재발행 메시지 구성: 원본 body/properties/헤더 유지 + retry 헤더 갱신.
 */
final class RetryMessages {

    private RetryMessages() {}

    static OutboundMessage retryMessage(DeliveryEnvelope original, DeliveryAction action, Clock clock, String expiration) {
        // 기존 헤더 유지
        Map<String, Object> headers = new LinkedHashMap<>(original.headers());
        headers.put(HeaderUtils.RETRY_HEADER, action.nextRetryCount());
        if (action.lastError() != null) {
            headers.put(HeaderUtils.LAST_ERROR_HEADER, action.lastError());
        }
        // 최초 실패 시각은 첫 재시도에만 기록
        if (HeaderUtils.getLong(headers, HeaderUtils.FIRST_FAILURE_TIMESTAMP_HEADER) == null) {
            headers.put(HeaderUtils.FIRST_FAILURE_TIMESTAMP_HEADER, clock.millis());
        }

        return OutboundMessage.builder()
                .body(original.body())
                .headers(headers)
                .contentType(original.contentType())
                .contentEncoding(original.contentEncoding())
                .messageId(original.messageId())
                .correlationId(original.correlationId())
                .priority(original.priority())
                .persistent(original.persistent())
                .expiration(expiration)
                .build();
    }
}
