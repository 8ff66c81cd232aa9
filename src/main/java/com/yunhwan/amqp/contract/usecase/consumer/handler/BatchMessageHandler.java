package com.yunhwan.amqp.contract.usecase.consumer.handler;

import com.yunhwan.amqp.contract.domain.consumer.ConsumedMessage;
import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;

import java.util.List;

/**
 * 배치 핸들러. 반환한 결과 하나가 배치 내 모든 메시지에 동일하게 적용된다(부분 ack 없음).
 */
@FunctionalInterface
public interface BatchMessageHandler<T> {

    HandlerOutcome handle(List<ConsumedMessage<T>> messages);
}
