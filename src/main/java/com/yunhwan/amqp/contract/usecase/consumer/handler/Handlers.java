package com.yunhwan.amqp.contract.usecase.consumer.handler;

import com.yunhwan.amqp.contract.domain.consumer.HandlerOutcome;

/**
 * 예외 기반 핸들러를 결과 기반 핸들러로 변환한다.
 * <p>
 * 정상 종료는 SUCCESS, 예외와 Error는 {@link HandlerOutcome#fromThrowable(Throwable)} 규칙으로 분류된다.
 */
public final class Handlers {

    private Handlers() {}

    public static <T> MessageHandler<T> safe(ThrowingMessageHandler<T> handler) {
        return (payload, envelope) -> {
            try {
                handler.handle(payload, envelope);
                return HandlerOutcome.success();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HandlerOutcome.retryable(e);
            } catch (Exception | Error e) {
                return HandlerOutcome.fromThrowable(e);
            }
        };
    }

    public static <T> BatchMessageHandler<T> safeBatch(ThrowingBatchMessageHandler<T> handler) {
        return messages -> {
            try {
                handler.handle(messages);
                return HandlerOutcome.success();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HandlerOutcome.retryable(e);
            } catch (Exception | Error e) {
                return HandlerOutcome.fromThrowable(e);
            }
        };
    }
}
