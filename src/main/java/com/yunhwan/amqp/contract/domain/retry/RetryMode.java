package com.yunhwan.amqp.contract.domain.retry;

public enum RetryMode {
    /** 정책이 설정된 경우 */
    POLICY,
    /** 정책 없음: 고정 1000ms 간격으로 무한 재시도 (하위 호환) */
    LEGACY_UNBOUNDED
}
