package com.yunhwan.amqp.contract.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    public static final String METRIC_CONSUME = "amqp_worker.consume";
    public static final String METRIC_RETRY_ENQUEUE = "amqp_worker.retry.enqueue";
    public static final String METRIC_DLQ = "amqp_worker.dlq";
    public static final String METRIC_BATCH = "amqp_worker.batch";
    public static final String METRIC_CONSUMER_CANCELLED = "amqp_worker.consumer.cancelled";

    // 고카디널리티 금지(메시지ID/에러메시지/스택 제외)
    public static final String TAG_CONSUMER = "consumer";
    public static final String TAG_QUEUE = "queue";
    public static final String TAG_RESULT = "result";
    public static final String TAG_RETRY_BUCKET = "retry_bucket";
    public static final String TAG_REASON = "reason";
    public static final String TAG_TRIGGER = "trigger";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_RETRY = "retry";
    public static final String RESULT_DEAD = "dead";
    public static final String RESULT_REQUEUE = "requeue";

    // 재시도 분포(1/2/3+)만 집계
    public static final String RETRY_BUCKET_1 = "1";
    public static final String RETRY_BUCKET_2 = "2";
    public static final String RETRY_BUCKET_3PLUS = "3plus";

    // 사유 택소노미(안정적 값만)
    public static final String REASON_VALIDATION = "validation";
    public static final String REASON_NON_RETRYABLE = "non_retryable";
    public static final String REASON_MAX_ATTEMPTS = "max_attempts";
    public static final String REASON_UNKNOWN = "unknown";
}
