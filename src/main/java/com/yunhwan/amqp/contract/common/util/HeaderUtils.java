package com.yunhwan.amqp.contract.common.util;

import java.util.Map;

public final class HeaderUtils {

    public static final String RETRY_HEADER = "x-retry-count";
    public static final String LAST_ERROR_HEADER = "x-last-error";
    public static final String FIRST_FAILURE_TIMESTAMP_HEADER = "x-first-failure-timestamp";

    private HeaderUtils() {}

    /**
     * retry 헤더가 없거나 해석할 수 없으면 0, 음수도 0으로 본다.
     */
    public static int getRetryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object v = headers.get(RETRY_HEADER);
        if (v instanceof Number n) {
            return Math.max(0, n.intValue());
        }
        if (v instanceof String s) {
            try {
                return Math.max(0, Integer.parseInt(s.trim()));
            } catch (NumberFormatException ignore) {
                // 형식 불량 헤더는 첫 시도로 취급
                return 0;
            }
        }
        return 0;
    }

    public static Long getLong(Map<String, Object> headers, String name) {
        if (headers == null) {
            return null;
        }
        Object v = headers.get(name);
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignore) {
                return null;
            }
        }
        return null;
    }
}
