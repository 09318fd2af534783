package org.checkout.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一响应结构：{code, message, data, traceId}
 */
public final class ResponseUtil {

    public static final String SUCCESS = "SUCCESS";

    private ResponseUtil() {
    }

    public static Map<String, Object> success(String message, Object data) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", SUCCESS);
        result.put("message", message);
        result.put("data", data);
        result.put("traceId", TraceIdUtil.getTraceId());
        return result;
    }

    public static Map<String, Object> error(String code, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", code);
        result.put("message", message);
        result.put("traceId", TraceIdUtil.getTraceId());
        return result;
    }
}
