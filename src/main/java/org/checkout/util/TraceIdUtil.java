package org.checkout.util;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 全链路追踪工具类
 * - 生成/校验追踪ID
 * - ThreadLocal 保存当前请求的追踪ID，同时写入 MDC 供日志输出
 */
public final class TraceIdUtil {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    // 外部传入的追踪ID只接受字母、数字、短横线，长度不超过64
    private static final Pattern VALID_TRACE_ID = Pattern.compile("[A-Za-z0-9\\-]{1,64}");

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static boolean isValid(String traceId) {
        return traceId != null && VALID_TRACE_ID.matcher(traceId).matches();
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
        if (traceId != null) {
            MDC.put(MDC_KEY, traceId);
        } else {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * 获取当前的追踪ID，未设置时返回 null
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    /**
     * 清除追踪ID（通常在请求或消息处理结束时调用）
     */
    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
        MDC.remove(MDC_KEY);
    }
}
