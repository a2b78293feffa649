package com.slb.update_backend.common.trace;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * 当前请求的 traceId，同时写入 SLF4J MDC（key = traceId），日志与响应头 X-Trace-Id 一致。
 */
public final class TraceIdHolder {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    /**
     * 绑定到当前线程，关闭 Scope 时解绑。
     */
    public static Scope open(String traceId) {
        CURRENT.set(traceId);
        MDC.put(MDC_KEY, traceId);
        return TraceIdHolder::clear;
    }

    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * 过滤器之外（如异步线程、单元测试）调用时生成一个新的 id 并绑定。
     */
    public static String require() {
        String traceId = CURRENT.get();
        if (traceId == null) {
            traceId = newTraceId();
            open(traceId);
        }
        return traceId;
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        CURRENT.remove();
        MDC.remove(MDC_KEY);
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
