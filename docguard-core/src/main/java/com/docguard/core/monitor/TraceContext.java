package com.docguard.core.monitor;

import java.util.UUID;

/**
 * 决策链路上下文
 * <p>
 * 同一线程内的多次决策共享一个 TraceId，审计记录据此串联。
 * 开启链路的调用方负责关闭它，嵌套调用只沿用。
 * </p>
 */
public final class TraceContext {

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private TraceContext() {
    }

    public static String current() {
        return CURRENT.get();
    }

    /**
     * 开启链路
     *
     * @param upstreamTraceId 上游传入的 TraceId（如网关 Header），为空时生成新的
     * @return 本次调用是否开启了新链路；已有链路时沿用并返回 false
     */
    public static boolean open(String upstreamTraceId) {
        if (CURRENT.get() != null) {
            return false;
        }
        CURRENT.set(upstreamTraceId != null && !upstreamTraceId.isBlank() ? upstreamTraceId : newTraceId());
        return true;
    }

    public static void close() {
        CURRENT.remove();
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
