package com.docguard.core.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 审计管理器 (异步非阻塞)
 */
@Slf4j
public class AuditManager {

    private AuditManager() {
    }

    public static CompletableFuture<Void> asyncRecord(AuditRecord record) {
        // 异步写出，避免阻塞请求线程
        return CompletableFuture.runAsync(() -> write(record));
    }

    static void write(AuditRecord record) {
        try {
            // 生产环境可对接 ES/DB，此处输出结构化日志
            log.info("[AUDIT] TraceId={}, Action={}, Principal={}, Operation={}, Resource={}/{}, Decision={}, At={}",
                    record.getTraceId(), record.getAction(), record.getPrincipal(), record.getOperation(),
                    record.getCollection(), record.getDocumentId() == null ? "-" : record.getDocumentId(),
                    record.getDecision(), record.getTimestamp());
        } catch (Exception e) {
            log.warn("Audit log failed", e);
        }
    }
}
