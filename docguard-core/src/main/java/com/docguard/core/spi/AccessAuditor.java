package com.docguard.core.spi;

import com.docguard.core.audit.AuditRecord;

/**
 * 审计记录器 SPI
 * 实现可写入日志、消息队列或数据库；实现抛出的异常不会影响决策结果。
 */
@FunctionalInterface
public interface AccessAuditor {

    void record(AuditRecord record);

    /**
     * 丢弃所有记录
     */
    static AccessAuditor noop() {
        return record -> {
        };
    }
}
