package com.docguard.core.audit;

import com.docguard.core.spi.AccessAuditor;

/**
 * 默认审计实现：通过 {@link AuditManager} 异步写入日志
 */
public class LoggingAccessAuditor implements AccessAuditor {

    @Override
    public void record(AuditRecord record) {
        AuditManager.asyncRecord(record);
    }
}
