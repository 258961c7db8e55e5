package com.docguard.core.audit;

import com.docguard.api.policy.AccessRequest;
import com.docguard.api.security.AccessDecision;
import com.docguard.api.security.AccessOperation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 审计记录
 */
@Value
@Builder
public class AuditRecord {

    /** 策略评估 */
    public static final String ACTION_EVALUATED = "EVALUATED";

    /** 提权主体绕过策略 */
    public static final String ACTION_BYPASS = "BYPASS";

    String traceId;
    String action;
    String collection;
    String documentId;
    AccessOperation operation;
    String principal;
    AccessDecision decision;

    @Builder.Default
    Instant timestamp = Instant.now();

    public static AuditRecord of(String traceId, String action, AccessRequest request, AccessDecision decision) {
        return AuditRecord.builder()
                .traceId(traceId)
                .action(action)
                .collection(request.getCollection())
                .documentId(request.getDocumentId())
                .operation(request.getOperation())
                .principal(request.principalLabel())
                .decision(decision)
                .build();
    }
}
