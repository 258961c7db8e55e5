package com.docguard.core.kernel;

import com.docguard.api.exception.AccessDeniedException;
import com.docguard.api.exception.PolicyContractException;
import com.docguard.api.policy.AccessRequest;
import com.docguard.api.policy.PolicyEvaluator;
import com.docguard.api.security.AccessDecision;
import com.docguard.core.audit.AuditRecord;
import com.docguard.core.config.DocGuardConfig;
import com.docguard.core.evaluator.RequestValidator;
import com.docguard.core.monitor.TraceContext;
import com.docguard.core.spi.AccessAuditor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 强制执行内核：上游中介层的统一入口
 * <p>
 * 流程：Trace 开启 → 提权识别 → 策略评估 → 审计 → Trace 清理。
 * 提权主体（后端特权函数）不经过策略评估，但仍然留下审计记录。
 * </p>
 *
 * @author DocGuard
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyEnforcer {

    private final PolicyEvaluator evaluator;
    private final DocGuardConfig config;
    private final AccessAuditor auditor;

    /**
     * 检查请求并返回决策，不抛出 DENY 异常
     *
     * @throws PolicyContractException 请求不合法时
     */
    public AccessDecision check(AccessRequest request) {
        return check(request, null);
    }

    /**
     * 在上游链路中检查请求，审计记录使用 upstreamTraceId
     * 当前线程已有链路时沿用已有的 TraceId。
     *
     * @throws PolicyContractException 请求不合法时
     */
    public AccessDecision check(AccessRequest request, String upstreamTraceId) {
        RequestValidator.validate(request);
        boolean opened = TraceContext.open(upstreamTraceId);
        String traceId = TraceContext.current();
        try {
            // 1. 提权识别
            if (isElevated(request)) {
                log.debug("[Enforcer] Elevated principal bypassed policy: {} {}/{}", request.getOperation(),
                        request.getCollection(), request.getDocumentId());
                audit(AuditRecord.of(traceId, AuditRecord.ACTION_BYPASS, request, AccessDecision.ALLOW));
                return AccessDecision.ALLOW;
            }

            // 2. 策略评估 (契约异常直接抛给上层)
            AccessDecision decision = evaluator.decide(request);

            // 3. 审计
            if (!decision.isAllowed()) {
                log.warn("⛔ Access Denied: principal=[{}] operation=[{}] resource=[{}/{}] trace=[{}]",
                        request.principalLabel(), request.getOperation(), request.getCollection(),
                        request.getDocumentId() == null ? "-" : request.getDocumentId(), traceId);
            }
            if (!decision.isAllowed() || config.isAuditAllowed()) {
                audit(AuditRecord.of(traceId, AuditRecord.ACTION_EVALUATED, request, decision));
            }
            return decision;
        } finally {
            // 4. 只关闭自己开启的链路
            if (opened) {
                TraceContext.close();
            }
        }
    }

    /**
     * 检查请求，DENY 时抛出 {@link AccessDeniedException}
     */
    public void enforce(AccessRequest request) {
        enforce(request, null);
    }

    public void enforce(AccessRequest request, String upstreamTraceId) {
        if (!check(request, upstreamTraceId).isAllowed()) {
            throw new AccessDeniedException(request.getCollection(), request.getOperation(),
                    request.getPrincipal().id());
        }
    }

    private boolean isElevated(AccessRequest request) {
        return config.isElevatedTrustEnabled()
                && request.getPrincipal().hasTrueClaim(config.getElevatedTrustClaim());
    }

    private void audit(AuditRecord record) {
        if (!config.isAuditEnabled() || auditor == null) {
            return;
        }
        try {
            auditor.record(record);
        } catch (Exception e) {
            // 审计失败不改变决策
            log.error("Audit failed", e);
        }
    }
}
