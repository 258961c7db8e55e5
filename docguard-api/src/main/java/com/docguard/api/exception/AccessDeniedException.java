package com.docguard.api.exception;

import com.docguard.api.security.AccessOperation;

/**
 * 访问拒绝异常
 * 仅由强制执行入口抛出；评估器本身以 DENY 返回值表达拒绝。
 *
 * @author DocGuard
 */
public class AccessDeniedException extends DocGuardException {

    private final String collection;
    private final AccessOperation operation;
    private final String principalId;

    public AccessDeniedException(String collection, AccessOperation operation, String principalId) {
        super(String.format("Access denied: collection=%s, operation=%s, principal=%s",
                collection, operation, principalId == null ? "anonymous" : principalId));
        this.collection = collection;
        this.operation = operation;
        this.principalId = principalId;
    }

    public String getCollection() {
        return collection;
    }

    public AccessOperation getOperation() {
        return operation;
    }

    /**
     * 被拒绝的主体 ID，匿名访问时为 null
     */
    public String getPrincipalId() {
        return principalId;
    }
}
