package com.docguard.api.security;

/**
 * 访问决策结果
 * DENY 是正常的一等结果，而不是错误。
 */
public enum AccessDecision {
    ALLOW,
    DENY;

    public static AccessDecision of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
