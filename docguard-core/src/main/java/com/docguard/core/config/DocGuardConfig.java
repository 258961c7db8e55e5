package com.docguard.core.config;

import lombok.Builder;
import lombok.Getter;

/**
 * 强制执行层配置
 */
@Getter
@Builder(toBuilder = true)
public class DocGuardConfig {

    // ==================== 信任 ====================

    /**
     * 提权声明名
     * 携带该声明且值为 true 的已认证主体视为后端特权调用，绕过策略评估。
     * 为 null 时不识别任何提权主体。
     */
    private final String elevatedTrustClaim;

    // ==================== 审计 ====================

    /**
     * 是否审计决策
     */
    @Builder.Default
    private final boolean auditEnabled = true;

    /**
     * 是否同时审计 ALLOW 决策（默认只审计 DENY 与绕过）
     */
    @Builder.Default
    private final boolean auditAllowed = false;

    // ==================== 工厂方法 ====================

    /**
     * 默认配置：审计拒绝与绕过，不识别提权主体
     */
    public static DocGuardConfig defaults() {
        return DocGuardConfig.builder().build();
    }

    /**
     * 全量审计：每一次决策都记录
     */
    public static DocGuardConfig fullAudit() {
        return DocGuardConfig.builder()
                .auditAllowed(true)
                .build();
    }

    /**
     * 关闭审计（压测、离线回放）
     */
    public static DocGuardConfig silent() {
        return DocGuardConfig.builder()
                .auditEnabled(false)
                .build();
    }

    public boolean isElevatedTrustEnabled() {
        return elevatedTrustClaim != null && !elevatedTrustClaim.isBlank();
    }
}
