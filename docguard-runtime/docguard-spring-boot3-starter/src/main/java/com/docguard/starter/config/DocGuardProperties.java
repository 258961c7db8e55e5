package com.docguard.starter.config;

import com.docguard.core.policy.ReferencePolicies;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DocGuard 主配置属性
 * <p>
 * 提供 IDE 智能提示。策略注册表只在启动时加载，运行期不支持逐条修改。
 */
@Data
@ConfigurationProperties(prefix = "docguard")
public class DocGuardProperties {

    /**
     * 是否启用 DocGuard。
     */
    private boolean enabled = true;

    /**
     * 内置策略名称 (ticket-003 / extended)。
     * 仅在未配置 manifestLocation 时生效。
     */
    private String profile = ReferencePolicies.TICKET_003;

    /**
     * 策略清单位置。
     * 支持 "classpath:" 前缀和文件系统路径，配置后覆盖 profile。
     * <p>
     * 示例：
     *
     * <pre>
     * docguard:
     *   manifest-location: classpath:docguard/extended.yml
     * </pre>
     */
    private String manifestLocation;

    /**
     * 提权声明名。
     * 携带该声明 (值为 true) 的主体视为后端特权调用，绕过策略。为空时不启用。
     */
    private String elevatedTrustClaim;

    /**
     * 审计相关配置。
     */
    private Audit audit = new Audit();

    @Data
    public static class Audit {
        /**
         * 是否审计决策。
         */
        private boolean enabled = true;

        /**
         * 是否同时审计 ALLOW 决策。
         * 生产环境流量大时建议关闭。
         */
        private boolean includeAllowed = false;
    }
}
