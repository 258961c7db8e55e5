package com.docguard.starter.configuration;

import com.docguard.api.exception.PolicyConfigurationException;
import com.docguard.api.policy.PolicyEvaluator;
import com.docguard.core.audit.LoggingAccessAuditor;
import com.docguard.core.config.DocGuardConfig;
import com.docguard.core.evaluator.DefaultPolicyEvaluator;
import com.docguard.core.kernel.PolicyEnforcer;
import com.docguard.core.loader.PolicyManifestLoader;
import com.docguard.core.policy.PolicyRegistry;
import com.docguard.core.policy.ReferencePolicies;
import com.docguard.core.spi.AccessAuditor;
import com.docguard.starter.config.DocGuardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DocGuardProperties.class)
@ConditionalOnProperty(prefix = "docguard", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DocGuardAutoConfiguration {

    // 1. 策略注册表：清单优先，否则使用内置策略
    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry policyRegistry(DocGuardProperties properties) {
        String location = properties.getManifestLocation();
        if (location != null && !location.isBlank()) {
            return PolicyManifestLoader.loadRegistry(location);
        }
        PolicyRegistry registry = ReferencePolicies.byName(properties.getProfile());
        if (registry == null) {
            throw new PolicyConfigurationException("docguard.profile",
                    "Unknown built-in profile: " + properties.getProfile());
        }
        log.info("[DocGuard] Using built-in profile '{}'", properties.getProfile());
        return registry;
    }

    // 2. 评估器
    @Bean
    @ConditionalOnMissingBean(PolicyEvaluator.class)
    public DefaultPolicyEvaluator policyEvaluator(PolicyRegistry policyRegistry) {
        return new DefaultPolicyEvaluator(policyRegistry);
    }

    // 3. 审计器 (可由应用替换为 DB/MQ 实现)
    @Bean
    @ConditionalOnMissingBean
    public AccessAuditor accessAuditor() {
        return new LoggingAccessAuditor();
    }

    // 4. 强制执行内核
    @Bean
    @ConditionalOnMissingBean
    public PolicyEnforcer policyEnforcer(PolicyEvaluator policyEvaluator, AccessAuditor accessAuditor,
            DocGuardProperties properties) {
        DocGuardConfig config = DocGuardConfig.builder()
                .elevatedTrustClaim(properties.getElevatedTrustClaim())
                .auditEnabled(properties.getAudit().isEnabled())
                .auditAllowed(properties.getAudit().isIncludeAllowed())
                .build();
        return new PolicyEnforcer(policyEvaluator, config, accessAuditor);
    }
}
