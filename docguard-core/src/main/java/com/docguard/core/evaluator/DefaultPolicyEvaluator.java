package com.docguard.core.evaluator;

import com.docguard.api.policy.AccessPredicate;
import com.docguard.api.policy.AccessRequest;
import com.docguard.api.policy.PolicyEvaluator;
import com.docguard.api.security.AccessDecision;
import com.docguard.core.policy.CollectionPolicy;
import com.docguard.core.policy.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 默认策略评估器
 * <p>
 * 职责：解析集合策略，执行操作对应的谓词，将结果映射为 ALLOW / DENY。
 * 评估过程无 I/O、无共享可变状态，可被任意多个线程并发调用。
 * 注册表通过 volatile 引用整体发布，{@link #reload} 只替换引用，不修改既有实例。
 * </p>
 *
 * @author DocGuard
 */
@Slf4j
public class DefaultPolicyEvaluator implements PolicyEvaluator {

    private volatile PolicyRegistry registry;

    public DefaultPolicyEvaluator(PolicyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        log.info("[DocGuard] Policy evaluator initialized with {}", registry);
    }

    @Override
    public AccessDecision decide(AccessRequest request) {
        RequestValidator.validate(request);

        // 读取一次引用，整个决策基于同一份注册表
        PolicyRegistry current = this.registry;
        CollectionPolicy policy = current.resolve(request.getCollection());
        AccessPredicate rule = policy.ruleFor(request.getOperation());

        boolean allowed;
        try {
            allowed = rule.test(request);
        } catch (RuntimeException e) {
            // 谓词违反全函数约定：失败即拒绝
            log.error("[DocGuard] Predicate failed, denying: collection={}, operation={}, policy={}",
                    request.getCollection(), request.getOperation(), policy.getName(), e);
            return AccessDecision.DENY;
        }

        AccessDecision decision = AccessDecision.of(allowed);
        if (log.isDebugEnabled()) {
            log.debug("[DocGuard] {} {}/{} by {} -> {} (policy={})", request.getOperation(),
                    request.getCollection(), request.getDocumentId(), request.principalLabel(), decision,
                    policy.getName());
        }
        return decision;
    }

    /**
     * 原子替换注册表，正在进行中的决策继续使用旧实例
     */
    public void reload(PolicyRegistry newRegistry) {
        Objects.requireNonNull(newRegistry, "newRegistry");
        PolicyRegistry old = this.registry;
        this.registry = newRegistry;
        log.info("[DocGuard] Policy registry reloaded: {} -> {}", old.getName(), newRegistry.getName());
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }
}
