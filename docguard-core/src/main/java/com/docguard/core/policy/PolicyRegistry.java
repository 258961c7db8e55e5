package com.docguard.core.policy;

import com.docguard.api.exception.PolicyConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 策略注册表
 * <p>
 * 集合名到 {@link CollectionPolicy} 的精确匹配映射；未匹配的集合回落到默认全拒绝策略。
 * 构建后不可变，重新部署时整体替换。
 * </p>
 */
public final class PolicyRegistry {

    /** 默认策略名 */
    public static final String DEFAULT_POLICY_NAME = "<default>";

    private static final CollectionPolicy DEFAULT_POLICY = CollectionPolicy.denyAll(DEFAULT_POLICY_NAME);

    private final String name;
    private final Map<String, CollectionPolicy> policies;

    private PolicyRegistry(String name, Map<String, CollectionPolicy> policies) {
        this.name = name;
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 空注册表：所有集合均使用默认策略
     */
    public static PolicyRegistry empty() {
        return builder("empty").build();
    }

    public static CollectionPolicy defaultPolicy() {
        return DEFAULT_POLICY;
    }

    /**
     * 解析集合策略，精确匹配，不支持通配
     */
    public CollectionPolicy resolve(String collection) {
        CollectionPolicy policy = policies.get(collection);
        return policy != null ? policy : DEFAULT_POLICY;
    }

    public boolean contains(String collection) {
        return policies.containsKey(collection);
    }

    public Set<String> collectionNames() {
        return policies.keySet();
    }

    public String getName() {
        return name;
    }

    public int size() {
        return policies.size();
    }

    @Override
    public String toString() {
        return "PolicyRegistry{name='" + name + "', collections=" + policies.keySet() + "}";
    }

    public static final class Builder {
        private final String name;
        private final Map<String, CollectionPolicy> policies = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder register(CollectionPolicy policy) {
            if (policies.putIfAbsent(policy.getName(), policy) != null) {
                throw new PolicyConfigurationException(name, "Duplicate collection: " + policy.getName());
            }
            return this;
        }

        public PolicyRegistry build() {
            return new PolicyRegistry(name, policies);
        }
    }
}
