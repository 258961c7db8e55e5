package com.docguard.core.policy;

import com.docguard.api.policy.AccessPredicate;
import com.docguard.api.security.AccessOperation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 集合策略
 * <p>
 * 每个操作对应一个谓词；缺失的操作等价于显式拒绝，而不是"未指定"。
 * 构建后不可变。
 * </p>
 *
 * @author DocGuard
 */
public final class CollectionPolicy {

    private final String name;
    private final Map<AccessOperation, AccessPredicate> rules;

    private CollectionPolicy(String name, Map<AccessOperation, AccessPredicate> rules) {
        this.name = name;
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 四个操作全部拒绝的策略
     */
    public static CollectionPolicy denyAll(String name) {
        return builder(name).build();
    }

    public String getName() {
        return name;
    }

    /**
     * 获取操作对应的谓词，未定义时返回 DENY
     */
    public AccessPredicate ruleFor(AccessOperation operation) {
        return rules.getOrDefault(operation, AccessPredicate.DENY);
    }

    public boolean defines(AccessOperation operation) {
        return rules.containsKey(operation);
    }

    @Override
    public String toString() {
        return "CollectionPolicy{name='" + name + "', rules=" + rules.keySet() + "}";
    }

    public static final class Builder {
        private final String name;
        private final Map<AccessOperation, AccessPredicate> rules = new EnumMap<>(AccessOperation.class);

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Collection name cannot be blank");
            }
            this.name = name;
        }

        public Builder rule(AccessOperation operation, AccessPredicate predicate) {
            rules.put(Objects.requireNonNull(operation, "operation"), Objects.requireNonNull(predicate, "predicate"));
            return this;
        }

        public Builder create(AccessPredicate predicate) {
            return rule(AccessOperation.CREATE, predicate);
        }

        public Builder read(AccessPredicate predicate) {
            return rule(AccessOperation.READ, predicate);
        }

        public Builder update(AccessPredicate predicate) {
            return rule(AccessOperation.UPDATE, predicate);
        }

        public Builder delete(AccessPredicate predicate) {
            return rule(AccessOperation.DELETE, predicate);
        }

        public CollectionPolicy build() {
            return new CollectionPolicy(name, rules);
        }
    }
}
