package com.docguard.api.policy;

import java.util.Objects;

/**
 * 访问谓词
 * <p>
 * 纯函数：(principal, existing, proposed) -> boolean，通过 {@link AccessRequest} 一次性传入。
 * 实现必须是全函数：不抛异常、无副作用。多个谓词通过 {@link #and} 组合。
 * </p>
 *
 * @author DocGuard
 */
@FunctionalInterface
public interface AccessPredicate {

    AccessPredicate ALLOW = request -> true;

    AccessPredicate DENY = request -> false;

    boolean test(AccessRequest request);

    default AccessPredicate and(AccessPredicate other) {
        Objects.requireNonNull(other, "other");
        return request -> test(request) && other.test(request);
    }

    /**
     * 将多个谓词以逻辑与组合，空数组等价于 DENY
     */
    static AccessPredicate allOf(AccessPredicate... predicates) {
        if (predicates == null || predicates.length == 0) {
            return DENY;
        }
        AccessPredicate combined = predicates[0];
        for (int i = 1; i < predicates.length; i++) {
            combined = combined.and(predicates[i]);
        }
        return combined;
    }
}
