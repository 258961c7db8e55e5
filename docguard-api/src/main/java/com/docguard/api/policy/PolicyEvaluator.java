package com.docguard.api.policy;

import com.docguard.api.security.AccessDecision;
import com.docguard.api.security.AccessOperation;
import com.docguard.api.security.Principal;

/**
 * 策略评估器
 * 负责为一次文档访问给出 ALLOW / DENY 决策。
 *
 * @author DocGuard
 */
public interface PolicyEvaluator {

    /**
     * 评估一次访问请求。
     *
     * @param request 访问请求
     * @return 决策结果，永不为 null
     * @throws com.docguard.api.exception.PolicyContractException 请求不合法时（缺失集合、操作或主体）
     */
    AccessDecision decide(AccessRequest request);

    default AccessDecision decide(String collection, AccessOperation operation, Principal principal,
            DocumentSnapshot existing, DocumentSnapshot proposed) {
        return decide(AccessRequest.of(collection, operation, principal, existing, proposed));
    }

    default boolean isAllowed(AccessRequest request) {
        return decide(request).isAllowed();
    }
}
