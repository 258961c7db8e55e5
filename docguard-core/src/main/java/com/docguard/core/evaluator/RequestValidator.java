package com.docguard.core.evaluator;

import com.docguard.api.exception.PolicyContractException;
import com.docguard.api.policy.AccessRequest;

/**
 * 请求契约校验
 * 不合法的请求以 {@link PolicyContractException} 暴露，绝不转化为决策。
 */
public final class RequestValidator {

    private RequestValidator() {
    }

    public static void validate(AccessRequest request) {
        if (request == null) {
            throw new PolicyContractException("request", "Access request must not be null");
        }
        if (request.getCollection() == null || request.getCollection().isBlank()) {
            throw new PolicyContractException("collection", request.getCollection(),
                    "Collection name must not be blank");
        }
        if (request.getOperation() == null) {
            throw new PolicyContractException("operation", "Operation must not be null");
        }
        if (request.getPrincipal() == null) {
            throw new PolicyContractException("principal",
                    "Principal must not be null, use Principal.anonymous() for unauthenticated access");
        }
    }
}
