package com.docguard.api.policy;

import com.docguard.api.security.AccessOperation;
import com.docguard.api.security.Principal;
import lombok.Builder;
import lombok.Value;

/**
 * 访问请求：评估器唯一认可的输入
 * <p>
 * 将原规则语言中隐式的 request / resource 绑定显式化。
 * existing 在创建时缺失，proposed 在读取和删除时缺失。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class AccessRequest {

    // 目标集合名称 (精确匹配)
    String collection;

    // 目标文档的路径键，例如 users/{userId} 中的 userId，可为 null
    String documentId;

    AccessOperation operation;

    Principal principal;

    // 已存储的文档
    DocumentSnapshot existing;

    // 即将写入的完整文档
    DocumentSnapshot proposed;

    public static AccessRequest of(String collection, AccessOperation operation, Principal principal,
            DocumentSnapshot existing, DocumentSnapshot proposed) {
        return AccessRequest.builder()
                .collection(collection)
                .operation(operation)
                .principal(principal)
                .existing(existing)
                .proposed(proposed)
                .build();
    }

    /**
     * 主体在审计日志中的展示名
     */
    public String principalLabel() {
        if (principal == null) {
            return "null";
        }
        return principal.idIfAuthenticated().orElse("anonymous");
    }
}
