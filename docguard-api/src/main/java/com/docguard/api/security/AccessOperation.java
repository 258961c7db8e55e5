package com.docguard.api.security;

import com.docguard.api.exception.PolicyContractException;

import java.util.Locale;

/**
 * 文档操作类型
 * <p>
 * 每次评估恰好对应一个操作。与存储运行时交互时，
 * 读操作的别名 get / list 统一归为 READ。
 * </p>
 *
 * @author DocGuard
 */
public enum AccessOperation {

    /**
     * 创建 - 文档尚不存在，只有 proposed 快照
     */
    CREATE,

    /**
     * 读取 - 只有 existing 快照
     */
    READ,

    /**
     * 更新 - existing 与 proposed 同时存在
     */
    UPDATE,

    /**
     * 删除 - 只有 existing 快照
     */
    DELETE;

    /**
     * 是否为写操作
     */
    public boolean isWrite() {
        return this != READ;
    }

    /**
     * 解析操作名称（大小写不敏感）
     * <p>
     * 支持 get / list 作为 READ 的别名。复合写操作 "write" 不被接受，
     * 调用方必须明确是 create、update 还是 delete。
     * </p>
     *
     * @param name 操作名称
     * @return 对应的操作
     * @throws PolicyContractException 名称为空或无法识别时
     */
    public static AccessOperation parse(String name) {
        if (name == null || name.isBlank()) {
            throw new PolicyContractException("operation", name, "Operation must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "GET":
            case "LIST":
                return READ;
            default:
                try {
                    return valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw new PolicyContractException("operation", name, "Unknown operation: " + name);
                }
        }
    }
}
