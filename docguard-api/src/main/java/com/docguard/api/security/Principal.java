package com.docguard.api.security;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 访问主体
 * <p>
 * 描述发起操作的身份（或身份的缺失）。匿名主体的 id 恒为 null，
 * 任何基于 id 的比较对匿名主体都返回 false，而不是抛出异常。
 * </p>
 *
 * @author DocGuard
 */
public record Principal(
        /**
         * 是否已通过身份认证
         */
        boolean authenticated,

        /**
         * 用户 ID，匿名时为 null
         */
        String id,

        /**
         * 令牌声明，值为 Boolean 或 String
         */
        Map<String, Object> claims) implements Serializable {

    private static final Principal ANONYMOUS = new Principal(false, null, Map.of());

    public Principal {
        if (authenticated && (id == null || id.isBlank())) {
            throw new IllegalArgumentException("Authenticated principal requires a non-blank id");
        }
        if (!authenticated) {
            // 匿名主体不携带任何身份信息
            id = null;
            claims = Map.of();
        } else {
            claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
        }
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    public static Principal of(String id) {
        return new Principal(true, id, Map.of());
    }

    public static Principal of(String id, Map<String, Object> claims) {
        return new Principal(true, id, claims);
    }

    /**
     * 已认证时返回 id
     */
    public Optional<String> idIfAuthenticated() {
        return authenticated ? Optional.of(id) : Optional.empty();
    }

    /**
     * 判断主体是否为指定用户（失败即拒绝语义）
     *
     * @param userId 目标用户 ID，允许为 null
     * @return 仅当已认证且 id 相同时返回 true
     */
    public boolean isIdentifiedAs(String userId) {
        return authenticated && userId != null && Objects.equals(id, userId);
    }

    /**
     * 获取声明值
     */
    public Optional<Object> claim(String name) {
        return Optional.ofNullable(claims.get(name));
    }

    /**
     * 判断声明是否为布尔 true
     */
    public boolean hasTrueClaim(String name) {
        return authenticated && Boolean.TRUE.equals(claims.get(name));
    }

    @Override
    public String toString() {
        return authenticated ? "Principal{id='" + id + "', claims=" + claims.keySet() + "}" : "Principal{anonymous}";
    }
}
