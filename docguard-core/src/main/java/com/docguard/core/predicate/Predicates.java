package com.docguard.core.predicate;

import com.docguard.api.policy.AccessPredicate;
import com.docguard.api.policy.AccessRequest;
import com.docguard.api.policy.DocumentSnapshot;
import com.docguard.api.security.AccessOperation;
import com.docguard.api.security.Principal;
import com.docguard.core.diff.DocumentDiff;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 谓词库
 * <p>
 * 所有函数均为纯函数且不抛异常：缺失的主体或文档一律按"失败即拒绝"处理，
 * 只有文档缺失即视为成立的谓词（创建路径）例外，见各方法说明。
 * </p>
 *
 * @author DocGuard
 */
public final class Predicates {

    /** 管理员声明 */
    public static final String ADMIN_CLAIM = "admin";

    /** 删除待定标记字段 */
    public static final String DELETION_SCHEDULED_FIELD = "deletionScheduled";

    /** 默认归属字段 */
    public static final String OWNER_FIELD = "userId";

    /** 请求未携带路径键时，从文档体中读取的键字段 */
    public static final String DOCUMENT_KEY_FIELD = "id";

    /** 字段路径分隔符，如 profile.height */
    private static final String PATH_SEPARATOR = ".";

    private static final Object MISSING = new Object();

    private Predicates() {
    }

    // ==================== 基础谓词 ====================

    public static boolean isAuthenticated(Principal principal) {
        return principal != null && principal.authenticated();
    }

    /**
     * 主体是否为目标用户。targetUserId 由调用方决定来源（路径键或文档字段）。
     */
    public static boolean isOwner(Principal principal, String targetUserId) {
        return principal != null && principal.isIdentifiedAs(targetUserId);
    }

    public static boolean isAdmin(Principal principal) {
        return principal != null && principal.hasTrueClaim(ADMIN_CLAIM);
    }

    /**
     * existing 缺失（创建路径）时恒成立；否则 deletionScheduled 为假值或缺失时成立。
     * 真值判断见 {@link DocumentSnapshot#isTruthy}：字符串 "false" 视为已标记删除。
     */
    public static boolean isNotScheduledForDeletion(DocumentSnapshot existing) {
        return existing == null || !existing.isTruthy(DELETION_SCHEDULED_FIELD);
    }

    /**
     * 受保护字段未被改动。existing 缺失时恒成立：保护只约束更新。
     */
    public static boolean protectedFieldsUnchanged(DocumentSnapshot existing, DocumentSnapshot proposed,
            Set<String> protectedKeys) {
        if (existing == null) {
            return true;
        }
        return !DocumentDiff.touchesAny(existing, proposed, protectedKeys);
    }

    /**
     * 主体未携带值为 true 的指定声明。匿名主体不携带任何声明。
     */
    public static boolean isClaimUnset(Principal principal, String claim) {
        return principal == null || !principal.hasTrueClaim(claim);
    }

    /**
     * document[field] 等于主体 id。文档缺失或字段非字符串时不成立。
     */
    public static boolean isFieldOwner(Principal principal, DocumentSnapshot document, String field) {
        if (document == null) {
            return false;
        }
        Object value = document.get(field);
        return value instanceof String && isOwner(principal, (String) value);
    }

    // ==================== 取值谓词 ====================

    /**
     * 数值在闭区间 [min, max] 内。min / max 为 null 时该端不设限；非数值与 NaN 不成立。
     */
    public static boolean isInRange(Object value, Double min, Double max) {
        if (!(value instanceof Number)) {
            return false;
        }
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d)) {
            return false;
        }
        return (min == null || d >= min) && (max == null || d <= max);
    }

    /**
     * 值属于候选集合，按 {@link DocumentDiff#valueEquals} 比较
     */
    public static boolean isOneOf(Object value, Collection<?> candidates) {
        if (value == null || candidates == null) {
            return false;
        }
        for (Object candidate : candidates) {
            if (DocumentDiff.valueEquals(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 字符串整体匹配正则；非字符串不成立
     */
    public static boolean matches(Object value, Pattern pattern) {
        return value instanceof CharSequence && pattern.matcher((CharSequence) value).matches();
    }

    /**
     * 字符串长度、集合或数组元素数不超过 max；其他类型不成立
     */
    public static boolean isSizeAtMost(Object value, int max) {
        int size;
        if (value instanceof CharSequence) {
            size = ((CharSequence) value).length();
        } else if (value instanceof Collection) {
            size = ((Collection<?>) value).size();
        } else if (value instanceof Map) {
            size = ((Map<?, ?>) value).size();
        } else if (value != null && value.getClass().isArray()) {
            size = Array.getLength(value);
        } else {
            return false;
        }
        return size <= max;
    }

    // ==================== 谓词工厂 ====================

    public static AccessPredicate allow() {
        return AccessPredicate.ALLOW;
    }

    public static AccessPredicate deny() {
        return AccessPredicate.DENY;
    }

    public static AccessPredicate authenticated() {
        return request -> isAuthenticated(request.getPrincipal());
    }

    public static AccessPredicate admin() {
        return request -> isAdmin(request.getPrincipal());
    }

    /**
     * 主体为文档路径键所标识的用户，如 users/{userId}
     */
    public static AccessPredicate ownerOfDocumentKey() {
        return request -> isOwner(request.getPrincipal(), resolveDocumentKey(request));
    }

    /**
     * 主体为文档归属字段所标识的用户：创建时读取 proposed，其余操作读取 existing
     */
    public static AccessPredicate ownerByField(String field) {
        return request -> {
            DocumentSnapshot source = request.getOperation() == AccessOperation.CREATE
                    ? request.getProposed()
                    : request.getExisting();
            return isAuthenticated(request.getPrincipal()) && isFieldOwner(request.getPrincipal(), source, field);
        };
    }

    public static AccessPredicate notScheduledForDeletion() {
        return request -> isNotScheduledForDeletion(request.getExisting());
    }

    public static AccessPredicate protectedFieldsUnchanged(Set<String> protectedKeys) {
        Set<String> keys = Collections.unmodifiableSet(new LinkedHashSet<>(protectedKeys));
        return request -> protectedFieldsUnchanged(request.getExisting(), request.getProposed(), keys);
    }

    public static AccessPredicate claimUnset(String claim) {
        return request -> isClaimUnset(request.getPrincipal(), claim);
    }

    // 以下取值条件只约束写入的 proposed 文档：
    // 没有 proposed（读取、删除）或字段缺失时成立，字段存在则必须满足条件

    public static AccessPredicate fieldInRange(String path, Double min, Double max) {
        return proposedField(path, value -> isInRange(value, min, max));
    }

    public static AccessPredicate fieldIn(String path, List<?> values) {
        List<Object> candidates = List.copyOf(values);
        return proposedField(path, value -> isOneOf(value, candidates));
    }

    /**
     * @throws java.util.regex.PatternSyntaxException 正则无效时
     */
    public static AccessPredicate fieldMatches(String path, String regex) {
        Pattern pattern = Pattern.compile(regex);
        return proposedField(path, value -> matches(value, pattern));
    }

    public static AccessPredicate fieldSizeAtMost(String path, int max) {
        return proposedField(path, value -> isSizeAtMost(value, max));
    }

    private static AccessPredicate proposedField(String path, Predicate<Object> check) {
        return request -> {
            DocumentSnapshot proposed = request.getProposed();
            if (proposed == null) {
                return true;
            }
            Object value = valueAt(proposed, path);
            return value == MISSING || check.test(value);
        };
    }

    /**
     * 按点分路径读取嵌套 Map 中的值，路径中断时返回 MISSING
     */
    static Object valueAt(DocumentSnapshot document, String path) {
        String[] segments = path.split(Pattern.quote(PATH_SEPARATOR));
        if (!document.contains(segments[0])) {
            return MISSING;
        }
        Object current = document.get(segments[0]);
        for (int i = 1; i < segments.length; i++) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(segments[i])) {
                return MISSING;
            }
            current = ((Map<?, ?>) current).get(segments[i]);
        }
        return current;
    }

    /**
     * 解析文档路径键：优先使用请求中的 documentId。
     * 没有路径键时，创建读取 proposed 的 id 字段，其余操作只读取 existing 的 id 字段；
     * proposed 由客户端提供，不能作为已存在文档的归属依据。都缺失时返回 null（拒绝）。
     */
    static String resolveDocumentKey(AccessRequest request) {
        if (request.getDocumentId() != null) {
            return request.getDocumentId();
        }
        DocumentSnapshot source = request.getOperation() == AccessOperation.CREATE
                ? request.getProposed()
                : request.getExisting();
        return stringField(source, DOCUMENT_KEY_FIELD);
    }

    private static String stringField(DocumentSnapshot document, String field) {
        return document == null ? null : document.get(field, String.class);
    }
}
