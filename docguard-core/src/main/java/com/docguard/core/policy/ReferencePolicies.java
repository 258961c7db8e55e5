package com.docguard.core.policy;

import com.docguard.api.policy.AccessPredicate;

import java.util.List;
import java.util.Set;

import static com.docguard.core.predicate.Predicates.*;

/**
 * 内置参考策略
 * <p>
 * ticket003 为应用必须随包发布的策略，需与 classpath 下的 docguard/ticket-003.yml 保持一致；
 * extended 在其基础上为三个集合的写入补充取值校验，并增加删除申请与管理员集合。
 * </p>
 *
 * @author DocGuard
 */
public final class ReferencePolicies {

    public static final String TICKET_003 = "ticket-003";
    public static final String EXTENDED = "extended";

    public static final String USERS = "users";
    public static final String SESSIONS = "sessions";
    public static final String CONSENTS = "consents";
    public static final String DATA_DELETION_REQUESTS = "dataDeletionRequests";
    public static final String BIGQUERY_SYNC_FAILURES = "bigquerySyncFailures";
    public static final String SECURITY_INCIDENTS = "securityIncidents";
    public static final String AUDIT_LOGS = "auditLogs";

    /**
     * 客户端只能在创建时设置、之后只能由后端函数修改的字段
     */
    public static final Set<String> USER_PROTECTED_FIELDS =
            Set.of("tosAccepted", "ppAccepted", "deletionScheduled", "createdAt");

    // ==================== extended 取值校验 ====================

    public static final String EMAIL_PATTERN = "[^@\\s]+@[^@\\s]+\\.[^@\\s]+";

    public static final List<String> EXERCISE_TYPES =
            List.of("squat", "pushup", "armcurl", "sidelateral", "shoulderpress");

    public static final List<String> CONSENT_TYPES = List.of("tos", "pp", "privacy_policy");

    public static final double MIN_HEIGHT_CM = 100;
    public static final double MAX_HEIGHT_CM = 250;
    public static final double MIN_WEIGHT_KG = 30;
    public static final double MAX_WEIGHT_KG = 300;
    public static final double MAX_REP_COUNT = 1000;
    public static final int MAX_POSE_FRAMES = 10000;

    private ReferencePolicies() {
    }

    public static PolicyRegistry ticket003() {
        return PolicyRegistry.builder(TICKET_003)
                .register(users())
                .register(sessions())
                .register(consents())
                .build();
    }

    public static PolicyRegistry extended() {
        AccessPredicate owner = ownerByField(OWNER_FIELD);
        return PolicyRegistry.builder(EXTENDED)
                .register(users(AccessPredicate.allOf(
                        fieldMatches("email", EMAIL_PATTERN),
                        fieldInRange("profile.height", MIN_HEIGHT_CM, MAX_HEIGHT_CM),
                        fieldInRange("profile.weight", MIN_WEIGHT_KG, MAX_WEIGHT_KG))))
                .register(sessions(AccessPredicate.allOf(
                        fieldIn("exerciseType", EXERCISE_TYPES),
                        fieldInRange("repCount", 0d, MAX_REP_COUNT),
                        fieldSizeAtMost("poseData", MAX_POSE_FRAMES))))
                .register(consents(fieldIn("consentType", CONSENT_TYPES)))
                // 删除申请：本人可提交与查看，状态流转只由后端处理
                .register(CollectionPolicy.builder(DATA_DELETION_REQUESTS)
                        .create(owner)
                        .read(owner)
                        .build())
                .register(adminOnly(BIGQUERY_SYNC_FAILURES))
                .register(adminOnly(SECURITY_INCIDENTS))
                // 审计日志只读，由后端写入
                .register(CollectionPolicy.builder(AUDIT_LOGS)
                        .read(admin())
                        .build())
                .build();
    }

    /**
     * 按名称查找内置策略
     *
     * @return 未知名称返回 null
     */
    public static PolicyRegistry byName(String name) {
        if (TICKET_003.equals(name)) {
            return ticket003();
        }
        if (EXTENDED.equals(name)) {
            return extended();
        }
        return null;
    }

    static CollectionPolicy users() {
        return users(allow());
    }

    /**
     * @param validation 附加在创建与更新上的取值校验
     */
    static CollectionPolicy users(AccessPredicate validation) {
        AccessPredicate owner = ownerOfDocumentKey();
        return CollectionPolicy.builder(USERS)
                .create(owner.and(validation))
                .read(owner)
                .update(owner
                        .and(protectedFieldsUnchanged(USER_PROTECTED_FIELDS))
                        .and(notScheduledForDeletion())
                        .and(validation))
                .delete(deny())
                .build();
    }

    static CollectionPolicy sessions() {
        return sessions(allow());
    }

    static CollectionPolicy sessions(AccessPredicate validation) {
        AccessPredicate owner = authenticated().and(ownerByField(OWNER_FIELD));
        return CollectionPolicy.builder(SESSIONS)
                .create(owner.and(validation))
                .read(owner)
                .update(owner.and(validation))
                .delete(deny())
                .build();
    }

    static CollectionPolicy consents() {
        return consents(allow());
    }

    static CollectionPolicy consents(AccessPredicate validation) {
        AccessPredicate owner = authenticated().and(ownerByField(OWNER_FIELD));
        // 只追加的审计轨迹
        return CollectionPolicy.builder(CONSENTS)
                .create(owner.and(validation))
                .read(owner)
                .update(deny())
                .delete(deny())
                .build();
    }

    private static CollectionPolicy adminOnly(String name) {
        AccessPredicate admin = admin();
        return CollectionPolicy.builder(name)
                .create(admin)
                .read(admin)
                .update(admin)
                .delete(admin)
                .build();
    }
}
