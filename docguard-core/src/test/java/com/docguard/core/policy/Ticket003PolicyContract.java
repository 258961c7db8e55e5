package com.docguard.core.policy;

import com.docguard.api.policy.DocumentSnapshot;
import com.docguard.api.policy.PolicyEvaluator;
import com.docguard.api.security.AccessDecision;
import com.docguard.api.security.AccessOperation;
import com.docguard.api.security.Principal;
import com.docguard.core.evaluator.DefaultPolicyEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.docguard.api.security.AccessDecision.ALLOW;
import static com.docguard.api.security.AccessDecision.DENY;
import static com.docguard.api.security.AccessOperation.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * ticket-003 策略的行为约定
 * Java 版与 YAML 版注册表都必须通过同一组用例。
 */
public abstract class Ticket003PolicyContract {

    protected static final Principal U1 = Principal.of("u1");
    protected static final Principal U2 = Principal.of("u2");
    protected static final Principal ADMIN = Principal.of("root", Map.of("admin", true));
    protected static final Principal ANON = Principal.anonymous();

    protected PolicyEvaluator evaluator;

    protected abstract PolicyRegistry registry();

    @BeforeEach
    protected void setUpEvaluator() {
        evaluator = new DefaultPolicyEvaluator(registry());
    }

    // ==================== 文档样例 ====================

    protected static DocumentSnapshot user(String id) {
        return DocumentSnapshot.builder()
                .field("id", id)
                .field("email", id + "@test.com")
                .field("tosAccepted", true)
                .field("ppAccepted", true)
                .field("deletionScheduled", false)
                .field("createdAt", 1_700_000_000_000L)
                .field("profile", Map.of("height", 170))
                .build();
    }

    protected static DocumentSnapshot withField(DocumentSnapshot doc, String field, Object value) {
        DocumentSnapshot.Builder builder = DocumentSnapshot.builder();
        doc.asMap().forEach(builder::field);
        return builder.field(field, value).build();
    }

    protected static DocumentSnapshot owned(String userId) {
        return DocumentSnapshot.of(Map.of("userId", userId, "exerciseType", "squat", "reps", 10));
    }

    protected AccessDecision decide(String collection, AccessOperation op, Principal p, DocumentSnapshot existing,
            DocumentSnapshot proposed) {
        return evaluator.decide(collection, op, p, existing, proposed);
    }

    // ==================== 示例场景 ====================

    @Test
    @DisplayName("示例：修改受保护字段被拒绝")
    void exampleProtectedFieldTouched() {
        assertEquals(DENY, decide("users", UPDATE, U1,
                doc("id", "u1", "tosAccepted", false), doc("id", "u1", "tosAccepted", true)));
    }

    @Test
    @DisplayName("示例：修改普通字段被允许")
    void exampleNonProtectedFieldChanged() {
        assertEquals(ALLOW, decide("users", UPDATE, U1, doc("id", "u1", "name", "A"), doc("id", "u1", "name", "B")));
    }

    @Test
    @DisplayName("示例：创建自己的训练记录")
    void exampleCreateOwnSession() {
        assertEquals(ALLOW, decide("sessions", CREATE, U1, null, doc("userId", "u1", "reps", 10)));
    }

    @Test
    @DisplayName("示例：替他人创建训练记录被拒绝")
    void exampleCreateSessionForOther() {
        assertEquals(DENY, decide("sessions", CREATE, U1, null, doc("userId", "u2", "reps", 10)));
    }

    @Test
    @DisplayName("示例：同意记录不可更新")
    void exampleConsentUpdate() {
        assertEquals(DENY, decide("consents", UPDATE, U1, doc("userId", "u1"), doc("userId", "u1", "accepted", false)));
    }

    @Test
    @DisplayName("示例：未知集合默认拒绝")
    void exampleUnknownCollection() {
        assertEquals(DENY, decide("unknown_collection", READ, U1, DocumentSnapshot.empty(), null));
    }

    // ==================== 隔离性 ====================

    @Test
    @DisplayName("他人无法读取、创建、更新用户文档")
    void usersAreIsolated() {
        DocumentSnapshot u2Doc = user("u2");
        assertEquals(DENY, decide("users", READ, U1, u2Doc, null));
        assertEquals(DENY, decide("users", CREATE, U1, null, u2Doc));
        assertEquals(DENY, decide("users", UPDATE, U1, u2Doc, withField(u2Doc, "profile", Map.of("height", 1))));
    }

    @Test
    @DisplayName("他人无法读取、创建、更新训练记录与同意记录")
    void sessionsAndConsentsAreIsolated() {
        for (String collection : List.of("sessions", "consents")) {
            assertEquals(DENY, decide(collection, READ, U1, owned("u2"), null), collection);
            assertEquals(DENY, decide(collection, CREATE, U1, null, owned("u2")), collection);
            assertEquals(DENY, decide(collection, UPDATE, U1, owned("u2"), owned("u2")), collection);
        }
    }

    @Test
    @DisplayName("在提交的文档中写入自己的 id 也无法更新他人的用户文档")
    void userOwnershipCannotBeClaimedThroughProposedId() {
        DocumentSnapshot victim = doc("name", "Victim", "tosAccepted", true);
        DocumentSnapshot forged = doc("name", "pwned", "tosAccepted", true, "id", "u1");

        assertEquals(DENY, decide("users", UPDATE, U1, victim, forged));
        assertEquals(DENY, decide("users", READ, U1, victim, null));
        assertEquals(DENY, decide("users", UPDATE, U1, user("u2"), withField(user("u2"), "id", "u1")));
    }

    @Test
    @DisplayName("更新时把 userId 改成自己也无法接管他人的训练记录")
    void sessionOwnershipCannotBeHijacked() {
        assertEquals(DENY, decide("sessions", UPDATE, U1, owned("u2"), owned("u1")));
    }

    // ==================== 本人访问 ====================

    @Test
    @DisplayName("本人可以创建和读取自己的文档")
    void ownerCanCreateAndRead() {
        assertEquals(ALLOW, decide("users", CREATE, U1, null, user("u1")));
        assertEquals(ALLOW, decide("users", READ, U1, user("u1"), null));
        for (String collection : List.of("sessions", "consents")) {
            assertEquals(ALLOW, decide(collection, CREATE, U1, null, owned("u1")), collection);
            assertEquals(ALLOW, decide(collection, READ, U1, owned("u1"), null), collection);
        }
        assertEquals(ALLOW, decide("sessions", UPDATE, U1, owned("u1"), withField(owned("u1"), "reps", 12)));
    }

    @Test
    @DisplayName("创建时可以自由设置受保护字段的初始值")
    void createMaySetProtectedFields() {
        DocumentSnapshot initial = withField(withField(user("u1"), "tosAccepted", false), "deletionScheduled", true);
        assertEquals(ALLOW, decide("users", CREATE, U1, null, initial));
    }

    // ==================== 受保护字段 ====================

    @Test
    @DisplayName("本人更新任一受保护字段都被拒绝")
    void protectedFieldsAreImmutableOnUpdate() {
        DocumentSnapshot existing = user("u1");
        assertEquals(DENY, decide("users", UPDATE, U1, existing, withField(existing, "tosAccepted", false)));
        assertEquals(DENY, decide("users", UPDATE, U1, existing, withField(existing, "ppAccepted", false)));
        assertEquals(DENY, decide("users", UPDATE, U1, existing, withField(existing, "deletionScheduled", true)));
        assertEquals(DENY, decide("users", UPDATE, U1, existing, withField(existing, "createdAt", 0L)));
    }

    @Test
    @DisplayName("删除受保护字段也视为改动")
    void removingProtectedFieldIsATouch() {
        DocumentSnapshot existing = doc("id", "u1", "createdAt", 1L);
        assertEquals(DENY, decide("users", UPDATE, U1, existing, doc("id", "u1")));
    }

    // ==================== 删除待定 ====================

    @Test
    @DisplayName("删除待定的账户无法更新任何字段")
    void deletionPendingBlocksUserUpdate() {
        DocumentSnapshot pending = withField(user("u1"), "deletionScheduled", true);
        assertEquals(DENY, decide("users", UPDATE, U1, pending, withField(pending, "profile", Map.of("height", 180))));
        assertEquals(DENY, decide("users", UPDATE, U1, pending, pending));
    }

    @Test
    @DisplayName("删除待定不影响训练记录与同意记录的写入")
    void deletionPendingDoesNotGateSessionsOrConsents() {
        assertEquals(ALLOW, decide("sessions", CREATE, U1, null, owned("u1")));
        assertEquals(ALLOW, decide("consents", CREATE, U1, null, owned("u1")));
        assertEquals(ALLOW, decide("users", READ, U1, withField(user("u1"), "deletionScheduled", true), null));
    }

    // ==================== 只追加 ====================

    @Test
    @DisplayName("同意记录对本人与管理员都不可更新或删除")
    void consentsAreAppendOnly() {
        for (Principal p : List.of(U1, ADMIN, U2, ANON)) {
            assertEquals(DENY, decide("consents", UPDATE, p, owned("u1"), owned("u1")), p.toString());
            assertEquals(DENY, decide("consents", DELETE, p, owned("u1"), null), p.toString());
        }
        assertEquals(DENY, decide("consents", UPDATE, ADMIN, owned("root"), owned("root")));
    }

    @Test
    @DisplayName("三个命名集合的删除一律拒绝")
    void deleteIsAlwaysDenied() {
        assertEquals(DENY, decide("users", DELETE, U1, user("u1"), null));
        assertEquals(DENY, decide("users", DELETE, ADMIN, user("root"), null));
        assertEquals(DENY, decide("sessions", DELETE, U1, owned("u1"), null));
        assertEquals(DENY, decide("consents", DELETE, U1, owned("u1"), null));
    }

    // ==================== 默认拒绝 / 匿名拒绝 ====================

    @Test
    @DisplayName("未注册集合的四个操作全部拒绝")
    void defaultDenyForUnregisteredCollections() {
        for (AccessOperation op : AccessOperation.values()) {
            assertEquals(DENY, decide("undefinedCollection", op, ADMIN, owned("root"), owned("root")), op.name());
        }
    }

    @Test
    @DisplayName("匿名主体在命名集合上的任何操作都被拒绝")
    void anonymousIsAlwaysDenied() {
        for (String collection : List.of("users", "sessions", "consents")) {
            for (AccessOperation op : AccessOperation.values()) {
                DocumentSnapshot existing = op == CREATE ? null : doc("id", "u1", "userId", "u1");
                DocumentSnapshot proposed = op == READ || op == DELETE ? null : doc("id", "u1", "userId", "u1");
                assertEquals(DENY, decide(collection, op, ANON, existing, proposed), collection + "." + op);
            }
        }
    }

    protected static DocumentSnapshot doc(Object... keyValues) {
        DocumentSnapshot.Builder builder = DocumentSnapshot.builder();
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.field((String) keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }
}
