package com.docguard.core.loader;

import com.docguard.api.config.PolicyManifest;
import com.docguard.api.exception.PolicyConfigurationException;
import com.docguard.api.policy.DocumentSnapshot;
import com.docguard.api.security.AccessDecision;
import com.docguard.api.security.AccessOperation;
import com.docguard.api.security.Principal;
import com.docguard.core.evaluator.DefaultPolicyEvaluator;
import com.docguard.core.policy.PolicyRegistry;
import com.docguard.core.policy.ReferencePolicies;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyManifestLoader 单元测试")
class PolicyManifestLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    // ==================== 内置清单 ====================

    @Nested
    @DisplayName("内置清单")
    class BuiltInManifestTests {

        @Test
        @DisplayName("ticket-003 清单与 Java 版集合一致")
        void ticket003MatchesJavaDefinition() {
            PolicyRegistry fromYaml = PolicyManifestLoader.loadRegistry("classpath:docguard/ticket-003.yml");
            PolicyRegistry fromJava = ReferencePolicies.ticket003();

            assertEquals(ReferencePolicies.TICKET_003, fromYaml.getName());
            assertEquals(fromJava.collectionNames(), fromYaml.collectionNames());
            for (String name : fromJava.collectionNames()) {
                for (AccessOperation op : AccessOperation.values()) {
                    assertEquals(fromJava.resolve(name).defines(op), fromYaml.resolve(name).defines(op),
                            name + "." + op);
                }
            }
        }

        @Test
        @DisplayName("extended 清单与 Java 版集合一致")
        void extendedMatchesJavaDefinition() {
            PolicyRegistry fromYaml = PolicyManifestLoader.loadRegistryFromClasspath("/docguard/extended.yml");
            PolicyRegistry fromJava = ReferencePolicies.extended();

            assertEquals(ReferencePolicies.EXTENDED, fromYaml.getName());
            assertEquals(fromJava.collectionNames(), fromYaml.collectionNames());
            for (String name : fromJava.collectionNames()) {
                for (AccessOperation op : AccessOperation.values()) {
                    assertEquals(fromJava.resolve(name).defines(op), fromYaml.resolve(name).defines(op),
                            name + "." + op);
                }
            }
        }

        @Test
        @DisplayName("从文件系统加载")
        void loadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("policy.yml");
            Files.writeString(file, "name: local\ncollections:\n  - name: notes\n    rules:\n      read: [{ type: authenticated }]\n");

            PolicyRegistry registry = PolicyManifestLoader.loadRegistry(file.toString());

            assertEquals("local", registry.getName());
            DefaultPolicyEvaluator evaluator = new DefaultPolicyEvaluator(registry);
            assertEquals(AccessDecision.ALLOW,
                    evaluator.decide("notes", AccessOperation.READ, Principal.of("u1"), DocumentSnapshot.empty(), null));
            assertEquals(AccessDecision.DENY,
                    evaluator.decide("notes", AccessOperation.UPDATE, Principal.of("u1"), DocumentSnapshot.empty(),
                            DocumentSnapshot.empty()));
        }

        @Test
        @DisplayName("未声明名称时以来源作为注册表名称")
        void nameFallsBackToSource() {
            PolicyRegistry registry = PolicyManifestLoader.loadRegistry(
                    yaml("collections:\n  - name: notes\n"), "inline");

            assertEquals("inline", registry.getName());
            assertFalse(registry.resolve("notes").defines(AccessOperation.READ));
        }

        @Test
        @DisplayName("claim-unset 条件生效")
        void claimUnsetCondition() {
            PolicyRegistry registry = PolicyManifestLoader.loadRegistry("classpath:manifests/claims.yml");
            DefaultPolicyEvaluator evaluator = new DefaultPolicyEvaluator(registry);
            DocumentSnapshot device = DocumentSnapshot.of(Map.of("ownerId", "u1"));

            assertEquals(AccessDecision.ALLOW,
                    evaluator.decide("devices", AccessOperation.READ, Principal.of("u1"), device, null));
            assertEquals(AccessDecision.DENY, evaluator.decide("devices", AccessOperation.READ,
                    Principal.of("u1", Map.of("forceLogout", true)), device, null));
            assertEquals(AccessDecision.DENY,
                    evaluator.decide("devices", AccessOperation.READ, Principal.of("u2"), device, null));
        }
    }

    @Test
    @DisplayName("取值条件从清单编译后生效")
    void valueConditionsFromManifest() {
        String manifest = String.join("\n",
                "name: values",
                "collections:",
                "  - name: items",
                "    rules:",
                "      create:",
                "        - type: authenticated",
                "        - { type: field-range, field: stats.score, min: 0, max: 10 }",
                "        - { type: field-in, field: kind, values: [a, b] }",
                "        - { type: field-matches, field: code, pattern: '[A-Z]{3}' }",
                "        - { type: field-size-max, field: tags, maxSize: 2 }",
                "");
        DefaultPolicyEvaluator evaluator = new DefaultPolicyEvaluator(
                PolicyManifestLoader.loadRegistry(yaml(manifest), "inline"));
        Principal u1 = Principal.of("u1");
        Map<String, Object> valid = Map.of("stats", Map.of("score", 7), "kind", "a", "code", "ABC",
                "tags", List.of("x"));

        assertEquals(AccessDecision.ALLOW,
                evaluator.decide("items", AccessOperation.CREATE, u1, null, DocumentSnapshot.of(valid)));
        assertEquals(AccessDecision.ALLOW,
                evaluator.decide("items", AccessOperation.CREATE, u1, null, DocumentSnapshot.empty()));
        assertEquals(AccessDecision.DENY, evaluator.decide("items", AccessOperation.CREATE, u1, null,
                DocumentSnapshot.of(Map.of("stats", Map.of("score", 11)))));
        assertEquals(AccessDecision.DENY, evaluator.decide("items", AccessOperation.CREATE, u1, null,
                DocumentSnapshot.of(Map.of("kind", "c"))));
        assertEquals(AccessDecision.DENY, evaluator.decide("items", AccessOperation.CREATE, u1, null,
                DocumentSnapshot.of(Map.of("code", "abc"))));
        assertEquals(AccessDecision.DENY, evaluator.decide("items", AccessOperation.CREATE, u1, null,
                DocumentSnapshot.of(Map.of("tags", List.of("x", "y", "z")))));
    }

    // ==================== 加载失败 ====================

    @Nested
    @DisplayName("加载失败")
    class FailureTests {

        private PolicyConfigurationException loadFails(String location) {
            return assertThrows(PolicyConfigurationException.class, () -> PolicyManifestLoader.loadRegistry(location));
        }

        @Test
        @DisplayName("未知条件类型")
        void unknownConditionType() {
            PolicyConfigurationException e = loadFails("classpath:manifests/unknown-type.yml");
            assertTrue(e.getMessage().contains("is-friend"));
            assertEquals("classpath:manifests/unknown-type.yml", e.getSource());
        }

        @Test
        @DisplayName("重复集合")
        void duplicateCollection() {
            PolicyConfigurationException e = loadFails("classpath:manifests/duplicate-collection.yml");
            assertTrue(e.getMessage().contains("items"));
        }

        @Test
        @DisplayName("protected-fields 缺少字段列表")
        void protectedFieldsWithoutFields() {
            PolicyConfigurationException e = loadFails("classpath:manifests/protected-fields-missing.yml");
            assertTrue(e.getMessage().contains("profiles.UPDATE"));
        }

        @Test
        @DisplayName("未知操作键")
        void unknownOperationKey() {
            loadFails("classpath:manifests/unknown-operation.yml");
        }

        @Test
        @DisplayName("缺少 collections")
        void missingCollections() {
            loadFails("classpath:manifests/no-collections.yml");
        }

        @Test
        @DisplayName("空清单")
        void emptyManifest() {
            PolicyConfigurationException e = loadFails("classpath:manifests/empty.yml");
            assertTrue(e.getMessage().contains("empty"));
        }

        @Test
        @DisplayName("资源或文件不存在")
        void missingResource(@TempDir Path dir) {
            loadFails("classpath:manifests/does-not-exist.yml");
            loadFails(dir.resolve("nope.yml").toString());
            loadFails(" ");
        }

        @Test
        @DisplayName("拒绝任意类型的全局标签")
        void globalTagsAreRejected() {
            loadFails("classpath:manifests/global-tag.yml");
        }

        @Test
        @DisplayName("取值条件缺少必要参数")
        void valueConditionsRequireArguments() {
            String[] broken = {
                    "[{ type: field-range, field: repCount }]",
                    "[{ type: field-range, field: repCount, min: 10, max: 1 }]",
                    "[{ type: field-range, min: 0, max: 1 }]",
                    "[{ type: field-in, field: exerciseType }]",
                    "[{ type: field-in, field: exerciseType, values: [squat, null] }]",
                    "[{ type: field-matches, field: email }]",
                    "[{ type: field-matches, field: email, pattern: '([' }]",
                    "[{ type: field-size-max, field: poseData }]",
                    "[{ type: field-size-max, field: poseData, maxSize: -1 }]",
            };
            for (String conditions : broken) {
                String manifest = "name: broken\ncollections:\n  - name: items\n    rules:\n      create: " + conditions
                        + "\n";
                PolicyConfigurationException e = assertThrows(PolicyConfigurationException.class,
                        () -> PolicyManifestLoader.loadRegistry(yaml(manifest), "inline"), conditions);
                assertTrue(e.getMessage().contains("items.CREATE"), conditions);
            }
        }

        @Test
        @DisplayName("重复键")
        void duplicateKeys() {
            assertThrows(PolicyConfigurationException.class, () -> PolicyManifestLoader.parseManifest(
                    yaml("name: a\nname: b\ncollections: []\n"), "inline"));
        }
    }

    @Test
    @DisplayName("parseManifest 只解析不编译")
    void parseManifestDoesNotCompile() {
        PolicyManifest manifest = PolicyManifestLoader.parseManifest(
                yaml("name: raw\ncollections:\n  - name: items\n    rules:\n      read: [{ type: is-friend }]\n"),
                "inline");

        assertEquals("raw", manifest.getName());
        assertEquals(1, manifest.getCollections().size());
        assertEquals("is-friend", manifest.getCollections().get(0).getRules().getRead().get(0).getType());
    }
}
