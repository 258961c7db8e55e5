package com.docguard.core.loader;

import com.docguard.api.config.CollectionDefinition;
import com.docguard.api.config.ConditionDefinition;
import com.docguard.api.config.PolicyManifest;
import com.docguard.api.exception.PolicyConfigurationException;
import com.docguard.api.policy.AccessPredicate;
import com.docguard.api.security.AccessOperation;
import com.docguard.core.policy.CollectionPolicy;
import com.docguard.core.policy.PolicyRegistry;
import com.docguard.core.predicate.Predicates;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * 清单编译器
 * 将 {@link PolicyManifest} 中的条件节点翻译为 {@link Predicates} 中的谓词组合。
 * 清单只是具名谓词工厂的列表，而不是表达式语言。
 */
public final class PolicyManifestCompiler {

    private PolicyManifestCompiler() {
    }

    public static PolicyRegistry compile(PolicyManifest manifest, String source) {
        manifest.validate(source);
        String name = manifest.getName() != null ? manifest.getName() : source;
        PolicyRegistry.Builder builder = PolicyRegistry.builder(name);
        for (CollectionDefinition def : manifest.getCollections()) {
            builder.register(compileCollection(def, source));
        }
        return builder.build();
    }

    static CollectionPolicy compileCollection(CollectionDefinition def, String source) {
        CollectionPolicy.Builder builder = CollectionPolicy.builder(def.getName());
        CollectionDefinition.RuleSet rules = def.getRules();
        if (rules == null) {
            // 未声明任何规则：四个操作全部拒绝
            return builder.build();
        }
        addRule(builder, AccessOperation.CREATE, rules.getCreate(), def.getName(), source);
        addRule(builder, AccessOperation.READ, rules.getRead(), def.getName(), source);
        addRule(builder, AccessOperation.UPDATE, rules.getUpdate(), def.getName(), source);
        addRule(builder, AccessOperation.DELETE, rules.getDelete(), def.getName(), source);
        return builder.build();
    }

    private static void addRule(CollectionPolicy.Builder builder, AccessOperation operation,
            List<ConditionDefinition> conditions, String collection, String source) {
        if (conditions == null || conditions.isEmpty()) {
            return;
        }
        AccessPredicate combined = null;
        for (ConditionDefinition condition : conditions) {
            AccessPredicate predicate = compileCondition(condition, collection + "." + operation, source);
            combined = combined == null ? predicate : combined.and(predicate);
        }
        builder.rule(operation, combined);
    }

    static AccessPredicate compileCondition(ConditionDefinition condition, String location, String source) {
        if (condition == null || condition.getType() == null || condition.getType().isBlank()) {
            throw new PolicyConfigurationException(source, "Condition type is required at " + location);
        }
        String type = condition.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "allow":
                return Predicates.allow();
            case "deny":
                return Predicates.deny();
            case "authenticated":
                return Predicates.authenticated();
            case "owner-key":
                return Predicates.ownerOfDocumentKey();
            case "owner-field":
                String field = condition.getField();
                return Predicates.authenticated().and(Predicates.ownerByField(
                        field == null || field.isBlank() ? Predicates.OWNER_FIELD : field));
            case "admin":
                return Predicates.admin();
            case "not-deletion-scheduled":
                return Predicates.notScheduledForDeletion();
            case "protected-fields":
                return Predicates.protectedFieldsUnchanged(requireFields(condition, location, source));
            case "claim-unset":
                if (condition.getClaim() == null || condition.getClaim().isBlank()) {
                    throw new PolicyConfigurationException(source,
                            "Condition 'claim-unset' requires 'claim' at " + location);
                }
                return Predicates.claimUnset(condition.getClaim());
            case "field-range":
                return compileRange(condition, location, source);
            case "field-in":
                List<Object> values = condition.getValues();
                if (values == null || values.isEmpty() || values.contains(null)) {
                    throw new PolicyConfigurationException(source,
                            "Condition 'field-in' requires non-empty 'values' without nulls at " + location);
                }
                return Predicates.fieldIn(requireField(condition, location, source), values);
            case "field-matches":
                return compileMatches(condition, location, source);
            case "field-size-max":
                Integer maxSize = condition.getMaxSize();
                if (maxSize == null || maxSize < 0) {
                    throw new PolicyConfigurationException(source,
                            "Condition 'field-size-max' requires non-negative 'maxSize' at " + location);
                }
                return Predicates.fieldSizeAtMost(requireField(condition, location, source), maxSize);
            default:
                throw new PolicyConfigurationException(source,
                        "Unknown condition type '" + condition.getType() + "' at " + location);
        }
    }

    private static AccessPredicate compileRange(ConditionDefinition condition, String location, String source) {
        Double min = condition.getMin();
        Double max = condition.getMax();
        if (min == null && max == null) {
            throw new PolicyConfigurationException(source,
                    "Condition 'field-range' requires 'min' or 'max' at " + location);
        }
        if (min != null && max != null && min > max) {
            throw new PolicyConfigurationException(source,
                    "Condition 'field-range' has min > max at " + location);
        }
        return Predicates.fieldInRange(requireField(condition, location, source), min, max);
    }

    private static AccessPredicate compileMatches(ConditionDefinition condition, String location, String source) {
        String field = requireField(condition, location, source);
        if (condition.getPattern() == null || condition.getPattern().isEmpty()) {
            throw new PolicyConfigurationException(source,
                    "Condition 'field-matches' requires 'pattern' at " + location);
        }
        try {
            return Predicates.fieldMatches(field, condition.getPattern());
        } catch (PatternSyntaxException e) {
            throw new PolicyConfigurationException(source,
                    "Invalid pattern for 'field-matches' at " + location + ": " + e.getDescription(), e);
        }
    }

    private static String requireField(ConditionDefinition condition, String location, String source) {
        String field = condition.getField();
        if (field == null || field.isBlank()) {
            throw new PolicyConfigurationException(source,
                    "Condition '" + condition.getType() + "' requires 'field' at " + location);
        }
        return field;
    }

    private static Set<String> requireFields(ConditionDefinition condition, String location, String source) {
        List<String> fields = condition.getFields();
        if (fields == null || fields.isEmpty()) {
            throw new PolicyConfigurationException(source,
                    "Condition 'protected-fields' requires non-empty 'fields' at " + location);
        }
        Set<String> result = new LinkedHashSet<>();
        for (String f : fields) {
            if (f == null || f.isBlank()) {
                throw new PolicyConfigurationException(source, "Blank protected field at " + location);
            }
            result.add(f);
        }
        return result;
    }
}
