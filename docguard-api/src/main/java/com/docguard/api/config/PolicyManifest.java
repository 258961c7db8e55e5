package com.docguard.api.config;

import com.docguard.api.exception.PolicyConfigurationException;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 对应策略清单 YAML 的根节点
 * 作为静态配置的标准契约
 */
@Getter
@Setter
public class PolicyManifest implements Serializable {

    // === 基础元数据 ===
    private String name;
    private String description;

    // === 集合策略 ===
    private List<CollectionDefinition> collections = new ArrayList<>();

    /**
     * 校验清单结构，条件类型由编译阶段校验
     *
     * @param source 配置来源，用于错误信息
     */
    public void validate(String source) {
        if (collections == null) {
            throw new PolicyConfigurationException(source, "Manifest has no 'collections' section");
        }
        Set<String> seen = new HashSet<>();
        for (CollectionDefinition def : collections) {
            if (def == null || def.getName() == null || def.getName().isBlank()) {
                throw new PolicyConfigurationException(source, "Collection name cannot be blank");
            }
            if (!seen.add(def.getName())) {
                throw new PolicyConfigurationException(source, "Duplicate collection: " + def.getName());
            }
        }
    }

    @Override
    public String toString() {
        return String.format("PolicyManifest{name='%s', collections=%d}", name,
                collections == null ? 0 : collections.size());
    }
}
