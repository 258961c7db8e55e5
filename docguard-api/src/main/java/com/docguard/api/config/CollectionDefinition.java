package com.docguard.api.config;

import lombok.*;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个集合的策略定义
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionDefinition implements Serializable {

    private String name;

    @Builder.Default
    private RuleSet rules = new RuleSet();

    /**
     * 按操作划分的条件列表，同一列表内的条件以逻辑与组合。
     * 缺失或为空的列表等价于拒绝。
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleSet implements Serializable {
        @Builder.Default
        private List<ConditionDefinition> create = new ArrayList<>();

        @Builder.Default
        private List<ConditionDefinition> read = new ArrayList<>();

        @Builder.Default
        private List<ConditionDefinition> update = new ArrayList<>();

        @Builder.Default
        private List<ConditionDefinition> delete = new ArrayList<>();
    }
}
