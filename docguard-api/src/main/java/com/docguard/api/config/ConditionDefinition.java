package com.docguard.api.config;

import lombok.*;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 条件节点
 * <p>
 * type 取值：allow, deny, authenticated, owner-key, owner-field, admin,
 * not-deletion-scheduled, protected-fields, claim-unset,
 * 以及只约束写入文档的取值条件 field-range, field-in, field-matches, field-size-max。
 * 取值条件的 field 支持点分路径，如 profile.height
 * </p>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConditionDefinition implements Serializable {

    private String type;

    // owner-field 与取值条件使用的字段名，owner-field 缺省为 userId
    private String field;

    // protected-fields 使用的字段列表
    @Builder.Default
    private List<String> fields = new ArrayList<>();

    // claim-unset 使用的声明名
    private String claim;

    // field-range 的闭区间，任一端可省略
    private Double min;

    private Double max;

    // field-in 的候选值
    @Builder.Default
    private List<Object> values = new ArrayList<>();

    // field-matches 的正则，整体匹配
    private String pattern;

    // field-size-max 的上限
    private Integer maxSize;

    @Override
    public String toString() {
        return "ConditionDefinition{type='" + type + "'}";
    }
}
