package com.docguard.api.policy;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 文档快照
 * <p>
 * 不可变的字段名到值的映射，表示已存储的文档（existing）或即将写入的文档（proposed）。
 * 字段值允许为 null；引擎只读取快照，从不修改。
 * </p>
 *
 * @author DocGuard
 */
public final class DocumentSnapshot implements Serializable {

    private static final DocumentSnapshot EMPTY = new DocumentSnapshot(Map.of());

    private final Map<String, Object> fields;

    private DocumentSnapshot(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static DocumentSnapshot of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new DocumentSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static DocumentSnapshot empty() {
        return EMPTY;
    }

    /**
     * 链式构建快照，便于测试和适配层使用
     */
    public static Builder builder() {
        return new Builder();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * 按类型读取字段，类型不匹配时返回 null
     */
    public <T> T get(String field, Class<T> type) {
        Object value = fields.get(field);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    /**
     * 字段是否为真值
     * <p>
     * 缺失、null、false、空字符串、数值 0 均视为假值。
     * 其余值均为真值，包括字符串 "false" 与 "0"：字符串不做布尔解析。
     * </p>
     */
    public boolean isTruthy(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        return true;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentSnapshot)) return false;
        return fields.equals(((DocumentSnapshot) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "DocumentSnapshot" + fields;
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public DocumentSnapshot build() {
            return DocumentSnapshot.of(fields);
        }
    }
}
