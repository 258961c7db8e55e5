package com.docguard.core.diff;

import com.docguard.api.policy.DocumentSnapshot;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 文档差异计算
 * <p>
 * 计算 existing 与 proposed 之间发生变化的字段键集合（新增、删除、值变化）。
 * 值比较为结构化深比较：嵌套 Map / List / 数组逐元素比较，数值按数值大小比较。
 * </p>
 *
 * @author DocGuard
 */
public final class DocumentDiff {

    private DocumentDiff() {
    }

    /**
     * 计算变化的字段键
     *
     * @param existing 已存储文档，可为 null
     * @param proposed 待写入文档，可为 null
     * @return 变化字段集合 (不可变)，两侧均缺失时为空集
     */
    public static Set<String> diffKeys(DocumentSnapshot existing, DocumentSnapshot proposed) {
        if (existing == null && proposed == null) {
            return Collections.emptySet();
        }
        // 任意一侧缺失：另一侧的全部键都视为变化
        if (existing == null) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(proposed.fieldNames()));
        }
        if (proposed == null) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(existing.fieldNames()));
        }

        Set<String> changed = new LinkedHashSet<>();
        for (String key : existing.fieldNames()) {
            if (!proposed.contains(key) || !valueEquals(existing.get(key), proposed.get(key))) {
                changed.add(key);
            }
        }
        for (String key : proposed.fieldNames()) {
            if (!existing.contains(key)) {
                changed.add(key);
            }
        }
        return Collections.unmodifiableSet(changed);
    }

    /**
     * 判断给定字段集合中是否有任一字段发生变化
     */
    public static boolean touchesAny(DocumentSnapshot existing, DocumentSnapshot proposed, Set<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return false;
        }
        for (String key : diffKeys(existing, proposed)) {
            if (keys.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 结构化值比较
     */
    public static boolean valueEquals(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return numberEquals((Number) a, (Number) b);
        }
        if (a instanceof Map && b instanceof Map) {
            return mapEquals((Map<?, ?>) a, (Map<?, ?>) b);
        }
        if (a instanceof List && b instanceof List) {
            return listEquals((List<?>) a, (List<?>) b);
        }
        if (a.getClass().isArray() && b.getClass().isArray()) {
            return Objects.deepEquals(a, b);
        }
        return a.equals(b);
    }

    private static boolean mapEquals(Map<?, ?> a, Map<?, ?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean listEquals(List<?> a, List<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<?> ia = a.iterator();
        Iterator<?> ib = b.iterator();
        while (ia.hasNext()) {
            if (!valueEquals(ia.next(), ib.next())) {
                return false;
            }
        }
        return true;
    }

    private static boolean numberEquals(Number a, Number b) {
        BigDecimal da = toBigDecimal(a);
        BigDecimal db = toBigDecimal(b);
        if (da == null || db == null) {
            // NaN / Infinity 无法转为 BigDecimal，退回到 double 比较
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return da.compareTo(db) == 0;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
