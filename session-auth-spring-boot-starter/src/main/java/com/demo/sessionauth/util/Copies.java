package com.demo.sessionauth.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 不可变拷贝工具。
 * <p>
 * 与 {@code Set.copyOf} / {@code Map.copyOf} 不同：集合中的 null 元素被丢弃，Map 中的 null 值被保留。
 */
public final class Copies {

    private Copies() {
    }

    public static Set<String> stringSet(Collection<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        Set<String> res = new LinkedHashSet<>();
        for (String s : source) {
            if (s != null) res.add(s);
        }
        return Collections.unmodifiableSet(res);
    }

    public static Map<String, Object> map(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> res = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null) res.put(k, v);
        });
        return Collections.unmodifiableMap(res);
    }

    /**
     * 合并两个集合（保持顺序，去掉 null）。
     */
    public static Set<String> union(Collection<String> first, Collection<String> second) {
        Set<String> res = new LinkedHashSet<>(stringSet(first));
        res.addAll(stringSet(second));
        return res.isEmpty() ? Set.of() : Collections.unmodifiableSet(res);
    }
}
