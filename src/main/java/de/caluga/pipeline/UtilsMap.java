package de.caluga.pipeline;

import java.util.LinkedHashMap;

/**
 * Insertion ordered map with a fluent {@link #add(Object, Object)}. Null values are skipped, which
 * keeps optional operator arguments out of the rendered document.
 */
public class UtilsMap<K, V> extends LinkedHashMap<K, V> {
    public static <K, V> UtilsMap<K, V> of(K k1, V v1) {
        return new UtilsMap<K, V>().add(k1, v1);
    }

    public static <K, V> UtilsMap<K, V> of(K k1, V v1, K k2, V v2) {
        return new UtilsMap<K, V>().add(k1, v1).add(k2, v2);
    }

    public static <K, V> UtilsMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        return new UtilsMap<K, V>().add(k1, v1)
                .add(k2, v2)
                .add(k3, v3);
    }

    public UtilsMap<K, V> add(K key, V val) {
        if (val == null) return this;
        put(key, val);
        return this;
    }
}
