package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.view.EntityPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Matches entities of two revisions by an identity key (field number, enum value number, name).
 */
public final class EntityPairing {

    private EntityPairing() {
    }

    /**
     * Pairs the entities of both revisions by {@code key}. Keys present on one side only produce an
     * addition or removal pair. The result is sorted by key so the comparison order is stable.
     * When a key repeats within one revision the last entity wins.
     */
    public static <T, K extends Comparable<K>> List<EntityPair<T>> pairBy(Collection<T> originals,
                                                                           Collection<T> updates,
                                                                           Function<T, K> key) {
        Map<K, T> originalByKey = index(originals, key);
        Map<K, T> updatedByKey = index(updates, key);
        TreeSet<K> keys = new TreeSet<>(originalByKey.keySet());
        keys.addAll(updatedByKey.keySet());

        List<EntityPair<T>> pairs = new ArrayList<>(keys.size());
        for (K k : keys) {
            pairs.add(EntityPair.of(originalByKey.get(k), updatedByKey.get(k)));
        }
        return pairs;
    }

    /**
     * Pairs two maps that are already keyed by identity.
     */
    public static <T> List<EntityPair<T>> pairByKey(Map<String, T> originals, Map<String, T> updates) {
        TreeSet<String> keys = new TreeSet<>(originals.keySet());
        keys.addAll(updates.keySet());
        List<EntityPair<T>> pairs = new ArrayList<>(keys.size());
        for (String k : keys) {
            pairs.add(EntityPair.of(originals.get(k), updates.get(k)));
        }
        return pairs;
    }

    private static <T, K extends Comparable<K>> Map<K, T> index(Collection<T> entities, Function<T, K> key) {
        Map<K, T> byKey = new TreeMap<>();
        if (entities != null) {
            for (T entity : entities) {
                byKey.put(key.apply(entity), entity);
            }
        }
        return byKey;
    }
}
