package io.blockchain.walletsync.tracking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending changes to a key/value map that has not been loaded.
 * <p>
 * Per key it remembers the value before the first change and the value after
 * the last one (empty = key absent). A key whose before and after values
 * coincide carries no change and is dropped, so a change followed by its
 * inverse leaves nothing behind. {@link #mergeFrom(MapModifier)} composes in
 * that same way and is associative.
 */
public final class MapModifier<K, V> {

    public record Change<V>(Optional<V> before, Optional<V> after) {
        public Change {
            Objects.requireNonNull(before, "before");
            Objects.requireNonNull(after, "after");
        }

        boolean isNoop() {
            return before.equals(after);
        }
    }

    private final Map<K, Change<V>> changes;

    public MapModifier() {
        this.changes = new LinkedHashMap<>();
    }

    private MapModifier(Map<K, Change<V>> changes) {
        this.changes = new LinkedHashMap<>(changes);
    }

    public MapModifier<K, V> copy() {
        return new MapModifier<>(changes);
    }

    /** Record that {@code key} now maps to {@code value}; absent before unless already changed. */
    public void insert(K key, V value) {
        Objects.requireNonNull(value, "value");
        Change<V> existing = changes.get(key);
        Optional<V> before = existing != null ? existing.before() : Optional.empty();
        put(key, new Change<>(before, Optional.of(value)));
    }

    /** Record that {@code key}, previously mapped to {@code previous}, is gone. */
    public void delete(K key, V previous) {
        Objects.requireNonNull(previous, "previous");
        Change<V> existing = changes.get(key);
        Optional<V> before = existing != null ? existing.before() : Optional.of(previous);
        put(key, new Change<>(before, Optional.empty()));
    }

    /** Compose: this modifier's changes first, then {@code next}'s. */
    public void mergeFrom(MapModifier<K, V> next) {
        for (Map.Entry<K, Change<V>> e : next.changes.entrySet()) {
            Change<V> existing = changes.get(e.getKey());
            if (existing == null) {
                put(e.getKey(), e.getValue());
            } else {
                put(e.getKey(), new Change<>(existing.before(), e.getValue().after()));
            }
        }
    }

    private void put(K key, Change<V> change) {
        if (change.isNoop()) {
            changes.remove(key);
        } else {
            changes.put(key, change);
        }
    }

    public Optional<Change<V>> lookup(K key) {
        return Optional.ofNullable(changes.get(key));
    }

    /** Keys present after the changes, with their new values. */
    public Map<K, V> insertions() {
        Map<K, V> out = new LinkedHashMap<>();
        for (Map.Entry<K, Change<V>> e : changes.entrySet()) {
            e.getValue().after().ifPresent(v -> out.put(e.getKey(), v));
        }
        return out;
    }

    /** Keys removed by the changes, with the values they had before. */
    public Map<K, V> deletions() {
        Map<K, V> out = new LinkedHashMap<>();
        for (Map.Entry<K, Change<V>> e : changes.entrySet()) {
            if (e.getValue().after().isEmpty()) {
                out.put(e.getKey(), e.getValue().before().orElseThrow());
            }
        }
        return out;
    }

    public Map<K, Change<V>> changes() {
        return Collections.unmodifiableMap(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    @Override public boolean equals(Object o) {
        return o instanceof MapModifier && changes.equals(((MapModifier<?, ?>) o).changes);
    }

    @Override public int hashCode() { return changes.hashCode(); }

    @Override public String toString() {
        return "+" + insertions().size() + "/-" + deletions().size();
    }
}
