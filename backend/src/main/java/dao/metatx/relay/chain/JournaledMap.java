package dao.metatx.relay.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Insertion-ordered map whose writes are undone when the enclosing transaction rolls back.
 * Null values are not stored; {@link #remove} deletes the key.
 */
public final class JournaledMap<K, V> {

    private final StateJournal journal;
    private final Map<K, V> values = Collections.synchronizedMap(new LinkedHashMap<>());

    public JournaledMap(StateJournal journal) {
        this.journal = journal;
    }

    public V get(K key) {
        return values.get(key);
    }

    public V getOrDefault(K key, V fallback) {
        V v = values.get(key);
        return v != null ? v : fallback;
    }

    public boolean containsKey(K key) {
        return values.containsKey(key);
    }

    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        V previous = values.put(key, value);
        journal.record(() -> restore(key, previous));
    }

    public void remove(K key) {
        V previous = values.remove(key);
        if (previous != null) {
            journal.record(() -> values.put(key, previous));
        }
    }

    public List<K> keys() {
        synchronized (values) {
            return new ArrayList<>(values.keySet());
        }
    }

    public Map<K, V> snapshot() {
        synchronized (values) {
            return new LinkedHashMap<>(values);
        }
    }

    public int size() {
        return values.size();
    }

    private void restore(K key, V previous) {
        if (previous == null) {
            values.remove(key);
        } else {
            values.put(key, previous);
        }
    }
}
