package dao.cosmos.peggy.repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Write buffer over a parent store. Reads see buffered writes first; nothing
 * reaches the parent until {@link #commit()}.
 */
public class CacheKeyValueStore implements KeyValueStore {

    private final KeyValueStore parent;

    // a null value marks a buffered delete
    private final NavigableMap<byte[], byte[]> writes = new TreeMap<>(Arrays::compareUnsigned);

    public CacheKeyValueStore(KeyValueStore parent) {
        this.parent = parent;
    }

    @Override
    public byte[] get(byte[] key) {
        if (writes.containsKey(key)) {
            byte[] value = writes.get(key);
            return value == null ? null : value.clone();
        }
        return parent.get(key);
    }

    @Override
    public void set(byte[] key, byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null, use delete()");
        }
        writes.put(key.clone(), value.clone());
    }

    @Override
    public void delete(byte[] key) {
        writes.put(key.clone(), null);
    }

    @Override
    public List<StoreEntry> iterate(byte[] prefix) {
        NavigableMap<byte[], byte[]> merged = new TreeMap<>(Arrays::compareUnsigned);
        for (StoreEntry e : parent.iterate(prefix)) {
            merged.put(e.key(), e.value());
        }
        for (Map.Entry<byte[], byte[]> w : writes.tailMap(prefix, true).entrySet()) {
            if (!StoreKeys.hasPrefix(w.getKey(), prefix)) break;
            if (w.getValue() == null) {
                merged.remove(w.getKey());
            } else {
                merged.put(w.getKey(), w.getValue());
            }
        }
        List<StoreEntry> res = new ArrayList<>(merged.size());
        for (Map.Entry<byte[], byte[]> e : merged.entrySet()) {
            res.add(new StoreEntry(e.getKey().clone(), e.getValue().clone()));
        }
        return res;
    }

    @Override
    public List<StoreEntry> reverseIterate(byte[] prefix) {
        List<StoreEntry> res = iterate(prefix);
        Collections.reverse(res);
        return res;
    }

    /** Flushes buffered writes into the parent, in key order. */
    public void commit() {
        for (Map.Entry<byte[], byte[]> w : writes.entrySet()) {
            if (w.getValue() == null) {
                parent.delete(w.getKey());
            } else {
                parent.set(w.getKey(), w.getValue());
            }
        }
        writes.clear();
    }
}
