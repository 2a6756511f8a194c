package dao.cosmos.peggy.repository;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

@Repository
public class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<byte[], byte[]> entries = new TreeMap<>(Arrays::compareUnsigned);

    @Override
    public byte[] get(byte[] key) {
        byte[] value = entries.get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public void set(byte[] key, byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null, use delete()");
        }
        entries.put(key.clone(), value.clone());
    }

    @Override
    public void delete(byte[] key) {
        entries.remove(key);
    }

    @Override
    public List<StoreEntry> iterate(byte[] prefix) {
        List<StoreEntry> res = new ArrayList<>();
        for (Map.Entry<byte[], byte[]> e : entries.tailMap(prefix, true).entrySet()) {
            if (!StoreKeys.hasPrefix(e.getKey(), prefix)) break;
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
}
