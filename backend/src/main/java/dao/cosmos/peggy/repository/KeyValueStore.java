package dao.cosmos.peggy.repository;

import java.util.List;

/**
 * Ordered byte-keyed store backing every bridge collection.
 *
 * Keys compare as unsigned byte strings, so fixed-width big-endian nonces
 * iterate in numeric order.
 */
public interface KeyValueStore {

    /** Returns the stored value or {@code null} when the key is absent. */
    byte[] get(byte[] key);

    default boolean has(byte[] key) {
        return get(key) != null;
    }

    void set(byte[] key, byte[] value);

    void delete(byte[] key);

    /** All entries whose key starts with {@code prefix}, ascending. */
    List<StoreEntry> iterate(byte[] prefix);

    /** All entries whose key starts with {@code prefix}, descending. */
    List<StoreEntry> reverseIterate(byte[] prefix);
}
