package dao.cosmos.peggy.repository;

/**
 * Module-wide monotonic counters: valset nonce, transfer id, batch nonce and
 * logic call submission order.
 * The first value handed out is 1.
 */
public final class StoreSequences {
    private StoreSequences() {}

    public static long next(KeyValueStore store, String name) {
        long next = last(store, name) + 1;
        store.set(StoreKeys.sequenceKey(name), StoreKeys.uint64(next));
        return next;
    }

    /** Last value handed out, 0 if none yet. */
    public static long last(KeyValueStore store, String name) {
        byte[] raw = store.get(StoreKeys.sequenceKey(name));
        return raw == null ? 0L : StoreKeys.readUint64(raw);
    }
}
