package dao.cosmos.peggy.repository;

/**
 * State handle passed to every bridge service call: the store to read and
 * write plus the height of the block being executed.
 */
public record StoreContext(KeyValueStore store, long blockHeight) {

    public StoreContext withBlockHeight(long height) {
        return new StoreContext(store, height);
    }
}
