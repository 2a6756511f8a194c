package dao.cosmos.peggy.service;

import dao.cosmos.peggy.repository.CacheKeyValueStore;
import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.StoreContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * Owns the committed bridge state and the current block height.
 *
 * Every message runs in its own cache branch that is committed only when the
 * handler returns normally. Queries run in a branch that is always discarded.
 * All access is serialized, so handlers never observe each other mid-way.
 */
@Slf4j
@Service
public class StateManager {

    private final KeyValueStore committed;
    private final EndBlocker endBlocker;
    private long height = 1L;

    public StateManager(KeyValueStore committed, EndBlocker endBlocker) {
        this.committed = committed;
        this.endBlocker = endBlocker;
    }

    public synchronized long currentHeight() {
        return height;
    }

    public synchronized void beginBlock(long newHeight) {
        if (newHeight <= height) {
            throw new IllegalStateException("Block height must increase: current=" + height + ", new=" + newHeight);
        }
        height = newHeight;
        log.debug("Begin block {}", newHeight);
    }

    /**
     * Runs {@code handler} atomically: either all of its writes are committed
     * or, if it throws, none are.
     */
    public synchronized <T> T deliverTx(Function<StoreContext, T> handler) {
        CacheKeyValueStore branch = new CacheKeyValueStore(committed);
        T result = handler.apply(new StoreContext(branch, height));
        branch.commit();
        return result;
    }

    public synchronized <T> T query(Function<StoreContext, T> reader) {
        return reader.apply(new StoreContext(new CacheKeyValueStore(committed), height));
    }

    public synchronized void endBlock() {
        deliverTx(ctx -> {
            endBlocker.endBlock(ctx);
            return null;
        });
        log.debug("End block {}", height);
    }
}
