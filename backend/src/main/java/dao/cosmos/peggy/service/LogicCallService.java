package dao.cosmos.peggy.service;

import dao.cosmos.peggy.exception.PreconditionFailedException;
import dao.cosmos.peggy.model.LogicCallKey;
import dao.cosmos.peggy.model.OutgoingLogicCall;
import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.LogicCallConfirmStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreEntry;
import dao.cosmos.peggy.repository.StoreKeys;
import dao.cosmos.peggy.repository.StoreSequences;
import dao.cosmos.peggy.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keyed store of outgoing logic calls. Stores whatever it is given; ordering
 * of invalidation nonces is checked by the message layer, which records the
 * last accepted nonce per invalidation id here.
 *
 * Besides the primary (invalidation id, nonce) key every call gets a slot in
 * a submission order index, so "most recent" listings follow the order in
 * which calls were stored rather than the byte order of their ids.
 */
@Slf4j
@Service
public class LogicCallService {

    private final LogicCallConfirmStore logicCallConfirms;
    private final StoreCodec codec;

    public LogicCallService(LogicCallConfirmStore logicCallConfirms, StoreCodec codec) {
        this.logicCallConfirms = logicCallConfirms;
        this.codec = codec;
    }

    public void setOutgoingLogicCall(StoreContext ctx, OutgoingLogicCall call) {
        KeyValueStore store = ctx.store();
        byte[] key = StoreKeys.logicCallKey(call.invalidationId(), call.invalidationNonce());

        removeFromSubmissionIndex(store, call.invalidationId(), call.invalidationNonce());
        long seq = StoreSequences.next(store, StoreKeys.SEQ_LOGIC_CALL_SUBMISSION);

        store.set(key, codec.encode(call));
        store.set(StoreKeys.logicCallBySubmissionKey(seq), key);
        store.set(StoreKeys.logicCallSubmissionSeqKey(call.invalidationId(), call.invalidationNonce()),
                StoreKeys.uint64(seq));
        log.info("Logic call stored: invalidationId={}, invalidationNonce={}, contract={}, seq={}",
                HexUtil.toHex0x(call.invalidationId()), call.invalidationNonce(), call.logicContractAddress(), seq);
    }

    public Optional<OutgoingLogicCall> getOutgoingLogicCall(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        byte[] raw = ctx.store().get(StoreKeys.logicCallKey(invalidationId, invalidationNonce));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, OutgoingLogicCall.class));
    }

    /** Calls stored under {@code invalidationId}, nonce ascending. */
    public List<OutgoingLogicCall> getOutgoingLogicCalls(StoreContext ctx, byte[] invalidationId) {
        List<OutgoingLogicCall> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().iterate(StoreKeys.logicCallIdPrefix(invalidationId))) {
            res.add(codec.decode(e.value(), OutgoingLogicCall.class));
        }
        return res;
    }

    /** All logic calls, most recently stored first. */
    public List<OutgoingLogicCall> getOutgoingLogicCallsNewestFirst(StoreContext ctx) {
        List<OutgoingLogicCall> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().reverseIterate(StoreKeys.prefix(StoreKeys.LOGIC_CALL_BY_SUBMISSION))) {
            byte[] raw = ctx.store().get(e.value());
            if (raw == null) {
                throw new IllegalStateException("Submission index points at missing logic call "
                        + HexUtil.toHex0x(e.value()));
            }
            res.add(codec.decode(raw, OutgoingLogicCall.class));
        }
        return res;
    }

    /**
     * Removes a logic call together with its confirmations and its submission
     * index slot.
     *
     * @return false if no such call was stored
     */
    public boolean deleteOutgoingLogicCall(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        KeyValueStore store = ctx.store();
        byte[] key = StoreKeys.logicCallKey(invalidationId, invalidationNonce);
        if (!store.has(key)) {
            return false;
        }
        store.delete(key);
        removeFromSubmissionIndex(store, invalidationId, invalidationNonce);
        int pruned = logicCallConfirms.deleteConfirms(ctx, new LogicCallKey(invalidationId, invalidationNonce));
        log.info("Logic call deleted: invalidationId={}, invalidationNonce={}, prunedConfirms={}",
                HexUtil.toHex0x(invalidationId), invalidationNonce, pruned);
        return true;
    }

    /**
     * Applies execution of a logic call on Ethereum: the call is deleted, and
     * so is every call under the same invalidation id with a lower nonce,
     * which the Ethereum side will now reject.
     */
    public OutgoingLogicCall outgoingLogicCallExecuted(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        OutgoingLogicCall executed = getOutgoingLogicCall(ctx, invalidationId, invalidationNonce)
                .orElseThrow(() -> new PreconditionFailedException("Unknown logic call "
                        + HexUtil.toHex0x(invalidationId) + "/" + invalidationNonce));

        for (OutgoingLogicCall older : getOutgoingLogicCalls(ctx, invalidationId)) {
            if (older.invalidationNonce() < invalidationNonce) {
                deleteOutgoingLogicCall(ctx, invalidationId, older.invalidationNonce());
            }
        }
        deleteOutgoingLogicCall(ctx, invalidationId, invalidationNonce);
        log.info("Logic call executed: invalidationId={}, invalidationNonce={}",
                HexUtil.toHex0x(invalidationId), invalidationNonce);
        return executed;
    }

    /** Highest invalidation nonce accepted for {@code invalidationId}, 0 if none. */
    public long getLastInvalidationNonce(StoreContext ctx, byte[] invalidationId) {
        byte[] raw = ctx.store().get(StoreKeys.lastInvalidationNonceKey(invalidationId));
        return raw == null ? 0L : StoreKeys.readUint64(raw);
    }

    public void setLastInvalidationNonce(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        ctx.store().set(StoreKeys.lastInvalidationNonceKey(invalidationId), StoreKeys.uint64(invalidationNonce));
    }

    private void removeFromSubmissionIndex(KeyValueStore store, byte[] invalidationId, long invalidationNonce) {
        byte[] seqKey = StoreKeys.logicCallSubmissionSeqKey(invalidationId, invalidationNonce);
        byte[] seq = store.get(seqKey);
        if (seq != null) {
            store.delete(StoreKeys.logicCallBySubmissionKey(StoreKeys.readUint64(seq)));
            store.delete(seqKey);
        }
    }
}
