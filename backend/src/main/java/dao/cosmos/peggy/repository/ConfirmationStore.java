package dao.cosmos.peggy.repository;

import dao.cosmos.peggy.model.Confirmation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-validator signatures for one kind of subject.
 *
 * Records are keyed by (subject, orchestrator): a second confirmation from
 * the same orchestrator replaces the first. Listing a subject's confirmations
 * returns them by orchestrator address bytes ascending.
 *
 * @param <K> subject key
 * @param <C> confirmation record
 */
@Slf4j
public abstract class ConfirmationStore<K, C extends Confirmation<K>> {

    private final StoreCodec codec;
    private final Class<C> type;

    protected ConfirmationStore(StoreCodec codec, Class<C> type) {
        this.codec = codec;
        this.type = type;
    }

    /** Key prefix shared by every confirmation of {@code subject}. */
    protected abstract byte[] subjectPrefix(K subject);

    public void setConfirm(StoreContext ctx, C confirm) {
        byte[] key = confirmKey(confirm.subject(), confirm.orchestrator());
        if (ctx.store().has(key)) {
            log.debug("Replacing {} from {} for {}", type.getSimpleName(), confirm.orchestrator(), confirm.subject());
        }
        ctx.store().set(key, codec.encode(confirm));
        log.debug("{} stored: subject={}, orchestrator={}", type.getSimpleName(), confirm.subject(), confirm.orchestrator());
    }

    public Optional<C> getConfirm(StoreContext ctx, K subject, String orchestrator) {
        byte[] raw = ctx.store().get(confirmKey(subject, orchestrator));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, type));
    }

    public boolean hasConfirm(StoreContext ctx, K subject, String orchestrator) {
        return ctx.store().has(confirmKey(subject, orchestrator));
    }

    public List<C> getConfirms(StoreContext ctx, K subject) {
        List<C> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().iterate(subjectPrefix(subject))) {
            res.add(codec.decode(e.value(), type));
        }
        return res;
    }

    public int deleteConfirms(StoreContext ctx, K subject) {
        List<StoreEntry> entries = ctx.store().iterate(subjectPrefix(subject));
        for (StoreEntry e : entries) {
            ctx.store().delete(e.key());
        }
        return entries.size();
    }

    private byte[] confirmKey(K subject, String orchestrator) {
        return StoreKeys.concat(subjectPrefix(subject), StoreKeys.utf8(orchestrator));
    }
}
