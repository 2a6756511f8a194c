package dao.cosmos.peggy.service;

import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.exception.PreconditionFailedException;
import dao.cosmos.peggy.model.BatchKey;
import dao.cosmos.peggy.model.OutgoingTransferTx;
import dao.cosmos.peggy.model.OutgoingTxBatch;
import dao.cosmos.peggy.repository.BatchConfirmStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreEntry;
import dao.cosmos.peggy.repository.StoreKeys;
import dao.cosmos.peggy.repository.StoreSequences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class BatchService {

    private final OutgoingPoolService poolService;
    private final BatchConfirmStore batchConfirms;
    private final StoreCodec codec;

    public BatchService(OutgoingPoolService poolService, BatchConfirmStore batchConfirms, StoreCodec codec) {
        this.poolService = poolService;
        this.batchConfirms = batchConfirms;
        this.codec = codec;
    }

    /**
     * Moves the best {@code maxSize} transfers for {@code tokenContract} out of
     * the pool into a new batch: highest fee first, older id first on equal
     * fees. Transfers for other contracts are not touched.
     *
     * @return the new batch, or empty when the pool holds nothing for the contract
     */
    public Optional<OutgoingTxBatch> buildOutgoingTxBatch(StoreContext ctx, String tokenContract, int maxSize) {
        if (maxSize < 1) {
            throw new InvalidRequestException("Batch max size must be at least 1, got " + maxSize);
        }

        List<OutgoingTransferTx> selected = poolService.getPoolTransactionsByFee(ctx, tokenContract, maxSize);
        if (selected.isEmpty()) {
            log.debug("Nothing to batch for {}", tokenContract);
            return Optional.empty();
        }

        for (OutgoingTransferTx tx : selected) {
            poolService.removeFromOutgoingPool(ctx, tx.id());
        }

        long nonce = StoreSequences.next(ctx.store(), StoreKeys.SEQ_BATCH_NONCE);
        byte[] key = StoreKeys.batchKey(nonce, tokenContract);
        if (ctx.store().has(key)) {
            throw new IllegalStateException("Batch nonce " + nonce + " already used for " + tokenContract);
        }

        OutgoingTxBatch batch = new OutgoingTxBatch(nonce, ctx.blockHeight(), tokenContract, selected);
        ctx.store().set(key, codec.encode(batch));
        log.info("Batch created: nonce={}, contract={}, txCount={}, block={}",
                nonce, tokenContract, selected.size(), batch.block());
        return Optional.of(batch);
    }

    public Optional<OutgoingTxBatch> getOutgoingTxBatch(StoreContext ctx, long nonce, String tokenContract) {
        byte[] raw = ctx.store().get(StoreKeys.batchKey(nonce, tokenContract));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, OutgoingTxBatch.class));
    }

    /** All stored batches, highest nonce first. */
    public List<OutgoingTxBatch> getOutgoingTxBatches(StoreContext ctx) {
        List<OutgoingTxBatch> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().reverseIterate(StoreKeys.prefix(StoreKeys.OUTGOING_TX_BATCH))) {
            res.add(codec.decode(e.value(), OutgoingTxBatch.class));
        }
        return res;
    }

    /**
     * Deletes a batch with its confirmations and puts its transfers back into
     * the pool.
     *
     * @return the cancelled batch, or empty if it did not exist
     */
    public Optional<OutgoingTxBatch> cancelOutgoingTxBatch(StoreContext ctx, long nonce, String tokenContract) {
        Optional<OutgoingTxBatch> batch = getOutgoingTxBatch(ctx, nonce, tokenContract);
        batch.ifPresent(b -> {
            for (OutgoingTransferTx tx : b.transactions()) {
                poolService.returnToPool(ctx, tx);
            }
            ctx.store().delete(StoreKeys.batchKey(nonce, tokenContract));
            int pruned = batchConfirms.deleteConfirms(ctx, new BatchKey(nonce, tokenContract));
            log.info("Batch cancelled: nonce={}, contract={}, returned={}, prunedConfirms={}",
                    nonce, tokenContract, b.transactions().size(), pruned);
        });
        return batch;
    }

    /**
     * Applies execution of a batch on Ethereum: the batch and its confirmations
     * are deleted and every older batch for the same contract, which the
     * contract will now reject, is cancelled so its transfers can be batched
     * again.
     */
    public OutgoingTxBatch outgoingTxBatchExecuted(StoreContext ctx, String tokenContract, long nonce) {
        OutgoingTxBatch executed = getOutgoingTxBatch(ctx, nonce, tokenContract)
                .orElseThrow(() -> new PreconditionFailedException(
                        "Unknown batch " + nonce + " for " + tokenContract));

        for (OutgoingTxBatch older : getOutgoingTxBatches(ctx)) {
            if (older.tokenContract().equals(tokenContract) && older.batchNonce() < nonce) {
                cancelOutgoingTxBatch(ctx, older.batchNonce(), tokenContract);
            }
        }
        ctx.store().delete(StoreKeys.batchKey(nonce, tokenContract));
        int pruned = batchConfirms.deleteConfirms(ctx, new BatchKey(nonce, tokenContract));
        log.info("Batch executed: nonce={}, contract={}, txCount={}, prunedConfirms={}",
                nonce, tokenContract, executed.transactions().size(), pruned);
        return executed;
    }
}
