package dao.cosmos.peggy.service;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.model.AssetMapping;
import dao.cosmos.peggy.model.BatchConfirm;
import dao.cosmos.peggy.model.BatchKey;
import dao.cosmos.peggy.model.LogicCallConfirm;
import dao.cosmos.peggy.model.LogicCallKey;
import dao.cosmos.peggy.model.OutgoingLogicCall;
import dao.cosmos.peggy.model.OutgoingTransferTx;
import dao.cosmos.peggy.model.OutgoingTxBatch;
import dao.cosmos.peggy.model.PendingSendToEth;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.model.ValsetConfirm;
import dao.cosmos.peggy.repository.BatchConfirmStore;
import dao.cosmos.peggy.repository.LogicCallConfirmStore;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.ValsetConfirmStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only views consumed by orchestrators and relayers.
 *
 * Nothing here writes to the store. "Pending for an orchestrator" means the
 * orchestrator has no confirmation for the subject; it is computed from the
 * request and confirmation collections on every call.
 */
@Service
public class QueryService {

    private final ValsetService valsetService;
    private final BatchService batchService;
    private final LogicCallService logicCallService;
    private final OutgoingPoolService poolService;
    private final AssetMappingService assetMapping;
    private final ValsetConfirmStore valsetConfirms;
    private final BatchConfirmStore batchConfirms;
    private final LogicCallConfirmStore logicCallConfirms;
    private final PeggyProperties props;

    public QueryService(ValsetService valsetService,
                        BatchService batchService,
                        LogicCallService logicCallService,
                        OutgoingPoolService poolService,
                        AssetMappingService assetMapping,
                        ValsetConfirmStore valsetConfirms,
                        BatchConfirmStore batchConfirms,
                        LogicCallConfirmStore logicCallConfirms,
                        PeggyProperties props) {
        this.valsetService = valsetService;
        this.batchService = batchService;
        this.logicCallService = logicCallService;
        this.poolService = poolService;
        this.assetMapping = assetMapping;
        this.valsetConfirms = valsetConfirms;
        this.batchConfirms = batchConfirms;
        this.logicCallConfirms = logicCallConfirms;
        this.props = props;
    }

    // ---------------------------------------------------------------------
    // valsets
    // ---------------------------------------------------------------------

    /** Most recently stored valset. */
    public Optional<Valset> currentValset(StoreContext ctx) {
        return valsetService.getLatestValset(ctx);
    }

    public Optional<Valset> valsetRequest(StoreContext ctx, long nonce) {
        return valsetService.getValset(ctx, nonce);
    }

    /** Up to {@code limit} most recent valsets, nonce descending. */
    public List<Valset> lastValsetRequests(StoreContext ctx, int limit) {
        return valsetService.getValsetsDescending(ctx, checkLimit(limit));
    }

    /** Most recent valset the orchestrator has not confirmed yet. */
    public Optional<Valset> lastPendingValsetRequest(StoreContext ctx, String orchestrator) {
        return valsetService.getValsetsDescending(ctx, Integer.MAX_VALUE).stream()
                .filter(v -> !valsetConfirms.hasConfirm(ctx, v.nonce(), orchestrator))
                .findFirst();
    }

    public Optional<ValsetConfirm> valsetConfirm(StoreContext ctx, long nonce, String orchestrator) {
        return valsetConfirms.getConfirm(ctx, nonce, orchestrator);
    }

    public List<ValsetConfirm> allValsetConfirms(StoreContext ctx, long nonce) {
        return valsetConfirms.getConfirms(ctx, nonce);
    }

    // ---------------------------------------------------------------------
    // batches
    // ---------------------------------------------------------------------

    /**
     * Up to {@code limit} most recent batches, nonce descending, optionally
     * only those for {@code tokenContract} (null for all contracts).
     */
    public List<OutgoingTxBatch> lastBatchesRequest(StoreContext ctx, int limit, String tokenContract) {
        int max = checkLimit(limit);
        List<OutgoingTxBatch> res = new ArrayList<>();
        for (OutgoingTxBatch b : batchService.getOutgoingTxBatches(ctx)) {
            if (res.size() >= max) break;
            if (tokenContract == null || tokenContract.equals(b.tokenContract())) {
                res.add(b);
            }
        }
        return res;
    }

    public Optional<OutgoingTxBatch> batch(StoreContext ctx, long nonce, String tokenContract) {
        return batchService.getOutgoingTxBatch(ctx, nonce, tokenContract);
    }

    /** Most recent batch the orchestrator has not confirmed, optionally for one contract. */
    public Optional<OutgoingTxBatch> lastPendingBatchRequest(StoreContext ctx, String orchestrator, String tokenContract) {
        return batchService.getOutgoingTxBatches(ctx).stream()
                .filter(b -> tokenContract == null || tokenContract.equals(b.tokenContract()))
                .filter(b -> !batchConfirms.hasConfirm(ctx, new BatchKey(b.batchNonce(), b.tokenContract()), orchestrator))
                .findFirst();
    }

    public List<BatchConfirm> allBatchConfirms(StoreContext ctx, long nonce, String tokenContract) {
        return batchConfirms.getConfirms(ctx, new BatchKey(nonce, tokenContract));
    }

    // ---------------------------------------------------------------------
    // logic calls
    // ---------------------------------------------------------------------

    /** Up to {@code limit} logic calls, most recently submitted first. */
    public List<OutgoingLogicCall> lastLogicCallRequests(StoreContext ctx, int limit) {
        List<OutgoingLogicCall> all = logicCallService.getOutgoingLogicCallsNewestFirst(ctx);
        return new ArrayList<>(all.subList(0, Math.min(checkLimit(limit), all.size())));
    }

    public Optional<OutgoingLogicCall> logicCall(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        return logicCallService.getOutgoingLogicCall(ctx, invalidationId, invalidationNonce);
    }

    public Optional<OutgoingLogicCall> lastPendingLogicCallRequest(StoreContext ctx, String orchestrator) {
        return logicCallService.getOutgoingLogicCallsNewestFirst(ctx).stream()
                .filter(c -> !logicCallConfirms.hasConfirm(ctx, c.key(), orchestrator))
                .findFirst();
    }

    public List<LogicCallConfirm> allLogicCallConfirms(StoreContext ctx, byte[] invalidationId, long invalidationNonce) {
        return logicCallConfirms.getConfirms(ctx, new LogicCallKey(invalidationId, invalidationNonce));
    }

    // ---------------------------------------------------------------------
    // transfers and assets
    // ---------------------------------------------------------------------

    /**
     * The sender's transfers that are still waiting: those already in a batch
     * (batch nonce ascending, batch order within a batch) and those still in
     * the pool (id ascending).
     */
    public PendingSendToEth pendingSendToEth(StoreContext ctx, String sender) {
        List<OutgoingTxBatch> batches = new ArrayList<>(batchService.getOutgoingTxBatches(ctx));
        Collections.reverse(batches);

        List<OutgoingTransferTx> inBatches = new ArrayList<>();
        for (OutgoingTxBatch b : batches) {
            for (OutgoingTransferTx tx : b.transactions()) {
                if (tx.sender().equals(sender)) inBatches.add(tx);
            }
        }

        List<OutgoingTransferTx> unbatched = new ArrayList<>();
        for (OutgoingTransferTx tx : poolService.getPoolTransactions(ctx)) {
            if (tx.sender().equals(sender)) unbatched.add(tx);
        }
        return new PendingSendToEth(inBatches, unbatched);
    }

    public Optional<AssetMapping> erc20ToDenom(StoreContext ctx, String erc20) {
        return assetMapping.getMappingByErc20(ctx, erc20);
    }

    public Optional<AssetMapping> denomToErc20(StoreContext ctx, String denom) {
        return assetMapping.getMappingByDenom(ctx, denom);
    }

    public int defaultLimit() {
        return props.getQuery().getDefaultLimit();
    }

    private int checkLimit(int limit) {
        if (limit < 1) {
            throw new InvalidRequestException("limit must be at least 1, got " + limit);
        }
        return Math.min(limit, props.getQuery().getMaxLimit());
    }
}
