package dao.cosmos.peggy.service;

import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.exception.PreconditionFailedException;
import dao.cosmos.peggy.model.Erc20Token;
import dao.cosmos.peggy.model.OutgoingTransferTx;
import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreEntry;
import dao.cosmos.peggy.repository.StoreKeys;
import dao.cosmos.peggy.repository.StoreSequences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Unbatched transfers to Ethereum.
 *
 * Each transfer is stored by id, plus a per-contract fee index that yields
 * the batching order (fee descending, then id ascending) by reverse scan.
 */
@Slf4j
@Service
public class OutgoingPoolService {

    private final BankKeeper bankKeeper;
    private final AssetMappingService assetMapping;
    private final StoreCodec codec;

    public OutgoingPoolService(BankKeeper bankKeeper,
                               AssetMappingService assetMapping,
                               StoreCodec codec) {
        this.bankKeeper = bankKeeper;
        this.assetMapping = assetMapping;
        this.codec = codec;
    }

    /**
     * Escrows amount + fee from the sender and queues the transfer.
     *
     * @return the new transfer id
     * @throws dao.cosmos.peggy.exception.InsufficientFundsException if the sender cannot cover amount + fee
     */
    public long addToOutgoingPool(StoreContext ctx, String sender, String destAddress,
                                  Erc20Token amount, Erc20Token fee) {
        if (!amount.contract().equals(fee.contract())) {
            throw new InvalidRequestException("Fee contract " + fee.contract()
                    + " differs from amount contract " + amount.contract());
        }

        String denom = assetMapping.voucherDenom(ctx, amount.contract());
        BigInteger total = amount.amount().add(fee.amount());
        bankKeeper.sendCoinsToModule(ctx, sender, denom, total);

        long id = StoreSequences.next(ctx.store(), StoreKeys.SEQ_OUTGOING_TX_ID);
        OutgoingTransferTx tx = new OutgoingTransferTx(id, sender, destAddress, amount, fee, denom);
        put(ctx.store(), tx);

        log.info("Transfer queued: id={}, sender={}, contract={}, amount={}, fee={}",
                id, sender, amount.contract(), amount.amount(), fee.amount());
        return id;
    }

    /**
     * Puts a previously batched transfer back, keeping its id.
     */
    public void returnToPool(StoreContext ctx, OutgoingTransferTx tx) {
        if (ctx.store().has(StoreKeys.outgoingTxKey(tx.id()))) {
            throw new IllegalStateException("Transfer " + tx.id() + " is already in the pool");
        }
        put(ctx.store(), tx);
    }

    /**
     * Removes a transfer from the pool. Empty if it was not there.
     */
    public Optional<OutgoingTransferTx> removeFromOutgoingPool(StoreContext ctx, long id) {
        Optional<OutgoingTransferTx> tx = getPoolTransaction(ctx, id);
        tx.ifPresent(t -> {
            ctx.store().delete(StoreKeys.outgoingTxKey(id));
            ctx.store().delete(StoreKeys.feeIndexKey(t.erc20Fee().contract(), t.erc20Fee().amount(), id));
        });
        return tx;
    }

    /**
     * Withdraws an unbatched transfer on behalf of its sender and refunds
     * amount + fee from escrow, in the denom that was escrowed.
     */
    public OutgoingTransferTx cancelSendToEth(StoreContext ctx, long id, String sender) {
        OutgoingTransferTx tx = getPoolTransaction(ctx, id)
                .orElseThrow(() -> new PreconditionFailedException(
                        "Transfer " + id + " is not in the pool (unknown or already batched)"));
        if (!tx.sender().equals(sender)) {
            throw new PreconditionFailedException("Transfer " + id + " does not belong to " + sender);
        }

        removeFromOutgoingPool(ctx, id);
        bankKeeper.sendCoinsFromModule(ctx, sender, tx.escrowDenom(),
                tx.erc20Token().amount().add(tx.erc20Fee().amount()));
        log.info("Transfer cancelled: id={}, sender={}, denom={}", id, sender, tx.escrowDenom());
        return tx;
    }

    public Optional<OutgoingTransferTx> getPoolTransaction(StoreContext ctx, long id) {
        byte[] raw = ctx.store().get(StoreKeys.outgoingTxKey(id));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, OutgoingTransferTx.class));
    }

    /** Whole pool, id ascending. */
    public List<OutgoingTransferTx> getPoolTransactions(StoreContext ctx) {
        List<OutgoingTransferTx> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().iterate(StoreKeys.prefix(StoreKeys.OUTGOING_TX_POOL))) {
            res.add(codec.decode(e.value(), OutgoingTransferTx.class));
        }
        return res;
    }

    /**
     * Up to {@code limit} transfers for {@code tokenContract}, fee descending
     * then id ascending.
     */
    public List<OutgoingTransferTx> getPoolTransactionsByFee(StoreContext ctx, String tokenContract, int limit) {
        List<OutgoingTransferTx> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().reverseIterate(StoreKeys.feeIndexPrefix(tokenContract))) {
            if (res.size() >= limit) break;
            long id = StoreKeys.idFromFeeIndexKey(e.key());
            res.add(getPoolTransaction(ctx, id)
                    .orElseThrow(() -> new IllegalStateException("Fee index points at missing transfer " + id)));
        }
        return res;
    }

    /** Contracts that have at least one unbatched transfer, sorted. */
    public SortedSet<String> getPendingTokenContracts(StoreContext ctx) {
        SortedSet<String> res = new TreeSet<>();
        for (OutgoingTransferTx tx : getPoolTransactions(ctx)) {
            res.add(tx.erc20Token().contract());
        }
        return res;
    }

    private void put(KeyValueStore store, OutgoingTransferTx tx) {
        store.set(StoreKeys.outgoingTxKey(tx.id()), codec.encode(tx));
        store.set(StoreKeys.feeIndexKey(tx.erc20Fee().contract(), tx.erc20Fee().amount(), tx.id()), new byte[0]);
    }
}
