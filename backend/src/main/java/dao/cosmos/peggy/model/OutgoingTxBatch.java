package dao.cosmos.peggy.model;

import java.util.List;

/**
 * Transfers for one token contract, committed together under a module-wide
 * batch nonce.
 */
public record OutgoingTxBatch(
        long batchNonce,
        long block,
        String tokenContract,
        List<OutgoingTransferTx> transactions
) {

    public OutgoingTxBatch {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
