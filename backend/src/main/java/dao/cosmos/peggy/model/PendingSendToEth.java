package dao.cosmos.peggy.model;

import java.util.List;

/** A sender's outstanding transfers split by whether a batch already holds them. */
public record PendingSendToEth(
        List<OutgoingTransferTx> transfersInBatches,
        List<OutgoingTransferTx> unbatchedTransfers
) {}
