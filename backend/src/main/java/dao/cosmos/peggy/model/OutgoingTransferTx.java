package dao.cosmos.peggy.model;

/**
 * A user's request to send tokens to Ethereum. Token and fee always share
 * the same contract. {@code escrowDenom} is the bank denom that was taken
 * from the sender when the transfer was queued; refunds go back in it even
 * if the contract's mapping changes later.
 */
public record OutgoingTransferTx(
        long id,
        String sender,
        String destAddress,
        Erc20Token erc20Token,
        Erc20Token erc20Fee,
        String escrowDenom
) {}
