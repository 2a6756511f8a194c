package dao.cosmos.peggy.service;

import dao.cosmos.peggy.exception.InsufficientFundsException;
import dao.cosmos.peggy.repository.StoreContext;

import java.math.BigInteger;

/**
 * Escrow side of the bank module as seen by the bridge.
 */
public interface BankKeeper {

    BigInteger getBalance(StoreContext ctx, String address, String denom);

    /**
     * Moves {@code amount} from {@code sender} into bridge escrow.
     *
     * @throws InsufficientFundsException if the sender cannot cover it
     */
    void sendCoinsToModule(StoreContext ctx, String sender, String denom, BigInteger amount);

    /** Returns escrowed funds to {@code recipient}. */
    void sendCoinsFromModule(StoreContext ctx, String recipient, String denom, BigInteger amount);
}
