package dao.cosmos.peggy.service;

import dao.cosmos.peggy.exception.InsufficientFundsException;
import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Minimal balance table kept in the bridge store so that escrow moves commit
 * or roll back together with the message that caused them. Stands in for
 * the host chain's bank module.
 */
@Slf4j
@Component
public class StoreBankKeeper implements BankKeeper {

    public static final String MODULE_ACCOUNT = "peggy";

    @Override
    public BigInteger getBalance(StoreContext ctx, String address, String denom) {
        byte[] raw = ctx.store().get(StoreKeys.bankBalanceKey(address, denom));
        return raw == null ? BigInteger.ZERO : new BigInteger(1, raw);
    }

    /** Credits {@code amount} to {@code address}; local chain genesis funds accounts with it. */
    public void mint(StoreContext ctx, String address, String denom, BigInteger amount) {
        setBalance(ctx.store(), address, denom, getBalance(ctx, address, denom).add(amount));
    }

    @Override
    public void sendCoinsToModule(StoreContext ctx, String sender, String denom, BigInteger amount) {
        transfer(ctx, sender, MODULE_ACCOUNT, denom, amount);
    }

    @Override
    public void sendCoinsFromModule(StoreContext ctx, String recipient, String denom, BigInteger amount) {
        transfer(ctx, MODULE_ACCOUNT, recipient, denom, amount);
    }

    private void transfer(StoreContext ctx, String from, String to, String denom, BigInteger amount) {
        BigInteger available = getBalance(ctx, from, denom);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(from, denom, amount, available);
        }
        setBalance(ctx.store(), from, denom, available.subtract(amount));
        setBalance(ctx.store(), to, denom, getBalance(ctx, to, denom).add(amount));
    }

    private void setBalance(KeyValueStore store, String address, String denom, BigInteger balance) {
        byte[] key = StoreKeys.bankBalanceKey(address, denom);
        if (balance.signum() == 0) {
            store.delete(key);
        } else {
            store.set(key, balance.toByteArray());
        }
    }
}
