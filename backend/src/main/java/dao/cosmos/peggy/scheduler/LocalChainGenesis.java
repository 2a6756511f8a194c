package dao.cosmos.peggy.scheduler;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.service.StateManager;
import dao.cosmos.peggy.service.StoreBankKeeper;
import dao.cosmos.peggy.util.AddressUtil;
import dao.cosmos.peggy.util.ParseUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Seeds account balances for a locally produced chain, so that send-to-eth
 * has something to escrow. All configured balances are credited in one
 * transaction; a malformed entry fails startup and credits nothing.
 */
@Slf4j
@Component
public class LocalChainGenesis {

    private final StateManager stateManager;
    private final StoreBankKeeper bank;
    private final PeggyProperties props;

    public LocalChainGenesis(StateManager stateManager, StoreBankKeeper bank, PeggyProperties props) {
        this.stateManager = stateManager;
        this.bank = bank;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        PeggyProperties.LocalChainConfig localChain = props.getLocalChain();
        if (!localChain.isEnabled()) {
            return;
        }
        int credited = applyGenesisBalances(localChain.getGenesisBalances());
        log.info("Local chain genesis applied: {} balance(s) credited", credited);
    }

    int applyGenesisBalances(List<PeggyProperties.GenesisBalance> balances) {
        return stateManager.deliverTx(ctx -> {
            for (PeggyProperties.GenesisBalance b : balances) {
                String address = AddressUtil.requireCosmosAddress(b.getAddress(), "genesisBalances.address");
                if (b.getDenom() == null || b.getDenom().isBlank()) {
                    throw new IllegalStateException("Genesis balance for " + address + " has no denom");
                }
                BigInteger amount = ParseUtil.parseAmount(b.getAmount(), "genesisBalances.amount");
                bank.mint(ctx, address, b.getDenom(), amount);
                log.debug("Genesis balance: address={}, denom={}, amount={}", address, b.getDenom(), amount);
            }
            return balances.size();
        });
    }
}
