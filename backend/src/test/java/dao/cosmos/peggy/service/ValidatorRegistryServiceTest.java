package dao.cosmos.peggy.service;

import dao.cosmos.peggy.repository.InMemoryKeyValueStore;
import dao.cosmos.peggy.repository.StoreContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static dao.cosmos.peggy.BridgeFixture.ETH_ADDRESSES;
import static dao.cosmos.peggy.BridgeFixture.VALIDATORS;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorRegistryServiceTest {

    private final ValidatorRegistryService registry = new ValidatorRegistryService();
    private final StoreContext ctx = new StoreContext(new InMemoryKeyValueStore(), 1L);

    @Test
    @DisplayName("Test registration is readable in both directions")
    void register() {
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[0]);

        assertEquals(ETH_ADDRESSES[0], registry.getEthAddress(ctx, VALIDATORS[0]).orElseThrow());
        assertEquals(VALIDATORS[0], registry.getValidatorByEthAddress(ctx, ETH_ADDRESSES[0]).orElseThrow());
        assertTrue(registry.getEthAddress(ctx, VALIDATORS[1]).isEmpty());
    }

    @Test
    @DisplayName("Test re-registering replaces the address and its reverse entry")
    void reRegister() {
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[0]);
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[1]);

        assertEquals(ETH_ADDRESSES[1], registry.getEthAddress(ctx, VALIDATORS[0]).orElseThrow());
        assertTrue(registry.getValidatorByEthAddress(ctx, ETH_ADDRESSES[0]).isEmpty());
    }

    @Test
    @DisplayName("Test a shared Ethereum address points at the latest claimant")
    void collision() {
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[0]);
        registry.setEthAddress(ctx, VALIDATORS[1], ETH_ADDRESSES[0]);

        assertEquals(ETH_ADDRESSES[0], registry.getEthAddress(ctx, VALIDATORS[0]).orElseThrow());
        assertEquals(VALIDATORS[1], registry.getValidatorByEthAddress(ctx, ETH_ADDRESSES[0]).orElseThrow());

        // moving validator 0 away must not drop validator 1's claim
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[2]);
        assertEquals(VALIDATORS[1], registry.getValidatorByEthAddress(ctx, ETH_ADDRESSES[0]).orElseThrow());
    }
}
