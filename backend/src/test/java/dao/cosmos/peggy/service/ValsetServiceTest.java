package dao.cosmos.peggy.service;

import dao.cosmos.peggy.model.BridgeValidator;
import dao.cosmos.peggy.model.ValidatorPower;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.repository.InMemoryKeyValueStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static dao.cosmos.peggy.BridgeFixture.ETH_ADDRESSES;
import static dao.cosmos.peggy.BridgeFixture.VALIDATORS;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValsetServiceTest {

    @Mock
    StakingKeeper stakingKeeper;

    private final ValidatorRegistryService registry = new ValidatorRegistryService();
    private ValsetService valsetService;
    private StoreContext ctx;

    @BeforeEach
    void setUp() {
        valsetService = new ValsetService(stakingKeeper, registry, new StoreCodec());
        ctx = new StoreContext(new InMemoryKeyValueStore(), 10L);
    }

    @Test
    @DisplayName("Test six equal validators each get floor((2^32 - 1) / 6)")
    void equalPowers() {
        bond(6, 100L);

        Valset current = valsetService.getCurrentValset(ctx);

        assertEquals(0L, current.nonce());
        assertEquals(6, current.members().size());
        for (BridgeValidator m : current.members()) {
            assertEquals(715827882L, m.power());
        }
        // equal powers fall back to address order
        assertEquals(ETH_ADDRESSES[0], current.members().get(0).ethereumAddress());
        assertEquals(ETH_ADDRESSES[5], current.members().get(5).ethereumAddress());
    }

    @Test
    @DisplayName("Test a single validator gets the full 2^32 - 1")
    void singleValidator() {
        bond(1, 5L);

        Valset current = valsetService.getCurrentValset(ctx);

        assertEquals(1, current.members().size());
        assertEquals(Valset.MAX_POWER, current.members().get(0).power());
    }

    @Test
    @DisplayName("Test validators without an Ethereum address still count toward total power")
    void unregisteredValidatorCountsInTotal() {
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[0]);
        when(stakingKeeper.getBondedValidators(any())).thenReturn(List.of(
                new ValidatorPower(VALIDATORS[0], 50L),
                new ValidatorPower(VALIDATORS[1], 50L)));

        Valset current = valsetService.getCurrentValset(ctx);

        assertEquals(1, current.members().size());
        assertEquals(Valset.MAX_POWER / 2, current.members().get(0).power());
    }

    @Test
    @DisplayName("Test members are ordered by power descending")
    void ordering() {
        registry.setEthAddress(ctx, VALIDATORS[0], ETH_ADDRESSES[0]);
        registry.setEthAddress(ctx, VALIDATORS[1], ETH_ADDRESSES[1]);
        when(stakingKeeper.getBondedValidators(any())).thenReturn(List.of(
                new ValidatorPower(VALIDATORS[0], 10L),
                new ValidatorPower(VALIDATORS[1], 30L)));

        Valset current = valsetService.getCurrentValset(ctx);

        assertEquals(ETH_ADDRESSES[1], current.members().get(0).ethereumAddress());
        assertTrue(current.members().get(0).power() > current.members().get(1).power());
    }

    @Test
    @DisplayName("Test no bonded stake gives an empty valset")
    void noStake() {
        when(stakingKeeper.getBondedValidators(any())).thenReturn(List.of());

        assertTrue(valsetService.getCurrentValset(ctx).members().isEmpty());
    }

    @Test
    @DisplayName("Test valset requests get increasing nonces and the current block height")
    void setValsetRequest() {
        bond(3, 1L);

        Valset first = valsetService.setValsetRequest(ctx);
        Valset second = valsetService.setValsetRequest(ctx.withBlockHeight(11L));

        assertEquals(1L, first.nonce());
        assertEquals(10L, first.height());
        assertEquals(2L, second.nonce());
        assertEquals(11L, second.height());
        assertEquals(first, valsetService.getValset(ctx, 1L).orElseThrow());
        assertEquals(second, valsetService.getLatestValset(ctx).orElseThrow());
        assertTrue(valsetService.getValset(ctx, 3L).isEmpty());
    }

    @Test
    @DisplayName("Test stored valsets are listed newest first up to the limit")
    void valsetsDescending() {
        bond(2, 1L);
        for (int i = 0; i < 4; i++) {
            valsetService.setValsetRequest(ctx);
        }

        List<Valset> last = valsetService.getValsetsDescending(ctx, 3);

        assertEquals(List.of(4L, 3L, 2L), last.stream().map(Valset::nonce).toList());
    }

    private void bond(int count, long power) {
        List<ValidatorPower> bonded = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            registry.setEthAddress(ctx, VALIDATORS[i], ETH_ADDRESSES[i]);
            bonded.add(new ValidatorPower(VALIDATORS[i], power));
        }
        when(stakingKeeper.getBondedValidators(any())).thenReturn(bonded);
    }
}
