package dao.cosmos.peggy.service;

import dao.cosmos.peggy.model.BridgeValidator;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.model.ValidatorPower;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreEntry;
import dao.cosmos.peggy.repository.StoreKeys;
import dao.cosmos.peggy.repository.StoreSequences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds and stores bridge validator set snapshots.
 */
@Slf4j
@Service
public class ValsetService {

    private static final BigInteger MAX_POWER = BigInteger.valueOf(Valset.MAX_POWER);

    private static final Comparator<BridgeValidator> MEMBER_ORDER =
            Comparator.comparingLong(BridgeValidator::power).reversed()
                    .thenComparing(BridgeValidator::ethereumAddress);

    private final StakingKeeper stakingKeeper;
    private final ValidatorRegistryService registry;
    private final StoreCodec codec;

    public ValsetService(StakingKeeper stakingKeeper,
                         ValidatorRegistryService registry,
                         StoreCodec codec) {
        this.stakingKeeper = stakingKeeper;
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Computes the validator set implied by current staking state without
     * storing it. The returned set has nonce 0.
     *
     * Every bonded validator counts toward total power, but only those with
     * a registered Ethereum address become members. Each member power is
     * {@code floor(stake * (2^32 - 1) / totalStake)}.
     */
    public Valset getCurrentValset(StoreContext ctx) {
        List<ValidatorPower> bonded = stakingKeeper.getBondedValidators(ctx);

        BigInteger total = BigInteger.ZERO;
        for (ValidatorPower vp : bonded) {
            total = total.add(BigInteger.valueOf(vp.power()));
        }

        List<BridgeValidator> members = new ArrayList<>();
        if (total.signum() > 0) {
            for (ValidatorPower vp : bonded) {
                Optional<String> ethAddress = registry.getEthAddress(ctx, vp.validator());
                if (ethAddress.isEmpty()) {
                    log.debug("Validator {} has no Ethereum address, excluded from valset", vp.validator());
                    continue;
                }
                long power = BigInteger.valueOf(vp.power()).multiply(MAX_POWER).divide(total).longValueExact();
                members.add(new BridgeValidator(power, ethAddress.get()));
            }
        }
        members.sort(MEMBER_ORDER);
        return new Valset(0L, ctx.blockHeight(), members);
    }

    /**
     * Snapshots the current validator set under the next valset nonce and
     * the current block height.
     */
    public Valset setValsetRequest(StoreContext ctx) {
        Valset current = getCurrentValset(ctx);
        long nonce = StoreSequences.next(ctx.store(), StoreKeys.SEQ_VALSET_NONCE);
        byte[] key = StoreKeys.valsetRequestKey(nonce);
        if (ctx.store().has(key)) {
            throw new IllegalStateException("Valset nonce " + nonce + " already used");
        }

        Valset valset = current.withNonce(nonce, ctx.blockHeight());
        ctx.store().set(key, codec.encode(valset));
        log.info("Valset snapshot stored: nonce={}, height={}, members={}",
                nonce, valset.height(), valset.members().size());
        return valset;
    }

    public Optional<Valset> getValset(StoreContext ctx, long nonce) {
        byte[] raw = ctx.store().get(StoreKeys.valsetRequestKey(nonce));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, Valset.class));
    }

    public Optional<Valset> getLatestValset(StoreContext ctx) {
        List<Valset> latest = getValsetsDescending(ctx, 1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    /** Stored valsets, highest nonce first, at most {@code limit} of them. */
    public List<Valset> getValsetsDescending(StoreContext ctx, int limit) {
        List<Valset> res = new ArrayList<>();
        for (StoreEntry e : ctx.store().reverseIterate(StoreKeys.prefix(StoreKeys.VALSET_REQUEST))) {
            if (res.size() >= limit) break;
            res.add(codec.decode(e.value(), Valset.class));
        }
        return res;
    }
}
