package dao.cosmos.peggy.service;

import dao.cosmos.peggy.model.AssetMapping;
import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Bidirectional denom / ERC20 contract table.
 *
 * Last write wins. When a denom or contract is remapped, the entry that
 * pointed at its old partner is removed, so each side maps to exactly one
 * partner at any time.
 */
@Slf4j
@Service
public class AssetMappingService {

    /** Denom prefix of vouchers for Ethereum-originated tokens without a mapping. */
    public static final String VOUCHER_PREFIX = "peggy";

    private final StoreCodec codec;

    public AssetMappingService(StoreCodec codec) {
        this.codec = codec;
    }

    public AssetMapping setMapping(StoreContext ctx, String denom, String erc20, boolean cosmosOriginated) {
        KeyValueStore store = ctx.store();

        getMappingByDenom(ctx, denom)
                .filter(old -> !old.erc20().equals(erc20))
                .ifPresent(old -> store.delete(StoreKeys.erc20ToDenomKey(old.erc20())));
        getMappingByErc20(ctx, erc20)
                .filter(old -> !old.denom().equals(denom))
                .ifPresent(old -> store.delete(StoreKeys.denomToErc20Key(old.denom())));

        AssetMapping mapping = new AssetMapping(denom, erc20, cosmosOriginated);
        byte[] value = codec.encode(mapping);
        store.set(StoreKeys.denomToErc20Key(denom), value);
        store.set(StoreKeys.erc20ToDenomKey(erc20), value);
        log.info("Asset mapping set: denom={}, erc20={}, cosmosOriginated={}", denom, erc20, cosmosOriginated);
        return mapping;
    }

    public Optional<AssetMapping> getMappingByErc20(StoreContext ctx, String erc20) {
        byte[] raw = ctx.store().get(StoreKeys.erc20ToDenomKey(erc20));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, AssetMapping.class));
    }

    public Optional<AssetMapping> getMappingByDenom(StoreContext ctx, String denom) {
        byte[] raw = ctx.store().get(StoreKeys.denomToErc20Key(denom));
        return raw == null ? Optional.empty() : Optional.of(codec.decode(raw, AssetMapping.class));
    }

    /**
     * Denom that represents {@code erc20} on the Cosmos side: the mapped
     * denom if one is registered, else the derived voucher denom.
     */
    public String voucherDenom(StoreContext ctx, String erc20) {
        return getMappingByErc20(ctx, erc20)
                .map(AssetMapping::denom)
                .orElse(VOUCHER_PREFIX + erc20);
    }
}
