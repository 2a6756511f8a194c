package dao.cosmos.peggy.service;

import dao.cosmos.peggy.repository.KeyValueStore;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.StoreKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Validator operator address to Ethereum signing address.
 *
 * Registration is last-write-wins. Two validators claiming the same
 * Ethereum address are tolerated and only logged; the reverse index then
 * points at the most recent claimant.
 */
@Slf4j
@Service
public class ValidatorRegistryService {

    public void setEthAddress(StoreContext ctx, String validator, String ethAddress) {
        KeyValueStore store = ctx.store();

        Optional<String> previous = getEthAddress(ctx, validator);
        if (previous.isPresent() && !previous.get().equals(ethAddress)) {
            // drop our stale reverse entry, but never someone else's claim
            if (getValidatorByEthAddress(ctx, previous.get()).filter(validator::equals).isPresent()) {
                store.delete(StoreKeys.validatorByEthAddressKey(previous.get()));
            }
        }

        getValidatorByEthAddress(ctx, ethAddress)
                .filter(claimant -> !claimant.equals(validator))
                .ifPresent(claimant -> log.warn("Ethereum address {} already registered by {}, now also claimed by {}",
                        ethAddress, claimant, validator));

        store.set(StoreKeys.ethAddressByValidatorKey(validator), StoreKeys.utf8(ethAddress));
        store.set(StoreKeys.validatorByEthAddressKey(ethAddress), StoreKeys.utf8(validator));
        log.info("Registered Ethereum address: validator={}, ethAddress={}", validator, ethAddress);
    }

    public Optional<String> getEthAddress(StoreContext ctx, String validator) {
        return Optional.ofNullable(readString(ctx.store().get(StoreKeys.ethAddressByValidatorKey(validator))));
    }

    public Optional<String> getValidatorByEthAddress(StoreContext ctx, String ethAddress) {
        return Optional.ofNullable(readString(ctx.store().get(StoreKeys.validatorByEthAddressKey(ethAddress))));
    }

    private static String readString(byte[] raw) {
        return raw == null ? null : new String(raw, StandardCharsets.UTF_8);
    }
}
