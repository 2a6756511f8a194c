package dao.cosmos.peggy.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the bridge validator set.
 *
 * Member powers are each an independent floor-scaled fraction of total
 * bonded stake, so they need not add up to exactly 2^32 - 1.
 */
public record Valset(long nonce, long height, List<BridgeValidator> members) {

    public static final long MAX_POWER = 0xFFFFFFFFL;

    public Valset {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Valset withNonce(long newNonce, long newHeight) {
        return new Valset(newNonce, newHeight, members);
    }

    /**
     * Sum of absolute per-address power changes between this set and
     * {@code other}, in basis points of {@link #MAX_POWER}. Addresses present
     * on one side only count with their full power.
     */
    public long powerDiffBps(Valset other) {
        Map<String, Long> before = new HashMap<>();
        for (BridgeValidator m : other.members()) {
            before.put(m.ethereumAddress(), m.power());
        }
        long delta = 0;
        for (BridgeValidator m : members) {
            Long old = before.remove(m.ethereumAddress());
            delta += Math.abs(m.power() - (old == null ? 0L : old));
        }
        for (long leftover : before.values()) {
            delta += leftover;
        }
        return delta * 10_000L / MAX_POWER;
    }
}
