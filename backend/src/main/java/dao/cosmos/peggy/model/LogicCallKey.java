package dao.cosmos.peggy.model;

import java.util.Arrays;

public record LogicCallKey(byte[] invalidationId, long invalidationNonce) {

    public LogicCallKey {
        invalidationId = invalidationId.clone();
    }

    @Override
    public byte[] invalidationId() {
        return invalidationId.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicCallKey other)) return false;
        return invalidationNonce == other.invalidationNonce
                && Arrays.equals(invalidationId, other.invalidationId);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(invalidationId) + Long.hashCode(invalidationNonce);
    }

    @Override
    public String toString() {
        return "LogicCallKey[invalidationId=" + Arrays.toString(invalidationId)
                + ", invalidationNonce=" + invalidationNonce + "]";
    }
}
