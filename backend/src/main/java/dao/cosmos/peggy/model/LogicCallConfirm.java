package dao.cosmos.peggy.model;

import java.util.Arrays;
import java.util.Objects;

public record LogicCallConfirm(
        byte[] invalidationId,
        long invalidationNonce,
        String ethSigner,
        String orchestrator,
        String signature
) implements Confirmation<LogicCallKey> {

    public LogicCallConfirm {
        invalidationId = invalidationId.clone();
    }

    @Override
    public LogicCallKey subject() {
        return new LogicCallKey(invalidationId, invalidationNonce);
    }

    @Override
    public byte[] invalidationId() {
        return invalidationId.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicCallConfirm other)) return false;
        return invalidationNonce == other.invalidationNonce
                && Arrays.equals(invalidationId, other.invalidationId)
                && Objects.equals(ethSigner, other.ethSigner)
                && Objects.equals(orchestrator, other.orchestrator)
                && Objects.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(invalidationNonce, ethSigner, orchestrator, signature)
                + Arrays.hashCode(invalidationId);
    }

    @Override
    public String toString() {
        return "LogicCallConfirm[invalidationId=" + Arrays.toString(invalidationId)
                + ", invalidationNonce=" + invalidationNonce
                + ", orchestrator=" + orchestrator + "]";
    }
}
