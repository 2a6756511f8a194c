package dao.cosmos.peggy.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One-shot call of an Ethereum contract, keyed by
 * (invalidationId, invalidationNonce). A higher nonce for the same
 * invalidation id supersedes lower ones on the Ethereum side.
 */
public record OutgoingLogicCall(
        List<Erc20Token> transfers,
        List<Erc20Token> fees,
        String logicContractAddress,
        byte[] payload,
        long timeout,
        byte[] invalidationId,
        long invalidationNonce
) {

    public OutgoingLogicCall {
        transfers = transfers == null ? List.of() : List.copyOf(transfers);
        fees = fees == null ? List.of() : List.copyOf(fees);
        payload = payload == null ? new byte[0] : payload.clone();
        invalidationId = invalidationId.clone();
    }

    public LogicCallKey key() {
        return new LogicCallKey(invalidationId, invalidationNonce);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public byte[] invalidationId() {
        return invalidationId.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutgoingLogicCall other)) return false;
        return timeout == other.timeout
                && invalidationNonce == other.invalidationNonce
                && transfers.equals(other.transfers)
                && fees.equals(other.fees)
                && Objects.equals(logicContractAddress, other.logicContractAddress)
                && Arrays.equals(payload, other.payload)
                && Arrays.equals(invalidationId, other.invalidationId);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(transfers, fees, logicContractAddress, timeout, invalidationNonce);
        h = 31 * h + Arrays.hashCode(payload);
        return 31 * h + Arrays.hashCode(invalidationId);
    }

    @Override
    public String toString() {
        return "OutgoingLogicCall[invalidationId=" + Arrays.toString(invalidationId)
                + ", invalidationNonce=" + invalidationNonce
                + ", logicContractAddress=" + logicContractAddress
                + ", timeout=" + timeout + "]";
    }
}
