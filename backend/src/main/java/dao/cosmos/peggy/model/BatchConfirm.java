package dao.cosmos.peggy.model;

public record BatchConfirm(
        long nonce,
        String tokenContract,
        String ethSigner,
        String orchestrator,
        String signature
) implements Confirmation<BatchKey> {

    @Override
    public BatchKey subject() {
        return new BatchKey(nonce, tokenContract);
    }
}
