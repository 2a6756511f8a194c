package dao.cosmos.peggy.model;

public record ValsetConfirm(
        long nonce,
        String orchestrator,
        String ethAddress,
        String signature
) implements Confirmation<Long> {

    @Override
    public Long subject() {
        return nonce;
    }

    @Override
    public String ethSigner() {
        return ethAddress;
    }
}
