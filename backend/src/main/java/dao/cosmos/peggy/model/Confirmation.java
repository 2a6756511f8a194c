package dao.cosmos.peggy.model;

/**
 * A validator's signature over a bridge subject (valset, batch or logic
 * call). The signature is opaque to this module.
 *
 * @param <K> subject key type
 */
public interface Confirmation<K> {

    K subject();

    /** Cosmos account that submitted the confirmation. */
    String orchestrator();

    /** Ethereum address that produced the signature. */
    String ethSigner();

    String signature();
}
