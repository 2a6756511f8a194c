package dao.cosmos.peggy.model;

/**
 * Pairing of a native denom with an ERC20 contract. {@code cosmosOriginated}
 * is true when the Cosmos chain is the asset's native issuer.
 */
public record AssetMapping(String denom, String erc20, boolean cosmosOriginated) {}
