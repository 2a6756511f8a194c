package dao.cosmos.peggy.model;

/**
 * Valset member: Ethereum signing address and its power normalized onto
 * [0, 2^32 - 1].
 */
public record BridgeValidator(long power, String ethereumAddress) {}
