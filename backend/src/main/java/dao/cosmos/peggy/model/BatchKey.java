package dao.cosmos.peggy.model;

public record BatchKey(long nonce, String tokenContract) {}
