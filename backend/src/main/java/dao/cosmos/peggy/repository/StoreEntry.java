package dao.cosmos.peggy.repository;

public record StoreEntry(byte[] key, byte[] value) {}
