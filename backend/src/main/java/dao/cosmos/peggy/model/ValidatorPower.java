package dao.cosmos.peggy.model;

/** Bonded validator as reported by the staking module. */
public record ValidatorPower(String validator, long power) {}
