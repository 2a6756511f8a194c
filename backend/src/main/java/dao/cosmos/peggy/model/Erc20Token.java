package dao.cosmos.peggy.model;

import java.math.BigInteger;

public record Erc20Token(String contract, BigInteger amount) {}
