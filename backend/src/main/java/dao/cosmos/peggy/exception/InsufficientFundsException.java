package dao.cosmos.peggy.exception;

import java.math.BigInteger;

public class InsufficientFundsException extends PreconditionFailedException {

    public static final String CODE = "INSUFFICIENT_FUNDS";

    public InsufficientFundsException(String address, String denom, BigInteger required, BigInteger available) {
        super(CODE, "Insufficient funds for " + address + ": required " + required + denom
                + ", available " + available + denom);
    }
}
