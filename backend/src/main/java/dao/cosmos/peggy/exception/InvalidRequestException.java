package dao.cosmos.peggy.exception;

/** Malformed input: unparsable nonce, bad address, bad hex or amount. */
public class InvalidRequestException extends PeggyException {

    public static final String CODE = "INVALID_REQUEST";

    public InvalidRequestException(String message) {
        super(CODE, message);
    }
}
