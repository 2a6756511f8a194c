package dao.cosmos.peggy.exception;

/** Well-formed request that current state does not allow. Nothing was written. */
public class PreconditionFailedException extends PeggyException {

    public static final String CODE = "PRECONDITION_FAILED";

    public PreconditionFailedException(String message) {
        this(CODE, message);
    }

    protected PreconditionFailedException(String code, String message) {
        super(code, message);
    }
}
