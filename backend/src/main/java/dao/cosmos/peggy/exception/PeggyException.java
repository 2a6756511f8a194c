package dao.cosmos.peggy.exception;

/**
 * Base of the bridge's typed failures. Each carries a stable error code that
 * is surfaced to the submitter of the failed message or query.
 */
public abstract class PeggyException extends RuntimeException {

    private final String code;

    protected PeggyException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
