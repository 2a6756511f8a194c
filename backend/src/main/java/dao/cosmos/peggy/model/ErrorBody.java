package dao.cosmos.peggy.model;

import java.time.Instant;

/**
 * Error response body: error code, message and timestamp (ISO 8601).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
