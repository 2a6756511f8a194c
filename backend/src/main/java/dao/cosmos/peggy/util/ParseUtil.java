package dao.cosmos.peggy.util;

import dao.cosmos.peggy.exception.InvalidRequestException;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Parsing of string-typed request fields into the module's numeric and byte
 * types. Every failure is an {@link InvalidRequestException}.
 */
public final class ParseUtil {
    private ParseUtil() {}

    private static final Pattern HEX = Pattern.compile("^(0x)?([0-9a-fA-F]{2})*$");
    private static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /** Invalidation ids are stored behind a one byte length prefix. */
    public static final int MAX_INVALIDATION_ID_BYTES = 255;

    /** Unsigned 64-bit decimal. Values above Long.MAX_VALUE are rejected. */
    public static long parseNonce(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
        try {
            long v = Long.parseLong(raw.trim());
            if (v < 0) {
                throw new InvalidRequestException(field + " must not be negative: " + raw);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid " + field + ": " + raw);
        }
    }

    public static long requireNonNegative(Long value, String field) {
        if (value == null) {
            throw new InvalidRequestException(field + " is required");
        }
        if (value < 0) {
            throw new InvalidRequestException(field + " must not be negative: " + value);
        }
        return value;
    }

    /** Decimal uint256 token amount. */
    public static BigInteger parseAmount(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
        BigInteger v;
        try {
            v = new BigInteger(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid " + field + ": " + raw);
        }
        if (v.signum() < 0 || v.compareTo(UINT256_MAX) > 0) {
            throw new InvalidRequestException(field + " out of uint256 range: " + raw);
        }
        return v;
    }

    public static boolean isHex(String raw) {
        return raw != null && HEX.matcher(raw).matches();
    }

    /** Hex with or without 0x; empty input gives an empty array. */
    public static byte[] parseHex(String raw, String field) {
        if (!isHex(raw)) {
            throw new InvalidRequestException("Invalid hex for " + field + ": " + raw);
        }
        return Numeric.hexStringToByteArray(raw);
    }

    public static byte[] parseNonEmptyHex(String raw, String field) {
        byte[] bytes = parseHex(raw, field);
        if (bytes.length == 0) {
            throw new InvalidRequestException(field + " must not be empty");
        }
        return bytes;
    }

    /** Non-empty hex of at most {@link #MAX_INVALIDATION_ID_BYTES} bytes. */
    public static byte[] parseInvalidationId(String raw, String field) {
        byte[] bytes = parseNonEmptyHex(raw, field);
        if (bytes.length > MAX_INVALIDATION_ID_BYTES) {
            throw new InvalidRequestException(field + " must be at most " + MAX_INVALIDATION_ID_BYTES
                    + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
