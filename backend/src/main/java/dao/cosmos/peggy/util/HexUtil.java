package dao.cosmos.peggy.util;

import org.web3j.utils.Numeric;

public final class HexUtil {
    private HexUtil() {}

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }
}
