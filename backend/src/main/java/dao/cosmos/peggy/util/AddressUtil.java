package dao.cosmos.peggy.util;

import dao.cosmos.peggy.exception.InvalidRequestException;
import org.web3j.crypto.WalletUtils;

import java.util.regex.Pattern;

/**
 * Format checks for the two address families the bridge handles.
 *
 * Cosmos addresses are checked for bech32 shape only (human readable part,
 * separator, data charset and length); checksum verification belongs to the
 * host chain's address codec.
 */
public final class AddressUtil {
    private AddressUtil() {}

    /** hrp, '1', then 20 or 32 byte payload plus 6 char checksum. */
    private static final Pattern BECH32_ADDRESS =
            Pattern.compile("^[a-z][a-z0-9]{0,82}1[qpzry9x8gf2tvdw0s3jn54khce6mua7l]{38,58}$");

    public static boolean isValidEthAddress(String address) {
        return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
    }

    public static boolean isValidCosmosAddress(String address) {
        return address != null && BECH32_ADDRESS.matcher(address).matches();
    }

    public static String requireEthAddress(String address, String field) {
        if (!isValidEthAddress(address)) {
            throw new InvalidRequestException("Invalid Ethereum address for " + field + ": " + address);
        }
        return address;
    }

    public static String requireCosmosAddress(String address, String field) {
        if (!isValidCosmosAddress(address)) {
            throw new InvalidRequestException("Invalid Cosmos address for " + field + ": " + address);
        }
        return address;
    }
}
