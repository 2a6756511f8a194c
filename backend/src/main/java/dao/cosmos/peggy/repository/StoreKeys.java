package dao.cosmos.peggy.repository;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Key layout of the bridge collections.
 *
 * Every key starts with a one byte collection prefix. Nonces and ids are
 * written as 8 byte big-endian, variable length parts (addresses, denoms,
 * invalidation ids) carry a one byte length prefix so that no key of one
 * subject is a prefix of another subject's keys.
 */
public final class StoreKeys {
    private StoreKeys() {}

    public static final byte VALSET_REQUEST = 0x01;
    public static final byte VALSET_CONFIRM = 0x02;
    public static final byte OUTGOING_TX_POOL = 0x03;
    public static final byte OUTGOING_TX_FEE_INDEX = 0x04;
    public static final byte OUTGOING_TX_BATCH = 0x05;
    public static final byte BATCH_CONFIRM = 0x06;
    public static final byte OUTGOING_LOGIC_CALL = 0x07;
    public static final byte LOGIC_CALL_CONFIRM = 0x08;
    public static final byte LAST_INVALIDATION_NONCE = 0x09;
    public static final byte ETH_ADDRESS_BY_VALIDATOR = 0x0a;
    public static final byte VALIDATOR_BY_ETH_ADDRESS = 0x0b;
    public static final byte DENOM_TO_ERC20 = 0x0c;
    public static final byte ERC20_TO_DENOM = 0x0d;
    public static final byte SEQUENCE = 0x0e;
    public static final byte LOGIC_CALL_BY_SUBMISSION = 0x0f;
    public static final byte LOGIC_CALL_SUBMISSION_SEQ = 0x10;
    public static final byte BANK_BALANCE = 0x20;

    public static final String SEQ_VALSET_NONCE = "valset_nonce";
    public static final String SEQ_OUTGOING_TX_ID = "outgoing_tx_id";
    public static final String SEQ_BATCH_NONCE = "batch_nonce";
    public static final String SEQ_LOGIC_CALL_SUBMISSION = "logic_call_submission";

    private static final int UINT256_BYTES = 32;

    public static byte[] prefix(byte collection) {
        return new byte[]{collection};
    }

    public static byte[] valsetRequestKey(long nonce) {
        return concat(prefix(VALSET_REQUEST), uint64(nonce));
    }

    public static byte[] valsetConfirmPrefix(long nonce) {
        return concat(prefix(VALSET_CONFIRM), uint64(nonce));
    }

    public static byte[] outgoingTxKey(long id) {
        return concat(prefix(OUTGOING_TX_POOL), uint64(id));
    }

    public static byte[] feeIndexPrefix(String tokenContract) {
        return concat(prefix(OUTGOING_TX_FEE_INDEX), lengthPrefixed(tokenContract));
    }

    /**
     * Reverse iteration over {@link #feeIndexPrefix} yields highest fee first
     * and, within equal fees, lowest id first because the id is stored inverted.
     */
    public static byte[] feeIndexKey(String tokenContract, BigInteger fee, long id) {
        return concat(feeIndexPrefix(tokenContract), uint256(fee), uint64(~id));
    }

    /** Recovers the transfer id from the tail of a fee index key. */
    public static long idFromFeeIndexKey(byte[] key) {
        return ~ByteBuffer.wrap(key, key.length - Long.BYTES, Long.BYTES).getLong();
    }

    public static byte[] batchKey(long nonce, String tokenContract) {
        return concat(prefix(OUTGOING_TX_BATCH), uint64(nonce), lengthPrefixed(tokenContract));
    }

    public static byte[] batchConfirmPrefix(long nonce, String tokenContract) {
        return concat(prefix(BATCH_CONFIRM), uint64(nonce), lengthPrefixed(tokenContract));
    }

    public static byte[] logicCallIdPrefix(byte[] invalidationId) {
        return concat(prefix(OUTGOING_LOGIC_CALL), lengthPrefixed(invalidationId));
    }

    public static byte[] logicCallKey(byte[] invalidationId, long invalidationNonce) {
        return concat(logicCallIdPrefix(invalidationId), uint64(invalidationNonce));
    }

    public static byte[] logicCallConfirmPrefix(byte[] invalidationId, long invalidationNonce) {
        return concat(prefix(LOGIC_CALL_CONFIRM), lengthPrefixed(invalidationId), uint64(invalidationNonce));
    }

    /** Submission order index; the value is the call's {@link #logicCallKey}. */
    public static byte[] logicCallBySubmissionKey(long seq) {
        return concat(prefix(LOGIC_CALL_BY_SUBMISSION), uint64(seq));
    }

    public static byte[] logicCallSubmissionSeqKey(byte[] invalidationId, long invalidationNonce) {
        return concat(prefix(LOGIC_CALL_SUBMISSION_SEQ), lengthPrefixed(invalidationId), uint64(invalidationNonce));
    }

    public static byte[] lastInvalidationNonceKey(byte[] invalidationId) {
        return concat(prefix(LAST_INVALIDATION_NONCE), lengthPrefixed(invalidationId));
    }

    public static byte[] ethAddressByValidatorKey(String validator) {
        return concat(prefix(ETH_ADDRESS_BY_VALIDATOR), utf8(validator));
    }

    public static byte[] validatorByEthAddressKey(String ethAddress) {
        return concat(prefix(VALIDATOR_BY_ETH_ADDRESS), utf8(ethAddress));
    }

    public static byte[] denomToErc20Key(String denom) {
        return concat(prefix(DENOM_TO_ERC20), utf8(denom));
    }

    public static byte[] erc20ToDenomKey(String contract) {
        return concat(prefix(ERC20_TO_DENOM), utf8(contract));
    }

    public static byte[] sequenceKey(String name) {
        return concat(prefix(SEQUENCE), utf8(name));
    }

    public static byte[] bankBalanceKey(String address, String denom) {
        return concat(prefix(BANK_BALANCE), lengthPrefixed(address), utf8(denom));
    }

    // ---------------------------------------------------------------------
    // encoding helpers
    // ---------------------------------------------------------------------

    public static byte[] uint64(long v) {
        return ByteBuffer.allocate(Long.BYTES).putLong(v).array();
    }

    public static long readUint64(byte[] bytes) {
        if (bytes.length != Long.BYTES) {
            throw new IllegalStateException("expected 8 byte value, got " + bytes.length);
        }
        return ByteBuffer.wrap(bytes).getLong();
    }

    /** Fixed 32 byte big-endian encoding of a non-negative uint256. */
    public static byte[] uint256(BigInteger v) {
        if (v.signum() < 0 || v.bitLength() > UINT256_BYTES * 8) {
            throw new IllegalArgumentException("value out of uint256 range: " + v);
        }
        byte[] raw = v.toByteArray();
        byte[] out = new byte[UINT256_BYTES];
        int copy = Math.min(raw.length, UINT256_BYTES);
        System.arraycopy(raw, raw.length - copy, out, UINT256_BYTES - copy, copy);
        return out;
    }

    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] lengthPrefixed(String s) {
        return lengthPrefixed(utf8(s));
    }

    public static byte[] lengthPrefixed(byte[] part) {
        if (part.length > 255) {
            throw new IllegalArgumentException("key component longer than 255 bytes");
        }
        return concat(new byte[]{(byte) part.length}, part);
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static boolean hasPrefix(byte[] key, byte[] prefix) {
        return key.length >= prefix.length
                && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
