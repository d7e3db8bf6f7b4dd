package com.lendledger.util;

import com.lendledger.error.ErrorCode;
import com.lendledger.error.LedgerException;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.util.Locale;

/**
 * Validators/normalizers for EVM addresses used as user and asset identifiers.
 * Addresses are kept lower-case with the 0x prefix everywhere inside the core.
 */
public final class AddressUtil {
    private AddressUtil(){}

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    public static String normalize(String addr) {
        if (addr == null) throw LedgerException.of(ErrorCode.ZERO_ADDRESS, "address is null");
        if (!addr.startsWith("0x")) throw LedgerException.of(ErrorCode.INVALID_ADDRESS, "address must start with 0x: " + addr);
        if (!WalletUtils.isValidAddress(addr)) {
            throw LedgerException.of(ErrorCode.INVALID_ADDRESS, "invalid address (need 40 hex chars): " + addr);
        }
        return Numeric.prependHexPrefix(Numeric.cleanHexPrefix(addr).toLowerCase(Locale.ROOT));
    }

    /** Normalizes and rejects the zero address. */
    public static String requireNonZero(String addr, String name) {
        if (addr == null) throw LedgerException.of(ErrorCode.ZERO_ADDRESS, name + " is null");
        String n = normalize(addr);
        if (ZERO.equals(n)) throw LedgerException.of(ErrorCode.ZERO_ADDRESS, name + " is the zero address");
        return n;
    }

    /** True for null, malformed or zero addresses; never throws. */
    public static boolean isZeroOrInvalid(String addr) {
        if (addr == null || !addr.startsWith("0x") || !WalletUtils.isValidAddress(addr)) return true;
        return ZERO.equals(addr.toLowerCase(Locale.ROOT));
    }
}
