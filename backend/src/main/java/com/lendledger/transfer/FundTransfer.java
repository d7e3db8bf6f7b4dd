package com.lendledger.transfer;

import java.math.BigInteger;

/**
 * Moves tokens out of the platform. The boolean result is the only success signal and must be
 * checked; implementations may also throw.
 */
public interface FundTransfer {

    boolean transfer(String token, String to, BigInteger amount);
}
