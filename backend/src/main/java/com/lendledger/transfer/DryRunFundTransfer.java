package com.lendledger.transfer;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/** Logs the transfer and reports success. Used when no signer is configured. */
@Slf4j
public class DryRunFundTransfer implements FundTransfer {

    @Override
    public boolean transfer(String token, String to, BigInteger amount) {
        log.info("[transfer:dry-run] token={} to={} amount={}", token, to, amount);
        return true;
    }
}
