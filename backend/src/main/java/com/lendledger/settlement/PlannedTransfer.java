package com.lendledger.settlement;

import lombok.Value;

import java.math.BigInteger;

@Value
public class PlannedTransfer {
    String token;
    String to;
    BigInteger amount;
    /** who the payment is for, e.g. "lender", "platform-fee" */
    String purpose;
}
