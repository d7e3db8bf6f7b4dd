package com.lendledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigInteger;

/** Early or matured repayment; {@code actualRepayAmount} is ignored for a default. */
@Data
public class RepaymentRequest {
    @NotBlank
    private String borrower;
    @NotBlank
    private String asset;
    private BigInteger actualRepayAmount;
}
