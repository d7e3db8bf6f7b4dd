package com.lendledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
public class LockGuaranteeRequest {
    @NotBlank
    private String borrower;
    @NotBlank
    private String lender;
    @NotBlank
    private String asset;
    @NotNull
    private BigInteger principal;
    @NotNull
    private BigInteger promisedInterest;
    /** (0, 3650] */
    private int termDays;
}
