package com.lendledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/** Deposit, withdraw, borrow or repay of one asset for one user. */
@Data
public class PositionChangeRequest {
    @NotBlank
    private String user;
    @NotBlank
    private String asset;
    /** raw token units */
    @NotNull
    private BigInteger amount;
}
