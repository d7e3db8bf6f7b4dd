package com.lendledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
public class LiquidationRequest {
    @NotBlank
    private String user;
    @NotBlank
    private String debtAsset;
    @NotNull
    private BigInteger debtAmount;
    @NotBlank
    private String collateralAsset;
    @NotNull
    private BigInteger seizeAmount;
}
