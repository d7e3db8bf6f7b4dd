package com.lendledger.api.dto;

import lombok.Data;

/** Either field may be null to leave that setting unchanged. */
@Data
public class FeeSettingsRequest {
    private Integer platformFeeRateBps;
    private String platformFeeReceiver;
}
