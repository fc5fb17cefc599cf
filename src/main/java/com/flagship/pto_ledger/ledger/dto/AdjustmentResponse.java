package com.flagship.pto_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pto_ledger.ledger.AdjustmentResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdjustmentResponse {

    @JsonProperty("entry")
    LedgerEntryResponse entry;

    @JsonProperty("replayed")
    boolean replayed;

    @JsonProperty("balance")
    BalanceResponse balance;

    public static AdjustmentResponse from(AdjustmentResult result) {
        return AdjustmentResponse.builder()
            .entry(LedgerEntryResponse.from(result.getEntry()))
            .replayed(result.isReplayed())
            .balance(BalanceResponse.from(result.getBalance()))
            .build();
    }
}
