package com.poc.tradedata.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TradePartnerSettings {
    String residualLabel;
    String missingMarker;

    public static TradePartnerSettings defaults() {
        return TradePartnerSettings.builder()
                .residualLabel("기타")
                .missingMarker("–")
                .build();
    }
}
