package com.poc.tradedata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One (country, partner, share) triple read from a trade-partner sheet row.
 * The partner is null when the definition text did not match.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeRelation {
    private String countryName;
    private String countryCode;
    private String partnerName;
    private double rate;
    private TradeDirection direction;
}
