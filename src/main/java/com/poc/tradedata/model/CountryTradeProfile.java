package com.poc.tradedata.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Export and import partners of one country, in the order they were read.
 */
@Data
public class CountryTradeProfile {
    private final String countryCode;
    private final List<PartnerShare> exports = new ArrayList<>();
    private final List<PartnerShare> imports = new ArrayList<>();

    public List<PartnerShare> partners(TradeDirection direction) {
        return direction == TradeDirection.EXPORT ? exports : imports;
    }

    public void add(TradeDirection direction, PartnerShare share) {
        partners(direction).add(share);
    }

    public double total(TradeDirection direction) {
        return partners(direction).stream().mapToDouble(PartnerShare::getRate).sum();
    }
}
