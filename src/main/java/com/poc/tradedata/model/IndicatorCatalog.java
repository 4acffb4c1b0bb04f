package com.poc.tradedata.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Frozen configuration for economic indicator extraction: the fixed code catalog,
 * header-to-field mapping, the estimate style signature and the year slot window.
 */
@Value
@Builder
public class IndicatorCatalog {

    @Singular
    List<IndicatorCode> codes;

    /**
     * Sheet header name to record field (series, code, currency, ...).
     */
    @Singular("column")
    Map<String, String> columnMapping;

    String estimateStyleTag;
    String missingMarker;

    /**
     * First and last year that have a slot in the result table (eiu_year1 .. eiu_year51).
     */
    int firstYear;
    int lastYear;

    public boolean contains(String code) {
        return code != null && codes.stream().anyMatch(c -> c.getCode().equals(code));
    }

    public boolean hasSlot(int year) {
        return year >= firstYear && year <= lastYear;
    }

    /**
     * Result column index for a year; 2001 maps to 1 when the window starts at 2001.
     */
    public int slotOf(int year) {
        return year - (firstYear - 1);
    }

    public static IndicatorCatalog defaults() {
        return IndicatorCatalog.builder()
                .code(new IndicatorCode("PSBR", "Budget balance (% of GDP)"))
                .code(new IndicatorCode("DCPI", "Consumer prices (% change pa; av)"))
                .code(new IndicatorCode("CARA", "Current-account balance (% of GDP)"))
                .code(new IndicatorCode("BALC", "Current-account balance (US$)"))
                .code(new IndicatorCode("XRPD", "Exchange rate LCU:US$ (av)"))
                .code(new IndicatorCode("XPP1", "Main destinations of exports 1 (% of total)"))
                .code(new IndicatorCode("XPP2", "Main destinations of exports 2 (% of total)"))
                .code(new IndicatorCode("XPP3", "Main destinations of exports 3 (% of total)"))
                .code(new IndicatorCode("XPP4", "Main destinations of exports 4 (% of total)"))
                .code(new IndicatorCode("FRES", "Foreign-exchange reserves excl gold (US$)"))
                .code(new IndicatorCode("MEXP", "Goods: exports fob (US$)"))
                .code(new IndicatorCode("MIMP", "Goods: imports fob (US$)"))
                .code(new IndicatorCode("MPP1", "Main origins of imports 1 (% of total)"))
                .code(new IndicatorCode("MPP2", "Main origins of imports 2 (% of total)"))
                .code(new IndicatorCode("MPP3", "Main origins of imports 3 (% of total)"))
                .code(new IndicatorCode("PUDP", "Public debt (% of GDP)"))
                .code(new IndicatorCode("DGDP", "Real GDP (% change pa)"))
                .code(new IndicatorCode("TDPY", "Total foreign debt (% of GDP)"))
                .code(new IndicatorCode("BALM", "Trade balance (US$)"))
                .column("Series", "series")
                .column("Code", "code")
                .column("Currency", "currency")
                .column("Units", "units")
                .column("Source", "source")
                .column("Definition", "definition")
                .column("Note", "note")
                .column("Published", "published")
                .estimateStyleTag("0000588D")
                .missingMarker("–")
                .firstYear(2001)
                .lastYear(2051)
                .build();
    }
}
