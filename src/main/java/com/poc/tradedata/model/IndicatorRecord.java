package com.poc.tradedata.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One (country, indicator code) row with its classified yearly values.
 */
@Data
@NoArgsConstructor
public class IndicatorRecord {
    private String countryCode;
    private String code;
    private String series;
    private String currency;
    private String units;
    private String source;
    private String definition;
    private String note;
    private String published;

    /**
     * Year to classified value, in column order.
     */
    private Map<Integer, ClassifiedValue> years = new LinkedHashMap<>();

    public IndicatorRecord(String countryCode) {
        this.countryCode = countryCode;
    }

    public void setField(String field, String value) {
        switch (field) {
            case "series": this.series = value; break;
            case "code": this.code = value; break;
            case "currency": this.currency = value; break;
            case "units": this.units = value; break;
            case "source": this.source = value; break;
            case "definition": this.definition = value; break;
            case "note": this.note = value; break;
            case "published": this.published = value; break;
            default: throw new IllegalArgumentException("Unknown indicator field: " + field);
        }
    }

    public ClassifiedValue yearValue(int year) {
        return years.get(year);
    }
}
