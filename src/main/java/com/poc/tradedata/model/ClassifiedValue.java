package com.poc.tradedata.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassifiedValue {

    private static final ClassifiedValue MISSING = new ClassifiedValue(DataKind.MISSING, null);
    private static final ClassifiedValue FORECAST = new ClassifiedValue(DataKind.FORECAST, null);
    private static final ClassifiedValue UNKNOWN = new ClassifiedValue(DataKind.UNKNOWN, null);

    DataKind kind;
    BigDecimal value;

    public static ClassifiedValue missing() {
        return MISSING;
    }

    public static ClassifiedValue forecast() {
        return FORECAST;
    }

    public static ClassifiedValue unknown() {
        return UNKNOWN;
    }

    /**
     * Builds an ACTUAL or ESTIMATE value, rounded to one decimal place.
     */
    public static ClassifiedValue measured(DataKind kind, BigDecimal raw) {
        if (!kind.carriesValue()) {
            throw new IllegalArgumentException(kind + " cannot carry a value");
        }
        if (raw == null) {
            throw new IllegalArgumentException(kind + " requires a value");
        }
        return new ClassifiedValue(kind, raw.setScale(1, RoundingMode.HALF_EVEN));
    }

    /**
     * Database representation: "ACT|12.3", "EST|-0.4", or the bare kind token.
     */
    public String serialize() {
        if (kind.carriesValue()) {
            return kind.getToken() + "|" + value.toPlainString();
        }
        return kind.getToken();
    }

    @Override
    public String toString() {
        return serialize();
    }
}
