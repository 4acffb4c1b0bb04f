package com.poc.tradedata.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered column names that identify the header row of a sheet.
 */
@Value
public class HeaderSpec {
    List<String> columns;

    public static HeaderSpec of(String... columns) {
        return new HeaderSpec(List.of(columns));
    }

    public int size() {
        return columns.size();
    }

    public String get(int idx) {
        return columns.get(idx);
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
