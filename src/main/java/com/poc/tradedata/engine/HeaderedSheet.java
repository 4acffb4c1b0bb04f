package com.poc.tradedata.engine;

import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows below a header row, addressed by column name. Cell values are trimmed text,
 * null for blank cells; rows with no value at all are skipped.
 */
public class HeaderedSheet {

    private final RawTable table;
    private final int headerIdx;
    private final Map<String, Integer> columns = new LinkedHashMap<>();

    private HeaderedSheet(RawTable table, int headerIdx) {
        this.table = table;
        this.headerIdx = headerIdx;
        List<RawCell> header = table.row(headerIdx);
        for (int idx = 0; idx < header.size(); idx++) {
            RawCell cell = header.get(idx);
            if (cell == null || cell.isBlank()) continue;
            columns.putIfAbsent(cell.trimmed(), idx);
        }
    }

    public static HeaderedSheet locate(RawTable table, HeaderSpec spec, HeaderLocator headerLocator) {
        return new HeaderedSheet(table, headerLocator.require(table, spec));
    }

    public static HeaderedSheet atRow(RawTable table, int headerIdx) {
        return new HeaderedSheet(table, headerIdx);
    }

    public String getSheetName() {
        return table.getSheetName();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<String> missingColumns(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!columns.containsKey(name)) missing.add(name);
        }
        return missing;
    }

    public List<Map<String, String>> records() {
        List<Map<String, String>> records = new ArrayList<>();
        for (int rowIdx = headerIdx + 1; rowIdx < table.rowCount(); rowIdx++) {
            Map<String, String> record = new LinkedHashMap<>();
            boolean empty = true;
            for (Map.Entry<String, Integer> column : columns.entrySet()) {
                String value = table.trimmed(rowIdx, column.getValue());
                if (value.isEmpty()) {
                    record.put(column.getKey(), null);
                } else {
                    record.put(column.getKey(), value);
                    empty = false;
                }
            }
            if (!empty) records.add(record);
        }
        return records;
    }
}
