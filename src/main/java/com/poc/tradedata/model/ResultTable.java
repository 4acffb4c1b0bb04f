package com.poc.tradedata.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Database-ready output of a pipeline: a target table name, its ordered columns and
 * one map per row keyed by column name.
 */
@Getter
public class ResultTable {
    private final String tableName;
    private final List<String> columns;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    public ResultTable(String tableName, List<String> columns) {
        this.tableName = tableName;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public Map<String, Object> newRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, null);
        }
        rows.add(row);
        return row;
    }

    public void addRow(Map<String, Object> values) {
        Map<String, Object> row = newRow();
        for (String column : columns) {
            row.put(column, values.get(column));
        }
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object value(int rowIdx, String column) {
        return rows.get(rowIdx).get(column);
    }
}
