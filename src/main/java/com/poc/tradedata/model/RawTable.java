package com.poc.tradedata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One sheet (or CSV file) as read from disk: ordered rows of cells, no header assumed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawTable {
    private String sheetName;
    private List<List<RawCell>> rows = new ArrayList<>();

    public static RawTable of(String sheetName, List<List<RawCell>> rows) {
        return new RawTable(sheetName, rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public List<RawCell> row(int rowIdx) {
        if (rowIdx < 0 || rowIdx >= rows.size()) return Collections.emptyList();
        List<RawCell> row = rows.get(rowIdx);
        return row == null ? Collections.emptyList() : row;
    }

    public RawCell cell(int rowIdx, int colIdx) {
        List<RawCell> row = row(rowIdx);
        if (colIdx < 0 || colIdx >= row.size()) return null;
        return row.get(colIdx);
    }

    public String text(int rowIdx, int colIdx) {
        RawCell cell = cell(rowIdx, colIdx);
        return cell == null ? null : cell.getText();
    }

    /**
     * Trimmed cell text, empty string for blank or absent cells.
     */
    public String trimmed(int rowIdx, int colIdx) {
        RawCell cell = cell(rowIdx, colIdx);
        return cell == null ? "" : cell.trimmed();
    }
}
