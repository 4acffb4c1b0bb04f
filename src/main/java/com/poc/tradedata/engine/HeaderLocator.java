package com.poc.tradedata.engine;

import com.poc.tradedata.exception.HeaderNotFoundException;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalInt;

/**
 * Finds the header row of a sheet that carries title or notes rows above its data.
 * Only the first {@code scanRows} rows are inspected and matching is exact after trimming.
 */
@Slf4j
@Getter
public class HeaderLocator {

    public static final int DEFAULT_SCAN_ROWS = 20;

    private final int scanRows;

    public HeaderLocator() {
        this(DEFAULT_SCAN_ROWS);
    }

    public HeaderLocator(int scanRows) {
        if (scanRows <= 0) {
            throw new IllegalArgumentException("scanRows must be positive: " + scanRows);
        }
        this.scanRows = scanRows;
    }

    public OptionalInt locate(RawTable table, HeaderSpec spec) {
        int limit = Math.min(scanRows, table.rowCount());
        for (int rowIdx = 0; rowIdx < limit; rowIdx++) {
            if (matches(table.row(rowIdx), spec)) {
                return OptionalInt.of(rowIdx);
            }
        }
        return OptionalInt.empty();
    }

    public int require(RawTable table, HeaderSpec spec) {
        OptionalInt idx = locate(table, spec);
        if (idx.isEmpty()) {
            log.error("Header {} not found in sheet '{}' (first {} rows)", spec, table.getSheetName(), scanRows);
            throw new HeaderNotFoundException(table.getSheetName(), spec);
        }
        return idx.getAsInt();
    }

    boolean matches(List<RawCell> row, HeaderSpec spec) {
        if (row.size() < spec.size()) return false;
        for (int i = 0; i < spec.size(); i++) {
            RawCell cell = row.get(i);
            if (cell == null || cell.isBlank()) return false;
            if (!cell.trimmed().equals(spec.get(i))) return false;
        }
        return true;
    }
}
