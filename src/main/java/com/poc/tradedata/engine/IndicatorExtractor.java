package com.poc.tradedata.engine;

import com.poc.tradedata.model.ClassifiedValue;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.IndicatorCatalog;
import com.poc.tradedata.model.IndicatorCode;
import com.poc.tradedata.model.IndicatorRecord;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Extracts the fixed indicator catalog from EIU "all data by series" workbooks.
 * Every sheet is one country and the sheet name is its ISO code.
 */
@Slf4j
public class IndicatorExtractor {

    public static final HeaderSpec HEADER = HeaderSpec.of("Series", "Code");

    private final IndicatorCatalog catalog;
    private final HeaderLocator headerLocator;
    private final CellClassifier cellClassifier;

    public IndicatorExtractor(IndicatorCatalog catalog, HeaderLocator headerLocator, CellClassifier cellClassifier) {
        this.catalog = catalog;
        this.headerLocator = headerLocator;
        this.cellClassifier = cellClassifier;
    }

    /**
     * Extracts every sheet and aligns the year columns of all records, padding the
     * future horizon with forecast placeholders.
     */
    public List<IndicatorRecord> extract(List<RawTable> sheets) {
        List<IndicatorRecord> records = new ArrayList<>();
        for (RawTable sheet : sheets) {
            log.info("Processing sheet: {}", sheet.getSheetName());
            records.addAll(extractSheet(sheet));
        }
        alignYears(records);
        return records;
    }

    /**
     * One record per catalog code, in sheet order followed by the synthesized ones.
     */
    public List<IndicatorRecord> extractSheet(RawTable sheet) {
        String countryCode = sheet.getSheetName();

        // 1. Header
        int headerIdx = headerLocator.require(sheet, HEADER);

        // 2. Column names up to the first blank
        List<String> columnNames = new ArrayList<>();
        for (RawCell cell : sheet.row(headerIdx)) {
            if (cell == null || cell.isBlank()) break;
            columnNames.add(cell.trimmed());
        }
        log.debug("Columns of {}: {}", countryCode, columnNames);

        // 3. Year columns inside the slot window
        List<Integer> years = new ArrayList<>();
        for (String name : columnNames) {
            Integer year = yearOf(name);
            if (year == null) continue;
            if (!catalog.hasSlot(year)) {
                log.warn("Sheet {} has year column {} outside {}-{}, ignored",
                        countryCode, year, catalog.getFirstYear(), catalog.getLastYear());
                continue;
            }
            years.add(year);
        }

        // 4-5. Data rows, catalog codes only, last duplicate wins
        Map<String, IndicatorRecord> byCode = new LinkedHashMap<>();
        for (int rowIdx = headerIdx + 1; rowIdx < sheet.rowCount(); rowIdx++) {
            IndicatorRecord record = readRow(sheet, rowIdx, columnNames, countryCode);
            if (record.getCode() != null && catalog.contains(record.getCode())) {
                byCode.put(record.getCode(), record);
            }
        }

        // 6. Placeholders for absent codes
        for (IndicatorCode code : catalog.getCodes()) {
            if (!byCode.containsKey(code.getCode())) {
                byCode.put(code.getCode(), defaultRecord(countryCode, code, years));
            }
        }
        return new ArrayList<>(byCode.values());
    }

    ClassifiedValue classify(RawCell cell) {
        if (cell == null || cell.isBlank()) return ClassifiedValue.missing();
        String text = cell.trimmed();
        if (text.equals(catalog.getMissingMarker())) return ClassifiedValue.missing();
        BigDecimal value;
        try {
            value = new BigDecimal(text);
        } catch (NumberFormatException e) {
            log.debug("Unparseable indicator value '{}'", text);
            return ClassifiedValue.unknown();
        }
        return ClassifiedValue.measured(cellClassifier.provenanceOf(cell), value);
    }

    /**
     * Gives every record the same year columns: the union of all sheet years, then forecast
     * slots from the overall maximum year up to the last slot.
     */
    void alignYears(List<IndicatorRecord> records) {
        TreeSet<Integer> allYears = new TreeSet<>();
        for (IndicatorRecord record : records) {
            allYears.addAll(record.getYears().keySet());
        }
        if (allYears.isEmpty()) return;
        int maxYear = allYears.last();

        for (IndicatorRecord record : records) {
            Map<Integer, ClassifiedValue> aligned = new LinkedHashMap<>();
            for (Integer year : allYears) {
                ClassifiedValue value = record.getYears().get(year);
                aligned.put(year, value == null ? ClassifiedValue.unknown() : value);
            }
            for (int year = maxYear + 1; year <= catalog.getLastYear(); year++) {
                aligned.put(year, ClassifiedValue.forecast());
            }
            record.setYears(aligned);
        }
    }

    private IndicatorRecord readRow(RawTable sheet, int rowIdx, List<String> columnNames, String countryCode) {
        IndicatorRecord record = new IndicatorRecord(countryCode);
        for (int colIdx = 0; colIdx < columnNames.size(); colIdx++) {
            String name = columnNames.get(colIdx);
            RawCell cell = sheet.cell(rowIdx, colIdx);
            String field = catalog.getColumnMapping().get(name);
            if (field != null) {
                record.setField(field, cell == null || cell.isBlank() ? null : cell.trimmed());
                continue;
            }
            Integer year = yearOf(name);
            if (year != null && catalog.hasSlot(year)) {
                record.getYears().put(year, classify(cell));
            }
        }
        return record;
    }

    private IndicatorRecord defaultRecord(String countryCode, IndicatorCode code, List<Integer> years) {
        IndicatorRecord record = new IndicatorRecord(countryCode);
        record.setCode(code.getCode());
        record.setSeries(code.getTitle());
        record.setCurrency("");
        record.setUnits("");
        record.setSource("");
        record.setDefinition("");
        record.setNote("");
        record.setPublished("");
        for (Integer year : years) {
            record.getYears().put(year, ClassifiedValue.missing());
        }
        return record;
    }

    private static Integer yearOf(String columnName) {
        if (columnName == null || columnName.isEmpty()) return null;
        for (int i = 0; i < columnName.length(); i++) {
            if (!Character.isDigit(columnName.charAt(i))) return null;
        }
        try {
            return Integer.valueOf(columnName);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
