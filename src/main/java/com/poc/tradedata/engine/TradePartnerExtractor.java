package com.poc.tradedata.engine;

import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import com.poc.tradedata.model.TradeDirection;
import com.poc.tradedata.model.TradePartnerSettings;
import com.poc.tradedata.model.TradeRelation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads (country, partner, share) triples from the XPM* / MPM* sheets of an EIU workbook.
 * The partner is only named inside the free-text definition, e.g.
 * "Exports to India, as a percentage of total exports".
 */
@Slf4j
public class TradePartnerExtractor {

    public static final HeaderSpec HEADER = HeaderSpec.of("Geography", "Code");

    private static final String COL_COUNTRY = "Geography";
    private static final String COL_CODE = "Code";
    private static final String COL_DEFINITION = "Definition";

    private static final Map<TradeDirection, Pattern> PARTNER_PATTERNS = new EnumMap<>(TradeDirection.class);

    static {
        for (TradeDirection direction : TradeDirection.values()) {
            PARTNER_PATTERNS.put(direction, Pattern.compile(
                    direction.getDefinitionVerb()
                            + " (?:from|to) (?:the\\s+)?([^,]+?)(?:,)?\\s*(?:as a percentage|as percentage)",
                    Pattern.CASE_INSENSITIVE));
        }
    }

    private final HeaderLocator headerLocator;
    private final TradePartnerSettings settings;

    public TradePartnerExtractor(HeaderLocator headerLocator, TradePartnerSettings settings) {
        this.headerLocator = headerLocator;
        this.settings = settings;
    }

    /**
     * Relations of every trade-partner sheet; other sheets are skipped.
     */
    public List<TradeRelation> extract(List<RawTable> sheets) {
        List<TradeRelation> relations = new ArrayList<>();
        for (RawTable sheet : sheets) {
            TradeDirection direction = TradeDirection.ofSheet(sheet.getSheetName());
            if (direction == null) {
                log.debug("Skipping sheet {}", sheet.getSheetName());
                continue;
            }
            relations.addAll(extractSheet(sheet, direction));
        }
        return relations;
    }

    public List<TradeRelation> extractSheet(RawTable sheet, TradeDirection direction) {
        int headerIdx = headerLocator.require(sheet, HEADER);
        Map<String, Integer> columns = columnIndices(sheet.row(headerIdx));
        if (!columns.containsKey(COL_DEFINITION)) {
            throw new DataValidationException(Map.of(
                    "sheet_name", sheet.getSheetName(),
                    "missing_column", COL_DEFINITION));
        }
        Integer rateIdx = firstYearColumn(columns);

        List<TradeRelation> relations = new ArrayList<>();
        for (int rowIdx = headerIdx + 1; rowIdx < sheet.rowCount(); rowIdx++) {
            String countryName = sheet.trimmed(rowIdx, columns.get(COL_COUNTRY));
            String countryCode = sheet.trimmed(rowIdx, columns.get(COL_CODE));
            String definition = sheet.text(rowIdx, columns.get(COL_DEFINITION));
            double rate = rateIdx == null ? 0.0 : parseRate(sheet.cell(rowIdx, rateIdx));

            relations.add(new TradeRelation(countryName, countryCode,
                    extractPartner(direction, definition), rate, direction));
        }
        log.info("Sheet {}: {} relations", sheet.getSheetName(), relations.size());
        return relations;
    }

    /**
     * Partner named in a definition text, or null when the text does not follow the template.
     */
    public String extractPartner(TradeDirection direction, String definition) {
        if (definition == null || definition.isBlank()) return null;
        Matcher matcher = PARTNER_PATTERNS.get(direction).matcher(definition.trim());
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    double parseRate(RawCell cell) {
        if (cell == null || cell.isBlank()) return 0.0;
        String text = cell.trimmed();
        if (text.equals(settings.getMissingMarker())) return 0.0;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static Map<String, Integer> columnIndices(List<RawCell> headerRow) {
        Map<String, Integer> indices = new LinkedHashMap<>();
        for (int idx = 0; idx < headerRow.size(); idx++) {
            RawCell cell = headerRow.get(idx);
            if (cell == null || cell.getText() == null) continue;
            indices.put(cell.trimmed(), idx);
        }
        return indices;
    }

    private static Integer firstYearColumn(Map<String, Integer> columns) {
        for (Map.Entry<String, Integer> entry : columns.entrySet()) {
            if (entry.getKey().matches("\\d{4}")) {
                return entry.getValue();
            }
        }
        return null;
    }
}
