package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.engine.CategoryNormalizer;
import com.poc.tradedata.engine.CountryBridge;
import com.poc.tradedata.engine.HeaderLocator;
import com.poc.tradedata.engine.HeaderedSheet;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.model.ClassifiedCategory;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.model.TradeDirection;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.reader.RawTableReader;
import com.poc.tradedata.service.reference.ReferenceDataProvider;
import com.poc.tradedata.service.reference.ReferenceTable;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Korea Customs Service export or import amounts per country and item category.
 * Both directions share one result table, told apart by impexp_flag.
 */
@Slf4j
@Component
public class CustomsItemPipeline extends AbstractIngestPipeline {

    static final String COL_FLAG = "수출입구분";
    static final String COL_CATEGORY = "성질명";
    static final String COL_WEIGHT = "중량";
    static final String COL_AMOUNT = "금액";

    static final List<String> REQUIRED_COLUMNS = List.of(
            CustomsCountryPipeline.COL_PERIOD, CustomsCountryPipeline.COL_COUNTRY, COL_CATEGORY, COL_WEIGHT, COL_AMOUNT);

    static final String FLAG_COLUMN = "impexp_flag";

    static final List<String> COLUMNS = List.of(
            "impexp_year", FLAG_COLUMN, "impexp_nation_code", "impexp_nation_nm",
            "impexp_item_nm", "impexp_item_weight", "impexp_item_money");

    private final RawTableReader rawTableReader;
    private final ReferenceDataProvider referenceDataProvider;
    private final HeaderLocator headerLocator;
    private final CategoryNormalizer categoryNormalizer;

    public CustomsItemPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter,
                               RawTableReader rawTableReader, ReferenceDataProvider referenceDataProvider,
                               HeaderLocator headerLocator, CategoryNormalizer categoryNormalizer) {
        super(runLedger, recordSink, csvWriter);
        this.rawTableReader = rawTableReader;
        this.referenceDataProvider = referenceDataProvider;
        this.headerLocator = headerLocator;
        this.categoryNormalizer = categoryNormalizer;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.CUSTOMS_EXPORT_ITEM, JobType.CUSTOMS_IMPORT_ITEM);
    }

    @Override
    protected ResultTable transform(ProcessingRun run, Path file) {
        TradeDirection direction = directionOf(run.getJobType());
        String flag = direction.getCustomsFlag();

        HeaderedSheet sheet = HeaderedSheet.locate(
                rawTableReader.readSheet(file, 0), CustomsCountryPipeline.HEADER, headerLocator);
        List<Map<String, String>> records = CustomsCountryPipeline.dropTotals(sheet.records());
        log.info("Read {} item rows from {}", records.size(), file.getFileName());

        // 1. Direction check
        validateFlag(sheet, records, flag, run, file);

        List<String> missing = sheet.missingColumns(REQUIRED_COLUMNS);
        if (!missing.isEmpty()) {
            Map<String, Object> detail = detail(run, file);
            detail.put("missing_columns", missing);
            throw new DataValidationException(detail);
        }

        // 2. Categories, 3. country names
        CountryBridge bridge = CountryBridge.twoHop(
                referenceDataProvider.lookup(ReferenceTable.CUSTOMS_NAME_TO_CODE),
                referenceDataProvider.lookup(ReferenceTable.CODE_TO_NAME));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, String> record : records) {
            Optional<ClassifiedCategory> category =
                    categoryNormalizer.normalize(record.get(COL_CATEGORY), direction);
            if (category.isEmpty()) continue;

            String code = bridge.resolveToCode(record.get(CustomsCountryPipeline.COL_COUNTRY));
            String name = bridge.resolveCode(code);
            String year = CustomsCountryPipeline.extractYear(record.get(CustomsCountryPipeline.COL_PERIOD));
            if (code == null || name == null || year == null) continue;

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("impexp_year", year);
            row.put(FLAG_COLUMN, flag);
            row.put("impexp_nation_code", code);
            row.put("impexp_nation_nm", name);
            row.put("impexp_item_nm", category.get().getLabel());
            row.put("impexp_item_weight", record.get(COL_WEIGHT));
            row.put("impexp_item_money", record.get(COL_AMOUNT));
            rows.add(row);
        }
        log.info("Item rows after category filter and country mapping: {}", rows.size());

        // 4. Nation name ascending, amount descending
        rows.sort(Comparator.comparing((Map<String, Object> row) -> (String) row.get("impexp_nation_nm"))
                .thenComparing(row -> amountOf(row.get("impexp_item_money")),
                        Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder())));

        ResultTable table = new ResultTable(run.getJobType().getResultTable(), COLUMNS);
        rows.forEach(table::addRow);
        return table;
    }

    /**
     * Without replace-all only the rows of this run's direction are swapped out.
     */
    @Override
    protected int persist(ProcessingRun run, ResultTable table, boolean replaceAll) {
        if (replaceAll) {
            return recordSink.replaceAll(table);
        }
        return recordSink.replaceWhere(table, FLAG_COLUMN, directionOf(run.getJobType()).getCustomsFlag());
    }

    void validateFlag(HeaderedSheet sheet, List<Map<String, String>> records, String flag,
                      ProcessingRun run, Path file) {
        if (!sheet.hasColumn(COL_FLAG)) {
            log.warn("No {} column, skipping direction check", COL_FLAG);
            return;
        }
        boolean matches = records.stream()
                .map(record -> record.get(COL_FLAG))
                .anyMatch(value -> value != null && value.contains(flag));
        if (!matches) {
            Map<String, Object> detail = detail(run, file);
            detail.put("flag", flag);
            throw new DataValidationException(detail);
        }
        log.info("Direction check passed: file contains {} rows", flag);
    }

    static TradeDirection directionOf(JobType jobType) {
        return jobType == JobType.CUSTOMS_IMPORT_ITEM ? TradeDirection.IMPORT : TradeDirection.EXPORT;
    }

    private static BigDecimal amountOf(Object value) {
        if (value == null) return null;
        try {
            return new BigDecimal(value.toString().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
