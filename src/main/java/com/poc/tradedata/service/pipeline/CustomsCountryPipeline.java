package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.engine.CountryBridge;
import com.poc.tradedata.engine.HeaderLocator;
import com.poc.tradedata.engine.HeaderedSheet;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.reader.RawTableReader;
import com.poc.tradedata.service.reference.ReferenceDataProvider;
import com.poc.tradedata.service.reference.ReferenceTable;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Korea Customs Service export/import totals per country and year.
 */
@Slf4j
@Component
public class CustomsCountryPipeline extends AbstractIngestPipeline {

    static final HeaderSpec HEADER = HeaderSpec.of("기간", "국가");

    static final String COL_PERIOD = "기간";
    static final String COL_COUNTRY = "국가";
    static final String COL_EXPORT_AMOUNT = "수출 금액";
    static final String COL_IMPORT_AMOUNT = "수입 금액";
    static final String COL_TRADE_BALANCE = "무역수지";
    static final String TOTAL_ROW = "총계";

    static final List<String> REQUIRED_COLUMNS = List.of(
            COL_PERIOD, COL_COUNTRY, COL_EXPORT_AMOUNT, COL_IMPORT_AMOUNT, COL_TRADE_BALANCE);

    static final List<String> COLUMNS = List.of(
            "impexp_year", "impexp_nation_code", "impexp_nation_nm",
            "impexp_exp_money", "impexp_imp_money", "impexp_trade_rate_money");

    private static final Pattern YEAR = Pattern.compile("(\\d{4})");

    private final RawTableReader rawTableReader;
    private final ReferenceDataProvider referenceDataProvider;
    private final HeaderLocator headerLocator;

    public CustomsCountryPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter,
                                  RawTableReader rawTableReader, ReferenceDataProvider referenceDataProvider,
                                  HeaderLocator headerLocator) {
        super(runLedger, recordSink, csvWriter);
        this.rawTableReader = rawTableReader;
        this.referenceDataProvider = referenceDataProvider;
        this.headerLocator = headerLocator;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.CUSTOMS_COUNTRY);
    }

    @Override
    protected ResultTable transform(ProcessingRun run, Path file) {
        HeaderedSheet sheet = HeaderedSheet.locate(rawTableReader.readSheet(file, 0), HEADER, headerLocator);

        List<String> missing = sheet.missingColumns(REQUIRED_COLUMNS);
        if (!missing.isEmpty()) {
            Map<String, Object> detail = detail(run, file);
            detail.put("missing_columns", missing);
            throw new DataValidationException(detail);
        }

        CountryBridge bridge = CountryBridge.twoHop(
                referenceDataProvider.lookup(ReferenceTable.CUSTOMS_NAME_TO_CODE),
                referenceDataProvider.lookup(ReferenceTable.CODE_TO_NAME));

        List<Map<String, Object>> rows = new ArrayList<>();
        int dropped = 0;
        for (Map<String, String> record : dropTotals(sheet.records())) {
            String code = bridge.resolveToCode(record.get(COL_COUNTRY));
            String name = bridge.resolveCode(code);
            String year = extractYear(record.get(COL_PERIOD));
            if (code == null || name == null || year == null) {
                dropped++;
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("impexp_year", year);
            row.put("impexp_nation_code", code);
            row.put("impexp_nation_nm", name);
            row.put("impexp_exp_money", record.get(COL_EXPORT_AMOUNT));
            row.put("impexp_imp_money", record.get(COL_IMPORT_AMOUNT));
            row.put("impexp_trade_rate_money", record.get(COL_TRADE_BALANCE));
            rows.add(row);
        }
        log.info("Country names resolved: {} rows kept, {} dropped", rows.size(), dropped);

        rows.sort(Comparator.comparing((Map<String, Object> row) -> (String) row.get("impexp_year"))
                .thenComparing(row -> (String) row.get("impexp_nation_nm")));

        ResultTable table = new ResultTable(run.getJobType().getResultTable(), COLUMNS);
        rows.forEach(table::addRow);
        return table;
    }

    static List<Map<String, String>> dropTotals(List<Map<String, String>> records) {
        List<Map<String, String>> kept = new ArrayList<>();
        for (Map<String, String> record : records) {
            String first = record.values().iterator().next();
            if (!TOTAL_ROW.equals(first)) kept.add(record);
        }
        return kept;
    }

    static String extractYear(String period) {
        if (period == null) return null;
        Matcher matcher = YEAR.matcher(period);
        return matcher.find() ? matcher.group(1) : null;
    }
}
