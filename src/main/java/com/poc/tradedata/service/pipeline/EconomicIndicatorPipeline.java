package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.engine.CountryBridge;
import com.poc.tradedata.engine.IndicatorExtractor;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.DataProcessingException;
import com.poc.tradedata.model.ClassifiedValue;
import com.poc.tradedata.model.IndicatorCatalog;
import com.poc.tradedata.model.IndicatorRecord;
import com.poc.tradedata.model.RawTable;
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
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * EIU economic indicators into tb_rhr100: one row per (country sheet, catalog code).
 */
@Slf4j
@Component
public class EconomicIndicatorPipeline extends AbstractIngestPipeline {

    static final List<String> FIXED_COLUMNS = List.of(
            "eiu_country_code", "eiu_cont_en_nm", "eiu_series_title", "eiu_code", "eiu_currency", "eiu_units");

    private final RawTableReader rawTableReader;
    private final ReferenceDataProvider referenceDataProvider;
    private final IndicatorExtractor indicatorExtractor;
    private final IndicatorCatalog indicatorCatalog;

    public EconomicIndicatorPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter,
                                     RawTableReader rawTableReader, ReferenceDataProvider referenceDataProvider,
                                     IndicatorExtractor indicatorExtractor, IndicatorCatalog indicatorCatalog) {
        super(runLedger, recordSink, csvWriter);
        this.rawTableReader = rawTableReader;
        this.referenceDataProvider = referenceDataProvider;
        this.indicatorExtractor = indicatorExtractor;
        this.indicatorCatalog = indicatorCatalog;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.ECONOMIC_INDICATOR);
    }

    @Override
    protected ResultTable transform(ProcessingRun run, Path file) {
        List<RawTable> sheets = rawTableReader.readWorkbook(file);
        List<IndicatorRecord> records = indicatorExtractor.extract(sheets);
        if (records.isEmpty()) {
            log.error("No indicator data in {}", file);
            throw new DataProcessingException(detail(run, file));
        }
        log.info("Extracted {} indicator records from {} sheets", records.size(), sheets.size());

        CountryBridge countryNames = CountryBridge.singleHop(
                referenceDataProvider.lookup(ReferenceTable.CODE_TO_ENGLISH_NAME));
        return toResultTable(run.getJobType().getResultTable(), records, countryNames);
    }

    ResultTable toResultTable(String tableName, List<IndicatorRecord> records, CountryBridge countryNames) {
        // year columns are aligned across records by the extractor
        List<Integer> years = new ArrayList<>(records.get(0).getYears().keySet());
        List<String> columns = new ArrayList<>(FIXED_COLUMNS);
        for (Integer year : years) {
            columns.add(yearColumn(year));
        }

        ResultTable table = new ResultTable(tableName, columns);
        for (IndicatorRecord record : records) {
            String name = countryNames.resolveCode(record.getCountryCode());

            Map<String, Object> row = table.newRow();
            row.put("eiu_country_code", record.getCountryCode());
            row.put("eiu_cont_en_nm", name == null ? "" : name);
            row.put("eiu_series_title", record.getSeries());
            row.put("eiu_code", record.getCode());
            row.put("eiu_currency", record.getCurrency());
            row.put("eiu_units", record.getUnits());
            for (Integer year : years) {
                ClassifiedValue value = record.yearValue(year);
                row.put(yearColumn(year), value == null ? ClassifiedValue.unknown().serialize() : value.serialize());
            }
        }
        return table;
    }

    String yearColumn(int year) {
        return "eiu_year" + indicatorCatalog.slotOf(year);
    }
}
