package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.engine.CountryBridge;
import com.poc.tradedata.engine.HeaderLocator;
import com.poc.tradedata.engine.HeaderedSheet;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.HeaderNotFoundException;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawTable;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.reader.RawTableReader;
import com.poc.tradedata.service.reference.ReferenceDataProvider;
import com.poc.tradedata.service.reference.ReferenceTable;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Country rankings of the four socioeconomic indexes, each into its own table as
 * (cont_code, cont_en_nm, rank).
 */
@Slf4j
@Component
public class SocioeconomicIndexPipeline extends AbstractIngestPipeline {

    static final String COL_CODE = "cont_code";
    static final String COL_NAME = "cont_en_nm";

    @Getter
    @RequiredArgsConstructor
    enum IndexSource {
        ECONOMIC_FREEDOM(JobType.ECONOMIC_FREEDOM_INDEX, null, "Country", "Overall Score", null, "eco_lib_rank"),
        CORRUPTION_PERCEPTION(JobType.CORRUPTION_PERCEPTION_INDEX,
                HeaderSpec.of("Country / Territory", "ISO3", "Region"), "Country / Territory", "Rank", null, "corr_perc_rank"),
        HUMAN_DEVELOPMENT(JobType.HUMAN_DEVELOPMENT_INDEX,
                HeaderSpec.of("HDI rank", "Country"), "Country", "HDI rank", null, "hdi_rank"),
        WORLD_COMPETITIVENESS(JobType.WORLD_COMPETITIVENESS_INDEX,
                HeaderSpec.of("WCR", "Country", "국가코드"), "Country", "WCR", "국가코드", "wcr_rank");

        private final JobType jobType;

        /**
         * Null for the CSV source, whose header is the first line after the preamble.
         */
        private final HeaderSpec header;
        private final String countryColumn;

        /**
         * Rank column, or the score column ranked descending for economic freedom.
         */
        private final String rankColumn;

        /**
         * Column already holding the ISO code; null when the code comes from the English name.
         */
        private final String isoColumn;
        private final String resultRankColumn;

        static IndexSource of(JobType jobType) {
            for (IndexSource source : values()) {
                if (source.jobType == jobType) return source;
            }
            throw new IllegalArgumentException("Not a socioeconomic index job: " + jobType);
        }
    }

    static final int CSV_PREAMBLE_ROWS = 4;

    private final RawTableReader rawTableReader;
    private final ReferenceDataProvider referenceDataProvider;
    private final HeaderLocator headerLocator;

    public SocioeconomicIndexPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter,
                                      RawTableReader rawTableReader, ReferenceDataProvider referenceDataProvider,
                                      HeaderLocator headerLocator) {
        super(runLedger, recordSink, csvWriter);
        this.rawTableReader = rawTableReader;
        this.referenceDataProvider = referenceDataProvider;
        this.headerLocator = headerLocator;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.ECONOMIC_FREEDOM_INDEX, JobType.CORRUPTION_PERCEPTION_INDEX,
                JobType.HUMAN_DEVELOPMENT_INDEX, JobType.WORLD_COMPETITIVENESS_INDEX);
    }

    @Override
    protected ResultTable transform(ProcessingRun run, Path file) {
        IndexSource source = IndexSource.of(run.getJobType());
        HeaderedSheet sheet = load(source, file);

        List<String> required = new ArrayList<>(List.of(source.getCountryColumn(), source.getRankColumn()));
        if (source.getIsoColumn() != null) required.add(source.getIsoColumn());
        if (!sheet.missingColumns(required).isEmpty()) {
            throw new HeaderNotFoundException(sheet.getSheetName(), required);
        }

        // 1. Ranked rows; blank or non-numeric values such as N/A are unranked
        List<Map<String, String>> records = new ArrayList<>();
        for (Map<String, String> record : sheet.records()) {
            if (numberOf(record.get(source.getRankColumn())) == null) {
                log.debug("Unranked row dropped: {} = '{}'",
                        record.get(source.getCountryColumn()), record.get(source.getRankColumn()));
                continue;
            }
            records.add(record);
        }
        Map<Map<String, String>, Integer> ranks = source == IndexSource.ECONOMIC_FREEDOM
                ? rankByScore(records, source.getRankColumn())
                : parseRanks(records, source.getRankColumn());

        // 2. Country code and name
        CountryBridge bridge = CountryBridge.twoHop(
                source.getIsoColumn() == null ? referenceDataProvider.lookup(ReferenceTable.ENGLISH_NAME_TO_CODE) : null,
                referenceDataProvider.lookup(ReferenceTable.CODE_TO_ENGLISH_NAME));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, String> record : records) {
            String code = source.getIsoColumn() == null
                    ? bridge.resolveToCode(record.get(source.getCountryColumn()))
                    : record.get(source.getIsoColumn());
            String name = bridge.resolveCode(code);
            if (code == null || name == null) {
                log.debug("Unmapped country dropped: {}", record.get(source.getCountryColumn()));
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(COL_CODE, code);
            row.put(COL_NAME, name);
            row.put(source.getResultRankColumn(), ranks.get(record));
            rows.add(row);
        }
        log.info("[{}] {} of {} ranked rows mapped to countries", source, rows.size(), records.size());

        // 3. Rank ascending
        rows.sort(Comparator.comparing(row -> (Integer) row.get(source.getResultRankColumn())));

        ResultTable table = new ResultTable(run.getJobType().getResultTable(),
                List.of(COL_CODE, COL_NAME, source.getResultRankColumn()));
        rows.forEach(table::addRow);
        return table;
    }

    private HeaderedSheet load(IndexSource source, Path file) {
        if (source.getHeader() == null) {
            RawTable table = rawTableReader.readCsv(file, CSV_PREAMBLE_ROWS);
            return HeaderedSheet.atRow(table, 0);
        }
        return HeaderedSheet.locate(rawTableReader.readSheet(file, 0), source.getHeader(), headerLocator);
    }

    static BigDecimal numberOf(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Competition ("min") ranking, highest score first: 90, 80, 80, 70 rank 1, 2, 2, 4.
     */
    static Map<Map<String, String>, Integer> rankByScore(List<Map<String, String>> records, String scoreColumn) {
        List<BigDecimal> scores = new ArrayList<>();
        for (Map<String, String> record : records) {
            scores.add(numberOf(record.get(scoreColumn)));
        }
        Map<Map<String, String>, Integer> ranks = new IdentityHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            int higher = 0;
            for (BigDecimal other : scores) {
                if (other.compareTo(scores.get(i)) > 0) higher++;
            }
            ranks.put(records.get(i), higher + 1);
        }
        return ranks;
    }

    // Keyed by identity: rows with equal content keep their own rank.
    static Map<Map<String, String>, Integer> parseRanks(List<Map<String, String>> records, String rankColumn) {
        Map<Map<String, String>, Integer> ranks = new IdentityHashMap<>();
        for (Map<String, String> record : records) {
            ranks.put(record, numberOf(record.get(rankColumn)).intValueExact());
        }
        return ranks;
    }
}
