package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.engine.CountryBridge;
import com.poc.tradedata.engine.TradePartnerAggregator;
import com.poc.tradedata.engine.TradePartnerExtractor;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.model.CountryTradeProfile;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.model.TradeDirection;
import com.poc.tradedata.model.TradeRelation;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.reader.RawTableReader;
import com.poc.tradedata.service.reference.ReferenceDataProvider;
import com.poc.tradedata.service.reference.ReferenceTable;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * EIU major export/import partners into tb_rhr150.
 */
@Slf4j
@Component
public class TradePartnerPipeline extends AbstractIngestPipeline {

    private final RawTableReader rawTableReader;
    private final ReferenceDataProvider referenceDataProvider;
    private final TradePartnerExtractor tradePartnerExtractor;
    private final TradePartnerAggregator tradePartnerAggregator;

    public TradePartnerPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter,
                                RawTableReader rawTableReader, ReferenceDataProvider referenceDataProvider,
                                TradePartnerExtractor tradePartnerExtractor,
                                TradePartnerAggregator tradePartnerAggregator) {
        super(runLedger, recordSink, csvWriter);
        this.rawTableReader = rawTableReader;
        this.referenceDataProvider = referenceDataProvider;
        this.tradePartnerExtractor = tradePartnerExtractor;
        this.tradePartnerAggregator = tradePartnerAggregator;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.TRADE_PARTNER);
    }

    @Override
    protected ResultTable transform(ProcessingRun run, Path file) {
        // 1. Extract
        List<TradeRelation> relations = tradePartnerExtractor.extract(rawTableReader.readWorkbook(file));
        log.info("Extracted {} trade relations", relations.size());

        // 2. Aggregate
        Map<String, CountryTradeProfile> profiles = tradePartnerAggregator.aggregate(relations);
        log.info("Countries with partner data: {}", profiles.size());

        // 3. Lay out
        Map<String, String> codeToName = referenceDataProvider.lookup(ReferenceTable.CODE_TO_NAME);
        CountryBridge countryNames = CountryBridge.singleHop(codeToName);
        CountryBridge partnerNames = CountryBridge.twoHopIgnoreCase(
                referenceDataProvider.lookup(ReferenceTable.PARTNER_NAME_TO_CODE), codeToName);
        ResultTable table = tradePartnerAggregator.toResultTable(
                run.getJobType().getResultTable(), profiles, countryNames, partnerNames);

        logSummary(profiles.values());
        return table;
    }

    private void logSummary(Collection<CountryTradeProfile> profiles) {
        long both = 0;
        long exportOnly = 0;
        long importOnly = 0;
        for (CountryTradeProfile profile : profiles) {
            boolean hasExport = !profile.partners(TradeDirection.EXPORT).isEmpty();
            boolean hasImport = !profile.partners(TradeDirection.IMPORT).isEmpty();
            if (hasExport && hasImport) both++;
            else if (hasExport) exportOnly++;
            else if (hasImport) importOnly++;
        }
        log.info("Summary: countries={}, both={}, exportOnly={}, importOnly={}",
                profiles.size(), both, exportOnly, importOnly);
    }
}
