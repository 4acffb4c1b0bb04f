package com.poc.tradedata.service.pipeline;

import static com.poc.tradedata.service.pipeline.PipelineFixtures.row;
import static com.poc.tradedata.service.pipeline.PipelineFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.poc.tradedata.engine.HeaderLocator;
import com.poc.tradedata.engine.TradePartnerAggregator;
import com.poc.tradedata.engine.TradePartnerExtractor;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.model.RawTable;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.model.TradePartnerSettings;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.reader.RawTableReader;
import com.poc.tradedata.service.reference.ReferenceDataProvider;
import com.poc.tradedata.service.reference.ReferenceTable;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class TradePartnerPipelineTest {

    @TempDir
    Path tempDir;

    @Test
    void workbookBecomesPairedPartnerRows() throws Exception {
        RecordSink recordSink = mock(RecordSink.class);
        RawTableReader rawTableReader = mock(RawTableReader.class);
        ReferenceDataProvider referenceDataProvider = mock(ReferenceDataProvider.class);
        when(referenceDataProvider.lookup(ReferenceTable.CODE_TO_NAME)).thenReturn(Map.of("KOR", "대한민국", "CHN", "중국"));
        when(referenceDataProvider.lookup(ReferenceTable.PARTNER_NAME_TO_CODE)).thenReturn(Map.of("china", "CHN"));

        RawTable exports = table("XPM1",
                row("Geography", "Code", "Definition", "2023"),
                row("South Korea", "KOR", "Exports to China, as a percentage of total exports", "19.7"));
        RawTable imports = table("MPM1",
                row("Geography", "Code", "Definition", "2023"),
                row("South Korea", "KOR", "Imports from China, as a percentage of total imports", "22.2"));
        when(rawTableReader.readWorkbook(any())).thenReturn(List.of(exports, imports));

        TradePartnerSettings settings = TradePartnerSettings.defaults();
        TradePartnerPipeline pipeline = new TradePartnerPipeline(mock(RunLedger.class), recordSink,
                mock(ResultTableCsvWriter.class), rawTableReader, referenceDataProvider,
                new TradePartnerExtractor(new HeaderLocator(), settings), new TradePartnerAggregator(settings));
        ProcessingRun run = PipelineFixtures.run(JobType.TRADE_PARTNER, tempDir, "partners.xlsx");

        pipeline.process(run, true);

        ArgumentCaptor<ResultTable> captor = ArgumentCaptor.forClass(ResultTable.class);
        verify(recordSink).replaceAll(captor.capture());
        ResultTable table = captor.getValue();
        assertThat(table.getTableName()).isEqualTo("tb_rhr150");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getRows().get(0))
                .containsEntry("cont_nm", "대한민국")
                .containsEntry("maj_exp_cont_nm", "중국")
                .containsEntry("exp_rate", "19.700%")
                .containsEntry("maj_imp_cont_nm", "중국")
                .containsEntry("imp_rate", "22.200%");
        assertThat(table.getRows().get(1))
                .containsEntry("maj_exp_cont_nm", "기타")
                .containsEntry("exp_rate", "80.300%")
                .containsEntry("imp_rate", "77.800%");
    }
}
