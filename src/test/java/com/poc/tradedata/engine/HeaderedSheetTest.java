package com.poc.tradedata.engine;

import static com.poc.tradedata.engine.HeaderLocatorTest.row;
import static com.poc.tradedata.engine.HeaderLocatorTest.table;
import static org.assertj.core.api.Assertions.assertThat;

import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawTable;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HeaderedSheetTest {

    @Test
    void addressesRowsByTrimmedColumnName() {
        RawTable table = table("수출입",
                row("무역통계"),
                row("기간", " 국가 ", "수출금액", "기간"),
                row("2023년", "미국", " 1,000 ", "ignored"),
                row(null, null, null, null),
                row("2023년", "일본", ""));

        HeaderedSheet sheet = HeaderedSheet.locate(table, HeaderSpec.of("기간", "국가"), new HeaderLocator());

        assertThat(sheet.getColumnNames()).containsExactly("기간", "국가", "수출금액");
        assertThat(sheet.hasColumn("국가")).isTrue();
        assertThat(sheet.missingColumns(List.of("기간", "수입금액"))).containsExactly("수입금액");

        List<Map<String, String>> records = sheet.records();
        assertThat(records).hasSize(2);
        assertThat(records.get(0)).containsEntry("기간", "2023년").containsEntry("수출금액", "1,000");
        assertThat(records.get(1)).containsEntry("국가", "일본").containsEntry("수출금액", null);
    }

    @Test
    void headerAtFixedRow() {
        RawTable table = table("csv", row("Country", "Overall Score"), row("Singapore", "83.5"));

        HeaderedSheet sheet = HeaderedSheet.atRow(table, 0);

        assertThat(sheet.records()).containsExactly(Map.of("Country", "Singapore", "Overall Score", "83.5"));
        assertThat(sheet.getSheetName()).isEqualTo("csv");
    }
}
