package com.poc.tradedata.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.HeaderNotFoundException;
import com.poc.tradedata.model.HeaderSpec;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class HeaderLocatorTest {

    private static final HeaderSpec SPEC = HeaderSpec.of("Series", "Code");

    @Test
    void findsHeaderBelowTitleRows() {
        RawTable table = table("KOR",
                row("Economist Intelligence Unit"),
                row((String) null),
                row(" Series ", "Code", "2020"),
                row("Real GDP", "DGDP", "1.5"));

        assertThat(new HeaderLocator().locate(table, SPEC)).isEqualTo(OptionalInt.of(2));
    }

    @Test
    void blankCellNeverMatches() {
        RawTable table = table("KOR", row("", "Code"), row("Series", "Code"));

        assertThat(new HeaderLocator().locate(table, SPEC)).isEqualTo(OptionalInt.of(1));
    }

    @Test
    void headerBeyondScanWindowIsNotFound() {
        RawTable table = table("KOR", row("title"), row("notes"), row("Series", "Code"));

        HeaderLocator locator = new HeaderLocator(2);

        assertThat(locator.locate(table, SPEC)).isEmpty();
        HeaderNotFoundException ex = catchThrowableOfType(
                () -> locator.require(table, SPEC), HeaderNotFoundException.class);
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.FILE_HEADER_NOT_FOUND);
        assertThat(ex.getDetail()).containsEntry("sheet_name", "KOR");
    }

    @Test
    void shortRowDoesNotMatch() {
        RawTable table = table("KOR", row("Series"));

        assertThat(new HeaderLocator().locate(table, SPEC)).isEmpty();
    }

    @Test
    void rejectsNonPositiveScanRows() {
        assertThatThrownBy(() -> new HeaderLocator(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @SafeVarargs
    static RawTable table(String sheetName, List<RawCell>... rows) {
        return RawTable.of(sheetName, new ArrayList<>(Arrays.asList(rows)));
    }

    static List<RawCell> row(String... texts) {
        List<RawCell> cells = new ArrayList<>();
        for (String text : texts) {
            cells.add(RawCell.of(text));
        }
        return cells;
    }
}
