package com.poc.tradedata.engine;

import static com.poc.tradedata.engine.HeaderLocatorTest.row;
import static com.poc.tradedata.engine.HeaderLocatorTest.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import com.poc.tradedata.model.TradeDirection;
import com.poc.tradedata.model.TradePartnerSettings;
import com.poc.tradedata.model.TradeRelation;
import java.util.List;
import org.junit.jupiter.api.Test;

class TradePartnerExtractorTest {

    private final TradePartnerExtractor extractor =
            new TradePartnerExtractor(new HeaderLocator(), TradePartnerSettings.defaults());

    @Test
    void extractsPartnerFromDefinition() {
        assertThat(extractor.extractPartner(TradeDirection.EXPORT,
                "Exports to India, as a percentage of total exports")).isEqualTo("India");
        assertThat(extractor.extractPartner(TradeDirection.IMPORT,
                "Imports from the United States as a percentage of total imports")).isEqualTo("United States");
        assertThat(extractor.extractPartner(TradeDirection.EXPORT,
                "exports TO Hong Kong as percentage of total")).isEqualTo("Hong Kong");
    }

    @Test
    void definitionOutsideTemplateHasNoPartner() {
        assertThat(extractor.extractPartner(TradeDirection.EXPORT, "Total exports in US$")).isNull();
        assertThat(extractor.extractPartner(TradeDirection.IMPORT, "Exports to India, as a percentage")).isNull();
        assertThat(extractor.extractPartner(TradeDirection.EXPORT, null)).isNull();
    }

    @Test
    void readsTradePartnerSheetsOnly() {
        RawTable exports = table("XPM1",
                row("Main destinations of exports"),
                row("Geography", "Code", "Definition", "Units", "2023"),
                row("France", "FRA", "Exports to Germany, as a percentage of total exports", "%", "14.5"),
                row("France", "FRA", "Exports to Italy, as a percentage of total exports", "%", "–"));
        RawTable imports = table("MPM1",
                row("Geography", "Code", "Definition", "2023"),
                row("France", "FRA", "Imports from Spain, as a percentage of total imports", "n/a"));
        RawTable other = table("Notes", row("Geography", "Code"));

        List<TradeRelation> relations = extractor.extract(List.of(exports, imports, other));

        assertThat(relations)
                .extracting(TradeRelation::getCountryCode, TradeRelation::getPartnerName,
                        TradeRelation::getRate, TradeRelation::getDirection)
                .containsExactly(
                        tuple("FRA", "Germany", 14.5, TradeDirection.EXPORT),
                        tuple("FRA", "Italy", 0.0, TradeDirection.EXPORT),
                        tuple("FRA", "Spain", 0.0, TradeDirection.IMPORT));
    }

    @Test
    void sheetWithoutDefinitionColumnFails() {
        RawTable sheet = table("XPM1", row("Geography", "Code", "2023"), row("France", "FRA", "1"));

        assertThatThrownBy(() -> extractor.extractSheet(sheet, TradeDirection.EXPORT))
                .isInstanceOf(DataValidationException.class);
    }

    @Test
    void unreadableRateIsZero() {
        assertThat(extractor.parseRate(RawCell.of(" 12.25 "))).isEqualTo(12.25);
        assertThat(extractor.parseRate(RawCell.of("–"))).isZero();
        assertThat(extractor.parseRate(RawCell.of(""))).isZero();
        assertThat(extractor.parseRate(null)).isZero();
    }
}
