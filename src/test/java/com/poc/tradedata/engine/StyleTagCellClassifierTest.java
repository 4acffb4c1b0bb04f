package com.poc.tradedata.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.poc.tradedata.model.DataKind;
import com.poc.tradedata.model.RawCell;
import org.junit.jupiter.api.Test;

class StyleTagCellClassifierTest {

    private final StyleTagCellClassifier classifier = new StyleTagCellClassifier("0000588D");

    @Test
    void matchingTagIsEstimate() {
        assertThat(classifier.provenanceOf(new RawCell("1.2", "0000588d"))).isEqualTo(DataKind.ESTIMATE);
    }

    @Test
    void otherOrMissingTagIsActual() {
        assertThat(classifier.provenanceOf(new RawCell("1.2", "FF000000"))).isEqualTo(DataKind.ACTUAL);
        assertThat(classifier.provenanceOf(RawCell.of("1.2"))).isEqualTo(DataKind.ACTUAL);
        assertThat(classifier.provenanceOf(null)).isEqualTo(DataKind.ACTUAL);
    }
}
