package com.poc.tradedata.engine;

import com.poc.tradedata.model.DataKind;
import com.poc.tradedata.model.RawCell;

/**
 * EIU marks estimated values with a coloured font on a solid fill; the reader exposes that
 * font colour as the cell's style tag.
 */
public class StyleTagCellClassifier implements CellClassifier {

    private final String estimateTag;

    public StyleTagCellClassifier(String estimateTag) {
        this.estimateTag = estimateTag;
    }

    @Override
    public DataKind provenanceOf(RawCell cell) {
        if (cell != null && estimateTag != null && estimateTag.equalsIgnoreCase(cell.getStyleTag())) {
            return DataKind.ESTIMATE;
        }
        return DataKind.ACTUAL;
    }
}
