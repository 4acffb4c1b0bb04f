package com.poc.tradedata.engine;

import com.poc.tradedata.model.DataKind;
import com.poc.tradedata.model.RawCell;

/**
 * Decides the provenance of a cell that holds a number.
 */
public interface CellClassifier {

    /**
     * @return {@link DataKind#ESTIMATE} or {@link DataKind#ACTUAL}
     */
    DataKind provenanceOf(RawCell cell);
}
