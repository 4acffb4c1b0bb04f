package com.poc.tradedata.service.reference;

import java.util.Map;

public interface ReferenceDataProvider {

    /**
     * Read-only snapshot of a mapping table, key column to value column.
     */
    Map<String, String> lookup(ReferenceTable table);
}
