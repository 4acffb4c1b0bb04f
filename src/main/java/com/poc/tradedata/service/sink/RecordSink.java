package com.poc.tradedata.service.sink;

import com.poc.tradedata.model.ResultTable;

/**
 * Persists result tables. Each call commits fully or not at all.
 */
public interface RecordSink {

    /**
     * Deletes every existing row of the target table, then inserts the new ones.
     * @return inserted row count
     */
    int replaceAll(ResultTable table);

    /**
     * @return inserted row count
     */
    int insert(ResultTable table);

    /**
     * Deletes the rows of the target table where {@code column = value}, then inserts the new ones.
     * @return inserted row count
     */
    int replaceWhere(ResultTable table, String column, Object value);

    /**
     * @return deleted row count
     */
    int deleteWhere(String tableName, String column, Object value);
}
