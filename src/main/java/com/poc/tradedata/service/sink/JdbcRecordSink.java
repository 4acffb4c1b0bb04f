package com.poc.tradedata.service.sink;

import com.poc.tradedata.model.ResultTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class JdbcRecordSink implements RecordSink {

    static final int BATCH_SIZE = 1000;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional
    public int replaceAll(ResultTable table) {
        String tableName = identifier(table.getTableName());
        int deleted = jdbcTemplate.update("DELETE FROM " + tableName);
        log.info("Deleted {} rows from {}", deleted, tableName);
        return insertRows(table);
    }

    @Override
    @Transactional
    public int insert(ResultTable table) {
        return insertRows(table);
    }

    @Override
    @Transactional
    public int replaceWhere(ResultTable table, String column, Object value) {
        deleteRows(table.getTableName(), column, value);
        return insertRows(table);
    }

    @Override
    @Transactional
    public int deleteWhere(String tableName, String column, Object value) {
        return deleteRows(tableName, column, value);
    }

    private int deleteRows(String tableName, String column, Object value) {
        int deleted = jdbcTemplate.update(
                "DELETE FROM " + identifier(tableName) + " WHERE " + identifier(column) + " = ?", value);
        log.info("Deleted {} rows from {} where {} = {}", deleted, tableName, column, value);
        return deleted;
    }

    String insertSql(ResultTable table) {
        List<String> columns = new ArrayList<>();
        for (String column : table.getColumns()) {
            columns.add(identifier(column));
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + identifier(table.getTableName())
                + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }

    private int insertRows(ResultTable table) {
        if (table.isEmpty()) return 0;
        String sql = insertSql(table);

        List<Object[]> batch = new ArrayList<>(Math.min(table.size(), BATCH_SIZE));
        int inserted = 0;
        for (Map<String, Object> row : table.getRows()) {
            Object[] args = new Object[table.getColumns().size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = row.get(table.getColumns().get(i));
            }
            batch.add(args);
            if (batch.size() >= BATCH_SIZE) {
                inserted += flush(sql, batch);
            }
        }
        if (!batch.isEmpty()) {
            inserted += flush(sql, batch);
        }
        log.info("Inserted {} rows into {}", inserted, table.getTableName());
        return inserted;
    }

    private int flush(String sql, List<Object[]> batch) {
        jdbcTemplate.batchUpdate(sql, new ArrayList<>(batch));
        int size = batch.size();
        batch.clear();
        return size;
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
        return name;
    }
}
