package com.poc.tradedata.service.reference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class JdbcReferenceDataProvider implements ReferenceDataProvider {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Map<String, String> lookup(ReferenceTable table) {
        String sql = "SELECT " + table.getKeyColumn() + ", " + table.getValueColumn()
                + " FROM " + table.getTableName();

        Map<String, String> mapping = new LinkedHashMap<>();
        jdbcTemplate.query(sql, rs -> {
            String key = rs.getString(1);
            if (key != null) {
                mapping.put(key, rs.getString(2));
            }
        });
        log.debug("Loaded {} entries from {}", mapping.size(), table);
        return Collections.unmodifiableMap(mapping);
    }
}
