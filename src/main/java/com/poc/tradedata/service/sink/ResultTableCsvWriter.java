package com.poc.tradedata.service.sink;

import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.FileStorageService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a copy of every persisted result table to storage as CSV.
 */
@Slf4j
@Component
public class ResultTableCsvWriter {

    static final String PROCESSED_FOLDER = "Processed/";

    private final FileStorageService fileStorageService;
    private final String nullValue;

    public ResultTableCsvWriter(FileStorageService fileStorageService,
                                @Value("${ingest.snapshot.null-value:NULL}") String nullValue) {
        this.fileStorageService = fileStorageService;
        this.nullValue = nullValue;
    }

    public String write(ResultTable table, String filenamePrefix) throws IOException {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));
        String fileName = PROCESSED_FOLDER + filenamePrefix + "_" + timestamp + ".csv";

        String path = fileStorageService.saveFile(render(table).getBytes(StandardCharsets.UTF_8), fileName);
        log.info("CSV snapshot saved: {} ({} rows)", path, table.size());
        return path;
    }

    String render(ResultTable table) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(table.getColumns().toArray(new String[0]))
                .setNullString(nullValue)
                .build();

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, csvFormat)) {
            for (Map<String, Object> row : table.getRows()) {
                List<Object> values = new ArrayList<>(table.getColumns().size());
                for (String column : table.getColumns()) {
                    values.add(row.get(column));
                }
                printer.printRecord(values);
            }
        }
        return out.toString();
    }
}
