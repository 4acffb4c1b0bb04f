package com.poc.tradedata.service.reader;

import com.poc.tradedata.model.RawTable;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads spreadsheet files as header-less raw tables.
 * Every failure surfaces as a {@link com.poc.tradedata.exception.FileNotReadableException}.
 */
public interface RawTableReader {

    /**
     * All sheets of an XLSX workbook, in workbook order.
     */
    List<RawTable> readWorkbook(Path path);

    RawTable readSheet(Path path, int sheetIndex);

    /**
     * A CSV file after skipping {@code skipRows} preamble lines.
     */
    RawTable readCsv(Path path, int skipRows);
}
