package com.poc.tradedata.service.reader;

import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.FileNotReadableException;
import com.poc.tradedata.model.RawCell;
import com.poc.tradedata.model.RawTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class PoiRawTableReader implements RawTableReader {

    private static final char BOM = '\uFEFF';

    @Override
    public List<RawTable> readWorkbook(Path path) {
        try (InputStream in = Files.newInputStream(path);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {

            List<RawTable> tables = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                tables.add(toRawTable(workbook.getSheetAt(i)));
            }
            log.info("Read {} sheets from {}", tables.size(), path.getFileName());
            return tables;
        } catch (IOException | RuntimeException e) {
            throw readFailure(path, e);
        }
    }

    @Override
    public RawTable readSheet(Path path, int sheetIndex) {
        try (InputStream in = Files.newInputStream(path);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            return toRawTable(workbook.getSheetAt(sheetIndex));
        } catch (IOException | RuntimeException e) {
            throw readFailure(path, e);
        }
    }

    @Override
    public RawTable readCsv(Path path, int skipRows) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            for (int i = 0; i < skipRows; i++) {
                if (reader.readLine() == null) break;
            }

            CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                    .setAllowMissingColumnNames(true)
                    .setIgnoreEmptyLines(true)
                    .build();

            List<List<RawCell>> rows = new ArrayList<>();
            try (CSVParser parser = csvFormat.parse(reader)) {
                for (CSVRecord record : parser) {
                    List<RawCell> row = new ArrayList<>(record.size());
                    for (String value : record) {
                        row.add(RawCell.of(value == null || value.isEmpty() ? null : value));
                    }
                    rows.add(row);
                }
            }
            stripBom(rows);
            log.info("Read {} CSV rows from {}", rows.size(), path.getFileName());
            return RawTable.of(String.valueOf(path.getFileName()), rows);
        } catch (IOException | RuntimeException e) {
            throw readFailure(path, e);
        }
    }

    RawTable toRawTable(Sheet sheet) {
        List<List<RawCell>> rows = new ArrayList<>();
        for (int rowIdx = 0; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
            Row row = sheet.getRow(rowIdx);
            List<RawCell> cells = new ArrayList<>();
            if (row != null) {
                for (int colIdx = 0; colIdx < row.getLastCellNum(); colIdx++) {
                    cells.add(toRawCell(row.getCell(colIdx)));
                }
            }
            rows.add(cells);
        }
        return RawTable.of(sheet.getSheetName(), rows);
    }

    private RawCell toRawCell(Cell cell) {
        if (cell == null) return new RawCell(null, null);
        return new RawCell(getCellText(cell), getStyleTag(cell));
    }

    private String getCellText(Cell cell) {
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    LocalDateTime value = cell.getLocalDateTimeCellValue();
                    return value.toLocalTime().toSecondOfDay() == 0 ? value.toLocalDate().toString() : value.toString();
                }
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    /**
     * Font colour (ARGB hex) of a solid-filled cell; null otherwise.
     */
    private String getStyleTag(Cell cell) {
        if (!(cell.getCellStyle() instanceof XSSFCellStyle)) return null;
        XSSFCellStyle style = (XSSFCellStyle) cell.getCellStyle();
        if (style.getFillPattern() != FillPatternType.SOLID_FOREGROUND) return null;

        XSSFFont font = style.getFont();
        XSSFColor color = font == null ? null : font.getXSSFColor();
        return color == null ? null : color.getARGBHex();
    }

    private static void stripBom(List<List<RawCell>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) return;
        RawCell first = rows.get(0).get(0);
        if (first.getText() != null && !first.getText().isEmpty() && first.getText().charAt(0) == BOM) {
            first.setText(first.getText().substring(1));
        }
    }

    private FileNotReadableException readFailure(Path path, Exception e) {
        log.error("Failed to read {}", path, e);
        return new FileNotReadableException(ErrorCode.FILE_READ_ERROR, Map.of("file_path", String.valueOf(path)), e);
    }
}
