package com.tdprofiler.quality.service.data_processing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.DataTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the first sheet of an {@code .xlsx} or {@code .xls} workbook. The first row holds the
 * column names; numeric cells become floats unless date formatted, and a column of whole numbers
 * is narrowed to integers.
 */
@Slf4j
@Service
public class ExcelParsingService {

  private final DataFormatter headerFormatter = new DataFormatter();

  public DataTable parse(byte[] workbookData, String tableName) throws IOException {
    try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(workbookData))) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new IllegalArgumentException("Workbook has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      Row headerRow = sheet.getRow(sheet.getFirstRowNum());
      if (headerRow == null || headerRow.getLastCellNum() <= 0) {
        throw new IllegalArgumentException("Excel sheet has no headers");
      }

      int columnCount = headerRow.getLastCellNum();
      List<String> rawHeaders = new ArrayList<>(columnCount);
      for (int c = 0; c < columnCount; c++) {
        Cell cell = headerRow.getCell(c);
        rawHeaders.add(cell == null ? null : headerFormatter.formatCellValue(cell).trim());
      }
      List<String> headers = ColumnValueConverter.normalizeHeaders(rawHeaders);

      List<List<CellValue>> columns = new ArrayList<>(columnCount);
      for (int c = 0; c < columnCount; c++) {
        columns.add(new ArrayList<>());
      }
      for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        for (int c = 0; c < columnCount; c++) {
          columns.get(c).add(toCell(row.getCell(c)));
        }
      }

      log.debug(
          "Read sheet '{}' with {} columns and {} rows",
          sheet.getSheetName(),
          columnCount,
          columns.get(0).size());

      DataTable.Builder builder = DataTable.builder(tableName);
      for (int c = 0; c < columnCount; c++) {
        builder.column(headers.get(c), ColumnValueConverter.normalizeWholeNumbers(columns.get(c)));
      }
      return builder.build();
    }
  }

  static CellValue toCell(Cell cell) {
    if (cell == null) {
      return CellValue.missing();
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case NUMERIC:
        if (DateUtil.isCellDateFormatted(cell)) {
          return CellValue.ofTimestamp(cell.getLocalDateTimeCellValue());
        }
        return CellValue.ofFloat(cell.getNumericCellValue());
      case BOOLEAN:
        return CellValue.ofBoolean(cell.getBooleanCellValue());
      case STRING:
        String text = cell.getStringCellValue();
        return ColumnValueConverter.isNullToken(text)
            ? CellValue.missing()
            : CellValue.ofText(text);
      default:
        return CellValue.missing();
    }
  }
}
