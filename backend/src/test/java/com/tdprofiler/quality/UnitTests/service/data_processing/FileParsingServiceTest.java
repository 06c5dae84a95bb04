package com.tdprofiler.quality.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tdprofiler.quality.model.DataTable;

@ExtendWith(MockitoExtension.class)
@DisplayName("FileParsingService Tests")
class FileParsingServiceTest {

  @Mock private CsvParsingService csvParsingService;
  @Mock private JsonParsingService jsonParsingService;
  @Mock private ExcelParsingService excelParsingService;

  @InjectMocks private FileParsingService fileParsingService;

  private final byte[] content = {1, 2, 3};
  private final DataTable table = DataTable.of("t", List.of());

  @Test
  void shouldDispatchCsvByExtension() throws IOException {
    when(csvParsingService.parse(content, "sales")).thenReturn(table);

    assertThat(fileParsingService.parse(content, "sales.CSV")).isSameAs(table);
    verifyNoInteractions(jsonParsingService, excelParsingService);
  }

  @Test
  void shouldDispatchJsonAndExcel() throws IOException {
    when(jsonParsingService.parse(any(byte[].class), eq("data"))).thenReturn(table);
    when(excelParsingService.parse(any(byte[].class), eq("book"))).thenReturn(table);

    fileParsingService.parse(content, "data.json");
    fileParsingService.parse(content, "book.xls");
    fileParsingService.parse(content, "book.xlsx");

    verify(jsonParsingService).parse(content, "data");
    verify(excelParsingService, times(2)).parse(content, "book");
  }

  @Test
  void shouldRejectUnsupportedFormat() {
    assertThatThrownBy(() -> fileParsingService.parse(content, "notes.txt"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unsupported file format: notes.txt");
  }

  @Test
  void shouldDeriveTableNameFromFileName() {
    assertThat(FileParsingService.extractTableName("my.data.csv")).isEqualTo("my.data");
    assertThat(FileParsingService.extractTableName(".hidden")).isEqualTo(".hidden");
    assertThat(FileParsingService.extractTableName("")).isEqualTo("unnamed_table");
    assertThat(FileParsingService.extractTableName(null)).isEqualTo("unnamed_table");
  }

  @Test
  void shouldReportSupportedExtensions() {
    assertThat(FileParsingService.isSupported("a.Xlsx")).isTrue();
    assertThat(FileParsingService.isSupported("a.parquet")).isFalse();
    assertThat(FileParsingService.isSupported("README")).isFalse();
    assertThat(FileParsingService.extensionOf("archive.tar.gz")).isEqualTo("gz");
  }
}
