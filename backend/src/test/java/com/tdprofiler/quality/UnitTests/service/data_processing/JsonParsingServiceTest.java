package com.tdprofiler.quality.service.data_processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.DataTable;
import com.tdprofiler.quality.model.StorageType;

@DisplayName("JsonParsingService Tests")
class JsonParsingServiceTest {

  private JsonParsingService service;

  @BeforeEach
  void setUp() {
    service = new JsonParsingService(new ObjectMapper());
  }

  private DataTable parse(String json) throws IOException {
    return service.parse(json.getBytes(StandardCharsets.UTF_8), "orders");
  }

  @Nested
  @DisplayName("Layouts")
  class Layouts {

    @Test
    void shouldReadArrayOfRecords() throws IOException {
      DataTable table = parse("[{\"id\":1,\"amount\":2.5},{\"id\":2,\"amount\":null}]");

      assertThat(table.getColumnNames()).containsExactly("id", "amount");
      assertThat(table.getColumn("id").orElseThrow().getStorageType())
          .isEqualTo(StorageType.INTEGER);
      assertThat(table.getColumn("amount").orElseThrow().get(1).isMissing()).isTrue();
    }

    @Test
    void shouldPadRecordsWithMissingKeys() throws IOException {
      DataTable table = parse("[{\"a\":1},{\"b\":\"x\"},{\"a\":3,\"b\":\"y\"}]");

      assertThat(table.getRowCount()).isEqualTo(3);
      assertThat(table.getColumn("a").orElseThrow().getCells())
          .containsExactly(CellValue.ofInteger(1), CellValue.missing(), CellValue.ofInteger(3));
      assertThat(table.getColumn("b").orElseThrow().get(0).isMissing()).isTrue();
    }

    @Test
    void shouldReadColumnArrays() throws IOException {
      DataTable table = parse("{\"a\":[1,2],\"b\":[true,false]}");

      assertThat(table.getRowCount()).isEqualTo(2);
      assertThat(table.getColumn("b").orElseThrow().getStorageType())
          .isEqualTo(StorageType.BOOLEAN);
    }

    @Test
    void shouldReadIndexedColumnObjects() throws IOException {
      DataTable table = parse("{\"name\":{\"0\":\"Ann\",\"1\":\"Bob\"}}");

      assertThat(table.getColumn("name").orElseThrow().get(1).asText()).isEqualTo("Bob");
    }

    @Test
    void shouldRejectScalarDocument() {
      assertThatThrownBy(() -> parse("42")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectRecordsThatAreNotObjects() {
      assertThatThrownBy(() -> parse("[1,2]"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("JSON records must be objects");
    }

    @Test
    void shouldRejectColumnsOfRaggedLength() {
      assertThatThrownBy(() -> parse("{\"a\":[1,2],\"b\":[1]}"))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectEmptyDocument() {
      assertThatThrownBy(() -> parse("")).isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Date columns")
  class DateColumns {

    @Test
    void shouldConvertIsoTextInDateNamedColumns() throws IOException {
      DataTable table =
          parse("[{\"created_at\":\"2024-01-02T03:04:05\"},{\"created_at\":\"2024-02-01\"}]");

      assertThat(table.getColumn("created_at").orElseThrow().getStorageType())
          .isEqualTo(StorageType.DATETIME);
      assertThat(table.getColumn("created_at").orElseThrow().get(1).getValue())
          .isEqualTo(LocalDateTime.of(2024, 2, 1, 0, 0));
    }

    @Test
    void shouldKeepTextWhenAnyValueIsNotADate() throws IOException {
      DataTable table = parse("{\"date\":[\"2024-01-01\",\"soon\"]}");

      assertThat(table.getColumn("date").orElseThrow().getStorageType())
          .isEqualTo(StorageType.TEXT);
    }

    @Test
    void shouldLeaveOtherColumnsAlone() throws IOException {
      DataTable table = parse("{\"note\":[\"2024-01-01\"]}");

      assertThat(table.getColumn("note").orElseThrow().getStorageType())
          .isEqualTo(StorageType.TEXT);
    }

    @Test
    void shouldRecogniseDateLikeNames() {
      assertThat(JsonParsingService.isDateLikeName("updated_at")).isTrue();
      assertThat(JsonParsingService.isDateLikeName("Start_Time")).isTrue();
      assertThat(JsonParsingService.isDateLikeName("timestamp_utc")).isTrue();
      assertThat(JsonParsingService.isDateLikeName("date")).isTrue();
      assertThat(JsonParsingService.isDateLikeName("update")).isFalse();
    }

    @Test
    void shouldNormaliseOffsetsToUtc() {
      assertThat(JsonParsingService.parseIsoDate("2024-01-01T10:00:00+02:00"))
          .contains(LocalDateTime.of(2024, 1, 1, 8, 0));
      assertThat(JsonParsingService.parseIsoDate("2024-01-01 10:00:00"))
          .contains(LocalDateTime.of(2024, 1, 1, 10, 0));
      assertThat(JsonParsingService.parseIsoDate("01/02/2024")).isEmpty();
    }
  }
}
