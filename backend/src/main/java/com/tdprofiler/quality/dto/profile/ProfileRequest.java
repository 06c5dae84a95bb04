package com.tdprofiler.quality.dto.profile;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tdprofiler.quality.model.DataTable;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Inline table submitted for synchronous profiling. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {

  @JsonProperty("table_name")
  private String tableName;

  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  public DataTable toTable() {
    String name = tableName == null || tableName.isBlank() ? "unnamed_table" : tableName;
    return DataTable.fromRecords(name, columns, data);
  }
}
