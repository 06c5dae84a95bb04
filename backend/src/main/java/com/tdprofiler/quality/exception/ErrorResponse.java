package com.tdprofiler.quality.exception;

import java.time.LocalDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Body of every error the API returns. Optional fields are left out when unset. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error returned by the profiling API")
public class ErrorResponse {

  LocalDateTime timestamp;

  int status;

  String error;

  String message;

  String path;

  /** Rate-limited action, for 429 responses. */
  String action;

  @JsonProperty("retry_after_seconds")
  Long retryAfterSeconds;

  @JsonProperty("validation_errors")
  Map<String, String> validationErrors;

  @JsonProperty("debug_message")
  String debugMessage;
}
