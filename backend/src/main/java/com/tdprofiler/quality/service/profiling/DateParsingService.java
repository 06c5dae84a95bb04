package com.tdprofiler.quality.service.profiling;

import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.cobber.fta.dates.DateTimeParser;
import com.cobber.fta.dates.DateTimeParser.DateResolutionMode;
import com.tdprofiler.quality.config.ProfilerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Permissive date recognition backed by the FTA date-time parser. Recognition is a fallible
 * operation: anything the parser rejects, or fails on, yields an empty result.
 */
@Slf4j
@Service
public class DateParsingService {

  private final Locale locale;

  public DateParsingService(ProfilerProperties properties) {
    String tag = properties.getDateLocale() != null ? properties.getDateLocale() : "en-US";
    this.locale = Locale.forLanguageTag(tag.replace('_', '-'));
  }

  /** Returns the date-time format {@code value} was recognised with, if any. */
  public Optional<String> tryParse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      DateTimeParser parser =
          new DateTimeParser().withDateResolutionMode(DateResolutionMode.Auto).withLocale(locale);
      return Optional.ofNullable(parser.determineFormatString(value.trim()));
    } catch (RuntimeException e) {
      log.debug("Date recognition failed for '{}': {}", value, e.getMessage());
      return Optional.empty();
    }
  }
}
