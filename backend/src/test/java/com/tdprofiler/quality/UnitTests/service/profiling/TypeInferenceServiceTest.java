package com.tdprofiler.quality.service.profiling;

import static com.tdprofiler.quality.fixtures.TestFixtures.column;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.InferredType;

@DisplayName("TypeInferenceService Tests")
class TypeInferenceServiceTest {

  private TypeInferenceService service;

  @BeforeEach
  void setUp() {
    ProfilerProperties properties = new ProfilerProperties();
    service = new TypeInferenceService(properties, new DateParsingService(properties));
  }

  @Nested
  @DisplayName("Typed storage")
  class TypedStorage {

    @Test
    void shouldInferIntegerForIntegerStorage() {
      assertThat(service.inferType(column("n", 1, 2, null))).isEqualTo(InferredType.INTEGER);
    }

    @Test
    void shouldInferIntegerForWholeFloats() {
      assertThat(service.inferType(column("n", 1.0, 2.0, null))).isEqualTo(InferredType.INTEGER);
    }

    @Test
    void shouldInferFloatForFractionalValues() {
      assertThat(service.inferType(column("n", 1, 2.5))).isEqualTo(InferredType.FLOAT);
    }

    @Test
    void shouldInferBooleanAndDatetime() {
      assertThat(service.inferType(column("b", true, false))).isEqualTo(InferredType.BOOLEAN);
      assertThat(service.inferType(column("d", LocalDateTime.of(2024, 1, 1, 8, 30))))
          .isEqualTo(InferredType.DATETIME);
    }
  }

  @Nested
  @DisplayName("Text storage")
  class TextStorage {

    @Test
    void shouldRecogniseIsoDates() {
      assertThat(service.inferType(column("d", "2024-01-15", "2024-02-20", "2023-12-31")))
          .isEqualTo(InferredType.DATETIME);
    }

    @Test
    void shouldKeepNamesAsString() {
      assertThat(service.inferType(column("n", "Alice", "Bob", "Carol")))
          .isEqualTo(InferredType.STRING);
    }

    @Test
    void shouldRequireEverySampledValueToBeADate() {
      assertThat(service.inferType(column("d", "2024-01-15", "hello")))
          .isEqualTo(InferredType.STRING);
    }

    @Test
    void shouldInferStringForAllMissingColumn() {
      assertThat(service.inferType(column("empty", null, null))).isEqualTo(InferredType.STRING);
    }

    @Test
    void shouldInferStringForMixedKinds() {
      assertThat(service.inferType(column("m", 1, "a"))).isEqualTo(InferredType.STRING);
    }
  }

  @Test
  void shouldOnlyParseTheFirstHundredValues() {
    ProfilerProperties properties = new ProfilerProperties();
    DateParsingService dates = mock(DateParsingService.class);
    when(dates.tryParse("2024-01-01")).thenReturn(Optional.of("yyyy-MM-dd"));
    TypeInferenceService sampled = new TypeInferenceService(properties, dates);

    Object[] values = new Object[101];
    for (int i = 0; i < 100; i++) {
      values[i] = "2024-01-01";
    }
    values[100] = "not a date";

    assertThat(sampled.inferType(column("d", values))).isEqualTo(InferredType.DATETIME);
    verify(dates, never()).tryParse("not a date");
  }

  @Test
  void shouldNotParseTypedColumns() {
    DateParsingService dates = mock(DateParsingService.class);
    TypeInferenceService typed = new TypeInferenceService(new ProfilerProperties(), dates);

    typed.inferType(column("n", 1, 2));

    verify(dates, never()).tryParse(anyString());
  }
}
