package com.tdprofiler.quality.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;

/**
 * One cell of a {@link DataTable}: a value tagged with its {@link ValueKind}.
 *
 * <p>Numeric cells compare by numeric value, so {@code 3} and {@code 3.0} are equal; missing
 * cells are equal to each other. Floating-point NaN is stored as a missing cell.
 */
public final class CellValue {

  private static final CellValue MISSING = new CellValue(ValueKind.MISSING, null);
  private static final double LONG_RANGE = 0x1p63;

  private final ValueKind kind;
  private final Object value;

  private CellValue(ValueKind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static CellValue missing() {
    return MISSING;
  }

  public static CellValue ofInteger(long value) {
    return new CellValue(ValueKind.INTEGER, value);
  }

  public static CellValue ofFloat(double value) {
    if (Double.isNaN(value)) {
      return MISSING;
    }
    return new CellValue(ValueKind.FLOAT, value);
  }

  public static CellValue ofBoolean(boolean value) {
    return new CellValue(ValueKind.BOOLEAN, value);
  }

  public static CellValue ofTimestamp(LocalDateTime value) {
    return value == null ? MISSING : new CellValue(ValueKind.TIMESTAMP, value);
  }

  public static CellValue ofText(String value) {
    return value == null ? MISSING : new CellValue(ValueKind.TEXT, value);
  }

  /** Tags an untyped value, as handed over by JSON binding or a spreadsheet reader. */
  public static CellValue of(Object raw) {
    if (raw == null) {
      return MISSING;
    }
    if (raw instanceof CellValue) {
      return (CellValue) raw;
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short
        || raw instanceof Byte) {
      return ofInteger(((Number) raw).longValue());
    }
    if (raw instanceof BigInteger) {
      BigInteger big = (BigInteger) raw;
      return big.bitLength() < 64 ? ofInteger(big.longValue()) : ofFloat(big.doubleValue());
    }
    if (raw instanceof BigDecimal || raw instanceof Double || raw instanceof Float) {
      return ofFloat(((Number) raw).doubleValue());
    }
    if (raw instanceof Boolean) {
      return ofBoolean((Boolean) raw);
    }
    if (raw instanceof LocalDateTime) {
      return ofTimestamp((LocalDateTime) raw);
    }
    if (raw instanceof LocalDate) {
      return ofTimestamp(((LocalDate) raw).atStartOfDay());
    }
    if (raw instanceof OffsetDateTime) {
      return ofTimestamp(
          ((OffsetDateTime) raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (raw instanceof ZonedDateTime) {
      return ofTimestamp(
          ((ZonedDateTime) raw).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }
    if (raw instanceof Instant) {
      return ofTimestamp(LocalDateTime.ofInstant((Instant) raw, ZoneOffset.UTC));
    }
    if (raw instanceof Date) {
      return ofTimestamp(LocalDateTime.ofInstant(((Date) raw).toInstant(), ZoneOffset.UTC));
    }
    return ofText(raw.toString());
  }

  public ValueKind getKind() {
    return kind;
  }

  public boolean isMissing() {
    return kind == ValueKind.MISSING;
  }

  public boolean isNumeric() {
    return kind.isNumeric();
  }

  public boolean isEmptyText() {
    return kind == ValueKind.TEXT && ((String) value).isEmpty();
  }

  /** Raw payload: Long, Double, Boolean, LocalDateTime, String, or null when missing. */
  public Object getValue() {
    return value;
  }

  public double asDouble() {
    if (!isNumeric()) {
      throw new IllegalStateException("Not a numeric cell: " + kind);
    }
    return ((Number) value).doubleValue();
  }

  public boolean isWholeNumber() {
    if (kind == ValueKind.INTEGER) {
      return true;
    }
    if (kind == ValueKind.FLOAT) {
      double d = (Double) value;
      return !Double.isInfinite(d) && Math.rint(d) == d;
    }
    return false;
  }

  /** Text rendering used by string statistics, patterns, semantic detection and top values. */
  public String asText() {
    switch (kind) {
      case MISSING:
        return null;
      case TEXT:
        return (String) value;
      default:
        return value.toString();
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CellValue)) {
      return false;
    }
    CellValue other = (CellValue) o;
    if (kind.isNumeric() && other.kind.isNumeric()) {
      return numericEquals(other);
    }
    return kind == other.kind && Objects.equals(value, other.value);
  }

  private boolean numericEquals(CellValue other) {
    if (kind == ValueKind.INTEGER && other.kind == ValueKind.INTEGER) {
      return ((Long) value).longValue() == ((Long) other.value).longValue();
    }
    if (kind == ValueKind.FLOAT && other.kind == ValueKind.FLOAT) {
      return ((Double) value).doubleValue() == ((Double) other.value).doubleValue();
    }
    CellValue integer = kind == ValueKind.INTEGER ? this : other;
    CellValue floating = kind == ValueKind.FLOAT ? this : other;
    double d = (Double) floating.value;
    return floating.isWholeNumber()
        && Math.abs(d) < LONG_RANGE
        && (long) d == (Long) integer.value;
  }

  @Override
  public int hashCode() {
    switch (kind) {
      case MISSING:
        return 0;
      case INTEGER:
        return Long.hashCode((Long) value);
      case FLOAT:
        double d = (Double) value;
        if (isWholeNumber() && Math.abs(d) < LONG_RANGE) {
          return Long.hashCode((long) d);
        }
        return Double.hashCode(d);
      default:
        return 31 * kind.hashCode() + value.hashCode();
    }
  }

  @Override
  public String toString() {
    return kind == ValueKind.MISSING ? "MISSING" : kind + "(" + value + ")";
  }
}
