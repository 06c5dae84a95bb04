package com.tdprofiler.quality.service.profiling;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Half-even rounding of the exact binary value, so results do not depend on string forms. */
public final class Rounding {

  private Rounding() {}

  public static double round(double value, int scale) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
  }

  /** Rounded value as plain text, keeping trailing zeros up to {@code scale} digits. */
  public static String format(double value, int scale) {
    return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
  }

  public static double percentage(long part, long whole) {
    return whole > 0 ? (double) part / whole * 100 : 0.0;
  }
}
