package com.tdprofiler.quality.service.profiling;

/** Linear-interpolation quantiles over sorted samples. */
public final class Quantiles {

  private Quantiles() {}

  /**
   * Quantile {@code p} of {@code sorted} using the position {@code (n - 1) * p} and linear
   * interpolation between the two closest ranks.
   */
  public static double linear(double[] sorted, double p) {
    if (sorted.length == 0) {
      throw new IllegalArgumentException("Cannot take a quantile of an empty sample");
    }
    if (p < 0 || p > 1) {
      throw new IllegalArgumentException("Quantile must be within [0, 1]: " + p);
    }
    double position = (sorted.length - 1) * p;
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    double fraction = position - lower;
    return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
  }

  public static double median(double[] sorted) {
    return linear(sorted, 0.5);
  }
}
