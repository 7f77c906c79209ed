package com.mk.fx.qa.analysis.stats;

/**
 * Closed interval around a point estimate.
 *
 * @param lower lower bound
 * @param upper upper bound
 */
public record Interval(double lower, double upper) {

  public Interval scale(double factor) {
    return new Interval(lower * factor, upper * factor);
  }

  public Interval plus(Interval other) {
    return new Interval(lower + other.lower, upper + other.upper);
  }

  public static Interval zero() {
    return new Interval(0.0, 0.0);
  }
}
