package com.mk.fx.qa.analysis.utils;

import java.util.Locale;

/** Number formatting shared by the narrative builders. Output is locale-independent. */
public final class AnalysisFormat {

  private AnalysisFormat() {
    // Utility class, no instantiation
  }

  /** Two decimals, no grouping: {@code 1234.5 -> "1234.50"}. */
  public static String fixed2(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  /** Four decimals, no grouping. */
  public static String fixed4(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }

  /** One decimal, no grouping. */
  public static String fixed1(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }

  /** Two decimals with thousands separators: {@code 12345.678 -> "12,345.68"}. */
  public static String grouped(double value) {
    return String.format(Locale.US, "%,.2f", value);
  }
}
