package com.mk.fx.qa.analysis.economics;

/**
 * Tuning for the economic translation.
 *
 * @param annualizationFactor days per year used to project the measured impact
 * @param confidenceLevel confidence level the dollar interval is reported at
 * @param includeOnlySignificant drop metrics with p >= 0.05 from the totals
 */
public record EconomicOptions(
    double annualizationFactor, int confidenceLevel, boolean includeOnlySignificant) {

  public static final double DEFAULT_ANNUALIZATION_FACTOR = 365.0;

  public static EconomicOptions defaults() {
    return new EconomicOptions(DEFAULT_ANNUALIZATION_FACTOR, 95, false);
  }

  public EconomicOptions onlySignificant() {
    return new EconomicOptions(annualizationFactor, confidenceLevel, true);
  }
}
