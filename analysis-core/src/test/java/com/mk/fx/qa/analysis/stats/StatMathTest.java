package com.mk.fx.qa.analysis.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StatMathTest {

  private static final double EPS = 1e-9;

  @Test
  void mean_ofEmpty_isZero() {
    assertThat(StatMath.mean(new double[0])).isZero();
    assertThat(StatMath.mean(new double[] {1, 2, 3})).isCloseTo(2.0, within(EPS));
  }

  @Test
  void standardDeviation_isPopulationDeviation_andZeroForSingleSample() {
    assertThat(StatMath.standardDeviation(new double[] {5})).isZero();
    assertThat(StatMath.standardDeviation(new double[0])).isZero();
    assertThat(StatMath.standardDeviation(new double[] {2, 4, 4, 4, 5, 5, 7, 9}))
        .isCloseTo(2.0, within(EPS));
  }

  @Test
  void standardError_dividesBySqrtN() {
    assertThat(StatMath.standardError(new double[] {3})).isZero();
    assertThat(StatMath.standardError(new double[] {2, 4, 4, 4, 5, 5, 7, 9}))
        .isCloseTo(2.0 / Math.sqrt(8), within(EPS));
  }

  @Test
  void cohensD_usesPooledDeviation() {
    double d = StatMath.cohensD(new double[] {1, 2, 3}, new double[] {0, 1, 2});
    assertThat(d).isCloseTo(1.0 / Math.sqrt(2.0 / 3.0), within(EPS));
  }

  @Test
  void cohensD_isZeroWhenUndefined() {
    assertThat(StatMath.cohensD(new double[0], new double[] {1, 2})).isZero();
    assertThat(StatMath.cohensD(new double[] {4, 4}, new double[] {1, 1})).isZero();
    // a single observation per arm leaves no degrees of freedom
    assertThat(StatMath.cohensD(new double[] {4}, new double[] {1})).isZero();
  }

  @Test
  void tStatistic_isZeroWithoutSpread() {
    assertThat(StatMath.tStatistic(new double[] {2, 2}, new double[] {1, 1})).isZero();
    assertThat(StatMath.tStatistic(new double[0], new double[] {1, 1})).isZero();
  }

  @Test
  void approximatePValue_followsFixedBuckets() {
    assertThat(StatMath.approximatePValue(10.0, 0)).isEqualTo(1.0);
    assertThat(StatMath.approximatePValue(10.0, -1)).isEqualTo(1.0);
    assertThat(StatMath.approximatePValue(2.576, 4)).isEqualTo(0.01);
    assertThat(StatMath.approximatePValue(2.575, 4)).isEqualTo(0.05);
    assertThat(StatMath.approximatePValue(1.96, 4)).isEqualTo(0.05);
    assertThat(StatMath.approximatePValue(1.959, 4)).isEqualTo(0.1);
    assertThat(StatMath.approximatePValue(1.645, 4)).isEqualTo(0.1);
    assertThat(StatMath.approximatePValue(1.282, 4)).isEqualTo(0.2);
    assertThat(StatMath.approximatePValue(1.281, 4)).isEqualTo(0.5);
    assertThat(StatMath.approximatePValue(-3.0, 4)).isEqualTo(0.01);
  }

  @Test
  void confidenceInterval_usesCriticalValueTable() {
    Interval ci95 = StatMath.confidenceInterval(1.0, 0.5, 95);
    assertThat(ci95.lower()).isCloseTo(0.02, within(EPS));
    assertThat(ci95.upper()).isCloseTo(1.98, within(EPS));

    Interval ci99 = StatMath.confidenceInterval(0.0, 1.0, 99);
    assertThat(ci99.lower()).isCloseTo(-2.576, within(EPS));
    assertThat(ci99.upper()).isCloseTo(2.576, within(EPS));

    assertThat(StatMath.criticalValue(90)).isEqualTo(1.645);
    assertThat(StatMath.criticalValue(80)).isEqualTo(1.96);
  }
}
