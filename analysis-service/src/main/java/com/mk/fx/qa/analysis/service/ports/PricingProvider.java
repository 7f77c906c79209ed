package com.mk.fx.qa.analysis.service.ports;

import com.mk.fx.qa.analysis.service.model.MetricValue;
import java.util.Map;

/** Current dollar value per unit for every metric that has one, keyed by metric id. */
@FunctionalInterface
public interface PricingProvider {

  Map<String, MetricValue> currentValues();
}
