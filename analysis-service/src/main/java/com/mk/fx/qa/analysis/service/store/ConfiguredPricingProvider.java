package com.mk.fx.qa.analysis.service.store;

import com.mk.fx.qa.analysis.service.cfg.PricingCfg;
import com.mk.fx.qa.analysis.service.model.MetricValue;
import com.mk.fx.qa.analysis.service.ports.PricingProvider;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Serves metric values bound from {@code analysis.pricing.metrics}. Values can be replaced at
 * runtime; each replacement bumps the metric's version.
 */
@Slf4j
@Component
public class ConfiguredPricingProvider implements PricingProvider {

  private final Map<String, MetricValue> values = new ConcurrentHashMap<>();

  public ConfiguredPricingProvider(PricingCfg cfg) {
    cfg.getMetrics().forEach((metricId, value) -> values.put(metricId, normalise(metricId, value)));
    log.info("Loaded economic values for {} metrics", values.size());
  }

  @Override
  public Map<String, MetricValue> currentValues() {
    Map<String, MetricValue> copy = new LinkedHashMap<>();
    values.forEach((metricId, value) -> copy.put(metricId, copyOf(value)));
    return copy;
  }

  /** Replaces the value for a metric and returns the stored copy. */
  public MetricValue update(String metricId, MetricValue value) {
    MetricValue stored =
        values.compute(
            metricId,
            (id, previous) -> {
              MetricValue next = normalise(id, value);
              next.setVersion(previous == null ? 1 : previous.getVersion() + 1);
              return next;
            });
    log.info(
        "Updated economic value for {} to {} per {} (version {})",
        metricId,
        stored.getDollarsPerUnit(),
        stored.getUnit(),
        stored.getVersion());
    return copyOf(stored);
  }

  public Set<String> metricIds() {
    return Set.copyOf(values.keySet());
  }

  private static MetricValue normalise(String metricId, MetricValue value) {
    MetricValue copy = copyOf(value);
    copy.setMetricId(metricId);
    if (copy.getName() == null) {
      copy.setName(metricId);
    }
    return copy;
  }

  private static MetricValue copyOf(MetricValue v) {
    return new MetricValue(
        v.getMetricId(),
        v.getDollarsPerUnit(),
        v.getUnit(),
        v.getName(),
        v.getDescription(),
        v.getCategory(),
        v.getLastUpdated(),
        v.getVersion());
  }
}
