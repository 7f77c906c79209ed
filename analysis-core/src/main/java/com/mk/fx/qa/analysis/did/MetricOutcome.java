package com.mk.fx.qa.analysis.did;

import java.util.List;

/** Per-metric outcome of a DiD run: either an included result or an exclusion with reasons. */
public sealed interface MetricOutcome permits MetricOutcome.Included, MetricOutcome.Excluded {

  String metricId();

  record Included(String metricId, DidResult result) implements MetricOutcome {}

  record Excluded(String metricId, ExclusionReason reason, List<String> details)
      implements MetricOutcome {

    public Excluded {
      details = List.copyOf(details);
    }
  }
}
