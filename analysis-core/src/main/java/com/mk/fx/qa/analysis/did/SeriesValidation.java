package com.mk.fx.qa.analysis.did;

import java.util.List;

/**
 * Outcome of checking a metric series against the DiD data requirements.
 *
 * @param errors itemised problems, empty when the series is usable
 */
public record SeriesValidation(List<String> errors) {

  public SeriesValidation {
    errors = List.copyOf(errors);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
