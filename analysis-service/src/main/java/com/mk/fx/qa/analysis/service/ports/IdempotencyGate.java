package com.mk.fx.qa.analysis.service.ports;

import java.time.Instant;

/** Tells whether a given experiment result has already been analysed successfully. */
@FunctionalInterface
public interface IdempotencyGate {

  boolean alreadyProcessed(String experimentId, Instant generatedAt);
}
