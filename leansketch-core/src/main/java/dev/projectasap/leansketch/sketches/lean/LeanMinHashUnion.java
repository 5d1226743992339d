/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.sketches.lean;

import org.apache.flink.api.common.functions.AggregateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregate function that reduces a stream of frozen MinHash sketches to their union, e.g. to
 * combine per-partition fingerprints of a window. All sketches of one aggregation must share seed,
 * width and precision.
 */
public class LeanMinHashUnion
    implements AggregateFunction<LeanMinHash, LeanMinHashUnionAccumulator, LeanMinHash> {
  private static final long serialVersionUID = 1L;
  private static final Logger logger = LoggerFactory.getLogger(LeanMinHashUnion.class);

  @Override
  public LeanMinHashUnionAccumulator createAccumulator() {
    return new LeanMinHashUnionAccumulator();
  }

  @Override
  public LeanMinHashUnionAccumulator add(LeanMinHash value, LeanMinHashUnionAccumulator acc) {
    return acc.add(value);
  }

  @Override
  public LeanMinHashUnionAccumulator merge(
      LeanMinHashUnionAccumulator a, LeanMinHashUnionAccumulator b) {
    return a.merge(b);
  }

  @Override
  public LeanMinHash getResult(LeanMinHashUnionAccumulator acc) {
    if (acc.isEmpty()) {
      logger.warn("Requested the union of an empty aggregation");
    } else {
      logger.debug("Union of {} sketches: {}", acc.getCount(), acc.getUnion());
    }
    return acc.getUnion();
  }
}
