/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.datamodel;

/**
 * Read side of a mutable MinHash builder. The builder owns the permutation functions and ingests
 * elements; a lean sketch only takes a snapshot of the state exposed here.
 *
 * <p>Implementations may return their live backing array from {@link #hashValues()}: callers
 * that keep the values are responsible for copying them.
 */
public interface MinHashGenerator {

  /** Seed that selected the permutation functions. */
  long seed();

  /** Bytes per hash value. */
  Precision precision();

  /** Current hash values, one per permutation function, as unsigned integers. */
  long[] hashValues();
}
