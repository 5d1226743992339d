/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.sketches.lean;

import dev.projectasap.leansketch.exceptions.InsufficientInputException;
import java.io.Serializable;

/**
 * Accumulator for {@link LeanMinHashUnion}. Holds the union of the sketches seen so far; sketches
 * are immutable, so every step replaces the held sketch instead of modifying it.
 */
public class LeanMinHashUnionAccumulator implements Serializable {
  private static final long serialVersionUID = 1L;

  private LeanMinHash union;
  private long count;

  /** Unions one more sketch into the accumulator. */
  public LeanMinHashUnionAccumulator add(LeanMinHash sketch) {
    union = union == null ? sketch : LeanMinHash.union(union, sketch);
    count++;
    return this;
  }

  /** Unions the partial result of another accumulator into this one. */
  public LeanMinHashUnionAccumulator merge(LeanMinHashUnionAccumulator other) {
    if (other.union != null) {
      union = union == null ? other.union : LeanMinHash.union(union, other.union);
      count += other.count;
    }
    return this;
  }

  public boolean isEmpty() {
    return union == null;
  }

  /** Number of sketches unioned into this accumulator. */
  public long getCount() {
    return count;
  }

  /**
   * @return the union of all added sketches
   * @throws InsufficientInputException if nothing was added
   */
  public LeanMinHash getUnion() {
    if (union == null) {
      throw new InsufficientInputException("No sketches were added to the union");
    }
    return union;
  }
}
