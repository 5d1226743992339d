/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.sketches.lean;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLong;
import dev.projectasap.leansketch.datamodel.MinHashGenerator;
import dev.projectasap.leansketch.datamodel.Precision;
import dev.projectasap.leansketch.datamodel.SerializableToSink;
import dev.projectasap.leansketch.exceptions.IncompatibleSketchException;
import dev.projectasap.leansketch.exceptions.InsufficientInputException;
import java.io.Serializable;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

/**
 * Frozen MinHash. Holds only the seed and the hash values of a MinHash generator, which makes it
 * small and cheap to (de)serialize, and offers no way to add elements. To keep ingesting, update
 * the generator and take a new snapshot.
 *
 * <p>Hash values are unsigned integers of {@link #precision()} bytes, stored widened in a {@code
 * long[]}. Instances are immutable and safe to share between threads.
 */
public final class LeanMinHash implements SerializableToSink, Serializable {
  private static final long serialVersionUID = 1L;

  private final long seed;
  private final Precision precision;
  private final long[] hashValues;

  /**
   * Snapshots the current state of a generator. The hash values are copied, so later updates of
   * the generator are not visible through this sketch.
   *
   * @param generator the MinHash generator to freeze
   * @throws IllegalArgumentException if the seed is negative, there are no hash values, or a value
   *     does not fit the generator's precision
   */
  public LeanMinHash(MinHashGenerator generator) {
    this(validatedSeed(generator), validatedPrecision(generator), copyOfValues(generator));
    for (int i = 0; i < hashValues.length; i++) {
      if (!precision.fits(hashValues[i])) {
        throw new IllegalArgumentException(
            "Hash value "
                + Long.toUnsignedString(hashValues[i])
                + " at slot "
                + i
                + " does not fit in "
                + precision.bytes()
                + " byte(s)");
      }
    }
  }

  private LeanMinHash(long seed, Precision precision, long[] hashValues) {
    Preconditions.checkArgument(seed >= 0, "seed must be non-negative: %s", seed);
    Preconditions.checkNotNull(precision, "precision must be set");
    Preconditions.checkArgument(
        hashValues != null && hashValues.length > 0, "a sketch needs at least one slot");
    this.seed = seed;
    this.precision = precision;
    this.hashValues = hashValues;
  }

  /**
   * Builds a sketch from fields that are already known to be valid, skipping the per-value checks
   * of the public constructor. The array is owned by the new sketch from here on.
   */
  static LeanMinHash fromTrustedFields(long seed, Precision precision, long[] hashValues) {
    return new LeanMinHash(seed, precision, hashValues);
  }

  private static long validatedSeed(MinHashGenerator generator) {
    long seed = generator.seed();
    if (seed < 0) {
      throw new IllegalArgumentException("Seed (" + seed + ") must be non-negative");
    }
    return seed;
  }

  private static Precision validatedPrecision(MinHashGenerator generator) {
    Precision precision = generator.precision();
    if (precision == null) {
      throw new IllegalArgumentException("Generator precision must not be null");
    }
    return precision;
  }

  private static long[] copyOfValues(MinHashGenerator generator) {
    long[] values = generator.hashValues();
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("Generator must have at least one hash value");
    }
    return values.clone();
  }

  public long seed() {
    return seed;
  }

  public Precision precision() {
    return precision;
  }

  /** Number of slots (permutation functions). */
  public int length() {
    return hashValues.length;
  }

  /** Unsigned hash value of one slot. */
  public long hashValue(int slot) {
    return hashValues[slot];
  }

  /** Copy of all hash values. */
  public long[] hashValues() {
    return hashValues.clone();
  }

  /** A new sketch with its own copy of the hash values. */
  public LeanMinHash copy() {
    return fromTrustedFields(seed, precision, hashValues.clone());
  }

  /** Size of this sketch in the binary format of {@link LeanMinHashCodec}. */
  public int byteSize() {
    return LeanMinHashCodec.byteSize(this);
  }

  /**
   * Estimates the Jaccard similarity of the two underlying sets as the fraction of slots holding
   * the same hash value.
   *
   * @param other a sketch built with the same seed and number of permutations
   * @return estimate in [0, 1]
   * @throws IncompatibleSketchException if the seeds or the widths differ
   */
  public double jaccard(LeanMinHash other) {
    if (seed != other.seed) {
      throw new IncompatibleSketchException(
          "Cannot compare sketches with different seeds (" + seed + " vs " + other.seed + ")");
    }
    if (length() != other.length()) {
      throw new IncompatibleSketchException(
          "Cannot compare sketches with different numbers of slots ("
              + length()
              + " vs "
              + other.length()
              + ")");
    }
    int equal = 0;
    for (int i = 0; i < hashValues.length; i++) {
      if (hashValues[i] == other.hashValues[i]) {
        equal++;
      }
    }
    return (double) equal / hashValues.length;
  }

  /**
   * Union of sketches: every slot takes the minimum over all inputs, which is exactly the sketch
   * of the union of the underlying sets. The operation is commutative and associative.
   *
   * @param sketches at least two sketches sharing seed, width and precision
   * @return a new sketch
   * @throws InsufficientInputException if fewer than two sketches are given
   * @throws IncompatibleSketchException if seed, width or precision differ
   */
  public static LeanMinHash union(LeanMinHash... sketches) {
    return union(Arrays.asList(sketches));
  }

  /** See {@link #union(LeanMinHash...)}. */
  public static LeanMinHash union(List<LeanMinHash> sketches) {
    if (sketches.size() < 2) {
      throw new InsufficientInputException(
          "Cannot union less than 2 sketches, got " + sketches.size());
    }
    LeanMinHash first = Preconditions.checkNotNull(sketches.get(0), "sketch 0 is null");
    for (int i = 1; i < sketches.size(); i++) {
      LeanMinHash other = Preconditions.checkNotNull(sketches.get(i), "sketch %s is null", i);
      if (first.seed != other.seed
          || first.length() != other.length()
          || first.precision != other.precision) {
        throw new IncompatibleSketchException(
            "Sketches to union must share seed, width and precision: got "
                + first.describeShape()
                + " and "
                + other.describeShape()
                + " at position "
                + i);
      }
    }

    long[] minimum = first.hashValues.clone();
    for (int i = 1; i < sketches.size(); i++) {
      long[] values = sketches.get(i).hashValues;
      for (int slot = 0; slot < minimum.length; slot++) {
        if (Long.compareUnsigned(values[slot], minimum[slot]) < 0) {
          minimum[slot] = values[slot];
        }
      }
    }
    return fromTrustedFields(first.seed, first.precision, minimum);
  }

  private String describeShape() {
    return "(seed=" + seed + ", width=" + length() + ", precision=" + precision.bytes() + ")";
  }

  /** Little-endian binary form, see {@link LeanMinHashCodec}. */
  @Override
  public byte[] serializeToBytes() {
    byte[] buffer = new byte[byteSize()];
    LeanMinHashCodec.serialize(this, buffer, ByteOrder.LITTLE_ENDIAN, 0);
    return buffer;
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("seed", seed);
    jsonNode.put("width", length());
    jsonNode.put("precision", precision.bytes());

    ArrayNode valuesArray = objectMapper.createArrayNode();
    for (long value : hashValues) {
      if (value < 0) {
        // only reachable with 8-byte precision
        valuesArray.add(UnsignedLong.fromLongBits(value).bigIntegerValue());
      } else {
        valuesArray.add(value);
      }
    }
    jsonNode.set("hashvalues", valuesArray);
    return jsonNode;
  }

  /** Equal when seed and all hash values match. Precision is not compared. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LeanMinHash)) {
      return false;
    }
    LeanMinHash that = (LeanMinHash) o;
    return seed == that.seed && Arrays.equals(hashValues, that.hashValues);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(seed) + Arrays.hashCode(hashValues);
  }

  @Override
  public String toString() {
    return "LeanMinHash{"
        + "seed="
        + seed
        + ", width="
        + length()
        + ", precision="
        + precision.bytes()
        + '}';
  }
}
