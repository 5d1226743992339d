/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.sketches.lean;

import dev.projectasap.leansketch.datamodel.Precision;
import dev.projectasap.leansketch.exceptions.BufferTooSmallException;
import dev.projectasap.leansketch.exceptions.MalformedBufferException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary format of a {@link LeanMinHash}. All fields use the byte order chosen by the caller:
 *
 * <pre>
 * offset  size               field
 * 0       2                  width (number of hash values), unsigned
 * 2       1                  seed, unsigned
 * 3       1                  precision (bytes per hash value: 1, 2, 4 or 8)
 * 4       width * precision  hash values, unsigned
 * </pre>
 *
 * <p>{@link #serialize(LeanMinHash, byte[], ByteOrder, int)} touches only the bytes of its own
 * range, so sketches can be packed into one shared buffer by independent threads as long as their
 * ranges do not overlap.
 */
public final class LeanMinHashCodec {
  public static final int HEADER_BYTES = Short.BYTES + Byte.BYTES + Byte.BYTES;
  public static final int MAX_WIDTH = 0xFFFF;
  public static final int MAX_SEED = 0xFF;

  private static final int WIDTH_OFFSET = 0;
  private static final int SEED_OFFSET = 2;
  private static final int PRECISION_OFFSET = 3;

  private static final Logger logger = LoggerFactory.getLogger(LeanMinHashCodec.class);

  private LeanMinHashCodec() {}

  /** Number of bytes {@code serialize} writes for this sketch. */
  public static int byteSize(LeanMinHash sketch) {
    return HEADER_BYTES + sketch.length() * sketch.precision().bytes();
  }

  /** Serializes at the start of the buffer, in native byte order. */
  public static void serialize(LeanMinHash sketch, byte[] buffer) {
    serialize(sketch, buffer, ByteOrder.nativeOrder(), 0);
  }

  /** Serializes at the start of the buffer. */
  public static void serialize(LeanMinHash sketch, byte[] buffer, ByteOrder order) {
    serialize(sketch, buffer, order, 0);
  }

  /**
   * Writes the sketch into {@code buffer[offset, offset + byteSize(sketch))}.
   *
   * @param sketch sketch to write
   * @param buffer destination, possibly shared with other writers of disjoint ranges
   * @param order byte order of the multi-byte fields
   * @param offset first byte to write
   * @throws BufferTooSmallException if fewer than {@code byteSize(sketch)} bytes follow {@code
   *     offset}
   * @throws IllegalArgumentException if the offset is negative, or the seed or the width do not
   *     fit their header fields
   */
  public static void serialize(LeanMinHash sketch, byte[] buffer, ByteOrder order, int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset (" + offset + ") must be non-negative");
    }
    // The header has a single byte for the seed; larger seeds are refused rather than truncated.
    if (sketch.seed() > MAX_SEED) {
      throw new IllegalArgumentException(
          "Seed (" + sketch.seed() + ") does not fit the one-byte seed field (max " + MAX_SEED + ")");
    }
    if (sketch.length() > MAX_WIDTH) {
      throw new IllegalArgumentException(
          "Width (" + sketch.length() + ") does not fit the two-byte width field (max "
              + MAX_WIDTH + ")");
    }
    int size = byteSize(sketch);
    int available = Math.max(buffer.length - offset, 0);
    if (available < size) {
      throw new BufferTooSmallException(size, available);
    }

    Precision precision = sketch.precision();
    ByteBuffer out = ByteBuffer.wrap(buffer).order(order);
    out.putShort(offset + WIDTH_OFFSET, (short) sketch.length());
    out.put(offset + SEED_OFFSET, (byte) sketch.seed());
    out.put(offset + PRECISION_OFFSET, (byte) precision.bytes());

    int position = offset + HEADER_BYTES;
    for (int slot = 0; slot < sketch.length(); slot++) {
      precision.write(out, position, sketch.hashValue(slot));
      position += precision.bytes();
    }
  }

  /** Reads a sketch from the start of the buffer, in native byte order. */
  public static LeanMinHash deserialize(byte[] buffer) {
    return deserialize(buffer, ByteOrder.nativeOrder(), 0);
  }

  /** Reads a sketch from the start of the buffer. */
  public static LeanMinHash deserialize(byte[] buffer, ByteOrder order) {
    return deserialize(buffer, order, 0);
  }

  /**
   * Reads the sketch that starts at {@code offset}. The header is read first to learn width and
   * precision, then exactly {@code width * precision} bytes of hash values.
   *
   * @param buffer source, only read
   * @param order byte order the sketch was written with
   * @param offset first byte of the sketch
   * @return a new sketch owning its hash values
   * @throws MalformedBufferException if the buffer is shorter than the header declares, the width
   *     is zero, or the precision is not 1, 2, 4 or 8
   */
  public static LeanMinHash deserialize(byte[] buffer, ByteOrder order, int offset) {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset (" + offset + ") must be non-negative");
    }
    int available = Math.max(buffer.length - offset, 0);
    if (available < HEADER_BYTES) {
      throw malformed(
          "Truncated header at offset "
              + offset
              + ": need "
              + HEADER_BYTES
              + " bytes, "
              + available
              + " available");
    }

    ByteBuffer in = ByteBuffer.wrap(buffer).order(order);
    int width = Short.toUnsignedInt(in.getShort(offset + WIDTH_OFFSET));
    long seed = Byte.toUnsignedLong(in.get(offset + SEED_OFFSET));
    int precisionBytes = Byte.toUnsignedInt(in.get(offset + PRECISION_OFFSET));

    Precision precision;
    try {
      precision = Precision.ofBytes(precisionBytes);
    } catch (IllegalArgumentException e) {
      logger.debug("Rejecting buffer at offset {}: {}", offset, e.getMessage());
      throw new MalformedBufferException(
          "Unsupported precision byte " + precisionBytes + " at offset " + offset, e);
    }
    if (width == 0) {
      throw malformed("Sketch at offset " + offset + " declares zero slots");
    }

    int valueBytes = width * precision.bytes();
    if (available - HEADER_BYTES < valueBytes) {
      throw malformed(
          "Truncated sketch at offset "
              + offset
              + ": header declares "
              + width
              + " values of "
              + precision.bytes()
              + " byte(s), but only "
              + (available - HEADER_BYTES)
              + " bytes follow");
    }

    long[] hashValues = new long[width];
    int position = offset + HEADER_BYTES;
    for (int slot = 0; slot < width; slot++) {
      hashValues[slot] = precision.read(in, position);
      position += precision.bytes();
    }
    return LeanMinHash.fromTrustedFields(seed, precision, hashValues);
  }

  private static MalformedBufferException malformed(String message) {
    logger.debug("Rejecting buffer: {}", message);
    return new MalformedBufferException(message);
  }

  /**
   * Packs sketches back to back into one new buffer.
   *
   * @param sketches sketches to write, in order
   * @param order byte order of every sketch
   * @return buffer of exactly the summed byte sizes
   */
  public static byte[] serializeAll(List<LeanMinHash> sketches, ByteOrder order) {
    long total = 0;
    for (LeanMinHash sketch : sketches) {
      total += byteSize(sketch);
    }
    if (total > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          "Sketches need " + total + " bytes, more than a single array can hold");
    }

    byte[] buffer = new byte[(int) total];
    int offset = 0;
    for (LeanMinHash sketch : sketches) {
      serialize(sketch, buffer, order, offset);
      offset += byteSize(sketch);
    }
    logger.debug("Packed {} sketches into {} bytes ({})", sketches.size(), total, order);
    return buffer;
  }

  /**
   * Reads sketches packed back to back until the buffer is consumed.
   *
   * @throws MalformedBufferException if the trailing bytes do not form a complete sketch
   */
  public static List<LeanMinHash> deserializeAll(byte[] buffer, ByteOrder order) {
    List<LeanMinHash> sketches = new ArrayList<>();
    int offset = 0;
    while (offset < buffer.length) {
      LeanMinHash sketch = deserialize(buffer, order, offset);
      sketches.add(sketch);
      offset += byteSize(sketch);
    }
    logger.debug("Read {} sketches from {} bytes ({})", sketches.size(), buffer.length, order);
    return sketches;
  }
}
