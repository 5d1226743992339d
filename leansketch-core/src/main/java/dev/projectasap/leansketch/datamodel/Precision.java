/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.datamodel;

import java.nio.ByteBuffer;

/**
 * Number of bytes used to store one hash value of a MinHash. Every width-dependent operation
 * (bounds, reading, writing) dispatches on this enum, so slot values are always handled as
 * unsigned integers of exactly this width.
 */
public enum Precision {
  ONE(Byte.BYTES) {
    @Override
    public void write(ByteBuffer buffer, int index, long value) {
      buffer.put(index, (byte) value);
    }

    @Override
    public long read(ByteBuffer buffer, int index) {
      return Byte.toUnsignedLong(buffer.get(index));
    }
  },
  TWO(Short.BYTES) {
    @Override
    public void write(ByteBuffer buffer, int index, long value) {
      buffer.putShort(index, (short) value);
    }

    @Override
    public long read(ByteBuffer buffer, int index) {
      return Short.toUnsignedLong(buffer.getShort(index));
    }
  },
  FOUR(Integer.BYTES) {
    @Override
    public void write(ByteBuffer buffer, int index, long value) {
      buffer.putInt(index, (int) value);
    }

    @Override
    public long read(ByteBuffer buffer, int index) {
      return Integer.toUnsignedLong(buffer.getInt(index));
    }
  },
  EIGHT(Long.BYTES) {
    @Override
    public void write(ByteBuffer buffer, int index, long value) {
      buffer.putLong(index, value);
    }

    @Override
    public long read(ByteBuffer buffer, int index) {
      return buffer.getLong(index);
    }
  };

  private final int bytes;

  Precision(int bytes) {
    this.bytes = bytes;
  }

  /** Writes one slot value at an absolute buffer index, using the buffer's byte order. */
  public abstract void write(ByteBuffer buffer, int index, long value);

  /** Reads one slot value at an absolute buffer index, zero-extended to a long. */
  public abstract long read(ByteBuffer buffer, int index);

  public int bytes() {
    return bytes;
  }

  /**
   * Largest value a slot can hold, as an unsigned long. For {@link #EIGHT} this is {@code -1L},
   * i.e. 2^64 - 1.
   */
  public long maxValue() {
    return bytes == Long.BYTES ? -1L : (1L << (Byte.SIZE * bytes)) - 1;
  }

  /** Whether the unsigned value fits into this many bytes. */
  public boolean fits(long value) {
    return Long.compareUnsigned(value, maxValue()) <= 0;
  }

  /**
   * Looks up the precision for a byte count.
   *
   * @param bytes one of 1, 2, 4 or 8
   * @return the matching precision
   * @throws IllegalArgumentException for any other byte count
   */
  public static Precision ofBytes(int bytes) {
    for (Precision precision : values()) {
      if (precision.bytes == bytes) {
        return precision;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported precision (" + bytes + " bytes): must be 1, 2, 4 or 8");
  }

  /** Smallest precision that holds the value, read as unsigned. */
  public static Precision smallestFor(long value) {
    for (Precision precision : values()) {
      if (precision.fits(value)) {
        return precision;
      }
    }
    return EIGHT;
  }
}
