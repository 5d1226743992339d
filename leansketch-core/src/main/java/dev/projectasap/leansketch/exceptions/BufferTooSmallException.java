/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.exceptions;

/** Thrown when a destination buffer cannot hold a serialized sketch at the requested offset. */
public class BufferTooSmallException extends LeanSketchException {
  private final int requiredBytes;
  private final int availableBytes;

  public BufferTooSmallException(int requiredBytes, int availableBytes) {
    super(
        "Buffer too small: need "
            + requiredBytes
            + " bytes but only "
            + availableBytes
            + " are available");
    this.requiredBytes = requiredBytes;
    this.availableBytes = availableBytes;
  }

  public int getRequiredBytes() {
    return requiredBytes;
  }

  public int getAvailableBytes() {
    return availableBytes;
  }
}
