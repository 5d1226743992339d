/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.exceptions;

/**
 * Thrown when a source buffer does not hold a valid serialized sketch: it is shorter than its
 * header declares, or the header carries an unsupported precision.
 */
public class MalformedBufferException extends LeanSketchException {

  public MalformedBufferException(String message) {
    super(message);
  }

  public MalformedBufferException(String message, Throwable cause) {
    super(message, cause);
  }
}
