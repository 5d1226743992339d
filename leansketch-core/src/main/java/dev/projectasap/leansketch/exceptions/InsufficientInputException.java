/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.exceptions;

/** Thrown when a union is requested over fewer than two sketches. */
public class InsufficientInputException extends LeanSketchException {

  public InsufficientInputException(String message) {
    super(message);
  }
}
