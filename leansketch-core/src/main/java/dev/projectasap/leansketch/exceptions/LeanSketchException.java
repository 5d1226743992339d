/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.exceptions;

/** Base class of the errors raised by lean sketch operations. */
public class LeanSketchException extends RuntimeException {

  public LeanSketchException(String message) {
    super(message);
  }

  public LeanSketchException(String message, Throwable cause) {
    super(message, cause);
  }
}
