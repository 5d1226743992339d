/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.exceptions;

/** Thrown when sketches built with different seeds, widths or precisions are combined. */
public class IncompatibleSketchException extends LeanSketchException {

  public IncompatibleSketchException(String message) {
    super(message);
  }
}
