/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for sketches that can be written out to a sink. Provides byte array and JSON
 * serialization.
 */
public interface SerializableToSink {
  byte[] serializeToBytes();

  JsonNode serializeToJson();

  default String serializeToString() {
    return serializeToJson().toString();
  }
}
