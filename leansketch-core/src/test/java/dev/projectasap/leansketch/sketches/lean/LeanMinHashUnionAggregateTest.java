/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.leansketch.sketches.lean;

import static dev.projectasap.leansketch.utils.TestUtils.sketch;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.projectasap.leansketch.datamodel.Precision;
import dev.projectasap.leansketch.exceptions.IncompatibleSketchException;
import dev.projectasap.leansketch.exceptions.InsufficientInputException;
import org.junit.jupiter.api.Test;

class LeanMinHashUnionAggregateTest {

  private final LeanMinHashUnion function = new LeanMinHashUnion();

  @Test
  void testSingleSketchPassesThrough() {
    LeanMinHash a = sketch(42, Precision.FOUR, 5, 9, 2, 7);
    LeanMinHashUnionAccumulator acc = function.add(a, function.createAccumulator());

    assertSame(a, function.getResult(acc));
    assertEquals(1, acc.getCount());
  }

  @Test
  void testAddUnionsSketches() {
    LeanMinHashUnionAccumulator acc = function.createAccumulator();
    acc = function.add(sketch(42, Precision.FOUR, 5, 9, 2, 7), acc);
    acc = function.add(sketch(42, Precision.FOUR, 3, 10, 1, 8), acc);
    acc = function.add(sketch(42, Precision.FOUR, 4, 4, 4, 4), acc);

    assertArrayEquals(new long[] {3, 4, 1, 4}, function.getResult(acc).hashValues());
    assertEquals(3, acc.getCount());
  }

  @Test
  void testMergePartialAccumulators() {
    LeanMinHashUnionAccumulator left =
        function.add(sketch(42, Precision.FOUR, 5, 9, 2, 7), function.createAccumulator());
    LeanMinHashUnionAccumulator right =
        function.add(sketch(42, Precision.FOUR, 3, 10, 1, 8), function.createAccumulator());
    LeanMinHashUnionAccumulator empty = function.createAccumulator();

    LeanMinHashUnionAccumulator merged = function.merge(function.merge(left, empty), right);

    assertArrayEquals(new long[] {3, 9, 1, 7}, function.getResult(merged).hashValues());
    assertEquals(2, merged.getCount());

    LeanMinHashUnionAccumulator fromEmpty =
        function.merge(
            function.createAccumulator(),
            function.add(sketch(42, Precision.FOUR, 1, 1, 1, 1), function.createAccumulator()));
    assertArrayEquals(new long[] {1, 1, 1, 1}, function.getResult(fromEmpty).hashValues());
  }

  @Test
  void testEmptyAggregation() {
    LeanMinHashUnionAccumulator acc = function.createAccumulator();

    assertTrue(acc.isEmpty());
    assertThrows(InsufficientInputException.class, () -> function.getResult(acc));
  }

  @Test
  void testIncompatibleSketchInStream() {
    LeanMinHashUnionAccumulator acc =
        function.add(sketch(42, Precision.FOUR, 5, 9, 2, 7), function.createAccumulator());

    assertThrows(
        IncompatibleSketchException.class,
        () -> function.add(sketch(43, Precision.FOUR, 5, 9, 2, 7), acc));
    assertEquals(1, acc.getCount());
  }
}
