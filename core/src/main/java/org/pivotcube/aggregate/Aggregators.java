/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pivotcube.aggregate;

import org.pivotcube.data.Row;
import org.pivotcube.data.Values;
import org.pivotcube.runtime.PivotException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Built-in {@link Aggregator} implementations, and a factory for custom
 * ones.
 */
public final class Aggregators {
  private Aggregators() {}

  /** Sums each field. Null values are skipped; an empty input sums to 0.
   * The sum is a {@link Long} if every value is integral, otherwise a
   * {@link Double}. An integral sum that does not fit in a {@code long} is
   * a {@link BigInteger}. */
  public static final Aggregator SUM = new SumAggregator();

  /** Counts records. The count is a {@link Long}, the same for every
   * field. */
  public static final Aggregator COUNT = new CountAggregator();

  /** Averages the non-null values of each field, as a {@link Double}. */
  public static final Aggregator MEAN = new MeanAggregator();

  /** Creates a named custom aggregator. */
  public static Aggregator custom(String name, AggregateFunction function) {
    return new CustomAggregator(name, function);
  }

  /** Returns the built-in aggregator with a given name, ignoring case.
   *
   * @throws PivotException if there is no such aggregator
   */
  public static Aggregator lookup(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
    case "sum":
      return SUM;
    case "count":
      return COUNT;
    case "mean":
    case "avg":
      return MEAN;
    default:
      throw new PivotException("Unknown aggregator '" + name + "'");
    }
  }

  /** Function that backs a custom aggregator. It has the same contract as
   * {@link Aggregator#aggregate}. */
  @FunctionalInterface
  public interface AggregateFunction {
    Row apply(List<Row> dataSource, List<String> fieldIds);
  }

  private static Number numericValue(Row row, String fieldId,
      Object value) {
    if (value instanceof Number) {
      return (Number) value;
    }
    throw new PivotException("Non-numeric value '" + value + "' of field '"
        + fieldId + "' in " + row);
  }

  /** Accumulates the sum of one field. Stays in {@code long} arithmetic
   * while every value is integral and the sum fits; moves to
   * {@link BigInteger} when it does not, and to {@code double} at the first
   * non-integral value. */
  private static class Sum {
    long longSum;
    /** Exact sum, once it has left the range of {@code long}, or once a
     * {@link BigInteger} value has been seen; otherwise null. */
    @Nullable BigInteger bigSum;
    double doubleSum;
    boolean integral = true;
    int count;

    void add(Number number) {
      ++count;
      if (integral && Values.isIntegral(number)) {
        addIntegral(number);
      } else {
        if (integral) {
          integral = false;
          doubleSum = integralDoubleValue();
        }
        doubleSum += number.doubleValue();
      }
    }

    private void addIntegral(Number number) {
      if (bigSum == null && !(number instanceof BigInteger)) {
        try {
          longSum = Math.addExact(longSum, number.longValue());
          return;
        } catch (ArithmeticException e) {
          bigSum = BigInteger.valueOf(longSum);
        }
      }
      if (bigSum == null) {
        bigSum = BigInteger.valueOf(longSum);
      }
      bigSum = bigSum.add(
          number instanceof BigInteger
              ? (BigInteger) number
              : BigInteger.valueOf(number.longValue()));
    }

    private double integralDoubleValue() {
      return bigSum == null ? longSum : bigSum.doubleValue();
    }

    Number value() {
      if (!integral) {
        return doubleSum;
      }
      if (bigSum == null) {
        return longSum;
      }
      return bigSum.bitLength() < Long.SIZE
          ? (Number) bigSum.longValue()
          : (Number) bigSum;
    }

    double doubleValue() {
      return integral ? integralDoubleValue() : doubleSum;
    }

    static Sum of(List<Row> dataSource, String fieldId) {
      final Sum sum = new Sum();
      for (Row row : dataSource) {
        final Object value = row.get(fieldId);
        if (value != null) {
          sum.add(numericValue(row, fieldId, value));
        }
      }
      return sum;
    }
  }

  /** Implementation of {@link #SUM}. */
  private static class SumAggregator implements Aggregator {
    @Override public AggregatorKind kind() {
      return AggregatorKind.SUM;
    }

    @Override public String name() {
      return "sum";
    }

    @Override public Row aggregate(List<Row> dataSource,
        List<String> fieldIds) {
      final Row.Builder builder = Row.builder();
      for (String fieldId : fieldIds) {
        builder.set(fieldId, Sum.of(dataSource, fieldId).value());
      }
      return builder.build();
    }

    @Override public String toString() {
      return name();
    }
  }

  /** Implementation of {@link #COUNT}. */
  private static class CountAggregator implements Aggregator {
    @Override public AggregatorKind kind() {
      return AggregatorKind.COUNT;
    }

    @Override public String name() {
      return "count";
    }

    @Override public Row aggregate(List<Row> dataSource,
        List<String> fieldIds) {
      final Row.Builder builder = Row.builder();
      for (String fieldId : fieldIds) {
        builder.set(fieldId, (long) dataSource.size());
      }
      return builder.build();
    }

    @Override public String toString() {
      return name();
    }
  }

  /** Implementation of {@link #MEAN}. */
  private static class MeanAggregator implements Aggregator {
    @Override public AggregatorKind kind() {
      return AggregatorKind.MEAN;
    }

    @Override public String name() {
      return "mean";
    }

    @Override public Row aggregate(List<Row> dataSource,
        List<String> fieldIds) {
      final Row.Builder builder = Row.builder();
      for (String fieldId : fieldIds) {
        final Sum sum = Sum.of(dataSource, fieldId);
        if (sum.count > 0) {
          builder.set(fieldId, sum.doubleValue() / sum.count);
        }
      }
      return builder.build();
    }

    @Override public String toString() {
      return name();
    }
  }

  /** Aggregator that delegates to a named function. */
  private static class CustomAggregator implements Aggregator {
    private final String name;
    private final AggregateFunction function;

    CustomAggregator(String name, AggregateFunction function) {
      this.name = requireNonNull(name, "name");
      this.function = requireNonNull(function, "function");
    }

    @Override public AggregatorKind kind() {
      return AggregatorKind.CUSTOM;
    }

    @Override public String name() {
      return name;
    }

    @Override public Row aggregate(List<Row> dataSource,
        List<String> fieldIds) {
      return requireNonNull(function.apply(dataSource, fieldIds),
          () -> "custom aggregator '" + name + "' returned null");
    }

    @Override public int hashCode() {
      return Objects.hash(name, function);
    }

    @Override public boolean equals(@Nullable Object obj) {
      return obj == this
          || obj instanceof CustomAggregator
          && name.equals(((CustomAggregator) obj).name)
          && function.equals(((CustomAggregator) obj).function);
    }

    @Override public String toString() {
      return name;
    }
  }
}

// End Aggregators.java
