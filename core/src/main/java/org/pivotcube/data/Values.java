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
package org.pivotcube.data;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;

/**
 * Canonical treatment of scalar values.
 *
 * <p>Every place that asks "are these two dimension values the same?"
 * (grouping, cuboid lookup, filter membership, highlighting, and
 * {@link Row#equals}) goes through {@link #key(Object)}. Numbers of any
 * boxed type and their decimal string forms share a key, so the integer
 * {@code 1}, the double {@code 1.0} and the string {@code "1"} are the same
 * value. Other strings are compared as-is; {@code "01"} and {@code "1"} are
 * different values.
 */
public final class Values {
  private Values() {}

  /** Default order of dimension values.
   *
   * <p>Nulls first, then numbers in numeric order, then all other values in
   * lexicographic order of their key. Numeric strings such as {@code "1"}
   * are not numbers, and sort with the labels. */
  public static final Comparator<@Nullable Object> ORDERING = Values::compare;

  /** Returns the canonical key of a value, or null if the value is null. */
  public static @Nullable String key(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return numberKey((Number) value);
    }
    return value.toString();
  }

  /** Returns whether two values have the same canonical key. */
  public static boolean equal(@Nullable Object v0, @Nullable Object v1) {
    return Objects.equals(key(v0), key(v1));
  }

  /** Compares two values according to {@link #ORDERING}. */
  public static int compare(@Nullable Object v0, @Nullable Object v1) {
    if (v0 == v1) {
      return 0;
    }
    if (v0 == null) {
      return -1;
    }
    if (v1 == null) {
      return 1;
    }
    final boolean n0 = isNumeric(v0);
    final boolean n1 = isNumeric(v1);
    if (n0 && n1) {
      return compareNumbers((Number) v0, (Number) v1);
    }
    if (n0) {
      return -1;
    }
    if (n1) {
      return 1;
    }
    return requireKey(v0).compareTo(requireKey(v1));
  }

  /** Returns whether a value is a number, and therefore sorts numerically. */
  public static boolean isNumeric(@Nullable Object value) {
    return value instanceof Number;
  }

  /** Returns whether a number has an integral boxed type. */
  public static boolean isIntegral(Number number) {
    return number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte
        || number instanceof BigInteger;
  }

  private static String requireKey(Object value) {
    return Objects.requireNonNull(key(value));
  }

  private static int compareNumbers(Number n0, Number n1) {
    final BigDecimal d0 = toBigDecimal(n0);
    final BigDecimal d1 = toBigDecimal(n1);
    if (d0 == null || d1 == null) {
      // NaN or infinite; Double.compare is a total order over them
      return Double.compare(n0.doubleValue(), n1.doubleValue());
    }
    return d0.compareTo(d1);
  }

  private static @Nullable BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    if (isIntegral(number)) {
      return BigDecimal.valueOf(number.longValue());
    }
    if (number instanceof Float) {
      final float f = number.floatValue();
      if (Float.isNaN(f) || Float.isInfinite(f)) {
        return null;
      }
      return new BigDecimal(Float.toString(f));
    }
    final double d = number.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return null;
    }
    return new BigDecimal(Double.toString(d));
  }

  private static String numberKey(Number number) {
    if (isIntegral(number) && !(number instanceof BigInteger)) {
      return Long.toString(number.longValue());
    }
    final BigDecimal decimal = toBigDecimal(number);
    if (decimal == null) {
      return Double.toString(number.doubleValue());
    }
    if (decimal.signum() == 0) {
      return "0";
    }
    return decimal.stripTrailingZeros().toPlainString();
  }
}

// End Values.java
