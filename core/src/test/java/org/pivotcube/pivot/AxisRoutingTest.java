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
package org.pivotcube.pivot;

import org.pivotcube.data.Measure;
import org.pivotcube.runtime.PivotException;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link AxisRouting} and {@link VisType}.
 */
class AxisRoutingTest {
  private static final List<String> ROWS = ImmutableList.of("a");
  private static final List<String> COLUMNS = ImmutableList.of("b", "c");
  private static final List<Measure> MEASURES =
      ImmutableList.of(Measure.of("x"), Measure.of("y"));

  @Test void testNumber() {
    final AxisRouting routing =
        AsyncCacheCube.deriveAxisRouting(VisType.NUMBER, ROWS, COLUMNS,
            MEASURES);
    assertThat(routing.nestRows, is(ImmutableList.of("a")));
    assertThat(routing.nestColumns, is(ImmutableList.of("b", "c")));
    assertThat(routing.facetFields.isEmpty(), is(true));
    assertThat(Measure.ids(routing.facetMeasures),
        is(ImmutableList.of("x", "y")));
    assertThat(Measure.ids(routing.viewMeasures),
        is(ImmutableList.of("x", "y")));
  }

  @Test void testBarAndLine() {
    for (VisType visType : new VisType[] {VisType.BAR, VisType.LINE}) {
      final AxisRouting routing =
          AxisRouting.derive(visType, ROWS, COLUMNS, MEASURES);
      assertThat(routing.nestRows, is(ImmutableList.of("a")));
      assertThat(routing.nestColumns, is(ImmutableList.of("b")));
      assertThat(routing.facetFields, is(ImmutableList.of("c")));
      assertThat(Measure.ids(routing.viewMeasures),
          is(ImmutableList.of("x", "y")));
    }
  }

  @Test void testScatter() {
    final AxisRouting routing =
        AxisRouting.derive(VisType.SCATTER, ROWS, COLUMNS, MEASURES);
    assertThat(routing.nestColumns, is(ImmutableList.of("b")));
    assertThat(routing.facetFields, is(ImmutableList.of("c")));
    assertThat(Measure.ids(routing.facetMeasures),
        is(ImmutableList.of("x", "y")));
    assertThat(Measure.ids(routing.viewMeasures), is(ImmutableList.of("y")));
  }

  @Test void testNoColumns() {
    final AxisRouting routing =
        AxisRouting.derive(VisType.BAR, ROWS, ImmutableList.of(),
            ImmutableList.of());
    assertThat(routing.nestColumns.isEmpty(), is(true));
    assertThat(routing.facetFields.isEmpty(), is(true));
    assertThat(routing.viewMeasures.isEmpty(), is(true));
  }

  @Test void testVisType() {
    assertThat(VisType.of("scatter"), is(VisType.SCATTER));
    assertThat(VisType.of("Number").isListPerCell(), is(false));
    assertThat(VisType.LINE.isListPerCell(), is(true));
    assertThrows(PivotException.class, () -> VisType.of("pie"));
  }
}

// End AxisRoutingTest.java
