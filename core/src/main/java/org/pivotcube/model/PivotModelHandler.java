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
package org.pivotcube.model;

import org.pivotcube.aggregate.Aggregators;
import org.pivotcube.data.Measure;
import org.pivotcube.pivot.PivotView;
import org.pivotcube.pivot.VisType;
import org.pivotcube.runtime.PivotException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Reads a pivot view model from JSON.
 *
 * <p>The parser is lenient: field names need not be quoted, strings may be
 * in single quotes, and comments are allowed.
 *
 * @see JsonPivotView
 */
public class PivotModelHandler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PivotModelHandler.class);

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
      .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
      .configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true)
      .configure(JsonParser.Feature.ALLOW_COMMENTS, true);

  private PivotModelHandler() {}

  /** Parses a model held in a string. */
  public static PivotView parse(String json) throws IOException {
    return convert(JSON_MAPPER.readValue(json, JsonPivotView.class));
  }

  /** Parses a model held in a file. */
  public static PivotView parse(File file) throws IOException {
    LOGGER.debug("Reading pivot view model from {}", file);
    return convert(JSON_MAPPER.readValue(file, JsonPivotView.class));
  }

  /** Converts a model to a view.
   *
   * @throws PivotException if the model names an unknown visualization
   *   type or aggregator, a measure has no name, or a list or one of its
   *   elements is null
   */
  public static PivotView convert(JsonPivotView jsonView) {
    final ImmutableList.Builder<Measure> measures = ImmutableList.builder();
    for (JsonPivotMeasure jsonMeasure
        : checkList(jsonView.measures, "measures")) {
      measures.add(convert(jsonMeasure));
    }
    final VisType visType = jsonView.visType == null
        ? VisType.NUMBER
        : VisType.of(jsonView.visType);
    return new PivotView(visType, checkList(jsonView.rows, "rows"),
        checkList(jsonView.columns, "columns"), measures.build());
  }

  private static <E> List<E> checkList(@Nullable List<E> list, String name) {
    if (list == null) {
      throw new PivotException("Pivot view '" + name + "' must not be null");
    }
    for (E e : list) {
      if (e == null) {
        throw new PivotException("Pivot view '" + name
            + "' must not contain null");
      }
    }
    return list;
  }

  private static Measure convert(JsonPivotMeasure jsonMeasure) {
    if (jsonMeasure.name == null) {
      throw new PivotException("Measure must have a name");
    }
    return Measure.of(jsonMeasure.name,
        Aggregators.lookup(jsonMeasure.agg == null ? "sum" : jsonMeasure.agg));
  }
}

// End PivotModelHandler.java
