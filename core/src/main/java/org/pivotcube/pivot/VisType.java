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

import org.pivotcube.runtime.PivotException;

import java.util.Locale;

/**
 * Kind of visualization drawn in each cell of a pivot table.
 */
public enum VisType {
  /** One aggregate value per cell. */
  NUMBER(false),
  BAR(true),
  LINE(true),
  /** Like {@link #BAR}, but plots only the last measure. */
  SCATTER(true);

  private final boolean listPerCell;

  VisType(boolean listPerCell) {
    this.listPerCell = listPerCell;
  }

  /** Returns whether each cell holds a list of records, faceted by a
   * dimension drawn inside the cell, rather than one record. */
  public boolean isListPerCell() {
    return listPerCell;
  }

  /** Returns the visualization type with a given name, ignoring case.
   *
   * @throws PivotException if there is no such type
   */
  public static VisType of(String name) {
    for (VisType visType : values()) {
      if (visType.name().equals(name.toUpperCase(Locale.ROOT))) {
        return visType;
      }
    }
    throw new PivotException("Unknown visualization type '" + name + "'");
  }
}

// End VisType.java
