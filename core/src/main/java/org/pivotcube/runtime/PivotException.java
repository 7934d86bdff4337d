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
package org.pivotcube.runtime;

import org.pivotcube.config.PivotSystemProperty;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all exceptions originating from PivotCube.
 *
 * @see CuboidComputeException
 */
public class PivotException extends RuntimeException {
  //~ Static fields/initializers ---------------------------------------------

  private static final long serialVersionUID = 4816203907310255614L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(PivotException.class);

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a new PivotException object.
   *
   * @param message error message
   * @param cause   underlying cause, or null
   */
  public PivotException(String message, @Nullable Throwable cause) {
    super(message, cause);

    LOGGER.trace("PivotException", this);
    if (PivotSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }

  /**
   * Creates a new PivotException object with no cause.
   *
   * @param message error message
   */
  public PivotException(String message) {
    this(message, null);
  }
}

// End PivotException.java
