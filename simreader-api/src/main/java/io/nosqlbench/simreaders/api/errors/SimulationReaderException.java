package io.nosqlbench.simreaders.api.errors;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.simreaders.api.ReaderCursor;

import java.util.Optional;

/// The base of all errors raised by simulation output readers.
public class SimulationReaderException extends RuntimeException {

  /// The source position the error was detected at, or null if not tied to a position
  private final ReaderCursor cursor;

  /// @param message the error message
  /// @param cause the underlying cause, may be null
  /// @param cursor the position of detection, may be null
  public SimulationReaderException(String message, Throwable cause, ReaderCursor cursor) {
    super(cursor != null ? message + " at " + cursor : message, cause);
    this.cursor = cursor;
  }

  /// @param message the error message
  public SimulationReaderException(String message) {
    this(message, null, null);
  }

  /// @return the position the error was detected at, if known
  public Optional<ReaderCursor> getCursor() {
    return Optional.ofNullable(cursor);
  }
}
