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

/// The source could not be opened or broke while being read: a missing file, missing
/// permissions, or an I/O failure of the underlying stream. Always fatal.
public class SourceUnavailableException extends SimulationReaderException {

  private final String sourceName;

  /// @param sourceName the name of the source
  /// @param cause the underlying I/O failure, may be null
  public SourceUnavailableException(String sourceName, Throwable cause) {
    this(sourceName, cause, null);
  }

  /// @param sourceName the name of the source
  /// @param cause the underlying I/O failure, may be null
  /// @param cursor the position of the failure, if it happened mid-stream
  public SourceUnavailableException(String sourceName, Throwable cause, ReaderCursor cursor) {
    super(describe(sourceName, cause), cause, cursor);
    this.sourceName = sourceName;
  }

  /// @return the name of the source which failed
  public String getSourceName() {
    return sourceName;
  }

  private static String describe(String sourceName, Throwable cause) {
    String message = "Source unavailable: " + sourceName;
    if (cause != null && cause.getMessage() != null) {
      message += " (" + cause.getMessage() + ")";
    }
    return message;
  }
}
