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

/// A row or block of the source violates the expectations of the reader's schema: a bad token
/// count, a non-numeric value, an unexpected ordering, a missing required quantity.
///
/// Raised only under the fail-fast recovery policy. Under the skip policy the same problems are
/// counted in the diagnostics instead.
public class MalformedRecordException extends SimulationReaderException {

  private final String reason;
  private final String line;

  /// @param reason what is wrong with the input
  /// @param cursor the position of the offending line
  /// @param line the offending line, may be null for whole-record problems
  public MalformedRecordException(String reason, ReaderCursor cursor, String line) {
    super(line != null ? "Malformed record: " + reason + " in '" + line + "'" : "Malformed record: " + reason,
          null, cursor);
    this.reason = reason;
    this.line = line;
  }

  /// @return what is wrong with the input
  public String getReason() {
    return reason;
  }

  /// @return the offending line, or null if the problem concerns a whole record
  public String getLine() {
    return line;
  }
}
