package io.nosqlbench.simreaders.api;

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

/// A logical position within a simulation output source.
///
/// @param line the 1-based number of the line, 0 before the first line is read
/// @param offset the number of characters preceding the start of that line
public record ReaderCursor(long line, long offset) {

  /// The position of a reader which has not read anything yet
  public static final ReaderCursor START = new ReaderCursor(0, 0);

  public ReaderCursor {
    if (line < 0 || offset < 0) {
      throw new IllegalArgumentException("Cursor positions cannot be negative: line=" + line
                                         + ", offset=" + offset);
    }
  }

  @Override
  public String toString() {
    return "line " + line + " (offset " + offset + ")";
  }
}
