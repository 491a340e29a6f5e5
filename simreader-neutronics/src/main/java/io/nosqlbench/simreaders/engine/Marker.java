package io.nosqlbench.simreaders.engine;

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

import io.nosqlbench.simreaders.api.point.PointIndex;

/// A line recognized by a [RecordSchema] as a record marker.
///
/// @param type whether the marker opens a new record or terminates the output
/// @param index the index stated by the marker, or null when the record carries it as a field
/// @param inline the `key=value` text following the marker keyword, possibly empty
public record Marker(Type type, PointIndex index, String inline) {

  /// Marker kinds
  public enum Type {
    /// closes the current record and opens the next one
    BOUNDARY,
    /// closes the current record and marks the last accepted one as final
    TERMINAL
  }

  public Marker {
    inline = inline == null ? "" : inline;
  }

  /// @param index the index stated by the marker, may be null
  /// @param inline the inline field text
  /// @return a boundary marker
  public static Marker boundary(PointIndex index, String inline) {
    return new Marker(Type.BOUNDARY, index, inline);
  }

  /// @param inline the inline field text
  /// @return a terminal marker
  public static Marker terminal(String inline) {
    return new Marker(Type.TERMINAL, null, inline);
  }
}
