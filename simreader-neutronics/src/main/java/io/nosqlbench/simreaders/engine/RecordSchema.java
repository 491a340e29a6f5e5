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

import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.point.PointIndex;

import java.util.Map;
import java.util.Optional;

/// The mode-specific rules a [SchemaDrivenReader] applies to simulation output: which lines are
/// record markers, which field carries the index, which quantities a record needs and how
/// consecutive indices must relate.
///
/// Implementations are stateless and can be shared between readers.
public interface RecordSchema {

  /// How a new index relates to the one before it
  enum Ordering {
    /// the index may follow the previous one
    IN_ORDER,
    /// the index repeats the previous one
    DUPLICATE,
    /// the index cannot follow the previous one
    OUT_OF_ORDER
  }

  /// @return the simulation mode described by this schema
  SimulationMode mode();

  /// @param line a trimmed line with any trailing comment removed
  /// @return the marker, if the line is one
  Optional<Marker> matchMarker(String line);

  /// Maps a field name as written to the name it is reported under. Names are case-insensitive,
  /// `-` and `_` are equivalent, and schema aliases are resolved.
  /// @param raw the field name as written
  /// @return the canonical name
  String canonicalName(String raw);

  /// @param canonicalName a canonical field name
  /// @return true if the field carries the record index rather than a quantity
  boolean isIndexField(String canonicalName);

  /// @param raw the value of an index field
  /// @return the index
  /// @throws IllegalArgumentException if the value is not a valid index
  PointIndex parseIndex(String raw);

  /// @param sawBoundary true if any boundary marker has been seen so far
  /// @return the index of a record which states none, or null if records must state one
  default PointIndex implicitIndex(boolean sawBoundary) {
    return null;
  }

  /// @param values the quantities of a closed record
  /// @return a description of the missing required quantity, if there is one
  Optional<String> missingRequirement(Map<String, Double> values);

  /// @param previous the index of the last accepted record
  /// @param candidate the index of the record being accepted
  /// @return how the candidate relates to the previous index
  Ordering checkOrder(PointIndex previous, PointIndex candidate);

  /// @return true if a repeated index must be detected against every record already emitted,
  ///     rather than only against the most recent one
  default boolean tracksReleasedIndices() {
    return false;
  }

  /// @param canonicalName a quantity name
  /// @return the unit assumed when nothing else states one, or null if the schema has none
  String defaultUnit(String canonicalName);
}
