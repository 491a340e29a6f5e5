package io.nosqlbench.simreaders.api.point;

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

import org.jetbrains.annotations.NotNull;

/// The position key of a [Point] within the indexing space of a simulation run.
///
/// Each simulation mode uses its own kind of index:
/// - transient output is indexed by simulation time, see [TimeIndex]
/// - k-eigenvalue output is indexed by solver iteration, see [IterationIndex]
/// - steady-state output is indexed by region or channel, see [RegionIndex]
///
/// Indices are totally ordered. Indices of different kinds order by their [IndexKind], indices of
/// the same kind by their value.
public interface PointIndex extends Comparable<PointIndex> {

  /// @return the kind of axis this index lives on
  IndexKind kind();

  /// @return a short human readable rendering of this index, for messages and logs
  String label();

  /// Compare with another index of the same [#kind()].
  /// @param other an index whose kind equals this one's
  /// @return a negative, zero or positive value as with [Comparable#compareTo(Object)]
  int compareWithinKind(PointIndex other);

  @Override
  default int compareTo(@NotNull PointIndex other) {
    int byKind = kind().compareTo(other.kind());
    if (byKind != 0) {
      return byKind;
    }
    return compareWithinKind(other);
  }
}
