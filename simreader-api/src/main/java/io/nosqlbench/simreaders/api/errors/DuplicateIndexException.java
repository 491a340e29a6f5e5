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
import io.nosqlbench.simreaders.api.point.PointIndex;

/// The same index was seen twice, for example because a simulation restart repeated a time step.
/// Raised only when the duplicate index policy is `error`.
public class DuplicateIndexException extends SimulationReaderException {

  private final PointIndex index;

  /// @param index the repeated index
  /// @param cursor the position at which the repetition was detected
  public DuplicateIndexException(PointIndex index, ReaderCursor cursor) {
    super("Duplicate index " + index.label(), null, cursor);
    this.index = index;
  }

  /// @return the repeated index
  public PointIndex getIndex() {
    return index;
  }
}
