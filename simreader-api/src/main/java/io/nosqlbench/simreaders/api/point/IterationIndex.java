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

/// An eigenvalue solver iteration index, used by k-eigenvalue output.
///
/// @param iteration the iteration number, zero or greater
public record IterationIndex(int iteration) implements PointIndex {

  public IterationIndex {
    if (iteration < 0) {
      throw new IllegalArgumentException("Iteration index cannot be negative: " + iteration);
    }
  }

  /// @return the index of the iteration following this one
  public IterationIndex next() {
    return new IterationIndex(Math.addExact(iteration, 1));
  }

  @Override
  public IndexKind kind() {
    return IndexKind.ITERATION;
  }

  @Override
  public String label() {
    return "iteration " + iteration;
  }

  @Override
  public int compareWithinKind(PointIndex other) {
    return Integer.compare(iteration, ((IterationIndex) other).iteration);
  }
}
