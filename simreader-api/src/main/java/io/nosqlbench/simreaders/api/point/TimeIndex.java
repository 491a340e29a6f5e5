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

/// A simulation time index, used by transient output.
///
/// @param time the simulation time; must be finite. Negative zero is normalized to zero so that
///     equality and ordering agree.
public record TimeIndex(double time) implements PointIndex {

  public TimeIndex {
    if (!Double.isFinite(time)) {
      throw new IllegalArgumentException("Time index must be finite: " + time);
    }
    time = time + 0.0d;
  }

  @Override
  public IndexKind kind() {
    return IndexKind.TIME;
  }

  @Override
  public String label() {
    return "t=" + time;
  }

  @Override
  public int compareWithinKind(PointIndex other) {
    return Double.compare(time, ((TimeIndex) other).time);
  }
}
