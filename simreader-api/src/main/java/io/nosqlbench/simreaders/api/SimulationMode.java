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

import java.util.Locale;

/// The simulation modes whose output can be read. Each mode has its own record schema.
public enum SimulationMode {
  /// time-dependent output, one record per time step
  TRANSIENT,
  /// criticality search output, one record per solver iteration
  K_EIGENVALUE,
  /// fixed-state output, one record per region or one for the whole problem
  STEADY_STATE;

  /// Parse a mode name leniently: case is ignored and `-` is accepted for `_`.
  /// @param name a name like `transient`, `k-eigenvalue` or `STEADY_STATE`
  /// @return the mode
  /// @throws IllegalArgumentException if the name matches no mode
  public static SimulationMode fromName(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    return SimulationMode.valueOf(normalized);
  }
}
