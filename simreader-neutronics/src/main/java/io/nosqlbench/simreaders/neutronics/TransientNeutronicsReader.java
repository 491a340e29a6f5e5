package io.nosqlbench.simreaders.neutronics;

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

import io.nosqlbench.simreaders.api.OutputMode;
import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import io.nosqlbench.simreaders.engine.SchemaDrivenReader;

/// Reads time-dependent neutronics output into one [io.nosqlbench.simreaders.api.point.Point]
/// per time step, indexed by simulation time.
///
/// Points are emitted in non-decreasing time order. A block whose time is lower than the one
/// before it is malformed; a block repeating the previous time, as a simulation restart does, is
/// resolved by the duplicate index policy.
///
/// @see TransientSchema
@OutputMode(SimulationMode.TRANSIENT)
public class TransientNeutronicsReader extends SchemaDrivenReader {

  /// Create a reader with the default configuration
  public TransientNeutronicsReader() {
    this(ReaderConfig.defaults());
  }

  /// @param config the reader configuration
  public TransientNeutronicsReader(ReaderConfig config) {
    super("transient-neutronics", new TransientSchema(), config);
  }
}
