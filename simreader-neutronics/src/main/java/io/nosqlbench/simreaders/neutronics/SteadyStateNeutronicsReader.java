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

/// Reads steady-state output: one point per region or channel, or a single aggregate point when
/// the output has no region blocks.
@OutputMode(SimulationMode.STEADY_STATE)
public class SteadyStateNeutronicsReader extends SchemaDrivenReader {

  public SteadyStateNeutronicsReader() {
    this(ReaderConfig.defaults());
  }

  /// @param config the reader configuration
  public SteadyStateNeutronicsReader(ReaderConfig config) {
    super("steady-state-neutronics", new SteadyStateSchema(), config);
  }
}
