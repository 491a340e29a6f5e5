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

/// Reads eigenvalue iteration output, one point per iteration with its `k_eff` and convergence
/// metrics. Iterations are emitted counting up by one. When the output reports convergence the
/// final accepted iteration is emitted last, with
/// [io.nosqlbench.simreaders.api.point.Point#converged()] set.
@OutputMode(SimulationMode.K_EIGENVALUE)
public class KEigenvalueNeutronicsReader extends SchemaDrivenReader {

  public KEigenvalueNeutronicsReader() {
    this(ReaderConfig.defaults());
  }

  public KEigenvalueNeutronicsReader(ReaderConfig config) {
    super("k-eigenvalue-neutronics", new KEigenvalueSchema(), config);
  }
}
