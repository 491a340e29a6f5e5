/// Reader APIs for numerical simulation output.
///
/// A [io.nosqlbench.simreaders.api.SimulationReader] turns the text output of one simulation
/// mode into a single-pass, lazy sequence of [io.nosqlbench.simreaders.api.point.Point]s, and
/// reports what it consumed through [io.nosqlbench.simreaders.api.ReaderDiagnostics].
///
/// ## Key Components
///
/// - {@link io.nosqlbench.simreaders.api.SimulationReader}: the reader lifecycle and point sequence
/// - {@link io.nosqlbench.simreaders.api.SimulationMode}: the simulation modes readers exist for
/// - {@link io.nosqlbench.simreaders.api.OutputMode}: marks a reader implementation with its mode
/// - {@link io.nosqlbench.simreaders.api.ReaderCursor}: a position in the source, for diagnostics
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
