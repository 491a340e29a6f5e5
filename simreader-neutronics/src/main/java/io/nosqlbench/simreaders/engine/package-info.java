/// The line-oriented parsing engine shared by the simulation output readers.
///
/// A [io.nosqlbench.simreaders.engine.SchemaDrivenReader] owns the reader lifecycle, line
/// classification, unit resolution, duplicate handling and recovery. Each output format only
/// supplies a [io.nosqlbench.simreaders.engine.RecordSchema].
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
