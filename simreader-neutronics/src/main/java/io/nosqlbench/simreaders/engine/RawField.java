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

/// A named field as tokenized from a line, before numeric coercion.
///
/// @param name the field name as written
/// @param raw the value token as written
/// @param unit the unit stated next to the value or in a column declaration, or null
public record RawField(String name, String raw, String unit) {
}
