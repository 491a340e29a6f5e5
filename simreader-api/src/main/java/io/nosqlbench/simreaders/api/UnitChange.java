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

/// A mid-stream unit change declared by the source for a quantity which had already been emitted
/// with another unit. Points emitted after the change carry the new unit.
///
/// @param quantity the quantity name
/// @param from the unit used by earlier points
/// @param to the unit declared by the source
/// @param cursor the position of the declaration
public record UnitChange(String quantity, String from, String to, ReaderCursor cursor) {
}
