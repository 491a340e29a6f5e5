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

import io.nosqlbench.simreaders.api.ReaderCursor;

/// One line of simulation output, without its terminator.
///
/// @param text the line content; capped at [LineSource#MAX_LINE_LENGTH] characters
/// @param cursor the position of the first character of the line
/// @param overlong true if the line was longer than the cap and its text is incomplete
public record SourceLine(String text, ReaderCursor cursor, boolean overlong) {
}
