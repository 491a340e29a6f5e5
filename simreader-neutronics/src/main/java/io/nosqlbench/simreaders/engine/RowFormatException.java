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

/// Signals that a single line does not tokenize or coerce as expected. The engine turns this into
/// a skipped row or a malformed record error according to the recovery policy.
class RowFormatException extends Exception {

  RowFormatException(String reason) {
    super(reason);
  }

  RowFormatException(String reason, Throwable cause) {
    super(reason, cause);
  }
}
