package io.nosqlbench.simreaders.api.point;

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

/// The axis a [PointIndex] is measured on. Declaration order is the cross-kind sort order.
public enum IndexKind {
  /// simulation time, in the time unit of the source
  TIME,
  /// eigenvalue solver iteration number
  ITERATION,
  /// spatial region or channel identifier
  REGION
}
