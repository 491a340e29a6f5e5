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

/// Unit tag conventions shared by readers.
public final class Units {

  /// The tag used for quantities without a physical unit, such as k-effective.
  public static final String DIMENSIONLESS = "1";

  private Units() {
    // Utility class
  }

  /// Normalize a unit tag as written in simulation output. Surrounding brackets and
  /// whitespace are removed, so `[MW]`, `(MW)` and ` MW ` all become `MW`.
  /// @param raw the unit as written, may be null
  /// @return the normalized tag, or null if nothing remains
  public static String normalize(String raw) {
    if (raw == null) {
      return null;
    }
    String unit = raw.trim();
    while (unit.length() >= 2 && isBracketed(unit)) {
      unit = unit.substring(1, unit.length() - 1).trim();
    }
    return unit.isEmpty() ? null : unit;
  }

  private static boolean isBracketed(String unit) {
    char first = unit.charAt(0);
    char last = unit.charAt(unit.length() - 1);
    return (first == '[' && last == ']') || (first == '(' && last == ')');
  }
}
