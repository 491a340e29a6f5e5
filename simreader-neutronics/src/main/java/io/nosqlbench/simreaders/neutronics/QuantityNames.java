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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Naming conventions for neutronics quantities: canonical spellings and the units assumed when
/// a simulation code prints a bare number.
final class QuantityNames {

  /// Quantity name prefix to default unit, tried in order
  private static final Map<String, String> FIELD_UNITS = new LinkedHashMap<>();

  static {
    FIELD_UNITS.put("power", "W");
    FIELD_UNITS.put("flux", "n/cm^2/s");
    FIELD_UNITS.put("temperature", "K");
    FIELD_UNITS.put("precursor", "1/cm^3");
  }

  private QuantityNames() {
  }

  /// @param raw a field name as written
  /// @param aliases canonical spelling of alternative names
  /// @return the name lower-cased, with `-` replaced by `_` and aliases resolved
  static String canonical(String raw, Map<String, String> aliases) {
    String name = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return aliases.getOrDefault(name, name);
  }

  /// @param name a canonical quantity name
  /// @return the default unit of the power, flux, temperature, precursor and reactivity
  ///     families, or null for anything else
  static String fieldUnit(String name) {
    if (name.equals("reactivity")) {
      return "pcm";
    }
    for (Map.Entry<String, String> entry : FIELD_UNITS.entrySet()) {
      if (name.startsWith(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }

  /// @param name a canonical quantity name
  /// @return true for the power and flux families
  static boolean isPowerOrFlux(String name) {
    return name.startsWith("power") || name.startsWith("flux");
  }
}
