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

import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.point.PointIndex;
import io.nosqlbench.simreaders.api.point.TimeIndex;
import io.nosqlbench.simreaders.engine.FieldTokenizer;
import io.nosqlbench.simreaders.engine.Marker;
import io.nosqlbench.simreaders.engine.RecordSchema;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Records of time-dependent output, one per time step.
///
/// ```
/// TIME STEP 1
///   time  = 0.0 s
///   power = 100.0 MW
///   flux_fast = 1.2e14
///```
///
/// A block starts at a `TIME STEP n` line (also `TIME_STEP n` or `TIMESTEP n`). The step number
/// only delimits the block: the index is the `time` field, which must not decrease from one
/// record to the next. A record needs at least one power or flux quantity.
public class TransientSchema implements RecordSchema {

  /// The field carrying the index
  public static final String TIME = "time";

  private static final Pattern TIME_STEP =
      Pattern.compile("^TIME[ _]?STEP\\s*[#:]?\\s*(\\d+)\\b(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Map<String, String> ALIASES = Map.of("t", TIME);

  @Override
  public SimulationMode mode() {
    return SimulationMode.TRANSIENT;
  }

  @Override
  public Optional<Marker> matchMarker(String line) {
    Matcher m = TIME_STEP.matcher(line);
    if (!m.matches()) {
      return Optional.empty();
    }
    return Optional.of(Marker.boundary(null, FieldTokenizer.inlineText(m.group(2))));
  }

  @Override
  public String canonicalName(String raw) {
    return QuantityNames.canonical(raw, ALIASES);
  }

  @Override
  public boolean isIndexField(String canonicalName) {
    return TIME.equals(canonicalName);
  }

  @Override
  public PointIndex parseIndex(String raw) {
    return new TimeIndex(FieldTokenizer.parseDouble(raw));
  }

  @Override
  public Optional<String> missingRequirement(Map<String, Double> values) {
    for (String name : values.keySet()) {
      if (QuantityNames.isPowerOrFlux(name)) {
        return Optional.empty();
      }
    }
    return Optional.of("no power or flux quantity");
  }

  @Override
  public Ordering checkOrder(PointIndex previous, PointIndex candidate) {
    int order = candidate.compareTo(previous);
    if (order == 0) {
      return Ordering.DUPLICATE;
    }
    return order > 0 ? Ordering.IN_ORDER : Ordering.OUT_OF_ORDER;
  }

  @Override
  public String defaultUnit(String canonicalName) {
    return TIME.equals(canonicalName) ? "s" : QuantityNames.fieldUnit(canonicalName);
  }
}
