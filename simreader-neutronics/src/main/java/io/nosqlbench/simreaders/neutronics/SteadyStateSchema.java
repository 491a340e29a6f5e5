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
import io.nosqlbench.simreaders.api.point.RegionIndex;
import io.nosqlbench.simreaders.engine.FieldTokenizer;
import io.nosqlbench.simreaders.engine.Marker;
import io.nosqlbench.simreaders.engine.RecordSchema;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Records of a single converged state, one per region or channel.
///
/// ```
/// REGION fuel_1
///   power = 3.2 MW
///   temperature_fuel = 900.0
/// REGION fuel_2
///   power = 3.1 MW
///```
///
/// Output without any `REGION id` or `CHANNEL id` line is a single aggregate state, reported
/// under [RegionIndex#AGGREGATE]. There is no axis to order by; each region may be reported
/// once, and a repeat of a region already emitted is a duplicate.
public class SteadyStateSchema implements RecordSchema {

  /// The field carrying the index
  public static final String REGION = "region";

  private static final Pattern REGION_MARKER = Pattern.compile(
      "^(?:REGION|CHANNEL)(?:\\s+|\\s*[#:]\\s*)([A-Za-z0-9_.\\-]+)(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Map<String, String> ALIASES = Map.of("channel", REGION);

  @Override
  public SimulationMode mode() {
    return SimulationMode.STEADY_STATE;
  }

  @Override
  public Optional<Marker> matchMarker(String line) {
    Matcher m = REGION_MARKER.matcher(line);
    if (!m.matches()) {
      return Optional.empty();
    }
    String rest = m.group(2);
    if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0)) && ":,;".indexOf(rest.charAt(0)) < 0) {
      return Optional.empty();
    }
    return Optional.of(Marker.boundary(new RegionIndex(m.group(1)), FieldTokenizer.inlineText(rest)));
  }

  @Override
  public String canonicalName(String raw) {
    return QuantityNames.canonical(raw, ALIASES);
  }

  @Override
  public boolean isIndexField(String canonicalName) {
    return REGION.equals(canonicalName);
  }

  @Override
  public PointIndex parseIndex(String raw) {
    return new RegionIndex(raw);
  }

  @Override
  public PointIndex implicitIndex(boolean sawBoundary) {
    return sawBoundary ? null : RegionIndex.AGGREGATE;
  }

  @Override
  public Optional<String> missingRequirement(Map<String, Double> values) {
    return values.isEmpty() ? Optional.of("no quantities") : Optional.empty();
  }

  @Override
  public Ordering checkOrder(PointIndex previous, PointIndex candidate) {
    return previous.equals(candidate) ? Ordering.DUPLICATE : Ordering.IN_ORDER;
  }

  @Override
  public boolean tracksReleasedIndices() {
    return true;
  }

  @Override
  public String defaultUnit(String canonicalName) {
    return QuantityNames.fieldUnit(canonicalName);
  }
}
