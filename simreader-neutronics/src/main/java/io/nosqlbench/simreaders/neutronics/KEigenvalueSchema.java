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
import io.nosqlbench.simreaders.api.point.IterationIndex;
import io.nosqlbench.simreaders.api.point.PointIndex;
import io.nosqlbench.simreaders.api.point.Units;
import io.nosqlbench.simreaders.engine.FieldTokenizer;
import io.nosqlbench.simreaders.engine.Marker;
import io.nosqlbench.simreaders.engine.RecordSchema;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Records of a criticality search, one per solver iteration.
///
/// ```
/// ITERATION 1: k_eff=1.01234 k_change=1.0e-2
/// ITERATION 2: k_eff=1.00511 k_change=7.2e-3
/// CONVERGED k_eff=1.00498
///```
///
/// A block starts at an `ITERATION n` or `OUTER ITERATION n` line, or a columnar row carries an
/// `iteration` column. Iterations count up by exactly one from the first accepted one. `k_eff`
/// is required. A `CONVERGED` line marks the last accepted iteration as the final eigenvalue;
/// nothing but comments and directives may follow it.
public class KEigenvalueSchema implements RecordSchema {

  /// The field carrying the index
  public static final String ITERATION = "iteration";
  /// The required quantity
  public static final String K_EFF = "k_eff";

  private static final Pattern ITERATION_MARKER = Pattern.compile(
      "^(?:OUTER\\s+)?ITERATION\\s*[#:]?\\s*(\\d+)\\b(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CONVERGED_MARKER =
      Pattern.compile("^CONVERGED\\b(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Map<String, String> ALIASES =
      Map.of("keff", K_EFF, "k", K_EFF, "iter", ITERATION);
  private static final Set<String> RATIOS = Set.of(K_EFF, "k_change", "phi_change", "shift");

  @Override
  public SimulationMode mode() {
    return SimulationMode.K_EIGENVALUE;
  }

  @Override
  public Optional<Marker> matchMarker(String line) {
    Matcher iteration = ITERATION_MARKER.matcher(line);
    if (iteration.matches()) {
      PointIndex index;
      try {
        index = parseIndex(iteration.group(1));
      } catch (NumberFormatException e) {
        // too large for an iteration count, left to the row rules
        return Optional.empty();
      }
      return Optional.of(Marker.boundary(index, FieldTokenizer.inlineText(iteration.group(2))));
    }
    Matcher converged = CONVERGED_MARKER.matcher(line);
    if (converged.matches()) {
      return Optional.of(Marker.terminal(FieldTokenizer.inlineText(converged.group(1))));
    }
    return Optional.empty();
  }

  @Override
  public String canonicalName(String raw) {
    return QuantityNames.canonical(raw, ALIASES);
  }

  @Override
  public boolean isIndexField(String canonicalName) {
    return ITERATION.equals(canonicalName);
  }

  @Override
  public PointIndex parseIndex(String raw) {
    return new IterationIndex(Integer.parseInt(raw.trim()));
  }

  @Override
  public Optional<String> missingRequirement(Map<String, Double> values) {
    return values.containsKey(K_EFF) ? Optional.empty() : Optional.of("no " + K_EFF);
  }

  @Override
  public Ordering checkOrder(PointIndex previous, PointIndex candidate) {
    int last = ((IterationIndex) previous).iteration();
    int next = ((IterationIndex) candidate).iteration();
    if (next == last) {
      return Ordering.DUPLICATE;
    }
    return next == last + 1 ? Ordering.IN_ORDER : Ordering.OUT_OF_ORDER;
  }

  @Override
  public String defaultUnit(String canonicalName) {
    return RATIOS.contains(canonicalName) ? Units.DIMENSIONLESS : QuantityNames.fieldUnit(canonicalName);
  }
}
