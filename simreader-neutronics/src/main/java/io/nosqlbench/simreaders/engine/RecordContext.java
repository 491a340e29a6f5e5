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
import io.nosqlbench.simreaders.api.point.PointIndex;

import java.util.LinkedHashMap;
import java.util.Map;

/// The record under construction between two boundaries.
final class RecordContext {

  private final ReaderCursor start;
  private final String firstLine;
  private final Map<String, Double> values = new LinkedHashMap<>();
  private final Map<String, String> units = new LinkedHashMap<>();
  private PointIndex index;
  private boolean indexFromField;

  RecordContext(ReaderCursor start, String firstLine, PointIndex markerIndex) {
    this.start = start;
    this.firstLine = firstLine;
    this.index = markerIndex;
  }

  ReaderCursor start() {
    return start;
  }

  String firstLine() {
    return firstLine;
  }

  PointIndex index() {
    return index;
  }

  boolean indexFromField() {
    return indexFromField;
  }

  void setIndexFromField(PointIndex index) {
    this.index = index;
    this.indexFromField = true;
  }

  boolean hasValue(String name) {
    return values.containsKey(name);
  }

  boolean hasValues() {
    return !values.isEmpty();
  }

  void put(String name, double value, String unit) {
    values.put(name, value);
    units.put(name, unit);
  }

  Map<String, Double> values() {
    return values;
  }

  Map<String, String> units() {
    return units;
  }
}
