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

import java.util.Objects;

/// A spatial region or channel index, used by steady-state output.
///
/// Region identifiers which are both integral order numerically, so that region `2` sorts before
/// region `10`. Other identifiers order lexically, after the numeric ones. The [#AGGREGATE]
/// sentinel sorts first.
///
/// @param region the region identifier, as written by the simulation code
public record RegionIndex(String region) implements PointIndex {

  /// The identifier used for output which describes the whole problem as one state
  public static final String AGGREGATE_ID = "*";

  /// The single index of an aggregate, region-less steady-state output
  public static final RegionIndex AGGREGATE = new RegionIndex(AGGREGATE_ID);

  public RegionIndex {
    Objects.requireNonNull(region, "region cannot be null");
    region = region.trim();
    if (region.isEmpty()) {
      throw new IllegalArgumentException("Region identifier cannot be blank");
    }
  }

  /// @return true if this is the [#AGGREGATE] sentinel
  public boolean isAggregate() {
    return AGGREGATE_ID.equals(region);
  }

  @Override
  public IndexKind kind() {
    return IndexKind.REGION;
  }

  @Override
  public String label() {
    return isAggregate() ? "aggregate" : "region " + region;
  }

  @Override
  public int compareWithinKind(PointIndex other) {
    RegionIndex that = (RegionIndex) other;
    if (isAggregate() || that.isAggregate()) {
      return Boolean.compare(that.isAggregate(), isAggregate());
    }
    Long mine = asNumber(region);
    Long theirs = asNumber(that.region);
    if (mine != null && theirs != null) {
      return Long.compare(mine, theirs);
    }
    if (mine != null) {
      return -1;
    }
    if (theirs != null) {
      return 1;
    }
    return region.compareTo(that.region);
  }

  private static Long asNumber(String id) {
    try {
      return Long.parseLong(id);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
