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

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/// One sampled measurement extracted from simulation output.
///
/// A point pairs an [PointIndex] with named physical quantities and the unit tag of each. Every
/// quantity in [#values()] has exactly one entry in [#units()], and the two key sets are equal.
/// Absent quantities are simply not present; there are no null placeholders.
///
/// Points are immutable. Transformations such as [#select(String...)] or
/// [#rescale(String, double, String)] return new points.
///
/// Points order by index, then by their sorted `(name, value)` entries, then by the converged
/// flag, so that consumers can sort and de-duplicate deterministically.
///
/// @param index the position of this sample, never null
/// @param values quantity name to value
/// @param units quantity name to unit tag, covering exactly the keys of `values`
/// @param converged true if this is the terminal, accepted point of an iterative solve
public record Point(
    PointIndex index,
    Map<String, Double> values,
    Map<String, String> units,
    boolean converged
) implements Comparable<Point> {

  public Point {
    Objects.requireNonNull(index, "A point requires an index");
    Objects.requireNonNull(values, "values cannot be null");
    Objects.requireNonNull(units, "units cannot be null");

    SortedMap<String, Double> valueCopy = new TreeMap<>();
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      String name = requireName(entry.getKey());
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Quantity '" + name + "' has a null value");
      }
      valueCopy.put(name, entry.getValue());
    }

    SortedMap<String, String> unitCopy = new TreeMap<>();
    for (Map.Entry<String, String> entry : units.entrySet()) {
      String name = requireName(entry.getKey());
      String unit = entry.getValue();
      if (unit == null || unit.isBlank()) {
        throw new IllegalArgumentException("Quantity '" + name + "' has a blank unit");
      }
      unitCopy.put(name, unit);
    }

    if (!valueCopy.keySet().equals(unitCopy.keySet())) {
      throw new IllegalArgumentException(
          "Units " + unitCopy.keySet() + " do not match quantities " + valueCopy.keySet() + " at "
          + index.label());
    }

    values = Collections.unmodifiableSortedMap(valueCopy);
    units = Collections.unmodifiableSortedMap(unitCopy);
  }

  /// Create a non-converged point.
  /// @param index the index
  /// @param values the values
  /// @param units the units, covering every value
  public Point(PointIndex index, Map<String, Double> values, Map<String, String> units) {
    this(index, values, units, false);
  }

  /// Create a point, filling in units which are not given explicitly.
  /// @param index the index
  /// @param values the values
  /// @param units explicit units; may cover only some of the values
  /// @param defaultUnit supplies the unit for any value without an explicit one
  /// @return a new non-converged point
  public static Point of(
      PointIndex index,
      Map<String, Double> values,
      Map<String, String> units,
      Function<String, String> defaultUnit
  )
  {
    Map<String, String> resolved = new TreeMap<>();
    for (String name : values.keySet()) {
      String unit = units.get(name);
      resolved.put(name, unit != null ? unit : defaultUnit.apply(name));
    }
    return new Point(index, values, resolved, false);
  }

  /// @param name the quantity name
  /// @return the value, or null if this point does not carry the quantity
  public Double value(String name) {
    return values.get(name);
  }

  /// @param name the quantity name
  /// @return the unit tag, or null if this point does not carry the quantity
  public String unit(String name) {
    return units.get(name);
  }

  /// @param name the quantity name
  /// @return true if the quantity is present
  public boolean has(String name) {
    return values.containsKey(name);
  }

  /// @return the quantity names of this point, sorted
  public Set<String> quantities() {
    return values.keySet();
  }

  /// @param names the quantities to keep
  /// @return a new point with only the named quantities which are present
  public Point select(String... names) {
    Set<String> keep = Set.copyOf(Arrays.asList(names));
    Map<String, Double> v = new TreeMap<>(values);
    v.keySet().retainAll(keep);
    Map<String, String> u = new TreeMap<>(units);
    u.keySet().retainAll(keep);
    return new Point(index, v, u, converged);
  }

  /// @param names the quantities to drop
  /// @return a new point without the named quantities
  public Point without(String... names) {
    Map<String, Double> v = new TreeMap<>(values);
    Map<String, String> u = new TreeMap<>(units);
    for (String name : names) {
      v.remove(name);
      u.remove(name);
    }
    return new Point(index, v, u, converged);
  }

  /// @param name the quantity to add or replace
  /// @param value its value
  /// @param unit its unit tag
  /// @return a new point carrying the quantity
  public Point withValue(String name, double value, String unit) {
    Map<String, Double> v = new TreeMap<>(values);
    Map<String, String> u = new TreeMap<>(units);
    v.put(name, value);
    u.put(name, unit);
    return new Point(index, v, u, converged);
  }

  /// Multiply one quantity by a factor and retag its unit, for example to go from `W` to `MW`
  /// with a factor of `1e-6`.
  /// @param name the quantity to rescale
  /// @param factor the multiplier
  /// @param newUnit the unit of the rescaled value
  /// @return a new point with the rescaled quantity
  /// @throws IllegalArgumentException if the quantity is not present
  public Point rescale(String name, double factor, String newUnit) {
    Double current = values.get(name);
    if (current == null) {
      throw new IllegalArgumentException("No quantity '" + name + "' at " + index.label());
    }
    return withValue(name, current * factor, newUnit);
  }

  /// @return a copy of this point marked as the converged, terminal point
  public Point asConverged() {
    return converged ? this : new Point(index, values, units, true);
  }

  @Override
  public int compareTo(@NotNull Point other) {
    int byIndex = index.compareTo(other.index);
    if (byIndex != 0) {
      return byIndex;
    }
    Iterator<Map.Entry<String, Double>> mine = values.entrySet().iterator();
    Iterator<Map.Entry<String, Double>> theirs = other.values.entrySet().iterator();
    while (mine.hasNext() && theirs.hasNext()) {
      Map.Entry<String, Double> a = mine.next();
      Map.Entry<String, Double> b = theirs.next();
      int byName = a.getKey().compareTo(b.getKey());
      if (byName != 0) {
        return byName;
      }
      int byValue = Double.compare(a.getValue(), b.getValue());
      if (byValue != 0) {
        return byValue;
      }
    }
    if (mine.hasNext() != theirs.hasNext()) {
      return mine.hasNext() ? 1 : -1;
    }
    // same names from here on, so units compare pairwise
    for (Map.Entry<String, String> unit : units.entrySet()) {
      int byUnit = unit.getValue().compareTo(other.units.get(unit.getKey()));
      if (byUnit != 0) {
        return byUnit;
      }
    }
    return Boolean.compare(converged, other.converged);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Point(").append(index.label()).append(", {");
    String sep = "";
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      sb.append(sep).append(entry.getKey()).append('=').append(entry.getValue())
          .append(' ').append(units.get(entry.getKey()));
      sep = ", ";
    }
    sb.append('}');
    if (converged) {
      sb.append(", converged");
    }
    return sb.append(')').toString();
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Quantity names cannot be blank");
    }
    return name;
  }
}
