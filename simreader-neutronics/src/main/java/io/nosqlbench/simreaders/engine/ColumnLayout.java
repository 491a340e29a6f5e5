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

import io.nosqlbench.simreaders.api.point.Units;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The column rules declared by an `@columns` directive, and optionally an `@widths` directive,
/// for tabular output.
///
/// ```
/// @columns time power[MW] flux_fast(n/cm^2/s)
/// 0.0   100.0  1.2e14
/// 0.1   102.5  1.3e14
///```
///
/// Rows are split on whitespace by default, on a configured delimiter when one is given, or into
/// fixed-width slices when widths are declared. With a delimiter or fixed widths an empty cell,
/// including the missing trailing cells of a short fixed-width row, means the quantity is absent
/// from that row.
public final class ColumnLayout {

  private static final Pattern COLUMN =
      Pattern.compile("^(" + FieldTokenizer.NAME + ")(\\[[^\\]]*\\]|\\([^)]*\\))?$");
  private static final Pattern DECLARATION_SEPARATOR = Pattern.compile("[\\s,;]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /// A declared column
  /// @param name the canonical quantity or index name
  /// @param unit the declared unit, or null
  public record Column(String name, String unit) {
  }

  private final List<Column> columns;
  private final int[] widths;
  private final String delimiter;

  private ColumnLayout(List<Column> columns, int[] widths, String delimiter) {
    this.columns = List.copyOf(columns);
    this.widths = widths;
    this.delimiter = delimiter;
  }

  /// Parses the arguments of an `@columns` directive.
  /// @param declaration the column tokens, such as `time power[MW]`
  /// @param canonicalName maps a column name to its canonical quantity name
  /// @param delimiter the configured cell delimiter, or null for whitespace
  /// @return the layout
  /// @throws RowFormatException if a token is invalid or a name repeats
  static ColumnLayout declare(String declaration, UnaryOperator<String> canonicalName, String delimiter)
      throws RowFormatException
  {
    if (declaration.isBlank()) {
      throw new RowFormatException("@columns needs at least one column");
    }
    List<Column> columns = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String token : DECLARATION_SEPARATOR.split(declaration.trim())) {
      Matcher m = COLUMN.matcher(token);
      if (!m.matches()) {
        throw new RowFormatException("invalid column declaration '" + token + "'");
      }
      String name = canonicalName.apply(m.group(1));
      if (!seen.add(name)) {
        throw new RowFormatException("column '" + name + "' is declared twice");
      }
      columns.add(new Column(name, Units.normalize(m.group(2))));
    }
    return new ColumnLayout(columns, null, delimiter);
  }

  /// Returns a copy of this layout which slices rows by fixed widths.
  /// @param declaration the arguments of an `@widths` directive, one width per column
  /// @return the fixed-width layout
  /// @throws RowFormatException if the widths are not positive integers, one per column
  ColumnLayout withWidths(String declaration) throws RowFormatException {
    String[] tokens = DECLARATION_SEPARATOR.split(declaration.trim());
    if (tokens.length != columns.size()) {
      throw new RowFormatException(
          "@widths declares " + tokens.length + " widths for " + columns.size() + " columns");
    }
    int[] parsed = new int[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      try {
        parsed[i] = Integer.parseInt(tokens[i]);
      } catch (NumberFormatException e) {
        throw new RowFormatException("invalid column width '" + tokens[i] + "'", e);
      }
      if (parsed[i] <= 0) {
        throw new RowFormatException("column widths must be positive: " + parsed[i]);
      }
    }
    return new ColumnLayout(columns, parsed, delimiter);
  }

  /// @return the declared columns in order
  public List<Column> columns() {
    return columns;
  }

  /// @param name a canonical name
  /// @return true if a column with this name is declared
  public boolean hasColumn(String name) {
    for (Column column : columns) {
      if (column.name().equals(name)) {
        return true;
      }
    }
    return false;
  }

  /// @return true if rows are sliced by fixed widths
  public boolean isFixedWidth() {
    return widths != null;
  }

  /// Splits a row into fields.
  /// @param line the row without its terminator; leading whitespace matters for fixed widths
  /// @return one field per non-empty cell, in column order
  /// @throws RowFormatException if the cell count does not match the declared columns
  List<RawField> split(String line) throws RowFormatException {
    String[] cells = widths != null ? sliceFixed(line) : splitDelimited(line.trim());
    if (cells.length != columns.size()) {
      throw new RowFormatException(
          "row has " + cells.length + " cells but " + columns.size() + " columns are declared");
    }
    List<RawField> fields = new ArrayList<>(cells.length);
    for (int i = 0; i < cells.length; i++) {
      String cell = cells[i].trim();
      if (cell.isEmpty()) {
        continue;
      }
      Column column = columns.get(i);
      fields.add(new RawField(column.name(), cell, column.unit()));
    }
    return fields;
  }

  private String[] splitDelimited(String line) {
    if (delimiter == null) {
      return WHITESPACE.split(line);
    }
    return line.split(Pattern.quote(delimiter), -1);
  }

  private String[] sliceFixed(String line) {
    String row = line.stripTrailing();
    String[] cells = new String[widths.length];
    int start = 0;
    for (int i = 0; i < widths.length; i++) {
      int end = (i == widths.length - 1) ? row.length() : Math.min(row.length(), start + widths[i]);
      cells[i] = start < end ? row.substring(start, end) : "";
      start = Math.max(start, end);
    }
    return cells;
  }
}
