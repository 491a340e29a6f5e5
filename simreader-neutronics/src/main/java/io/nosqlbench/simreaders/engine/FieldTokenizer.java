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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Line classification and key/value tokenization shared by all record schemas.
///
/// Two key/value forms are recognized:
/// - a single assignment with an optional unit: `power = 100.0 MW`, `k_eff: 1.0023`
/// - a run of compact pairs: `power=100.0 flux_fast=1.2e14[n/cm^2/s]`, optionally separated by
///   commas or semicolons
///
/// Numbers accept Fortran notations as printed by simulation codes: `1.0D-03` and the
/// exponent-without-E form `1.234-105`.
public final class FieldTokenizer {

  /// The characters allowed in a quantity or column name
  public static final String NAME = "[A-Za-z_][A-Za-z0-9_.\\-]*";

  private static final Pattern SINGLE_ASSIGNMENT =
      Pattern.compile("^(" + NAME + ")\\s*[=:]\\s*([^\\s\\[(]+)\\s*(\\S+)?\\s*$");
  private static final Pattern COMPACT_PAIR =
      Pattern.compile("^(" + NAME + ")=([^\\s\\[]+)(\\[[^\\]]*\\])?$");
  private static final Pattern PAIR_SEPARATOR = Pattern.compile("[\\s,;]+");
  private static final Pattern DECORATION = Pattern.compile("^[\\s\\-=*_~+|]{3,}$");
  private static final Pattern FORTRAN_D_EXPONENT =
      Pattern.compile("^([-+]?(?:\\d+\\.?\\d*|\\.\\d+))[dD]([-+]?\\d+)$");
  private static final Pattern FORTRAN_BARE_EXPONENT =
      Pattern.compile("^([-+]?(?:\\d+\\.\\d*|\\.\\d+))([-+]\\d{2,3})$");
  private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[\\s:,;\\-]+");

  private FieldTokenizer() {
    // Utility class
  }

  /// @param trimmed a trimmed line
  /// @return true for comment lines, starting with `#` or `!`
  public static boolean isComment(String trimmed) {
    return trimmed.startsWith("#") || trimmed.startsWith("!");
  }

  /// @param trimmed a trimmed line
  /// @return true for separator lines such as `-----` or `=====`
  public static boolean isDecoration(String trimmed) {
    return DECORATION.matcher(trimmed).matches();
  }

  /// Removes a trailing `# ...` comment which is preceded by whitespace.
  /// @param text the line text
  /// @return the text before the comment, trimmed
  public static String stripTrailingComment(String text) {
    for (int i = 1; i < text.length(); i++) {
      if (text.charAt(i) == '#' && Character.isWhitespace(text.charAt(i - 1))) {
        return text.substring(0, i).trim();
      }
    }
    return text.trim();
  }

  /// @param text a trimmed data line
  /// @return true if the line is written in one of the key/value forms, valid or not
  public static boolean looksLikeAssignment(String text) {
    return text.indexOf('=') >= 0 || SINGLE_ASSIGNMENT.matcher(text).matches();
  }

  /// Strips the separator punctuation between a marker keyword and its inline fields, as in
  /// `ITERATION 4: k_eff=1.02`.
  /// @param rest the text after the marker
  /// @return the inline field text, possibly empty
  public static String inlineText(String rest) {
    if (rest == null) {
      return "";
    }
    return LEADING_PUNCTUATION.matcher(rest).replaceFirst("").trim();
  }

  /// Tokenizes a key/value line.
  /// @param text a trimmed line without trailing comment
  /// @return the fields in line order, possibly empty for empty text
  /// @throws RowFormatException if the text is not in a key/value form
  static List<RawField> parseAssignments(String text) throws RowFormatException {
    List<RawField> fields = new ArrayList<>();
    if (text.isEmpty()) {
      return fields;
    }

    String[] tokens = PAIR_SEPARATOR.split(text);
    boolean allCompact = true;
    for (String token : tokens) {
      if (!COMPACT_PAIR.matcher(token).matches()) {
        allCompact = false;
        break;
      }
    }
    if (allCompact) {
      for (String token : tokens) {
        Matcher m = COMPACT_PAIR.matcher(token);
        if (m.matches()) {
          fields.add(new RawField(m.group(1), m.group(2), Units.normalize(m.group(3))));
        }
      }
      return fields;
    }

    Matcher single = SINGLE_ASSIGNMENT.matcher(text);
    if (single.matches()) {
      fields.add(new RawField(single.group(1), single.group(2), Units.normalize(single.group(3))));
      return fields;
    }
    throw new RowFormatException("expected 'name = value [unit]' or 'name=value' pairs");
  }

  /// Tokenizes the body of a `@units` directive: `name=unit` pairs.
  /// @param text the directive arguments
  /// @return name to normalized unit, in declaration order
  /// @throws RowFormatException if a token is not a `name=unit` pair
  static Map<String, String> parseUnitDeclarations(String text) throws RowFormatException {
    Map<String, String> units = new LinkedHashMap<>();
    if (text.isBlank()) {
      throw new RowFormatException("@units needs at least one name=unit pair");
    }
    for (String token : PAIR_SEPARATOR.split(text.trim())) {
      int eq = token.indexOf('=');
      if (eq <= 0 || eq == token.length() - 1) {
        throw new RowFormatException("expected name=unit in @units, found '" + token + "'");
      }
      String name = token.substring(0, eq);
      String unit = Units.normalize(token.substring(eq + 1));
      if (!name.matches(NAME) || unit == null) {
        throw new RowFormatException("invalid unit declaration '" + token + "'");
      }
      units.put(name, unit);
    }
    return units;
  }

  /// Coerces a value token to a double, accepting Fortran exponents and the usual spellings of
  /// NaN and infinity.
  /// @param raw the token
  /// @return the value
  /// @throws NumberFormatException if the token is not numeric
  public static double parseDouble(String raw) {
    String token = raw.trim();
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException e) {
      Double special = parseSpecial(token);
      if (special != null) {
        return special;
      }
      Matcher d = FORTRAN_D_EXPONENT.matcher(token);
      if (d.matches()) {
        return Double.parseDouble(d.group(1) + "E" + d.group(2));
      }
      Matcher bare = FORTRAN_BARE_EXPONENT.matcher(token);
      if (bare.matches()) {
        return Double.parseDouble(bare.group(1) + "E" + bare.group(2));
      }
      throw e;
    }
  }

  /// @param name the field name, for the error message
  /// @param raw the token
  /// @return the value
  /// @throws RowFormatException if the token is not numeric
  static double parseNumber(String name, String raw) throws RowFormatException {
    try {
      return parseDouble(raw);
    } catch (NumberFormatException e) {
      throw new RowFormatException("non-numeric value '" + raw + "' for " + name, e);
    }
  }

  private static Double parseSpecial(String token) {
    switch (token.toLowerCase(Locale.ROOT)) {
      case "nan":
      case "+nan":
      case "-nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        return null;
    }
  }
}
