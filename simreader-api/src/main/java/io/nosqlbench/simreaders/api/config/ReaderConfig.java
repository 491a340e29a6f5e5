package io.nosqlbench.simreaders.api.config;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-serializable configuration shared by all simulation output readers.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "recovery_policy": "skip",               // skip | fail-fast
 *   "duplicate_index_policy": "last-wins",   // last-wins | first-wins | error
 *   "default_units": {"power": "MW"},        // used when the source states no unit
 *   "column_delimiter": ",",                 // optional, whitespace when absent
 *   "charset": "UTF-8",
 *   "max_logged_problems": 100
 * }
 * }</pre>
 *
 * <p>Every key is optional. Absent keys keep the defaults shown above, except
 * {@code default_units} which is empty and {@code column_delimiter} which is absent.
 */
public class ReaderConfig {

  private static final Gson GSON = new GsonBuilder()
      .setPrettyPrinting()
      .create();

  @SerializedName("recovery_policy")
  private RecoveryPolicy recoveryPolicy = RecoveryPolicy.SKIP;

  @SerializedName("duplicate_index_policy")
  private DuplicateIndexPolicy duplicateIndexPolicy = DuplicateIndexPolicy.LAST_WINS;

  /** Quantity name to unit tag, for values whose unit the source does not state */
  @SerializedName("default_units")
  private Map<String, String> defaultUnits = new LinkedHashMap<>();

  /** Delimiter for columnar rows; whitespace separated when null */
  @SerializedName("column_delimiter")
  private String columnDelimiter;

  @SerializedName("charset")
  private String charset = StandardCharsets.UTF_8.name();

  /** Malformed input beyond this many problems is still counted, but no longer logged */
  @SerializedName("max_logged_problems")
  private int maxLoggedProblems = 100;

  public ReaderConfig() {
  }

  /**
   * @return a configuration with all defaults
   */
  public static ReaderConfig defaults() {
    return new ReaderConfig();
  }

  public RecoveryPolicy getRecoveryPolicy() {
    return recoveryPolicy;
  }

  public ReaderConfig setRecoveryPolicy(RecoveryPolicy recoveryPolicy) {
    this.recoveryPolicy = require(recoveryPolicy, "recovery_policy", RecoveryPolicy.configNames());
    return this;
  }

  public DuplicateIndexPolicy getDuplicateIndexPolicy() {
    return duplicateIndexPolicy;
  }

  public ReaderConfig setDuplicateIndexPolicy(DuplicateIndexPolicy duplicateIndexPolicy) {
    this.duplicateIndexPolicy =
        require(duplicateIndexPolicy, "duplicate_index_policy", DuplicateIndexPolicy.configNames());
    return this;
  }

  /**
   * @return an unmodifiable view of the configured default units
   */
  public Map<String, String> getDefaultUnits() {
    return defaultUnits == null ? Map.of() : Collections.unmodifiableMap(defaultUnits);
  }

  public ReaderConfig setDefaultUnits(Map<String, String> defaultUnits) {
    this.defaultUnits = new LinkedHashMap<>(defaultUnits);
    return this;
  }

  public ReaderConfig defaultUnit(String quantity, String unit) {
    if (defaultUnits == null) {
      defaultUnits = new LinkedHashMap<>();
    }
    defaultUnits.put(quantity, unit);
    return this;
  }

  public String getColumnDelimiter() {
    return columnDelimiter;
  }

  public ReaderConfig setColumnDelimiter(String columnDelimiter) {
    this.columnDelimiter = columnDelimiter;
    return this;
  }

  public Charset getCharset() {
    return Charset.forName(charset);
  }

  public ReaderConfig setCharset(Charset charset) {
    this.charset = charset.name();
    return this;
  }

  public int getMaxLoggedProblems() {
    return maxLoggedProblems;
  }

  public ReaderConfig setMaxLoggedProblems(int maxLoggedProblems) {
    this.maxLoggedProblems = maxLoggedProblems;
    return this;
  }

  /**
   * Checks that the configuration is complete and consistent.
   *
   * @return this configuration
   * @throws IllegalArgumentException if an option is missing or invalid
   */
  public ReaderConfig validate() {
    require(recoveryPolicy, "recovery_policy", RecoveryPolicy.configNames());
    require(duplicateIndexPolicy, "duplicate_index_policy", DuplicateIndexPolicy.configNames());
    if (charset == null || !Charset.isSupported(charset)) {
      throw new IllegalArgumentException("Unsupported charset: " + charset);
    }
    if (columnDelimiter != null && columnDelimiter.isEmpty()) {
      throw new IllegalArgumentException("column_delimiter cannot be empty, omit it for whitespace");
    }
    if (maxLoggedProblems < 0) {
      throw new IllegalArgumentException("max_logged_problems cannot be negative: " + maxLoggedProblems);
    }
    if (defaultUnits != null) {
      for (Map.Entry<String, String> entry : defaultUnits.entrySet()) {
        if (entry.getValue() == null || entry.getValue().isBlank()) {
          throw new IllegalArgumentException("default_units has a blank unit for '" + entry.getKey() + "'");
        }
      }
    }
    return this;
  }

  /**
   * Reads a configuration from JSON.
   *
   * @param reader the JSON source
   * @return the validated configuration
   * @throws IllegalArgumentException if the JSON is invalid, or names an unknown policy
   */
  public static ReaderConfig fromJson(Reader reader) {
    ReaderConfig config;
    try {
      config = GSON.fromJson(reader, ReaderConfig.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid reader configuration: " + e.getMessage(), e);
    }
    if (config == null) {
      return defaults();
    }
    return config.validate();
  }

  /**
   * @param json the JSON text
   * @return the validated configuration
   */
  public static ReaderConfig fromJson(String json) {
    return fromJson(new StringReader(json));
  }

  /**
   * @param path a JSON file
   * @return the validated configuration
   * @throws IOException if the file cannot be read
   */
  public static ReaderConfig fromJson(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    }
  }

  /**
   * @return this configuration as pretty-printed JSON
   */
  public String toJson() {
    return GSON.toJson(this);
  }

  /**
   * Writes this configuration to a JSON file.
   *
   * @param path the file to write
   * @throws IOException if the file cannot be written
   */
  public void saveToFile(Path path) throws IOException {
    Files.writeString(path, toJson(), StandardCharsets.UTF_8);
  }

  private static <E extends Enum<E>> E require(E value, String key, String[] allowed) {
    if (value == null) {
      // Gson maps unrecognized enum names to null
      throw new IllegalArgumentException(key + " must be one of " + Arrays.toString(allowed));
    }
    return value;
  }

  @Override
  public String toString() {
    return "ReaderConfig{recovery_policy=" + recoveryPolicy.configName()
           + ", duplicate_index_policy=" + duplicateIndexPolicy.configName()
           + ", default_units=" + getDefaultUnits()
           + ", column_delimiter=" + (columnDelimiter == null ? "whitespace" : "'" + columnDelimiter + "'")
           + ", charset=" + charset + "}";
  }
}
