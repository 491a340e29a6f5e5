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

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;

/// How a reader resolves two records with the same index.
public enum DuplicateIndexPolicy {
  /// the later occurrence replaces the earlier one
  @SerializedName("last-wins")
  LAST_WINS("last-wins"),
  /// the earlier occurrence is kept and the later one dropped
  @SerializedName("first-wins")
  FIRST_WINS("first-wins"),
  /// a duplicate index error is raised and the sequence ends
  @SerializedName("error")
  ERROR("error");

  private final String configName;

  DuplicateIndexPolicy(String configName) {
    this.configName = configName;
  }

  /// @return the name used in configuration files
  public String configName() {
    return configName;
  }

  /// @param name a configuration name such as `last-wins`
  /// @return the policy
  /// @throws IllegalArgumentException if the name is not recognized
  public static DuplicateIndexPolicy fromName(String name) {
    for (DuplicateIndexPolicy policy : values()) {
      if (policy.configName.equalsIgnoreCase(name.trim()) || policy.name().equalsIgnoreCase(name.trim())) {
        return policy;
      }
    }
    throw new IllegalArgumentException(
        "Unknown duplicate_index_policy '" + name + "', expected one of " + Arrays.toString(configNames()));
  }

  static String[] configNames() {
    return Arrays.stream(values()).map(DuplicateIndexPolicy::configName).toArray(String[]::new);
  }
}
