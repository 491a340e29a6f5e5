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

/// What a reader does when it meets malformed input.
public enum RecoveryPolicy {
  /// count the malformed row or record, exclude it, and continue
  @SerializedName("skip")
  SKIP("skip"),
  /// raise a malformed record error at the first occurrence and end the sequence
  @SerializedName("fail-fast")
  FAIL_FAST("fail-fast");

  private final String configName;

  RecoveryPolicy(String configName) {
    this.configName = configName;
  }

  /// @return the name used in configuration files
  public String configName() {
    return configName;
  }

  /// @param name a configuration name such as `skip` or `fail-fast`
  /// @return the policy
  /// @throws IllegalArgumentException if the name is not recognized
  public static RecoveryPolicy fromName(String name) {
    for (RecoveryPolicy policy : values()) {
      if (policy.configName.equalsIgnoreCase(name.trim()) || policy.name().equalsIgnoreCase(name.trim())) {
        return policy;
      }
    }
    throw new IllegalArgumentException(
        "Unknown recovery_policy '" + name + "', expected one of " + Arrays.toString(configNames()));
  }

  static String[] configNames() {
    return Arrays.stream(values()).map(RecoveryPolicy::configName).toArray(String[]::new);
  }
}
