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

import io.nosqlbench.simreaders.api.OutputMode;
import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.SimulationReader;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.EnumSet;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Finds [SimulationReader] implementations through [ServiceLoader], matched by their
/// [OutputMode] annotation.
///
/// ```java
/// try (SimulationReader reader = SimulationReaders.forMode(SimulationMode.K_EIGENVALUE, config)
///     .orElseThrow()) {
///   reader.open(path);
///   reader.read().forEach(...);
/// }
///```
public class SimulationReaders {

  private static final Logger logger = LogManager.getLogger(SimulationReaders.class);

  private SimulationReaders() {
  }

  /// @param mode the simulation mode of the output
  /// @return a new reader with the default configuration, or empty if none is registered
  public static Optional<SimulationReader> forMode(SimulationMode mode) {
    return forMode(mode, ReaderConfig.defaults());
  }

  /// @param mode the simulation mode of the output
  /// @param config the reader configuration
  /// @return a new reader, or empty if none is registered for the mode or it cannot be created
  public static Optional<SimulationReader> forMode(SimulationMode mode, ReaderConfig config) {
    return providers()
        .filter(provider -> matchesMode(provider, mode))
        .findFirst()
        .flatMap(provider -> instantiate(provider, config));
  }

  /// @param modeName a mode name such as `k-eigenvalue`
  /// @param config the reader configuration
  /// @return a new reader, or empty if the name is unknown or no reader is registered
  public static Optional<SimulationReader> forMode(String modeName, ReaderConfig config) {
    SimulationMode mode;
    try {
      mode = SimulationMode.fromName(modeName);
    } catch (IllegalArgumentException e) {
      logger.debug("No simulation mode named '{}'", modeName);
      return Optional.empty();
    }
    return forMode(mode, config);
  }

  /// @return the modes which have a registered reader
  public static Set<SimulationMode> availableModes() {
    Set<SimulationMode> modes = EnumSet.noneOf(SimulationMode.class);
    providers()
        .map(provider -> provider.type().getAnnotation(OutputMode.class))
        .filter(annotation -> annotation != null)
        .forEach(annotation -> modes.add(annotation.value()));
    return modes;
  }

  private static Stream<ServiceLoader.Provider<SimulationReader>> providers() {
    ServiceLoader<SimulationReader> loader = ServiceLoader.load(SimulationReader.class);
    return StreamSupport.stream(loader.stream().spliterator(), false);
  }

  private static boolean matchesMode(ServiceLoader.Provider<SimulationReader> provider, SimulationMode mode) {
    OutputMode annotation = provider.type().getAnnotation(OutputMode.class);
    return annotation != null && annotation.value() == mode;
  }

  private static Optional<SimulationReader> instantiate(
      ServiceLoader.Provider<SimulationReader> provider,
      ReaderConfig config
  )
  {
    Class<? extends SimulationReader> type = provider.type();
    try {
      Constructor<? extends SimulationReader> constructor = type.getConstructor(ReaderConfig.class);
      return Optional.of(constructor.newInstance(config));
    } catch (NoSuchMethodException e) {
      logger.warn("{} has no ({}) constructor, using its defaults", type.getName(),
          ReaderConfig.class.getSimpleName());
      return Optional.of(provider.get());
    } catch (InstantiationException | IllegalAccessException e) {
      logger.warn("Unable to create {}: {}", type.getName(), e.getMessage());
      return Optional.empty();
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      logger.warn("Unable to create {}: {}", type.getName(), cause.getMessage());
      return Optional.empty();
    }
  }
}
