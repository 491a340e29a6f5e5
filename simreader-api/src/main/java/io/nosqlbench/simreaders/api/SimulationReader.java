package io.nosqlbench.simreaders.api;

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

import io.nosqlbench.simreaders.api.errors.InvalidReaderStateException;
import io.nosqlbench.simreaders.api.errors.SourceUnavailableException;
import io.nosqlbench.simreaders.api.point.Point;
import org.jetbrains.annotations.NotNull;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// The base type for all readers of simulation output.
///
/// A reader is opened exactly once against a source, yields a lazy, forward-only sequence of
/// [Point]s, and is then closed. It is single-pass: [#iterator()] and [#read()] may be called
/// once per instance, and a fresh instance is needed to read a source again.
///
/// ```java
/// try (SimulationReader reader = new TransientNeutronicsReader(config)) {
///   reader.open(Path.of("run.out"));
///   for (Point point : reader) {
///     ...
///   }
///   ReaderDiagnostics diagnostics = reader.diagnostics();
/// }
///```
///
/// The reader closes its source by itself when the sequence is exhausted or a fatal error is
/// raised. Abandoning iteration early is safe as long as [#close()] is called, which a
/// try-with-resources block guarantees.
///
/// Instances are not thread-safe. Concurrent reads of the same output need independent readers
/// over independent stream handles.
public interface SimulationReader extends Iterable<Point>, AutoCloseable {

  /// Open a file.
  /// @param path the file to read
  /// @throws SourceUnavailableException if the file cannot be opened
  /// @throws InvalidReaderStateException if this reader was already opened
  void open(Path path);

  /// Open a byte stream, decoded with the configured charset. The reader takes ownership of the
  /// stream and closes it.
  /// @param stream the stream to read
  /// @param name a name for the source, used in messages
  /// @throws SourceUnavailableException if the stream is null
  /// @throws InvalidReaderStateException if this reader was already opened
  void open(InputStream stream, String name);

  /// Open a character stream. The reader takes ownership of it and closes it.
  /// @param reader the characters to read
  /// @param name a name for the source, used in messages
  /// @throws SourceUnavailableException if the reader is null
  /// @throws InvalidReaderStateException if this reader was already opened
  void open(Reader reader, String name);

  /// Returns the lazy sequence of points. Each call to `hasNext()` reads only as much of the
  /// source as is needed to produce the next point.
  /// @return the single iterator of this reader
  /// @throws InvalidReaderStateException if the reader is not open or the sequence was
  ///     already requested
  @NotNull
  @Override
  Iterator<Point> iterator();

  @Override
  default Spliterator<Point> spliterator() {
    return Spliterators.spliteratorUnknownSize(
        iterator(), Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE);
  }

  /// The sequence of points as a stream. Closing the stream closes the reader.
  /// @return a sequential stream of points
  default Stream<Point> read() {
    return StreamSupport.stream(spliterator(), false).onClose(this::close);
  }

  /// @return the diagnostics so far; final once the sequence is exhausted or the reader closed
  ReaderDiagnostics diagnostics();

  /// @return the `@key value` header directives seen so far, in source order
  Map<String, String> metadata();

  /// @return the simulation mode this reader understands
  SimulationMode mode();

  /// @return a name for this reader and its source
  String getName();

  /// @return true between a successful open and close
  boolean isOpen();

  /// Release the source. Safe to call any number of times.
  @Override
  void close();
}
