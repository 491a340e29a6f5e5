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

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/// Splits a character stream into lines while tracking the exact character offset of each one.
///
/// LF, CR+LF and a lone CR all terminate a line. A leading byte order mark is skipped but still
/// counted in offsets. Lines longer than [#MAX_LINE_LENGTH] are consumed in full but only their
/// first [#MAX_LINE_LENGTH] characters are kept, so memory stays bounded by the buffer size and
/// the cap no matter what the source contains.
///
/// ```
///  Reader ──▶ char[] buffer ──▶ SourceLine(text, cursor(line, offset))
///                 ▲    │
///                 └────┘ refill when drained
///```
public final class LineSource implements Closeable {

  /// The largest number of characters kept for a single line
  public static final int MAX_LINE_LENGTH = 1 << 20;

  private static final int BUFFER_SIZE = 64 * 1024;
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final Reader reader;
  private final char[] buffer = new char[BUFFER_SIZE];
  private int position;
  private int limit;
  private boolean endOfInput;
  private boolean started;

  private long linesRead;
  private long charactersConsumed;

  /// @param reader the characters to split; owned and closed by this source
  public LineSource(Reader reader) {
    this.reader = Objects.requireNonNull(reader, "reader cannot be null");
  }

  /// Reads the next line.
  /// @return the line, or null at the end of the input
  /// @throws IOException if the underlying reader fails
  public SourceLine readLine() throws IOException {
    if (!started) {
      started = true;
      if (fill() && buffer[position] == BYTE_ORDER_MARK) {
        position++;
        charactersConsumed++;
      }
    }
    if (!fill()) {
      return null;
    }

    long lineStart = charactersConsumed;
    StringBuilder text = new StringBuilder(128);
    boolean overlong = false;
    long consumed = 0;

    while (fill()) {
      char c = buffer[position++];
      consumed++;
      if (c == '\n') {
        break;
      }
      if (c == '\r') {
        if (fill() && buffer[position] == '\n') {
          position++;
          consumed++;
        }
        break;
      }
      if (text.length() < MAX_LINE_LENGTH) {
        text.append(c);
      } else {
        overlong = true;
      }
    }

    linesRead++;
    charactersConsumed = lineStart + consumed;
    return new SourceLine(text.toString(), new ReaderCursor(linesRead, lineStart), overlong);
  }

  /// @return the number of lines read and the number of characters consumed so far
  public ReaderCursor position() {
    return new ReaderCursor(linesRead, charactersConsumed);
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  private boolean fill() throws IOException {
    if (position < limit) {
      return true;
    }
    if (endOfInput) {
      return false;
    }
    int read;
    do {
      read = reader.read(buffer, 0, buffer.length);
    } while (read == 0);
    if (read < 0) {
      endOfInput = true;
      return false;
    }
    position = 0;
    limit = read;
    return true;
  }
}
