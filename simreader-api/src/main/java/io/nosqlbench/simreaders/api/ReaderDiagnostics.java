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

import java.util.List;

/// A summary of what a [SimulationReader] has consumed and produced. After the sequence of points
/// is exhausted or the reader is closed, this is the final account of the run.
///
/// Every line read is counted exactly once in one of [#noiseLines()], [#headerLines()],
/// [#markerLines()], [#dataRows()] or [#skippedRows()], so nothing read goes unaccounted; see
/// [#accountedLines()].
///
/// @param linesRead total lines consumed from the source
/// @param noiseLines blank, comment and decoration lines
/// @param headerLines `@` directive lines
/// @param markerLines record boundary and terminal marker lines which were accepted
/// @param dataRows data rows which were accepted into a record
/// @param skippedRows rows excluded as malformed under the skip recovery policy
/// @param skippedRecords whole records excluded as malformed, e.g. missing a required quantity
/// @param truncatedRecords incomplete records discarded at the end of the stream
/// @param duplicatesResolved records dropped or overwritten by duplicate index resolution
/// @param pointsEmitted points handed to the consumer
/// @param unitChanges unit changes declared by the source mid-stream
/// @param cursor the last position read; the position at close once the reader is closed
public record ReaderDiagnostics(
    long linesRead,
    long noiseLines,
    long headerLines,
    long markerLines,
    long dataRows,
    long skippedRows,
    long skippedRecords,
    long truncatedRecords,
    long duplicatesResolved,
    long pointsEmitted,
    List<UnitChange> unitChanges,
    ReaderCursor cursor
) {

  /// Diagnostics of a reader which has not read anything
  public static final ReaderDiagnostics EMPTY =
      new ReaderDiagnostics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), ReaderCursor.START);

  public ReaderDiagnostics {
    unitChanges = List.copyOf(unitChanges);
  }

  /// @return the number of lines attributed to a classification, equal to [#linesRead()]
  public long accountedLines() {
    return noiseLines + headerLines + markerLines + dataRows + skippedRows;
  }

  /// @return true if any input was skipped, truncated or resolved away
  public boolean hasProblems() {
    return skippedRows > 0 || skippedRecords > 0 || truncatedRecords > 0 || duplicatesResolved > 0;
  }

  /// @return a one-line summary for logs
  public String summary() {
    return String.format(
        "%d points from %d lines (%d data rows, %d markers, %d headers, %d noise); "
        + "skipped %d rows and %d records, truncated %d, resolved %d duplicates, %d unit changes; at %s",
        pointsEmitted, linesRead, dataRows, markerLines, headerLines, noiseLines,
        skippedRows, skippedRecords, truncatedRecords, duplicatesResolved, unitChanges.size(), cursor);
  }
}
