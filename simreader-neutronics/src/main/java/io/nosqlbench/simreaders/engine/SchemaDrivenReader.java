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
import io.nosqlbench.simreaders.api.ReaderDiagnostics;
import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.SimulationReader;
import io.nosqlbench.simreaders.api.UnitChange;
import io.nosqlbench.simreaders.api.config.DuplicateIndexPolicy;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import io.nosqlbench.simreaders.api.config.RecoveryPolicy;
import io.nosqlbench.simreaders.api.errors.DuplicateIndexException;
import io.nosqlbench.simreaders.api.errors.InvalidReaderStateException;
import io.nosqlbench.simreaders.api.errors.MalformedRecordException;
import io.nosqlbench.simreaders.api.errors.SimulationReaderException;
import io.nosqlbench.simreaders.api.errors.SourceUnavailableException;
import io.nosqlbench.simreaders.api.point.Point;
import io.nosqlbench.simreaders.api.point.PointIndex;
import io.nosqlbench.simreaders.api.point.Units;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The streaming extraction engine shared by all simulation output readers.
///
/// Lines are pulled from the source only when the consumer asks for the next point. Each line is
/// classified as noise, a `@` directive, a marker recognized by the [RecordSchema], or a data row.
/// Markers and self-contained columnar rows delimit records; a closed record is validated by the
/// schema and becomes a [Point].
///
/// ```
///   line ──▶ classify ──▶ record context ──close──▶ validate ──▶ pending ──▶ ready ──▶ consumer
///                                                                  ▲
///                                          duplicate resolution ───┘
///```
///
/// One accepted record is held back as pending until the next record is accepted or the input
/// ends, so that a repeated index can still replace it under the `last-wins` policy. Memory use
/// is bounded by the open record, the pending record and, for schemas which track them, the set
/// of indices already emitted.
///
/// Malformed rows and records are counted and skipped, or raised as [MalformedRecordException]
/// under the `fail-fast` policy. A fatal error closes the source; points accepted before the
/// error are still delivered, then the error is thrown from `hasNext()`.
public abstract class SchemaDrivenReader implements SimulationReader {

  private static final Logger logger = LogManager.getLogger(SchemaDrivenReader.class);

  private static final Pattern DIRECTIVE =
      Pattern.compile("^@(" + FieldTokenizer.NAME + ")(?:\\s*[:=]?\\s*(.*))?$");
  private static final int LOGGED_LINE_LENGTH = 200;

  private enum State {
    NEW,
    OPEN,
    ITERATING,
    EXHAUSTED,
    FAILED,
    CLOSED
  }

  private final String readerName;
  private final RecordSchema schema;
  private final ReaderConfig config;
  private final Map<String, String> configuredUnits = new HashMap<>();

  private State state = State.NEW;
  private String sourceName;
  private LineSource source;
  private ReaderCursor finalCursor = ReaderCursor.START;
  private boolean iteratorRequested;
  private SimulationReaderException failure;

  private final Deque<Point> ready = new ArrayDeque<>();
  private final Map<String, String> metadata = new LinkedHashMap<>();
  private final Map<String, String> declaredUnits = new HashMap<>();
  private final Map<String, String> establishedUnits = new HashMap<>();
  private final Set<PointIndex> released = new HashSet<>();
  private ColumnLayout layout;
  private boolean layoutHasIndex;
  private RecordContext context;
  private Point pending;
  private PointIndex lastReleased;
  private boolean sawBoundary;
  private boolean converged;

  private long linesRead;
  private long noiseLines;
  private long headerLines;
  private long markerLines;
  private long dataRows;
  private long skippedRows;
  private long skippedRecords;
  private long truncatedRecords;
  private long duplicatesResolved;
  private long pointsEmitted;
  private final List<UnitChange> unitChanges = new ArrayList<>();
  private int loggedProblems;

  /// @param readerName the name of the reader, used in messages
  /// @param schema the record rules of the simulation mode
  /// @param config the reader configuration
  /// @throws IllegalArgumentException if the configuration is invalid
  protected SchemaDrivenReader(String readerName, RecordSchema schema, ReaderConfig config) {
    this.readerName = Objects.requireNonNull(readerName, "readerName cannot be null");
    this.schema = Objects.requireNonNull(schema, "schema cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null").validate();
    for (Map.Entry<String, String> entry : config.getDefaultUnits().entrySet()) {
      String unit = Units.normalize(entry.getValue());
      configuredUnits.put(schema.canonicalName(entry.getKey()), unit != null ? unit : entry.getValue());
    }
  }

  /// @return the record rules of this reader
  public RecordSchema getSchema() {
    return schema;
  }

  /// @return the configuration of this reader
  public ReaderConfig getConfig() {
    return config;
  }

  @Override
  public void open(Path path) {
    Objects.requireNonNull(path, "path cannot be null");
    requireNew();
    if (Files.isDirectory(path)) {
      throw new SourceUnavailableException(path.toString(), new IOException("is a directory"));
    }
    InputStream stream;
    try {
      stream = Files.newInputStream(path);
    } catch (IOException e) {
      throw new SourceUnavailableException(path.toString(), e);
    }
    attach(new InputStreamReader(stream, config.getCharset()), path.toString());
  }

  @Override
  public void open(InputStream stream, String name) {
    requireNew();
    if (stream == null) {
      throw new SourceUnavailableException(name, new IOException("no input stream"));
    }
    attach(new InputStreamReader(stream, config.getCharset()), name);
  }

  @Override
  public void open(Reader reader, String name) {
    requireNew();
    if (reader == null) {
      throw new SourceUnavailableException(name, new IOException("no reader"));
    }
    attach(reader, name);
  }

  private void requireNew() {
    if (state != State.NEW) {
      throw new InvalidReaderStateException(
          getName() + " is " + state.name().toLowerCase(Locale.ROOT) + " and cannot be opened again");
    }
  }

  private void attach(Reader reader, String name) {
    this.source = new LineSource(reader);
    this.sourceName = name == null ? "stream" : name;
    this.state = State.OPEN;
    logger.debug("Opened {} for {} output with {}", sourceName, schema.mode(), config);
  }

  @NotNull
  @Override
  public Iterator<Point> iterator() {
    if (state == State.NEW) {
      throw new InvalidReaderStateException(getName() + " must be opened before reading");
    }
    if (state == State.CLOSED) {
      throw new InvalidReaderStateException(getName() + " is closed");
    }
    if (iteratorRequested) {
      throw new InvalidReaderStateException(
          getName() + " is single-pass and its points were already requested");
    }
    iteratorRequested = true;
    state = State.ITERATING;
    return new PointIterator();
  }

  private final class PointIterator implements Iterator<Point> {

    @Override
    public boolean hasNext() {
      if (state == State.CLOSED) {
        throw new InvalidReaderStateException(getName() + " was closed during iteration");
      }
      while (ready.isEmpty() && state == State.ITERATING) {
        advance();
      }
      if (!ready.isEmpty()) {
        return true;
      }
      if (failure != null) {
        SimulationReaderException raised = failure;
        failure = null;
        throw raised;
      }
      return false;
    }

    @Override
    public Point next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      pointsEmitted++;
      return ready.poll();
    }
  }

  private void advance() {
    try {
      SourceLine line = source.readLine();
      if (line == null) {
        finishStream();
        return;
      }
      linesRead++;
      handle(line);
    } catch (IOException e) {
      fail(new SourceUnavailableException(sourceName, e, source.position()));
    } catch (SimulationReaderException e) {
      fail(e);
    }
  }

  private void handle(SourceLine line) {
    if (line.overlong()) {
      rowProblem("line exceeds " + LineSource.MAX_LINE_LENGTH + " characters", line);
      return;
    }
    String trimmed = line.text().trim();
    if (trimmed.isEmpty() || FieldTokenizer.isComment(trimmed) || FieldTokenizer.isDecoration(trimmed)) {
      noiseLines++;
      return;
    }
    if (trimmed.startsWith("@")) {
      handleDirective(trimmed, line);
      return;
    }
    if (converged) {
      rowProblem("unexpected input after convergence", line);
      return;
    }
    String text = FieldTokenizer.stripTrailingComment(trimmed);
    Optional<Marker> marker = schema.matchMarker(text);
    if (marker.isPresent()) {
      handleMarker(marker.get(), text, line);
    } else {
      handleDataRow(text, line);
    }
  }

  private void handleDirective(String trimmed, SourceLine line) {
    Matcher m = DIRECTIVE.matcher(trimmed);
    if (!m.matches()) {
      rowProblem("invalid directive", line);
      return;
    }
    String key = m.group(1);
    String args = m.group(2) == null ? "" : m.group(2).trim();
    try {
      switch (key.toLowerCase(Locale.ROOT)) {
        case "units":
          declareUnits(FieldTokenizer.parseUnitDeclarations(FieldTokenizer.stripTrailingComment(args)),
              line.cursor());
          break;
        case "columns":
          layout = ColumnLayout.declare(
              FieldTokenizer.stripTrailingComment(args), schema::canonicalName, config.getColumnDelimiter());
          layoutHasIndex = layout.columns().stream().anyMatch(c -> schema.isIndexField(c.name()));
          break;
        case "widths":
          if (layout == null) {
            throw new RowFormatException("@widths must follow an @columns directive");
          }
          layout = layout.withWidths(FieldTokenizer.stripTrailingComment(args));
          break;
        default:
          metadata.put(key, args);
      }
      headerLines++;
    } catch (RowFormatException e) {
      rowProblem(e.getMessage(), line);
    }
  }

  private void declareUnits(Map<String, String> declarations, ReaderCursor cursor) {
    for (Map.Entry<String, String> entry : declarations.entrySet()) {
      String name = schema.canonicalName(entry.getKey());
      String unit = entry.getValue();
      declaredUnits.put(name, unit);
      String current = currentUnit(name);
      if (current != null && !current.equals(unit)) {
        unitChanges.add(new UnitChange(name, current, unit, cursor));
        establishedUnits.put(name, unit);
        logger.warn("{}: unit of '{}' changes from {} to {} at {}", getName(), name, current, unit, cursor);
      }
    }
  }

  private void handleMarker(Marker marker, String text, SourceLine line) {
    closeContext();
    if (marker.type() == Marker.Type.TERMINAL) {
      handleTerminal(marker, text, line);
      return;
    }
    sawBoundary = true;
    context = new RecordContext(line.cursor(), text, marker.index());
    if (marker.inline().isEmpty()) {
      markerLines++;
      return;
    }
    try {
      applyFields(FieldTokenizer.parseAssignments(marker.inline()), context);
      markerLines++;
    } catch (RowFormatException e) {
      rowProblem(e.getMessage(), line);
    }
  }

  private void handleTerminal(Marker marker, String text, SourceLine line) {
    if (pending == null) {
      rowProblem("convergence marker without an accepted record", line);
      return;
    }
    boolean counted = false;
    if (!marker.inline().isEmpty()) {
      try {
        RecordContext extra = new RecordContext(line.cursor(), text, pending.index());
        applyFields(FieldTokenizer.parseAssignments(marker.inline()), extra);
        Point merged = pending;
        for (Map.Entry<String, Double> entry : extra.values().entrySet()) {
          merged = merged.withValue(entry.getKey(), entry.getValue(), extra.units().get(entry.getKey()));
        }
        pending = merged;
      } catch (RowFormatException e) {
        rowProblem(e.getMessage(), line);
        counted = true;
      }
    }
    if (!counted) {
      markerLines++;
    }
    pending = pending.asConverged();
    releasePending();
    converged = true;
    logger.debug("{}: converged at {}", getName(), line.cursor());
  }

  private void handleDataRow(String text, SourceLine line) {
    try {
      boolean columnar = layout != null && !FieldTokenizer.looksLikeAssignment(text);
      List<RawField> fields = columnar
          ? layout.split(layout.isFixedWidth() ? line.text() : text)
          : FieldTokenizer.parseAssignments(text);
      if (fields.isEmpty()) {
        throw new RowFormatException("row has no values");
      }
      boolean selfContained = columnar && layoutHasIndex;
      if (selfContained && context != null && (context.hasValues() || context.indexFromField())) {
        closeContext();
      }
      RecordContext target = context != null ? context : new RecordContext(line.cursor(), text, null);
      applyFields(fields, target);
      context = target;
      dataRows++;
      if (selfContained) {
        closeContext();
      }
    } catch (RowFormatException e) {
      rowProblem(e.getMessage(), line);
    }
  }

  /// Validates every field of a row before adding any of them, so a malformed row leaves the
  /// record unchanged.
  private void applyFields(List<RawField> fields, RecordContext target) throws RowFormatException {
    Map<String, Double> values = new LinkedHashMap<>();
    Map<String, String> units = new LinkedHashMap<>();
    PointIndex index = null;
    for (RawField field : fields) {
      String name = schema.canonicalName(field.name());
      if (schema.isIndexField(name)) {
        if (index != null || target.indexFromField()) {
          throw new RowFormatException("repeated index field '" + name + "'");
        }
        try {
          index = schema.parseIndex(field.raw());
        } catch (IllegalArgumentException e) {
          throw new RowFormatException("invalid " + name + " '" + field.raw() + "': " + e.getMessage(), e);
        }
        if (target.index() != null && !target.index().equals(index)) {
          throw new RowFormatException(
              name + " " + index.label() + " contradicts " + target.index().label() + " of the marker");
        }
        continue;
      }
      if (values.containsKey(name) || target.hasValue(name)) {
        throw new RowFormatException("repeated quantity '" + name + "'");
      }
      values.put(name, FieldTokenizer.parseNumber(name, field.raw()));
      units.put(name, resolveUnit(name, field.unit()));
    }
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      String unit = units.get(entry.getKey());
      target.put(entry.getKey(), entry.getValue(), unit);
    }
    if (index != null) {
      target.setIndexFromField(index);
    }
  }

  private String resolveUnit(String name, String explicit) throws RowFormatException {
    String current = currentUnit(name);
    String declared = declaredUnits.get(name);
    if (explicit != null) {
      if (current != null && !current.equals(explicit)) {
        throw new RowFormatException(
            "unit " + explicit + " of '" + name + "' contradicts " + current + " of earlier points");
      }
      if (current == null && declared != null && !declared.equals(explicit)) {
        throw new RowFormatException(
            "unit " + explicit + " of '" + name + "' contradicts the declared unit " + declared);
      }
      return explicit;
    }
    if (declared != null) {
      return declared;
    }
    if (current != null) {
      return current;
    }
    String configured = configuredUnits.get(name);
    if (configured != null) {
      return configured;
    }
    String schemaDefault = schema.defaultUnit(name);
    return schemaDefault != null ? schemaDefault : Units.DIMENSIONLESS;
  }

  /// The unit a quantity holds in this stream: from released points or a declared change, else
  /// from the pending point, else from the open record. Skipped records never establish a unit.
  private String currentUnit(String name) {
    String unit = establishedUnits.get(name);
    if (unit == null && pending != null && pending.has(name)) {
      unit = pending.unit(name);
    }
    if (unit == null && context != null) {
      unit = context.units().get(name);
    }
    return unit;
  }

  private PointIndex indexOf(RecordContext record) {
    return record.index() != null ? record.index() : schema.implicitIndex(sawBoundary);
  }

  private void closeContext() {
    RecordContext closing = context;
    if (closing == null) {
      return;
    }
    context = null;
    PointIndex index = indexOf(closing);
    if (index == null) {
      recordProblem("record states no index", closing);
      return;
    }
    Optional<String> missing = schema.missingRequirement(closing.values());
    if (missing.isPresent()) {
      recordProblem(missing.get() + " at " + index.label(), closing);
      return;
    }
    accept(new Point(index, closing.values(), closing.units()), closing);
  }

  private void accept(Point candidate, RecordContext origin) {
    PointIndex index = candidate.index();
    if (schema.tracksReleasedIndices() && released.contains(index)) {
      unrevisableDuplicate(index, origin);
      return;
    }
    PointIndex previous = pending != null ? pending.index() : lastReleased;
    RecordSchema.Ordering ordering =
        previous == null ? RecordSchema.Ordering.IN_ORDER : schema.checkOrder(previous, index);
    switch (ordering) {
      case OUT_OF_ORDER:
        recordProblem(index.label() + " cannot follow " + previous.label(), origin);
        break;
      case DUPLICATE:
        if (pending != null && pending.index().equals(index)) {
          resolveDuplicate(candidate, origin);
        } else {
          unrevisableDuplicate(index, origin);
        }
        break;
      default:
        releasePending();
        pending = candidate;
    }
  }

  private void resolveDuplicate(Point candidate, RecordContext origin) {
    DuplicateIndexPolicy policy = config.getDuplicateIndexPolicy();
    if (policy == DuplicateIndexPolicy.ERROR) {
      throw new DuplicateIndexException(candidate.index(), origin.start());
    }
    duplicatesResolved++;
    if (policy == DuplicateIndexPolicy.LAST_WINS) {
      pending = candidate;
    }
    logger.debug("{}: duplicate {} at {} resolved by {}", getName(), candidate.index().label(),
        origin.start(), policy.configName());
  }

  private void unrevisableDuplicate(PointIndex index, RecordContext origin) {
    if (config.getDuplicateIndexPolicy() == DuplicateIndexPolicy.ERROR) {
      throw new DuplicateIndexException(index, origin.start());
    }
    duplicatesResolved++;
    warnProblem("dropping duplicate " + index.label() + ", which was already emitted", origin.start());
  }

  private void releasePending() {
    if (pending == null) {
      return;
    }
    ready.add(pending);
    for (String quantity : pending.quantities()) {
      establishedUnits.putIfAbsent(quantity, pending.unit(quantity));
    }
    lastReleased = pending.index();
    if (schema.tracksReleasedIndices()) {
      released.add(lastReleased);
    }
    pending = null;
  }

  private void finishStream() {
    RecordContext open = context;
    if (open != null) {
      PointIndex index = indexOf(open);
      if (index != null && schema.missingRequirement(open.values()).isEmpty()) {
        closeContext();
      } else {
        context = null;
        truncatedRecords++;
        warnProblem("discarding the incomplete record at the end of the input", open.start());
      }
    }
    releasePending();
    state = State.EXHAUSTED;
    closeSource();
    logger.debug("Finished {}: {}", getName(), diagnostics().summary());
  }

  private void rowProblem(String reason, SourceLine line) {
    String text = line.overlong() ? abbreviate(line.text()) : line.text();
    if (config.getRecoveryPolicy() == RecoveryPolicy.FAIL_FAST) {
      throw new MalformedRecordException(reason, line.cursor(), text);
    }
    skippedRows++;
    warnProblem("skipping row, " + reason + ": '" + abbreviate(text) + "'", line.cursor());
  }

  private void recordProblem(String reason, RecordContext record) {
    if (config.getRecoveryPolicy() == RecoveryPolicy.FAIL_FAST) {
      throw new MalformedRecordException(reason, record.start(), null);
    }
    skippedRecords++;
    warnProblem("skipping record, " + reason, record.start());
  }

  private void warnProblem(String message, ReaderCursor cursor) {
    if (loggedProblems >= config.getMaxLoggedProblems()) {
      return;
    }
    loggedProblems++;
    logger.warn("{} at {}: {}", getName(), cursor, message);
    if (loggedProblems == config.getMaxLoggedProblems()) {
      logger.warn("{}: problem log limit of {} reached, further problems are only counted",
          getName(), loggedProblems);
    }
  }

  private void fail(SimulationReaderException error) {
    releasePending();
    failure = error;
    state = State.FAILED;
    closeSource();
    logger.error("{} stopped: {}", getName(), error.getMessage());
  }

  private void closeSource() {
    if (source == null) {
      return;
    }
    finalCursor = source.position();
    try {
      source.close();
    } catch (IOException e) {
      logger.warn("Failed to close {}: {}", sourceName, e.getMessage());
    }
    source = null;
  }

  private static String abbreviate(String text) {
    return text.length() <= LOGGED_LINE_LENGTH ? text : text.substring(0, LOGGED_LINE_LENGTH) + "...";
  }

  @Override
  public ReaderDiagnostics diagnostics() {
    return new ReaderDiagnostics(
        linesRead,
        noiseLines,
        headerLines,
        markerLines,
        dataRows,
        skippedRows,
        skippedRecords,
        truncatedRecords,
        duplicatesResolved,
        pointsEmitted,
        unitChanges,
        source != null ? source.position() : finalCursor);
  }

  @Override
  public Map<String, String> metadata() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  @Override
  public SimulationMode mode() {
    return schema.mode();
  }

  @Override
  public String getName() {
    return sourceName == null ? readerName : readerName + "(" + sourceName + ")";
  }

  @Override
  public boolean isOpen() {
    return state == State.OPEN || state == State.ITERATING;
  }

  @Override
  public void close() {
    if (state == State.CLOSED) {
      return;
    }
    boolean abandoned = state == State.ITERATING || state == State.OPEN;
    closeSource();
    state = State.CLOSED;
    if (abandoned && sourceName != null) {
      logger.debug("Closed {} before the end of the input: {}", getName(), diagnostics().summary());
    }
  }

  @Override
  public String toString() {
    return getName();
  }
}
