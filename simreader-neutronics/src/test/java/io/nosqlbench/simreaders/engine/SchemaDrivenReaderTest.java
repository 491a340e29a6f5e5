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

import io.nosqlbench.simreaders.api.ReaderDiagnostics;
import io.nosqlbench.simreaders.api.SimulationReader;
import io.nosqlbench.simreaders.api.UnitChange;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import io.nosqlbench.simreaders.api.config.RecoveryPolicy;
import io.nosqlbench.simreaders.api.errors.InvalidReaderStateException;
import io.nosqlbench.simreaders.api.errors.MalformedRecordException;
import io.nosqlbench.simreaders.api.errors.SourceUnavailableException;
import io.nosqlbench.simreaders.api.point.IterationIndex;
import io.nosqlbench.simreaders.api.point.Point;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaDrivenReaderTest {

  private static SchemaDrivenReader reader(ReaderConfig config) {
    return new SchemaDrivenReader("blocks", new BlockSchema(), config) {
    };
  }

  private static SchemaDrivenReader open(String text) {
    return open(text, ReaderConfig.defaults());
  }

  private static SchemaDrivenReader open(String text, ReaderConfig config) {
    SchemaDrivenReader reader = reader(config);
    reader.open(new StringReader(text), "test");
    return reader;
  }

  @Test
  void iteratingBeforeOpenIsInvalid() {
    SchemaDrivenReader reader = reader(ReaderConfig.defaults());
    assertThatThrownBy(reader::iterator).isInstanceOf(InvalidReaderStateException.class);
    assertThat(reader.isOpen()).isFalse();
    assertThat(reader.diagnostics()).isEqualTo(ReaderDiagnostics.EMPTY);
  }

  @Test
  void opensOnlyOnce() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\n");
    assertThat(reader.isOpen()).isTrue();
    assertThatThrownBy(() -> reader.open(new StringReader(""), "again"))
        .isInstanceOf(InvalidReaderStateException.class);

    reader.close();
    reader.close();
    assertThat(reader.isOpen()).isFalse();
    assertThatThrownBy(() -> reader.open(new StringReader(""), "again"))
        .isInstanceOf(InvalidReaderStateException.class);
    assertThatThrownBy(reader::iterator).isInstanceOf(InvalidReaderStateException.class);
  }

  @Test
  void isSinglePass() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\n");
    assertThat(reader.read().count()).isEqualTo(1);
    assertThatThrownBy(reader::iterator)
        .isInstanceOf(InvalidReaderStateException.class)
        .hasMessageContaining("single-pass");
  }

  @Test
  void missingSourceIsUnavailable(@TempDir Path tempDir) {
    Path missing = tempDir.resolve("missing.out");
    SchemaDrivenReader reader = reader(ReaderConfig.defaults());

    assertThatThrownBy(() -> reader.open(missing))
        .isInstanceOf(SourceUnavailableException.class)
        .satisfies(e -> assertThat(((SourceUnavailableException) e).getSourceName())
            .isEqualTo(missing.toString()));
    assertThatThrownBy(() -> reader.open(tempDir)).isInstanceOf(SourceUnavailableException.class);
    assertThatThrownBy(() -> reader.open((InputStream) null, "nothing"))
        .isInstanceOf(SourceUnavailableException.class);
  }

  @Test
  void readsFilesAndStreams(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("blocks.out");
    Files.writeString(file, "BLOCK 1\nvalue=1\nBLOCK 2\nvalue=2\n");

    try (SimulationReader fromFile = reader(ReaderConfig.defaults())) {
      fromFile.open(file);
      assertThat(fromFile.getName()).isEqualTo("blocks(" + file + ")");
      assertThat(fromFile.read().toList()).hasSize(2);
      assertThat(fromFile.isOpen()).isFalse();
    }

    try (SimulationReader fromStream = reader(ReaderConfig.defaults())) {
      fromStream.open(new ByteArrayInputStream(Files.readAllBytes(file)), "bytes");
      assertThat(fromStream.read().map(p -> p.value("value")).toList()).containsExactly(1.0, 2.0);
    }
  }

  @Test
  void closingDuringIterationInvalidatesTheIterator() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\nBLOCK 2\nvalue=2\nBLOCK 3\nvalue=3\n");
    Iterator<Point> points = reader.iterator();
    assertThat(points.next().index()).isEqualTo(new IterationIndex(1));

    reader.close();
    assertThat(reader.isOpen()).isFalse();
    assertThatThrownBy(points::hasNext).isInstanceOf(InvalidReaderStateException.class);
  }

  @Test
  void closingTheStreamClosesTheReader() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\nBLOCK 2\nvalue=2\nBLOCK 3\nvalue=3\n");
    try (Stream<Point> points = reader.read()) {
      assertThat(points.findFirst()).isPresent();
    }
    assertThat(reader.isOpen()).isFalse();
    assertThat(reader.diagnostics().pointsEmitted()).isEqualTo(1);
  }

  @Test
  void accountsForEveryLine() {
    String text = """
        # produced by a test
        @code blocks 1.0
        ==========
        BLOCK 1
          value = 1.5
          extra = 7   # trailing note

        ! another comment
        BLOCK 2
          value = oops
          value = 2.5
        ----------
        """;
    SchemaDrivenReader reader = open(text);
    List<Point> points = reader.read().toList();

    assertThat(points).hasSize(2);
    ReaderDiagnostics diagnostics = reader.diagnostics();
    assertThat(diagnostics.linesRead()).isEqualTo(12);
    assertThat(diagnostics.accountedLines()).isEqualTo(diagnostics.linesRead());
    assertThat(diagnostics.noiseLines()).isEqualTo(5);
    assertThat(diagnostics.headerLines()).isEqualTo(1);
    assertThat(diagnostics.markerLines()).isEqualTo(2);
    assertThat(diagnostics.dataRows()).isEqualTo(3);
    assertThat(diagnostics.skippedRows()).isEqualTo(1);
    assertThat(diagnostics.pointsEmitted()).isEqualTo(2);
    assertThat(diagnostics.hasProblems()).isTrue();
    assertThat(diagnostics.summary()).contains("2 points from 12 lines");
  }

  @Test
  void collectsHeaderMetadata() {
    SchemaDrivenReader reader = open("@code SIMX 2.1\n@title: restart run\nBLOCK 1\nvalue=1\n@units value=MW\n");
    reader.read().forEach(point -> { });

    assertThat(reader.metadata()).containsExactly(
        Map.entry("code", "SIMX 2.1"),
        Map.entry("title", "restart run"));
  }

  @Test
  void resolvesUnitsByPrecedence() {
    ReaderConfig config = new ReaderConfig().defaultUnit("VOLTAGE", "V");
    SchemaDrivenReader reader = open("""
        BLOCK 1
          value = 1.0
          voltage = 3.0
          ratio = 0.5
          speed = 2.0 [m/s]
        @units ratio=%
        BLOCK 2
          value = 2.0
          ratio = 0.6
        """, config);
    List<Point> points = reader.read().toList();

    Point first = points.get(0);
    assertThat(first.units()).containsExactly(
        Map.entry("ratio", "1"),
        Map.entry("speed", "m/s"),
        Map.entry("value", "W"),
        Map.entry("voltage", "V"));
    assertThat(points.get(1).unit("ratio")).isEqualTo("%");
  }

  @Test
  void keepsTheUnitAnEarlierPointEstablished() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue = 1.0 MW\nBLOCK 2\nvalue = 2.0\n");
    assertThat(reader.read().map(p -> p.unit("value")).toList()).containsExactly("MW", "MW");
  }

  @Test
  void recordsDeclaredUnitChanges() {
    SchemaDrivenReader reader = open("""
        @units value=MW
        BLOCK 1
        value = 1.0
        @units value=kW
        BLOCK 2
        value = 900
        """);
    List<Point> points = reader.read().toList();

    assertThat(points).extracting(p -> p.unit("value")).containsExactly("MW", "kW");
    List<UnitChange> changes = reader.diagnostics().unitChanges();
    assertThat(changes).hasSize(1);
    assertThat(changes.get(0).quantity()).isEqualTo("value");
    assertThat(changes.get(0).from()).isEqualTo("MW");
    assertThat(changes.get(0).to()).isEqualTo("kW");
    assertThat(changes.get(0).cursor().line()).isEqualTo(4);
  }

  @Test
  void contradictingUnitIsMalformed() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue = 1 MW\nBLOCK 2\nvalue = 2 kW\n");
    List<Point> points = reader.read().toList();

    assertThat(points).hasSize(1);
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
    assertThat(reader.diagnostics().truncatedRecords()).isEqualTo(1);
  }

  @Test
  void explicitUnitMustAgreeWithTheDeclaredUnit() {
    SchemaDrivenReader reader = open("""
        @units value=MW
        BLOCK 1
        value = 100.0 kW
        BLOCK 2
        value = 102.5
        """);
    List<Point> points = reader.read().toList();

    assertThat(points).singleElement().satisfies(p -> {
      assertThat(p.index()).isEqualTo(new IterationIndex(2));
      assertThat(p.unit("value")).isEqualTo("MW");
    });
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
    assertThat(reader.diagnostics().unitChanges()).isEmpty();
  }

  @Test
  void skippedRecordEstablishesNoUnit() {
    SchemaDrivenReader reader = open("""
        BLOCK 1
        other = 600.0 C
        BLOCK 2
        value = 1.0
        other = 900.0 K
        BLOCK 3
        value = 2.0
        other = 910.0
        """);
    List<Point> points = reader.read().toList();

    assertThat(points).extracting(p -> p.unit("other")).containsExactly("K", "K");
    assertThat(reader.diagnostics().skippedRows()).isZero();
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
  }

  @Test
  void pendingPointFixesTheUnitBeforeItIsReleased() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue = 1 MW\nBLOCK 2\nvalue = 2 kW\nvalue = 2\n");
    List<Point> points = reader.read().toList();

    assertThat(points).extracting(p -> p.unit("value")).containsExactly("MW", "MW");
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
  }

  @Test
  void malformedRowLeavesTheRecordUnchanged() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1 other=x\nvalue=2\n");
    List<Point> points = reader.read().toList();

    assertThat(points).hasSize(1);
    assertThat(points.get(0).values()).containsExactly(Map.entry("value", 2.0));
  }

  @Test
  void repeatedQuantityIsMalformed() {
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\nvalue=2\n");
    List<Point> points = reader.read().toList();

    assertThat(points).singleElement().satisfies(p -> assertThat(p.value("value")).isEqualTo(1.0));
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
  }

  @Test
  void failFastDeliversAcceptedPointsThenRaises() {
    ReaderConfig config = new ReaderConfig().setRecoveryPolicy(RecoveryPolicy.FAIL_FAST);
    SchemaDrivenReader reader = open("BLOCK 1\nvalue=1\nBLOCK 2\nvalue=abc\nBLOCK 3\nvalue=3\n", config);
    Iterator<Point> points = reader.iterator();

    assertThat(points.hasNext()).isTrue();
    assertThat(points.next().value("value")).isEqualTo(1.0);
    assertThatThrownBy(points::hasNext)
        .isInstanceOf(MalformedRecordException.class)
        .satisfies(e -> {
          MalformedRecordException malformed = (MalformedRecordException) e;
          assertThat(malformed.getCursor()).isPresent();
          assertThat(malformed.getCursor().get().line()).isEqualTo(4);
          assertThat(malformed.getLine()).isEqualTo("value=abc");
        });
    assertThat(points.hasNext()).isFalse();
    assertThat(reader.isOpen()).isFalse();
  }

  @Test
  void columnarRowsWithAnIndexAreSelfContained() {
    SchemaDrivenReader reader = open("""
        @columns n value[MW] other
        1  10.0  0.1
        2  11.0  0.2
        3  12.0  0.3
        """);
    List<Point> points = reader.read().toList();

    assertThat(points).extracting(Point::index)
        .containsExactly(new IterationIndex(1), new IterationIndex(2), new IterationIndex(3));
    assertThat(points.get(2).values()).containsEntry("value", 12.0).containsEntry("other", 0.3);
    assertThat(points.get(2).unit("value")).isEqualTo("MW");
  }

  @Test
  void columnarRowsWithoutAnIndexFillTheMarkedRecord() {
    SchemaDrivenReader reader = open("""
        @columns value other
        BLOCK 1
        10.0 0.1
        BLOCK 2
        11.0 0.2
        """);
    List<Point> points = reader.read().toList();

    assertThat(points).hasSize(2);
    assertThat(points.get(1).values()).containsEntry("value", 11.0).containsEntry("other", 0.2);
  }

  @Test
  void indexFieldMustAgreeWithTheMarker() {
    SchemaDrivenReader reader = open("BLOCK 1\nn=2\nvalue=1\n");
    List<Point> points = reader.read().toList();

    assertThat(points).singleElement().satisfies(p -> assertThat(p.index()).isEqualTo(new IterationIndex(1)));
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
  }

  @Test
  void overlongLinesAreSkipped() {
    String text = "BLOCK 1\nvalue=1\n" + "x".repeat(LineSource.MAX_LINE_LENGTH + 1) + "\n";
    SchemaDrivenReader reader = open(text);

    assertThat(reader.read().toList()).hasSize(1);
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
  }

  @Test
  void decodesConfiguredCharset() {
    byte[] latin1 = "@title Réacteur\nBLOCK 1\nvalue=1\n".getBytes(StandardCharsets.ISO_8859_1);
    SchemaDrivenReader reader = reader(new ReaderConfig().setCharset(StandardCharsets.ISO_8859_1));
    reader.open(new ByteArrayInputStream(latin1), "latin1");
    reader.read().forEach(point -> { });

    assertThat(reader.metadata()).containsEntry("title", "Réacteur");
  }
}
