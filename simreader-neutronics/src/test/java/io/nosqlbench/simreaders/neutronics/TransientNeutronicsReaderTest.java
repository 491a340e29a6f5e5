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

import io.nosqlbench.simreaders.api.ReaderDiagnostics;
import io.nosqlbench.simreaders.api.SimulationMode;
import io.nosqlbench.simreaders.api.config.DuplicateIndexPolicy;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import io.nosqlbench.simreaders.api.config.RecoveryPolicy;
import io.nosqlbench.simreaders.api.errors.DuplicateIndexException;
import io.nosqlbench.simreaders.api.errors.MalformedRecordException;
import io.nosqlbench.simreaders.api.point.Point;
import io.nosqlbench.simreaders.api.point.PointIndex;
import io.nosqlbench.simreaders.api.point.TimeIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransientNeutronicsReaderTest {

  private static final String TWO_STEPS = """
      TIME STEP 1
        time  = 0.0
        power = 100.0 MW
      TIME STEP 2
        time  = 0.1
        power = 102.5 MW
      """;

  private static List<Point> readAll(TransientNeutronicsReader reader, String text) {
    reader.open(new StringReader(text), "transient.out");
    List<Point> points = new ArrayList<>();
    for (Point point : reader) {
      points.add(point);
    }
    return points;
  }

  private static TransientNeutronicsReader withDuplicates(DuplicateIndexPolicy policy) {
    return new TransientNeutronicsReader(new ReaderConfig().setDuplicateIndexPolicy(policy));
  }

  @Test
  void readsTwoWellFormedTimeSteps() {
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, TWO_STEPS);

    assertThat(points).containsExactly(
        new Point(new TimeIndex(0.0), Map.of("power", 100.0), Map.of("power", "MW")),
        new Point(new TimeIndex(0.1), Map.of("power", 102.5), Map.of("power", "MW")));
    assertThat(reader.mode()).isEqualTo(SimulationMode.TRANSIENT);
    assertThat(reader.diagnostics().hasProblems()).isFalse();
  }

  @Test
  void skipsANonNumericRow() {
    String text = """
        TIME STEP 1
          time = 0.0
          power = 100.0 MW
        TIME STEP 2
          time = 0.1
          power=abc
          flux_fast = 1.0e14
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).hasSize(2);
    assertThat(points.get(1).has("power")).isFalse();
    assertThat(points.get(1).value("flux_fast")).isEqualTo(1.0e14);
    assertThat(reader.diagnostics().skippedRows()).isEqualTo(1);
  }

  @Test
  void failFastRaisesAtTheNonNumericRow() {
    String text = """
        TIME STEP 1
          time = 0.0
          power=abc
        """;
    TransientNeutronicsReader reader =
        new TransientNeutronicsReader(new ReaderConfig().setRecoveryPolicy(RecoveryPolicy.FAIL_FAST));

    assertThatThrownBy(() -> readAll(reader, text))
        .isInstanceOf(MalformedRecordException.class)
        .hasMessageContaining("line 3")
        .satisfies(e -> assertThat(((MalformedRecordException) e).getCursor())
            .hasValueSatisfying(cursor -> assertThat(cursor.line()).isEqualTo(3)));
    assertThat(reader.isOpen()).isFalse();
  }

  private static final String RESTARTED = """
      TIME STEP 1
        time = 0.0
        power = 100.0 MW
      # restart from step 1
      TIME STEP 1
        time = 0.0
        power = 105.0 MW
      """;

  @Test
  void lastWinsKeepsTheSecondBlock() {
    TransientNeutronicsReader reader = withDuplicates(DuplicateIndexPolicy.LAST_WINS);
    List<Point> points = readAll(reader, RESTARTED);

    assertThat(points).singleElement().satisfies(p -> assertThat(p.value("power")).isEqualTo(105.0));
    assertThat(reader.diagnostics().duplicatesResolved()).isEqualTo(1);
  }

  @Test
  void firstWinsKeepsTheFirstBlock() {
    TransientNeutronicsReader reader = withDuplicates(DuplicateIndexPolicy.FIRST_WINS);
    List<Point> points = readAll(reader, RESTARTED);

    assertThat(points).singleElement().satisfies(p -> assertThat(p.value("power")).isEqualTo(100.0));
    assertThat(reader.diagnostics().duplicatesResolved()).isEqualTo(1);
  }

  @Test
  void errorPolicyRaisesOnTheDuplicate() {
    TransientNeutronicsReader reader = withDuplicates(DuplicateIndexPolicy.ERROR);

    assertThatThrownBy(() -> readAll(reader, RESTARTED))
        .isInstanceOf(DuplicateIndexException.class)
        .satisfies(e -> assertThat(((DuplicateIndexException) e).getIndex()).isEqualTo(new TimeIndex(0.0)));
    assertThat(reader.isOpen()).isFalse();
  }

  @Test
  void emittedTimesNeverDecrease() {
    String text = """
        TIME STEP 1
          time = 0.0
          power = 1.0
        TIME STEP 2
          time = 0.2
          power = 2.0
        TIME STEP 3
          time = 0.1
          power = 3.0
        TIME STEP 4
          time = 0.3
          power = 4.0
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(Point::index)
        .containsExactly(new TimeIndex(0.0), new TimeIndex(0.2), new TimeIndex(0.3));
    PointIndex previous = null;
    for (Point point : points) {
      if (previous != null) {
        assertThat(point.index().compareTo(previous)).isNotNegative();
      }
      previous = point.index();
    }
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
  }

  @Test
  void discardsATruncatedFinalBlock() {
    String text = TWO_STEPS + """
        TIME STEP 3
          time = 0.2
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).hasSize(2);
    ReaderDiagnostics diagnostics = reader.diagnostics();
    assertThat(diagnostics.truncatedRecords()).isEqualTo(1);
    assertThat(diagnostics.accountedLines()).isEqualTo(diagnostics.linesRead());
  }

  @Test
  void blockWithoutPowerOrFluxIsSkipped() {
    String text = """
        TIME STEP 1
          time = 0.0
          temperature_fuel = 900.0
        TIME STEP 2
          time = 0.1
          flux_thermal = 2.0e13
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(Point::index).containsExactly(new TimeIndex(0.1));
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
  }

  @Test
  void appliesDefaultUnits() {
    String text = """
        TIMESTEP 1
          t = 0.0
          power = 5.0
          temperature_fuel = 900.0
          reactivity = 12.0
          precursor_group_1 = 3.0e10
          flux_fast = 1.0e14
        """;
    List<Point> points = readAll(new TransientNeutronicsReader(), text);

    assertThat(points.get(0).units()).containsExactly(
        Map.entry("flux_fast", "n/cm^2/s"),
        Map.entry("power", "W"),
        Map.entry("precursor_group_1", "1/cm^3"),
        Map.entry("reactivity", "pcm"),
        Map.entry("temperature_fuel", "K"));
  }

  @Test
  void configuredDefaultUnitsOverrideTheSchema() {
    ReaderConfig config = new ReaderConfig().defaultUnit("Power", "MW");
    List<Point> points = readAll(new TransientNeutronicsReader(config), "TIME_STEP 1: t=0.0 power=5.0\n");

    assertThat(points).singleElement().satisfies(p -> assertThat(p.unit("power")).isEqualTo("MW"));
  }

  @Test
  void readsColumnarOutput() {
    String text = """
        @code  KINETICS-X 3.2
        @columns time[s] power[MW] flux-fast
           0.00   100.0   1.20e14
           0.05   100.7   1.21D+14
           0.10   101.9   1.22e14
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(Point::index)
        .containsExactly(new TimeIndex(0.0), new TimeIndex(0.05), new TimeIndex(0.1));
    assertThat(points.get(1).value("flux_fast")).isEqualTo(1.21e14);
    assertThat(points.get(1).unit("power")).isEqualTo("MW");
    assertThat(reader.metadata()).containsEntry("code", "KINETICS-X 3.2");
  }

  @Test
  void rereadingYieldsEqualSequences(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("transient.out");
    Files.writeString(file, TWO_STEPS + """
        TIME STEP 3
          time = 0.2
          power = 1.049D+02 MW
          flux_fast = 1.3e14
        """);

    List<Point> first;
    try (TransientNeutronicsReader reader = new TransientNeutronicsReader()) {
      reader.open(file);
      first = reader.read().toList();
    }
    List<Point> second;
    try (TransientNeutronicsReader reader = new TransientNeutronicsReader()) {
      reader.open(file);
      second = reader.read().toList();
    }

    assertThat(first).hasSize(3).isEqualTo(second);
  }

  @Test
  void skippedStepDoesNotFixTemperatureUnits() {
    String text = """
        TIME STEP 1
          time = 0.0
          temperature_fuel = 600.0 C
        TIME STEP 2
          time = 0.1
          power = 100.0
          temperature_fuel = 900.0 K
        """;
    TransientNeutronicsReader reader = new TransientNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).singleElement().satisfies(p -> {
      assertThat(p.value("temperature_fuel")).isEqualTo(900.0);
      assertThat(p.unit("temperature_fuel")).isEqualTo("K");
    });
    assertThat(reader.diagnostics().skippedRows()).isZero();
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
  }

  @Test
  void timeStepNumberIsNotAQuantity() {
    List<Point> points = readAll(new TransientNeutronicsReader(), "TIME STEP 7\ntime=1.5\npower=1\n");
    assertThat(points.get(0).quantities()).containsExactly("power");
  }
}
