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

import io.nosqlbench.simreaders.api.config.DuplicateIndexPolicy;
import io.nosqlbench.simreaders.api.config.ReaderConfig;
import io.nosqlbench.simreaders.api.errors.DuplicateIndexException;
import io.nosqlbench.simreaders.api.point.Point;
import io.nosqlbench.simreaders.api.point.RegionIndex;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SteadyStateNeutronicsReaderTest {

  private static List<Point> readAll(SteadyStateNeutronicsReader reader, String text) {
    reader.open(new StringReader(text), "steady.out");
    return reader.read().toList();
  }

  @Test
  void singleStateYieldsOneAggregatePoint() {
    String text = """
        # whole core
        power       = 3000.0 MW
        temperature = 565.0
        k_eff       = 1.00002
        """;
    List<Point> points = readAll(new SteadyStateNeutronicsReader(), text);

    assertThat(points).singleElement().satisfies(p -> {
      assertThat(p.index()).isEqualTo(RegionIndex.AGGREGATE);
      assertThat(p.quantities()).containsExactly("k_eff", "power", "temperature");
      assertThat(p.unit("temperature")).isEqualTo("K");
      assertThat(p.unit("k_eff")).isEqualTo("1");
    });
  }

  @Test
  void regionBlocksYieldOnePointPerRegion() {
    String text = """
        REGION fuel_1
          power = 3.2 MW
          temperature_fuel = 900.0
        REGION fuel_2: power=3.1 temperature_fuel=880.0
        CHANNEL 17
          flux_thermal = 2.1e13
        """;
    List<Point> points = readAll(new SteadyStateNeutronicsReader(), text);

    assertThat(points).extracting(Point::index).containsExactly(
        new RegionIndex("fuel_1"), new RegionIndex("fuel_2"), new RegionIndex("17"));
    assertThat(points).extracting(Point::index).doesNotHaveDuplicates();
  }

  @Test
  void adjacentRepeatedRegionFollowsThePolicy() {
    String text = "REGION 1\npower=1.0\nREGION 1\npower=1.5\nREGION 2\npower=2.0\n";
    SteadyStateNeutronicsReader reader = new SteadyStateNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(p -> p.value("power")).containsExactly(1.5, 2.0);
    assertThat(reader.diagnostics().duplicatesResolved()).isEqualTo(1);
  }

  @Test
  void regionRepeatedAfterEmissionIsDropped() {
    String text = "REGION 1\npower=1.0\nREGION 2\npower=2.0\nREGION 3\npower=3.0\nREGION 1\npower=9.0\n";
    SteadyStateNeutronicsReader reader = new SteadyStateNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).hasSize(3);
    assertThat(points.get(0).value("power")).isEqualTo(1.0);
    assertThat(reader.diagnostics().duplicatesResolved()).isEqualTo(1);
  }

  @Test
  void regionRepeatedUnderErrorPolicyRaises() {
    String text = "REGION 1\npower=1.0\nREGION 2\npower=2.0\nREGION 1\npower=9.0\n";
    SteadyStateNeutronicsReader reader = new SteadyStateNeutronicsReader(
        new ReaderConfig().setDuplicateIndexPolicy(DuplicateIndexPolicy.ERROR));

    assertThatThrownBy(() -> readAll(reader, text))
        .isInstanceOf(DuplicateIndexException.class)
        .hasMessageContaining("region 1");
  }

  @Test
  void readsDelimitedChannelTables() {
    String text = """
        @columns channel;power[kW];temperature_coolant
        A1; 31.5; 580.1
        A2; 30.9;
        """;
    SteadyStateNeutronicsReader reader =
        new SteadyStateNeutronicsReader(new ReaderConfig().setColumnDelimiter(";"));
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(Point::index)
        .containsExactly(new RegionIndex("A1"), new RegionIndex("A2"));
    assertThat(points.get(1).quantities()).containsExactly("power");
    assertThat(points.get(1).unit("power")).isEqualTo("kW");
  }

  @Test
  void emptyRegionIsSkipped() {
    String text = "REGION 1\nREGION 2\npower=2.0\n";
    SteadyStateNeutronicsReader reader = new SteadyStateNeutronicsReader();
    List<Point> points = readAll(reader, text);

    assertThat(points).extracting(Point::index).containsExactly(new RegionIndex("2"));
    assertThat(reader.diagnostics().skippedRecords()).isEqualTo(1);
  }

  @Test
  void emptyOutputYieldsNothing() {
    SteadyStateNeutronicsReader reader = new SteadyStateNeutronicsReader();
    assertThat(readAll(reader, "# no results\n\n")).isEmpty();
    assertThat(reader.diagnostics().noiseLines()).isEqualTo(2);
  }
}
