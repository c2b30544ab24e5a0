// Copyright 2024-2025 The SMTPlan Authors
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.smtplan;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests PlannerOptions defaults, validation and property parsing. */
public final class PlannerOptionsTest {
  @Test
  public void defaults() {
    PlannerOptions options = PlannerOptions.defaults();
    assertThat(options.getUpperBound()).isEqualTo(100);
    assertThat(options.getScale()).isEqualTo(1000);
    assertThat(options.getNumericBound()).isEqualTo(1_000_000);
    assertThat(options.getMaxTime()).isEqualTo(100_000);
    assertThat(options.getExplanatoryVarNames()).isFalse();
    assertThat(options.getSolverTimeLimit()).isEqualTo(0.0);
    assertThat(options.getNumWorkers()).isEqualTo(0);
    assertThat(options.getLogSearchProgress()).isFalse();
  }

  @Test
  public void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> PlannerOptions.newBuilder().setUpperBound(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> PlannerOptions.newBuilder().setScale(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> PlannerOptions.newBuilder().setMaxTime(2_000_000).build());
    assertThrows(IllegalArgumentException.class,
        () -> PlannerOptions.newBuilder().setSolverTimeLimit(-1.0).build());
  }

  @Test
  public void rejectsBoundsThatOverflowProducts() {
    assertThrows(IllegalArgumentException.class,
        () -> PlannerOptions.newBuilder().setScale(1_000_000).build());
    PlannerOptions options =
        PlannerOptions.newBuilder().setScale(1_000_000).setNumericBound(2000).setMaxTime(100)
            .build();
    assertThat(options.getScale()).isEqualTo(1_000_000);
  }

  @Test
  public void fromProperties() {
    Properties properties = new Properties();
    properties.setProperty("smtplan.upperBound", "12");
    properties.setProperty("smtplan.scale", " 100 ");
    properties.setProperty("smtplan.explanatoryVarNames", "true");
    properties.setProperty("smtplan.solverTimeLimit", "2.5");
    properties.setProperty("unrelated.key", "x");
    PlannerOptions options = PlannerOptions.fromProperties(properties);
    assertThat(options.getUpperBound()).isEqualTo(12);
    assertThat(options.getScale()).isEqualTo(100);
    assertThat(options.getExplanatoryVarNames()).isTrue();
    assertThat(options.getSolverTimeLimit()).isEqualTo(2.5);
    assertThat(options.getMaxTime()).isEqualTo(100_000);
  }

  @Test
  public void fromProperties_malformedNumber() {
    Properties properties = new Properties();
    properties.setProperty("smtplan.numWorkers", "many");
    assertThrows(IllegalArgumentException.class, () -> PlannerOptions.fromProperties(properties));
  }

  @Test
  public void toBuilder_keepsValues() {
    PlannerOptions options = PlannerOptions.newBuilder().setUpperBound(7).setRandomSeed(3).build();
    PlannerOptions copy = options.toBuilder().setNumWorkers(2).build();
    assertThat(copy.getUpperBound()).isEqualTo(7);
    assertThat(copy.getRandomSeed()).isEqualTo(3);
    assertThat(copy.getNumWorkers()).isEqualTo(2);
  }
}
