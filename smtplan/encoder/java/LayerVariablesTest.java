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

package org.smtplan.encoder;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smtplan.PlannerOptions;
import org.smtplan.encoder.LayerVariables.Phase;
import org.smtplan.problem.Effect;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;

/** Tests the layer variable allocator. */
public final class LayerVariablesTest {
  private CpModel model;
  private IndexSpace space;
  private EffectIndex effects;

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
    model = new CpModel();
    IndexSpace.Builder builder = IndexSpace.newBuilder();
    builder.addLiteral("(at-goal)");
    builder.addFluent("(fuel)");
    builder.addAction("(go)");
    space = builder.build();
    effects = EffectIndex.build(GroundProblem.newBuilder(space)
        .addTimedInitialLiteral(3, Effect.add(0))
        .build());
  }

  @Test
  public void layersAreAppendOnly() {
    LayerVariables variables =
        new LayerVariables(model, space, effects, PlannerOptions.defaults());
    assertThat(variables.ensureLayers(1)).isEqualTo(2);
    assertThat(variables.numLayers()).isEqualTo(2);
    int timeIndex = variables.time(1).getIndex();
    int literalIndex = variables.literal(0, 1, Phase.POST).getIndex();

    assertThat(variables.ensureLayers(3)).isEqualTo(2);
    assertThat(variables.ensureLayers(2)).isEqualTo(0);
    assertThat(variables.numLayers()).isEqualTo(4);
    assertThat(variables.time(1).getIndex()).isEqualTo(timeIndex);
    assertThat(variables.literal(0, 1, Phase.POST).getIndex()).isEqualTo(literalIndex);
    assertThat(variables.literal(0, 1, Phase.PRE).getIndex()).isNotEqualTo(literalIndex);
  }

  @Test
  public void domainsFollowTheFixedPointScale() {
    PlannerOptions options =
        PlannerOptions.newBuilder().setScale(100).setNumericBound(50).setMaxTime(20).build();
    LayerVariables variables = new LayerVariables(model, space, effects, options);
    variables.ensureLayers(0);
    assertThat(variables.time(0).getDomain().flattenedIntervals())
        .isEqualTo(new long[] {0, 2000});
    assertThat(variables.fluent(0, 0, Phase.PRE).getDomain().flattenedIntervals())
        .isEqualTo(new long[] {-5000, 5000});
    assertThat(variables.duration(0, 0).getDomain().flattenedIntervals())
        .isEqualTo(new long[] {0, 2000});
  }

  @Test
  public void explanatoryNames() {
    PlannerOptions options = PlannerOptions.newBuilder().setExplanatoryVarNames(true).build();
    LayerVariables variables = new LayerVariables(model, space, effects, options);
    variables.ensureLayers(2);
    assertThat(variables.literal(0, 2, Phase.PRE).getName()).isEqualTo("pre_lit[(at-goal)]@2");
    assertThat(variables.fluent(0, 1, Phase.POST).getName()).isEqualTo("pos_pne[(fuel)]@1");
    assertThat(variables.starts(0, 0).getName()).isEqualTo("sta[(go)]@0");
    assertThat(variables.timedInitial(0, 1).getName()).isEqualTo("til[0]@1");
  }

  @Test
  public void terseNames() {
    LayerVariables variables =
        new LayerVariables(model, space, effects, PlannerOptions.defaults());
    variables.ensureLayers(2);
    assertThat(variables.time(2).getName()).isEqualTo("t_2");
    assertThat(variables.literal(0, 2, Phase.PRE).getName()).isEqualTo("lp0_2");
  }

  @Test
  public void horizonLimit() {
    PlannerOptions options = PlannerOptions.newBuilder().setUpperBound(3).build();
    LayerVariables variables = new LayerVariables(model, space, effects, options);
    variables.ensureLayers(3);
    assertThrows(EncodingException.HorizonLimitExceeded.class, () -> variables.ensureLayers(4));
    assertThat(variables.numLayers()).isEqualTo(4);
  }

  @Test
  public void outOfRangeLookups() {
    LayerVariables variables =
        new LayerVariables(model, space, effects, PlannerOptions.defaults());
    variables.ensureLayers(1);
    assertThrows(EncodingException.IndexOutOfRange.class, () -> variables.time(2));
    assertThrows(EncodingException.IndexOutOfRange.class,
        () -> variables.literal(1, 0, Phase.PRE));
    assertThrows(EncodingException.IndexOutOfRange.class,
        () -> variables.fluent(-1, 0, Phase.PRE));
    assertThrows(EncodingException.IndexOutOfRange.class, () -> variables.starts(1, 0));
    assertThrows(EncodingException.IndexOutOfRange.class, () -> variables.timedInitial(1, 0));
  }

  @Test
  public void inconsistentIndexSpace() {
    IndexSpace other = IndexSpace.ofSizes(2, 1, 1);
    assertThrows(EncodingException.InconsistentIndexSpace.class,
        () -> new LayerVariables(model, other, effects, PlannerOptions.defaults()));
  }
}
