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

package org.smtplan.problem;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

/** Tests the ground problem model and its builders. */
public final class GroundProblemTest {
  @Test
  public void indexSpace_handsOutDenseIndices() {
    IndexSpace.Builder builder = IndexSpace.newBuilder();
    assertThat(builder.addLiteral("(at a)")).isEqualTo(0);
    assertThat(builder.addLiteral("(at b)")).isEqualTo(1);
    assertThat(builder.addFluent("(fuel)")).isEqualTo(0);
    assertThat(builder.addAction("(move a b)")).isEqualTo(0);
    IndexSpace space = builder.build();

    assertThat(space.numLiterals()).isEqualTo(2);
    assertThat(space.numFluents()).isEqualTo(1);
    assertThat(space.numActions()).isEqualTo(1);
    assertThat(space.literalName(1)).isEqualTo("(at b)");
    assertThat(space.hasLiteral(2)).isFalse();
    assertThat(space.hasFluent(-1)).isFalse();
    assertThat(space.hasAction(0)).isTrue();
  }

  @Test
  public void indexSpace_ofSizes() {
    IndexSpace space = IndexSpace.ofSizes(3, 2, 1);
    assertThat(space.numLiterals()).isEqualTo(3);
    assertThat(space.fluentName(1)).isEqualTo("pne1");
    assertThat(space.actionName(0)).isEqualTo("op0");
    assertThrows(IllegalArgumentException.class, () -> IndexSpace.ofSizes(-1, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> IndexSpace.newBuilder().addLiteral(""));
  }

  @Test
  public void groundAction_defaults() {
    GroundAction action = GroundAction.newBuilder(4, ActionKind.INSTANTANEOUS).build();
    assertThat(action.getName()).isEqualTo("op4");
    assertThat(action.getDurationConstraint()).isNull();
    assertThat(action.getCondition()).isInstanceOf(ConjunctiveCondition.class);
    assertThat(((ConjunctiveCondition) action.getCondition()).getOperands()).isEmpty();
    assertThat(action.getEffect()).isInstanceOf(EffectList.class);
  }

  @Test
  public void groundAction_durationOnlyForDurativeActions() {
    assertThrows(IllegalArgumentException.class,
        () -> GroundAction.newBuilder(0, ActionKind.DURATIVE).build());
    assertThrows(IllegalArgumentException.class,
        () -> GroundAction.newBuilder(0, ActionKind.EVENT)
            .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
            .build());
    GroundAction durative = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(2)))
        .build();
    assertThat(durative.getDurationConstraint()).isInstanceOf(Comparison.class);
  }

  @Test
  public void groundProblem_actionsInIndexOrder() {
    IndexSpace space = IndexSpace.ofSizes(1, 1, 2);
    GroundProblem.Builder builder = GroundProblem.newBuilder(space);
    assertThrows(IllegalArgumentException.class,
        () -> builder.addAction(GroundAction.newBuilder(1, ActionKind.INSTANTANEOUS).build()));
    builder.addAction(GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS).build());
    builder.addAction(GroundAction.newBuilder(1, ActionKind.EVENT).build());
    GroundProblem problem = builder.build();
    assertThat(problem.getActions()).hasSize(2);
    assertThat(problem.getAction(1).getKind()).isEqualTo(ActionKind.EVENT);
  }

  @Test
  public void groundProblem_initialState() {
    IndexSpace space = IndexSpace.ofSizes(2, 2, 0);
    GroundProblem problem = GroundProblem.newBuilder(space)
        .setInitiallyTrue(1)
        .setInitialValue(0, 2.5)
        .addTimedInitialLiteral(10, Effect.add(0))
        .build();
    assertThat(problem.isInitiallyTrue(0)).isFalse();
    assertThat(problem.isInitiallyTrue(1)).isTrue();
    assertThat(problem.getInitialValue(0)).isEqualTo(new BigDecimal("2.5"));
    assertThat(problem.getInitialValue(1)).isNull();
    assertThat(problem.getTimedInitialLiterals()).hasSize(1);
    assertThat(problem.getTimedInitialLiterals().get(0).getIndex()).isEqualTo(0);
    assertThrows(IllegalArgumentException.class,
        () -> GroundProblem.newBuilder(space).setInitiallyTrue(2));
    assertThrows(IllegalArgumentException.class,
        () -> GroundProblem.newBuilder(space).setInitialValue(5, 1L));
  }

  @Test
  public void qualifiers_rejectImpossibleTimeSpecs() {
    assertThrows(IllegalArgumentException.class,
        () -> new TimedCondition(TimeSpec.CONTINUOUS, Condition.literal(0)));
    assertThrows(IllegalArgumentException.class,
        () -> new TimedEffect(TimeSpec.OVER_ALL, Effect.add(0)));
  }

  @Test
  public void comparison_negate() {
    assertThat(Comparison.Operator.LESS.negate()).isEqualTo(Comparison.Operator.GREATER_OR_EQUAL);
    assertThat(Comparison.Operator.GREATER.negate()).isEqualTo(Comparison.Operator.LESS_OR_EQUAL);
    assertThrows(
        UnsupportedOperationException.class, () -> Comparison.Operator.EQUAL.negate());
  }

  @Test
  public void durationBetween_isConjunctionOfBounds() {
    Condition duration =
        Condition.durationBetween(Expression.constant(5), Expression.constant(10));
    assertThat(duration).isInstanceOf(ConjunctiveCondition.class);
    ConjunctiveCondition bounds = (ConjunctiveCondition) duration;
    assertThat(bounds.getOperands()).hasSize(2);
    Comparison lower = (Comparison) bounds.getOperands().get(0);
    assertThat(lower.getOperator()).isEqualTo(Comparison.Operator.GREATER_OR_EQUAL);
    assertThat(lower.getLeft()).isInstanceOf(SpecialValue.class);
  }
}
