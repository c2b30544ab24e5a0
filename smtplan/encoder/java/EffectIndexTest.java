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

import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.Condition;
import org.smtplan.problem.Effect;
import org.smtplan.problem.Expression;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.problem.TimeSpec;

/** Tests the inversion of effect trees into per-target records. */
public final class EffectIndexTest {
  private static GroundProblem problemOf(IndexSpace space, GroundAction... actions) {
    GroundProblem.Builder builder = GroundProblem.newBuilder(space);
    for (GroundAction action : actions) {
      builder.addAction(action);
    }
    return builder.build();
  }

  @Test
  public void instantaneousEffectsHappenAtStart() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS)
        .setEffect(Effect.all(Effect.add(0), Effect.delete(1),
            Effect.increase(0, Expression.constant(2))))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(2, 1, 1), action));

    assertThat(index.records()).hasSize(3);
    assertThat(index.literalAdders(0)).hasSize(1);
    assertThat(index.literalAdders(0).get(0).getInstant()).isEqualTo(EffectRecord.Instant.START);
    assertThat(index.literalDeleters(1)).hasSize(1);
    assertThat(index.literalAdders(1)).isEmpty();
    assertThat(index.fluentEffects(0)).hasSize(1);
    assertThat(index.fluentEffects(0).get(0).getKind()).isEqualTo(EffectRecord.Kind.INCREASE);
    assertThat(index.continuousEffects(0)).isEmpty();
    assertThat(index.touchesLiteral(1)).isTrue();
  }

  @Test
  public void durativeEffectsKeepTheirQualifier() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
        .setEffect(Effect.all(
            Effect.atStart(Effect.delete(0)),
            Effect.atEnd(Effect.add(1)),
            Effect.continuous(Effect.decrease(0, Expression.elapsed()))))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(2, 1, 1), action));

    assertThat(index.literalDeleters(0).get(0).getInstant())
        .isEqualTo(EffectRecord.Instant.START);
    assertThat(index.literalAdders(1).get(0).getInstant()).isEqualTo(EffectRecord.Instant.END);
    assertThat(index.continuousEffects(0)).hasSize(1);
    assertThat(index.fluentEffects(0)).isEmpty();
    assertThat(EffectIndex.at(index.records(), EffectRecord.Instant.END)).hasSize(1);
  }

  @Test
  public void durativeEffectsNeedAQualifier() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
        .setEffect(Effect.add(0))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(1, 0, 1), action);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(problem));
  }

  @Test
  public void processEffectsAreContinuous() {
    GroundAction process = GroundAction.newBuilder(0, ActionKind.PROCESS)
        .setEffect(Effect.increase(0, Expression.elapsed()))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(0, 1, 1), process));
    assertThat(index.continuousEffects(0).get(0).getInstant())
        .isEqualTo(EffectRecord.Instant.CONTINUOUS);

    GroundAction badProcess = GroundAction.newBuilder(0, ActionKind.PROCESS)
        .setEffect(Effect.atStart(Effect.increase(0, Expression.constant(1))))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(0, 1, 1), badProcess);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(problem));
  }

  @Test
  public void continuousEffectsMustBeAdditive() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.PROCESS)
        .setEffect(Effect.assign(0, Expression.constant(1)))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(0, 1, 1), action);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(problem));
  }

  @Test
  public void eventsCannotHaveContinuousEffects() {
    GroundAction event = GroundAction.newBuilder(0, ActionKind.EVENT)
        .setEffect(Effect.continuous(Effect.increase(0, Expression.constant(1))))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(0, 1, 1), event);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(problem));
  }

  @Test
  public void conditionalAndForallEffects() {
    Condition guard = Condition.literal(0);
    GroundAction action = GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS)
        .setEffect(Effect.when(guard,
            Effect.forall(Arrays.asList(Effect.add(1), Effect.add(2)))))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(3, 0, 1), action));

    assertThat(index.literalAdders(1)).hasSize(1);
    assertThat(index.literalAdders(2)).hasSize(1);
    assertThat(index.literalAdders(2).get(0).getGuards()).containsExactly(guard);
    assertThat(index.touchesLiteral(0)).isFalse();
  }

  @Test
  public void timedInitialLiterals() {
    IndexSpace space = IndexSpace.ofSizes(1, 0, 0);
    GroundProblem problem =
        GroundProblem.newBuilder(space).addTimedInitialLiteral(5, Effect.add(0)).build();
    EffectIndex index = EffectIndex.build(problem);

    EffectRecord record = index.literalAdders(0).get(0);
    assertThat(record.isTimedInitial()).isTrue();
    assertThat(record.getInstant()).isEqualTo(EffectRecord.Instant.TIMED);
    assertThat(index.numTimedInitialLiterals()).isEqualTo(1);

    GroundProblem qualified = GroundProblem.newBuilder(space)
        .addTimedInitialLiteral(5, Effect.atStart(Effect.add(0)))
        .build();
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(qualified));
  }

  @Test
  public void targetsOutsideTheIndexSpace() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS)
        .setEffect(Effect.assign(3, Expression.constant(1)))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(0, 1, 1), action);
    assertThrows(EncodingException.IndexOutOfRange.class, () -> EffectIndex.build(problem));

    EffectIndex index = EffectIndex.build(GroundProblem.newBuilder(IndexSpace.ofSizes(1, 0, 0))
        .build());
    assertThrows(EncodingException.IndexOutOfRange.class, () -> index.literalAdders(1));
  }

  @Test
  public void nestedQualifiers() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
        .setEffect(Effect.atStart(Effect.atEnd(Effect.add(0))))
        .build();
    GroundProblem problem = problemOf(IndexSpace.ofSizes(1, 0, 1), action);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(problem));
  }

  @Test
  public void timedGuardsOfDurativeEffects() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(2)))
        .setEffect(Effect.when(
            Condition.and(Condition.atStart(Condition.literal(0)),
                Condition.atEnd(Condition.not(Condition.literal(2)))),
            Effect.atEnd(Effect.add(1))))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(3, 0, 1), action));

    EffectRecord record = index.literalAdders(1).get(0);
    assertThat(record.getInstant()).isEqualTo(EffectRecord.Instant.END);
    assertThat(record.getGuardStages()).containsExactly(TimeSpec.AT_START, TimeSpec.AT_END);
  }

  @Test
  public void plainGuardsHaveNoStage() {
    GroundAction action = GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS)
        .setEffect(Effect.when(Condition.literal(0), Effect.add(1)))
        .build();
    EffectIndex index = EffectIndex.build(problemOf(IndexSpace.ofSizes(2, 0, 1), action));
    assertThat(index.literalAdders(1).get(0).getGuardStages()).isEmpty();
  }

  @Test
  public void impossibleTimedGuards() {
    GroundAction instantaneous = GroundAction.newBuilder(0, ActionKind.INSTANTANEOUS)
        .setEffect(Effect.when(Condition.atStart(Condition.literal(0)), Effect.add(1)))
        .build();
    GroundProblem first = problemOf(IndexSpace.ofSizes(2, 0, 1), instantaneous);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(first));

    GroundAction lookahead = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
        .setEffect(
            Effect.when(Condition.atEnd(Condition.literal(0)), Effect.atStart(Effect.add(1))))
        .build();
    GroundProblem second = problemOf(IndexSpace.ofSizes(2, 0, 1), lookahead);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(second));

    GroundAction invariant = GroundAction.newBuilder(0, ActionKind.DURATIVE)
        .setDurationConstraint(Condition.durationEquals(Expression.constant(1)))
        .setEffect(
            Effect.when(Condition.overAll(Condition.literal(0)), Effect.atEnd(Effect.add(1))))
        .build();
    GroundProblem third = problemOf(IndexSpace.ofSizes(2, 0, 1), invariant);
    assertThrows(EncodingException.UnsupportedConstruct.class, () -> EffectIndex.build(third));
  }
}
