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

import java.util.Arrays;
import java.util.List;

/** A node of a ground effect tree. */
public interface Effect {
  /** Double dispatch entry point. */
  <R, C> R accept(EffectVisitor<R, C> visitor, C context);

  static Effect add(int literal) {
    return new LiteralEffect(literal, true);
  }

  static Effect delete(int literal) {
    return new LiteralEffect(literal, false);
  }

  static Effect assign(int fluent, Expression value) {
    return new AssignmentEffect(AssignmentEffect.Operator.ASSIGN, fluent, value);
  }

  static Effect increase(int fluent, Expression value) {
    return new AssignmentEffect(AssignmentEffect.Operator.INCREASE, fluent, value);
  }

  static Effect decrease(int fluent, Expression value) {
    return new AssignmentEffect(AssignmentEffect.Operator.DECREASE, fluent, value);
  }

  static Effect scaleUp(int fluent, Expression value) {
    return new AssignmentEffect(AssignmentEffect.Operator.SCALE_UP, fluent, value);
  }

  static Effect scaleDown(int fluent, Expression value) {
    return new AssignmentEffect(AssignmentEffect.Operator.SCALE_DOWN, fluent, value);
  }

  static Effect when(Condition condition, Effect effect) {
    return new ConditionalEffect(condition, effect);
  }

  static Effect forall(List<Effect> instances) {
    return new ForallEffect(instances);
  }

  static Effect atStart(Effect effect) {
    return new TimedEffect(TimeSpec.AT_START, effect);
  }

  static Effect atEnd(Effect effect) {
    return new TimedEffect(TimeSpec.AT_END, effect);
  }

  /** A continuous effect; its value is the rate of change, usually written with {@code #t}. */
  static Effect continuous(Effect effect) {
    return new TimedEffect(TimeSpec.CONTINUOUS, effect);
  }

  static Effect all(Effect... effects) {
    return new EffectList(Arrays.asList(effects));
  }

  static Effect all(List<Effect> effects) {
    return new EffectList(effects);
  }
}
