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

/**
 * A node of a ground condition tree: goals, preconditions, duration constraints and effect
 * guards.
 *
 * <p>Quantified conditions are already expanded by grounding: they carry one subtree per instance.
 */
public interface Condition {
  /** Double dispatch entry point. */
  <R, C> R accept(ConditionVisitor<R, C> visitor, C context);

  /** Shortcut for a positive ground literal. */
  static Condition literal(int index) {
    return new LiteralCondition(index);
  }

  static Condition not(Condition operand) {
    return new NegatedCondition(operand);
  }

  static Condition and(Condition... operands) {
    return new ConjunctiveCondition(Arrays.asList(operands));
  }

  static Condition and(List<Condition> operands) {
    return new ConjunctiveCondition(operands);
  }

  static Condition or(Condition... operands) {
    return new DisjunctiveCondition(Arrays.asList(operands));
  }

  static Condition or(List<Condition> operands) {
    return new DisjunctiveCondition(operands);
  }

  static Condition imply(Condition antecedent, Condition consequent) {
    return new ImplyCondition(antecedent, consequent);
  }

  static Condition forall(List<Condition> instances) {
    return new QuantifiedCondition(QuantifiedCondition.Quantifier.FORALL, instances);
  }

  static Condition exists(List<Condition> instances) {
    return new QuantifiedCondition(QuantifiedCondition.Quantifier.EXISTS, instances);
  }

  static Condition atStart(Condition operand) {
    return new TimedCondition(TimeSpec.AT_START, operand);
  }

  static Condition atEnd(Condition operand) {
    return new TimedCondition(TimeSpec.AT_END, operand);
  }

  static Condition overAll(Condition operand) {
    return new TimedCondition(TimeSpec.OVER_ALL, operand);
  }

  static Condition lessThan(Expression left, Expression right) {
    return new Comparison(Comparison.Operator.LESS, left, right);
  }

  static Condition lessOrEqual(Expression left, Expression right) {
    return new Comparison(Comparison.Operator.LESS_OR_EQUAL, left, right);
  }

  static Condition equalTo(Expression left, Expression right) {
    return new Comparison(Comparison.Operator.EQUAL, left, right);
  }

  static Condition greaterOrEqual(Expression left, Expression right) {
    return new Comparison(Comparison.Operator.GREATER_OR_EQUAL, left, right);
  }

  static Condition greaterThan(Expression left, Expression right) {
    return new Comparison(Comparison.Operator.GREATER, left, right);
  }

  /** Duration constraint {@code (and (>= ?duration min) (<= ?duration max))}. */
  static Condition durationBetween(Expression min, Expression max) {
    return and(
        greaterOrEqual(Expression.duration(), min), lessOrEqual(Expression.duration(), max));
  }

  /** Duration constraint {@code (= ?duration value)}. */
  static Condition durationEquals(Expression value) {
    return equalTo(Expression.duration(), value);
  }
}
