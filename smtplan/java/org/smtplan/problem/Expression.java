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

import java.math.BigDecimal;

/** A node of a ground numeric expression tree. */
public interface Expression {
  /** Double dispatch entry point. */
  <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);

  static Expression constant(long value) {
    return new NumberExpression(BigDecimal.valueOf(value));
  }

  /** Uses the shortest decimal representation of {@code value}, so 0.1 stays 0.1. */
  static Expression constant(double value) {
    return new NumberExpression(BigDecimal.valueOf(value));
  }

  static Expression constant(BigDecimal value) {
    return new NumberExpression(value);
  }

  static Expression fluent(int index) {
    return new FluentTerm(index);
  }

  static Expression plus(Expression left, Expression right) {
    return new BinaryExpression(BinaryExpression.Operator.PLUS, left, right);
  }

  static Expression minus(Expression left, Expression right) {
    return new BinaryExpression(BinaryExpression.Operator.MINUS, left, right);
  }

  static Expression times(Expression left, Expression right) {
    return new BinaryExpression(BinaryExpression.Operator.MULTIPLY, left, right);
  }

  static Expression divide(Expression left, Expression right) {
    return new BinaryExpression(BinaryExpression.Operator.DIVIDE, left, right);
  }

  static Expression negate(Expression operand) {
    return new NegatedExpression(operand);
  }

  /** {@code ?duration}. */
  static Expression duration() {
    return new SpecialValue(SpecialValue.Kind.DURATION);
  }

  /** {@code #t}, the time elapsed inside a continuous effect. */
  static Expression elapsed() {
    return new SpecialValue(SpecialValue.Kind.HASHT);
  }

  /** {@code total-time}. */
  static Expression totalTime() {
    return new SpecialValue(SpecialValue.Kind.TOTAL_TIME);
  }
}
