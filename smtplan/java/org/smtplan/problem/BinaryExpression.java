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

import java.util.Objects;

/** Binary arithmetic. */
public final class BinaryExpression implements Expression {
  /** Arithmetic operators. */
  public enum Operator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private final Operator operator;
  private final Expression left;
  private final Expression right;

  public BinaryExpression(Operator operator, Expression left, Expression right) {
    this.operator = Objects.requireNonNull(operator);
    this.left = Objects.requireNonNull(left);
    this.right = Objects.requireNonNull(right);
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitBinary(this, context);
  }

  @Override
  public String toString() {
    return "(" + operator + " " + left + " " + right + ")";
  }
}
