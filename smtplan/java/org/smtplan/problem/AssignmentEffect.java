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

/** Numeric update of a ground fluent. */
public final class AssignmentEffect implements Effect {
  /** Update operators. */
  public enum Operator {
    ASSIGN("assign"),
    INCREASE("increase"),
    DECREASE("decrease"),
    SCALE_UP("scale-up"),
    SCALE_DOWN("scale-down");

    private final String keyword;

    Operator(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  private final Operator operator;
  private final int fluent;
  private final Expression value;

  public AssignmentEffect(Operator operator, int fluent, Expression value) {
    this.operator = Objects.requireNonNull(operator);
    this.fluent = fluent;
    this.value = Objects.requireNonNull(value);
  }

  public Operator getOperator() {
    return operator;
  }

  public int getFluent() {
    return fluent;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <R, C> R accept(EffectVisitor<R, C> visitor, C context) {
    return visitor.visitAssignment(this, context);
  }

  @Override
  public String toString() {
    return "(" + operator + " pne" + fluent + " " + value + ")";
  }
}
