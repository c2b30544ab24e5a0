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

/** Values whose meaning depends on where the expression is used. */
public final class SpecialValue implements Expression {
  /** The special symbols of the temporal fragment. */
  public enum Kind {
    /** {@code ?duration}: the duration of the action occurrence. */
    DURATION("?duration"),
    /** {@code #t}: the time elapsed within a continuous effect. */
    HASHT("#t"),
    /** {@code total-time}: the makespan of the plan. */
    TOTAL_TIME("total-time");

    private final String symbol;

    Kind(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private final Kind kind;

  public SpecialValue(Kind kind) {
    this.kind = Objects.requireNonNull(kind);
  }

  public Kind getKind() {
    return kind;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitSpecialValue(this, context);
  }

  @Override
  public String toString() {
    return kind.toString();
  }
}
