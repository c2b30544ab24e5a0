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
import java.util.Objects;

/** Integer or decimal literal. */
public final class NumberExpression implements Expression {
  private final BigDecimal value;

  public NumberExpression(BigDecimal value) {
    this.value = Objects.requireNonNull(value);
  }

  public BigDecimal getValue() {
    return value;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitNumber(this, context);
  }

  @Override
  public String toString() {
    return value.toPlainString();
  }
}
