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

/** Reference to a ground numeric fluent. */
public final class FluentTerm implements Expression {
  private final int fluent;

  public FluentTerm(int fluent) {
    this.fluent = fluent;
  }

  public int getFluent() {
    return fluent;
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitFluent(this, context);
  }

  @Override
  public String toString() {
    return "pne" + fluent;
  }
}
