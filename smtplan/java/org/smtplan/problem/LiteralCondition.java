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

/** A positive reference to a ground literal. */
public final class LiteralCondition implements Condition {
  private final int literal;

  public LiteralCondition(int literal) {
    this.literal = literal;
  }

  public int getLiteral() {
    return literal;
  }

  @Override
  public <R, C> R accept(ConditionVisitor<R, C> visitor, C context) {
    return visitor.visitLiteral(this, context);
  }

  @Override
  public String toString() {
    return "lit" + literal;
  }
}
