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

/** Adds or deletes a ground literal. */
public final class LiteralEffect implements Effect {
  private final int literal;
  private final boolean add;

  public LiteralEffect(int literal, boolean add) {
    this.literal = literal;
    this.add = add;
  }

  public int getLiteral() {
    return literal;
  }

  public boolean isAdd() {
    return add;
  }

  @Override
  public <R, C> R accept(EffectVisitor<R, C> visitor, C context) {
    return visitor.visitLiteralEffect(this, context);
  }

  @Override
  public String toString() {
    return add ? "lit" + literal : "(not lit" + literal + ")";
  }
}
