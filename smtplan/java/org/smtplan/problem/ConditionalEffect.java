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

/** {@code (when condition effect)}. */
public final class ConditionalEffect implements Effect {
  private final Condition condition;
  private final Effect effect;

  public ConditionalEffect(Condition condition, Effect effect) {
    this.condition = Objects.requireNonNull(condition);
    this.effect = Objects.requireNonNull(effect);
  }

  public Condition getCondition() {
    return condition;
  }

  public Effect getEffect() {
    return effect;
  }

  @Override
  public <R, C> R accept(EffectVisitor<R, C> visitor, C context) {
    return visitor.visitConditional(this, context);
  }

  @Override
  public String toString() {
    return "(when " + condition + " " + effect + ")";
  }
}
