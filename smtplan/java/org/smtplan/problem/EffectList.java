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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A list of effects that all apply. */
public final class EffectList implements Effect {
  private final List<Effect> effects;

  public EffectList(List<Effect> effects) {
    for (Effect effect : effects) {
      if (effect == null) {
        throw new NullPointerException("null effect in (and ...)");
      }
    }
    this.effects = Collections.unmodifiableList(new ArrayList<>(effects));
  }

  public List<Effect> getEffects() {
    return effects;
  }

  @Override
  public <R, C> R accept(EffectVisitor<R, C> visitor, C context) {
    return visitor.visitList(this, context);
  }

  @Override
  public String toString() {
    return "(and " + effects + ")";
  }
}
