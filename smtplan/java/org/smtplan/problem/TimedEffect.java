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

/** An effect qualified with {@code at start}, {@code at end}, or a continuous effect. */
public final class TimedEffect implements Effect {
  private final TimeSpec timeSpec;
  private final Effect effect;

  public TimedEffect(TimeSpec timeSpec, Effect effect) {
    if (timeSpec == TimeSpec.OVER_ALL) {
      throw new IllegalArgumentException("effects cannot be qualified with over all");
    }
    this.timeSpec = Objects.requireNonNull(timeSpec);
    this.effect = Objects.requireNonNull(effect);
  }

  public TimeSpec getTimeSpec() {
    return timeSpec;
  }

  public Effect getEffect() {
    return effect;
  }

  @Override
  public <R, C> R accept(EffectVisitor<R, C> visitor, C context) {
    return visitor.visitTimed(this, context);
  }

  @Override
  public String toString() {
    return "(" + timeSpec + " " + effect + ")";
  }
}
