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

/**
 * A ground action, process or event.
 *
 * <p>For durative actions the condition is a conjunction of {@link TimedCondition}s and the effect
 * tree qualifies every effect with a {@link TimeSpec}. The duration constraint is a condition over
 * {@code ?duration}, usually built with {@link Condition#durationBetween}.
 */
public final class GroundAction {
  /** Builder for {@link GroundAction}. */
  public static final class Builder {
    private final int index;
    private final ActionKind kind;
    private String name;
    private Condition condition = Condition.and();
    private Condition durationConstraint;
    private Effect effect = Effect.all();

    private Builder(int index, ActionKind kind) {
      this.index = index;
      this.kind = Objects.requireNonNull(kind);
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setCondition(Condition condition) {
      this.condition = Objects.requireNonNull(condition);
      return this;
    }

    public Builder setDurationConstraint(Condition durationConstraint) {
      this.durationConstraint = Objects.requireNonNull(durationConstraint);
      return this;
    }

    public Builder setEffect(Effect effect) {
      this.effect = Objects.requireNonNull(effect);
      return this;
    }

    public GroundAction build() {
      if (index < 0) {
        throw new IllegalArgumentException("negative action index " + index);
      }
      if (kind == ActionKind.DURATIVE && durationConstraint == null) {
        throw new IllegalArgumentException("durative action " + index + " has no duration");
      }
      if (kind != ActionKind.DURATIVE && durationConstraint != null) {
        throw new IllegalArgumentException(kind + " " + index + " cannot have a duration");
      }
      return new GroundAction(this);
    }
  }

  public static Builder newBuilder(int index, ActionKind kind) {
    return new Builder(index, kind);
  }

  private final int index;
  private final ActionKind kind;
  private final String name;
  private final Condition condition;
  private final Condition durationConstraint;
  private final Effect effect;

  private GroundAction(Builder builder) {
    this.index = builder.index;
    this.kind = builder.kind;
    this.name = builder.name != null ? builder.name : "op" + builder.index;
    this.condition = builder.condition;
    this.durationConstraint = builder.durationConstraint;
    this.effect = builder.effect;
  }

  public int getIndex() {
    return index;
  }

  public ActionKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public Condition getCondition() {
    return condition;
  }

  /** Returns the duration constraint, or null when the action is not durative. */
  public Condition getDurationConstraint() {
    return durationConstraint;
  }

  public Effect getEffect() {
    return effect;
  }

  @Override
  public String toString() {
    return name + "[" + index + ", " + kind + "]";
  }
}
