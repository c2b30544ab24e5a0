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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A grounded planning problem: the index space, the ground actions, the initial state, the goal
 * and the timed initial literals. This is what the grounding step hands to the encoder.
 */
public final class GroundProblem {
  /** Builder for {@link GroundProblem}. */
  public static final class Builder {
    private final IndexSpace indexSpace;
    private final List<GroundAction> actions = new ArrayList<>();
    private final BitSet initialLiterals = new BitSet();
    private final Map<Integer, BigDecimal> initialFluents = new HashMap<>();
    private final List<TimedInitialLiteral> timedInitialLiterals = new ArrayList<>();
    private Condition goal = Condition.and();

    private Builder(IndexSpace indexSpace) {
      this.indexSpace = Objects.requireNonNull(indexSpace);
    }

    /** Appends an action; actions must be added in index order. */
    public Builder addAction(GroundAction action) {
      if (action.getIndex() != actions.size()) {
        throw new IllegalArgumentException(
            "action " + action + " added at position " + actions.size());
      }
      actions.add(action);
      return this;
    }

    public Builder setInitiallyTrue(int literal) {
      if (!indexSpace.hasLiteral(literal)) {
        throw new IllegalArgumentException("unknown literal " + literal);
      }
      initialLiterals.set(literal);
      return this;
    }

    public Builder setInitialValue(int fluent, BigDecimal value) {
      if (!indexSpace.hasFluent(fluent)) {
        throw new IllegalArgumentException("unknown fluent " + fluent);
      }
      initialFluents.put(fluent, Objects.requireNonNull(value));
      return this;
    }

    public Builder setInitialValue(int fluent, long value) {
      return setInitialValue(fluent, BigDecimal.valueOf(value));
    }

    public Builder setInitialValue(int fluent, double value) {
      return setInitialValue(fluent, BigDecimal.valueOf(value));
    }

    public Builder setGoal(Condition goal) {
      this.goal = Objects.requireNonNull(goal);
      return this;
    }

    /** Schedules {@code effect} at absolute time {@code time}. */
    public Builder addTimedInitialLiteral(BigDecimal time, Effect effect) {
      timedInitialLiterals.add(
          new TimedInitialLiteral(timedInitialLiterals.size(), time, effect));
      return this;
    }

    public Builder addTimedInitialLiteral(double time, Effect effect) {
      return addTimedInitialLiteral(BigDecimal.valueOf(time), effect);
    }

    public GroundProblem build() {
      return new GroundProblem(this);
    }
  }

  public static Builder newBuilder(IndexSpace indexSpace) {
    return new Builder(indexSpace);
  }

  private final IndexSpace indexSpace;
  private final List<GroundAction> actions;
  private final BitSet initialLiterals;
  private final Map<Integer, BigDecimal> initialFluents;
  private final Condition goal;
  private final List<TimedInitialLiteral> timedInitialLiterals;

  private GroundProblem(Builder builder) {
    this.indexSpace = builder.indexSpace;
    this.actions = Collections.unmodifiableList(new ArrayList<>(builder.actions));
    this.initialLiterals = (BitSet) builder.initialLiterals.clone();
    this.initialFluents = Collections.unmodifiableMap(new HashMap<>(builder.initialFluents));
    this.goal = builder.goal;
    this.timedInitialLiterals =
        Collections.unmodifiableList(new ArrayList<>(builder.timedInitialLiterals));
  }

  public IndexSpace getIndexSpace() {
    return indexSpace;
  }

  public List<GroundAction> getActions() {
    return actions;
  }

  public GroundAction getAction(int index) {
    return actions.get(index);
  }

  public boolean isInitiallyTrue(int literal) {
    return initialLiterals.get(literal);
  }

  /** Returns the initial value of {@code fluent}, or null when the problem leaves it undefined. */
  public BigDecimal getInitialValue(int fluent) {
    return initialFluents.get(fluent);
  }

  public Condition getGoal() {
    return goal;
  }

  public List<TimedInitialLiteral> getTimedInitialLiterals() {
    return timedInitialLiterals;
  }
}
