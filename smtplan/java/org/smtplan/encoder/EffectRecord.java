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

package org.smtplan.encoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.smtplan.problem.Comparison;
import org.smtplan.problem.Condition;
import org.smtplan.problem.ConditionVisitor;
import org.smtplan.problem.ConjunctiveCondition;
import org.smtplan.problem.DisjunctiveCondition;
import org.smtplan.problem.Expression;
import org.smtplan.problem.ImplyCondition;
import org.smtplan.problem.LiteralCondition;
import org.smtplan.problem.NegatedCondition;
import org.smtplan.problem.QuantifiedCondition;
import org.smtplan.problem.TimeSpec;
import org.smtplan.problem.TimedCondition;

/**
 * One ground effect, detached from its action: who causes it, when, on what, and under which
 * guards. Records do not depend on the layer; the encoder instantiates them at every layer.
 */
public final class EffectRecord {
  /** When, relative to its actor, an effect happens. */
  public enum Instant {
    /** At the start of an action, or at the happening of an instantaneous action or event. */
    START,
    /** At the end of a durative action. */
    END,
    /** Over the interval during which the actor runs. */
    CONTINUOUS,
    /** At the fixed time of a timed initial literal. */
    TIMED
  }

  /** What an effect does to its target. */
  public enum Kind {
    ADD,
    DELETE,
    ASSIGN,
    INCREASE,
    DECREASE,
    SCALE_UP,
    SCALE_DOWN;

    public boolean isLiteralKind() {
      return this == ADD || this == DELETE;
    }

    /** True for the kinds that overwrite the value of a fluent. */
    public boolean isAssigning() {
      return this == ASSIGN || this == SCALE_UP || this == SCALE_DOWN;
    }

    /** True for the kinds that add a delta to the value of a fluent. */
    public boolean isAdditive() {
      return this == INCREASE || this == DECREASE;
    }
  }

  private final int actor;
  private final Instant instant;
  private final int target;
  private final Kind kind;
  private final List<Condition> guards;
  private final Expression value;
  private final Set<TimeSpec> guardStages;

  EffectRecord(
      int actor, Instant instant, int target, Kind kind, List<Condition> guards, Expression value) {
    this.actor = actor;
    this.instant = Objects.requireNonNull(instant);
    this.target = target;
    this.kind = Objects.requireNonNull(kind);
    this.guards = Collections.unmodifiableList(new ArrayList<>(guards));
    this.value = value;
    if (kind.isLiteralKind() != (value == null)) {
      throw new IllegalArgumentException("numeric effects need a value, literal effects none");
    }
    Set<TimeSpec> stages = EnumSet.noneOf(TimeSpec.class);
    for (Condition guard : guards) {
      stages.addAll(timeQualifiers(guard));
    }
    this.guardStages = Collections.unmodifiableSet(stages);
  }

  /** The time qualifiers that appear anywhere in {@code condition}. */
  static Set<TimeSpec> timeQualifiers(Condition condition) {
    Set<TimeSpec> stages = EnumSet.noneOf(TimeSpec.class);
    condition.accept(QualifierFinder.INSTANCE, stages);
    return stages;
  }

  /** Action index, or timed initial literal index when {@link #isTimedInitial()}. */
  public int getActor() {
    return actor;
  }

  public boolean isTimedInitial() {
    return instant == Instant.TIMED;
  }

  public Instant getInstant() {
    return instant;
  }

  /** Literal index for {@code ADD}/{@code DELETE}, fluent index otherwise. */
  public int getTarget() {
    return target;
  }

  public Kind getKind() {
    return kind;
  }

  /** Conditions of the enclosing conditional effects; empty when unconditional. */
  public List<Condition> getGuards() {
    return guards;
  }

  /**
   * Time qualifiers used by the guards, as in {@code (when (at start p) (at end q))}; empty when
   * the guards are read at the layer of the effect.
   */
  public Set<TimeSpec> getGuardStages() {
    return guardStages;
  }

  /** Right-hand side of a numeric effect; null for literal effects. */
  public Expression getValue() {
    return value;
  }

  @Override
  public String toString() {
    return (isTimedInitial() ? "til" : "op") + actor + "/" + instant + ": " + kind + " " + target
        + (value != null ? " " + value : "") + (guards.isEmpty() ? "" : " when " + guards);
  }

  private static final class QualifierFinder implements ConditionVisitor<Void, Set<TimeSpec>> {
    static final QualifierFinder INSTANCE = new QualifierFinder();

    @Override
    public Void visitLiteral(LiteralCondition condition, Set<TimeSpec> stages) {
      return null;
    }

    @Override
    public Void visitNegation(NegatedCondition condition, Set<TimeSpec> stages) {
      return condition.getOperand().accept(this, stages);
    }

    @Override
    public Void visitConjunction(ConjunctiveCondition condition, Set<TimeSpec> stages) {
      return visitAll(condition.getOperands(), stages);
    }

    @Override
    public Void visitDisjunction(DisjunctiveCondition condition, Set<TimeSpec> stages) {
      return visitAll(condition.getOperands(), stages);
    }

    @Override
    public Void visitImplication(ImplyCondition condition, Set<TimeSpec> stages) {
      condition.getAntecedent().accept(this, stages);
      return condition.getConsequent().accept(this, stages);
    }

    @Override
    public Void visitQuantified(QuantifiedCondition condition, Set<TimeSpec> stages) {
      return visitAll(condition.getInstances(), stages);
    }

    @Override
    public Void visitTimed(TimedCondition condition, Set<TimeSpec> stages) {
      stages.add(condition.getTimeSpec());
      return condition.getOperand().accept(this, stages);
    }

    @Override
    public Void visitComparison(Comparison condition, Set<TimeSpec> stages) {
      return null;
    }

    private Void visitAll(List<Condition> conditions, Set<TimeSpec> stages) {
      for (Condition condition : conditions) {
        condition.accept(this, stages);
      }
      return null;
    }
  }
}
