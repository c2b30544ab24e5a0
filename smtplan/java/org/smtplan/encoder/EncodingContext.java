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

import com.google.ortools.sat.Literal;
import java.util.Objects;
import org.smtplan.encoder.LayerVariables.Phase;
import org.smtplan.problem.TimeSpec;

/**
 * Request-scoped translation context: what role the expression being built plays and which
 * variables its leaves resolve to. Contexts are immutable; a subtree that needs a different
 * binding gets a derived context.
 */
public final class EncodingContext {
  /** The role of the expression being translated. */
  public enum Mode {
    /** The goal, read at the final layer. */
    GOAL,
    /** Conditions of an action occurrence. */
    CONDITION,
    /** Duration constraints of an action occurrence. */
    DURATION,
    /** Guards and right-hand sides of effects. */
    EFFECT,
    /** A bare state formula, not attached to any action. */
    LITERAL
  }

  /** Marker for contexts not attached to an action. */
  public static final int NO_ACTION = -1;

  private final Mode mode;
  private final int layer;
  private final Phase phase;
  private final int action;
  private final TimeSpec stage;
  private final boolean continuous;
  private final boolean temporalAllowed;
  private final Literal enforcement;

  private EncodingContext(Mode mode, int layer, Phase phase, int action, TimeSpec stage,
      boolean continuous, boolean temporalAllowed) {
    this(mode, layer, phase, action, stage, continuous, temporalAllowed, null);
  }

  private EncodingContext(Mode mode, int layer, Phase phase, int action, TimeSpec stage,
      boolean continuous, boolean temporalAllowed, Literal enforcement) {
    this.mode = Objects.requireNonNull(mode);
    this.layer = layer;
    this.phase = Objects.requireNonNull(phase);
    this.action = action;
    this.stage = stage;
    this.continuous = continuous;
    this.temporalAllowed = temporalAllowed;
    this.enforcement = enforcement;
  }

  /** The goal: state is read after the effects of the final layer {@code horizon}. */
  public static EncodingContext goal(int horizon) {
    return new EncodingContext(Mode.GOAL, horizon, Phase.POST, NO_ACTION, null, false, false);
  }

  /**
   * The part of the condition of {@code action} that must hold at {@code stage}, reading the state
   * of layer {@code layer} in {@code phase}.
   */
  public static EncodingContext condition(int action, int layer, Phase phase, TimeSpec stage) {
    if (stage == TimeSpec.CONTINUOUS) {
      throw new IllegalArgumentException("conditions have no continuous stage");
    }
    return new EncodingContext(Mode.CONDITION, layer, phase, action, stage, false, true);
  }

  /** Duration constraints of the occurrence of {@code action} that starts at {@code layer}. */
  public static EncodingContext duration(int action, int layer) {
    return new EncodingContext(Mode.DURATION, layer, Phase.PRE, action, null, false, false);
  }

  /** Guards and values of effects happening at {@code layer}; {@code action} may be NO_ACTION. */
  public static EncodingContext effect(int action, int layer) {
    return new EncodingContext(Mode.EFFECT, layer, Phase.PRE, action, null, false, false);
  }

  /** Continuous effects of {@code action} over the interval that follows {@code layer}. */
  public static EncodingContext continuousEffect(int action, int layer) {
    return new EncodingContext(Mode.EFFECT, layer, Phase.POST, action, null, true, false);
  }

  /** A bare state formula at {@code layer}. */
  public static EncodingContext state(int layer, Phase phase) {
    return new EncodingContext(Mode.LITERAL, layer, phase, NO_ACTION, null, false, false);
  }

  /**
   * The same binding once the stage has been selected: the operand of a matching time qualifier,
   * or an unqualified subformula. Time qualifiers are not allowed below this point.
   */
  EncodingContext selected() {
    if (stage == null && !temporalAllowed) {
      return this;
    }
    return new EncodingContext(mode, layer, phase, action, null, continuous, false, enforcement);
  }

  /**
   * The same binding, for an expression whose value only matters when {@code literal} holds.
   * Auxiliary constraints of products and quotients are enforced by {@code literal}, so an
   * expression without an exact value does not constrain states where it is not used.
   */
  public EncodingContext enforcedBy(Literal literal) {
    return new EncodingContext(
        mode, layer, phase, action, stage, continuous, temporalAllowed, literal);
  }

  public Mode getMode() {
    return mode;
  }

  public int getLayer() {
    return layer;
  }

  public Phase getPhase() {
    return phase;
  }

  /** The action whose occurrence is being encoded, or {@link #NO_ACTION}. */
  public int getAction() {
    return action;
  }

  /**
   * The condition stage being selected in CONDITION mode; null in other modes and once the stage
   * has been selected.
   */
  public TimeSpec getStage() {
    return stage;
  }

  /** True when {@code #t} stands for the length of the interval after the layer. */
  public boolean isContinuous() {
    return continuous;
  }

  /** False once a time qualifier can no longer appear. */
  public boolean isTemporalAllowed() {
    return temporalAllowed;
  }

  /** The literal under which the expression is evaluated, or null when it always is. */
  public Literal getEnforcement() {
    return enforcement;
  }

  @Override
  public String toString() {
    return mode + "@" + layer + "/" + phase
        + (action != NO_ACTION ? " op" + action : "")
        + (stage != null ? " " + stage : "")
        + (continuous ? " continuous" : "");
  }
}
