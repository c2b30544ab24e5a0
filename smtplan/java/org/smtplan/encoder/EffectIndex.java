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
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.AssignmentEffect;
import org.smtplan.problem.Condition;
import org.smtplan.problem.ConditionalEffect;
import org.smtplan.problem.Effect;
import org.smtplan.problem.EffectList;
import org.smtplan.problem.EffectVisitor;
import org.smtplan.problem.ForallEffect;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.problem.LiteralEffect;
import org.smtplan.problem.TimeSpec;
import org.smtplan.problem.TimedEffect;
import org.smtplan.problem.TimedInitialLiteral;

/**
 * Inverted effect relation: for every literal and fluent, the records of the actors that can
 * change it.
 *
 * <p>Frame axioms are built per target and per layer; looking up the records of a target here
 * keeps their size linear in the number of actors that actually touch it. The index is built once
 * per problem and never changes afterwards.
 */
public final class EffectIndex {
  private static final Logger logger = Logger.getLogger(EffectIndex.class.getName());

  /** Builds the index of all actions and timed initial literals of {@code problem}. */
  public static EffectIndex build(GroundProblem problem) {
    EffectIndex index = new EffectIndex(problem.getIndexSpace(),
        problem.getTimedInitialLiterals().size());
    for (GroundAction action : problem.getActions()) {
      Scope scope = new Scope(action.getIndex(), action.getKind(), null, Collections.emptyList());
      index.addAll(action.getEffect().accept(index.new Collector(action.getName()), scope));
    }
    for (TimedInitialLiteral til : problem.getTimedInitialLiterals()) {
      Scope scope = new Scope(til.getIndex(), null, null, Collections.emptyList());
      index.addAll(til.getEffect().accept(index.new Collector(til.toString()), scope));
    }
    logger.fine("Indexed " + index.records.size() + " effect records");
    return index;
  }

  private final IndexSpace indexSpace;
  private final int numTimedInitialLiterals;
  private final List<EffectRecord> records = new ArrayList<>();
  private final List<List<EffectRecord>> adders = new ArrayList<>();
  private final List<List<EffectRecord>> deleters = new ArrayList<>();
  private final List<List<EffectRecord>> discrete = new ArrayList<>();
  private final List<List<EffectRecord>> continuous = new ArrayList<>();

  private EffectIndex(IndexSpace indexSpace, int numTimedInitialLiterals) {
    this.indexSpace = indexSpace;
    this.numTimedInitialLiterals = numTimedInitialLiterals;
    for (int i = 0; i < indexSpace.numLiterals(); ++i) {
      adders.add(new ArrayList<>());
      deleters.add(new ArrayList<>());
    }
    for (int i = 0; i < indexSpace.numFluents(); ++i) {
      discrete.add(new ArrayList<>());
      continuous.add(new ArrayList<>());
    }
  }

  private void addAll(List<EffectRecord> collected) {
    for (EffectRecord record : collected) {
      records.add(record);
      switch (record.getKind()) {
        case ADD:
          adders.get(record.getTarget()).add(record);
          break;
        case DELETE:
          deleters.get(record.getTarget()).add(record);
          break;
        default:
          if (record.getInstant() == EffectRecord.Instant.CONTINUOUS) {
            continuous.get(record.getTarget()).add(record);
          } else {
            discrete.get(record.getTarget()).add(record);
          }
      }
    }
  }

  public int numLiterals() {
    return adders.size();
  }

  public int numFluents() {
    return discrete.size();
  }

  public int numActions() {
    return indexSpace.numActions();
  }

  public int numTimedInitialLiterals() {
    return numTimedInitialLiterals;
  }

  /** All records, in action order followed by timed initial literal order. */
  public List<EffectRecord> records() {
    return Collections.unmodifiableList(records);
  }

  public List<EffectRecord> literalAdders(int literal) {
    return Collections.unmodifiableList(adders.get(checkLiteral(literal)));
  }

  public List<EffectRecord> literalDeleters(int literal) {
    return Collections.unmodifiableList(deleters.get(checkLiteral(literal)));
  }

  /** Discrete effects on {@code fluent}: assignments, increases, decreases and scalings. */
  public List<EffectRecord> fluentEffects(int fluent) {
    return Collections.unmodifiableList(discrete.get(checkFluent(fluent)));
  }

  public List<EffectRecord> continuousEffects(int fluent) {
    return Collections.unmodifiableList(continuous.get(checkFluent(fluent)));
  }

  /** Returns the records of {@code records} that happen at {@code instant}. */
  public static List<EffectRecord> at(List<EffectRecord> records, EffectRecord.Instant instant) {
    List<EffectRecord> result = new ArrayList<>();
    for (EffectRecord record : records) {
      if (record.getInstant() == instant) {
        result.add(record);
      }
    }
    return result;
  }

  public boolean touchesLiteral(int literal) {
    return !adders.get(checkLiteral(literal)).isEmpty()
        || !deleters.get(literal).isEmpty();
  }

  private int checkLiteral(int literal) {
    if (literal < 0 || literal >= adders.size()) {
      throw new EncodingException.IndexOutOfRange("literal", literal, adders.size());
    }
    return literal;
  }

  private int checkFluent(int fluent) {
    if (fluent < 0 || fluent >= discrete.size()) {
      throw new EncodingException.IndexOutOfRange("fluent", fluent, discrete.size());
    }
    return fluent;
  }

  /** Where the effect being collected sits: its actor, qualifier and enclosing guards. */
  private static final class Scope {
    final int actor;
    // Null for timed initial literals.
    final ActionKind kind;
    final EffectRecord.Instant instant;
    final List<Condition> guards;

    Scope(int actor, ActionKind kind, EffectRecord.Instant instant, List<Condition> guards) {
      this.actor = actor;
      this.kind = kind;
      this.instant = instant;
      this.guards = guards;
    }

    Scope withInstant(EffectRecord.Instant newInstant) {
      return new Scope(actor, kind, newInstant, guards);
    }

    Scope withGuard(Condition guard) {
      List<Condition> newGuards = new ArrayList<>(guards);
      newGuards.add(guard);
      return new Scope(actor, kind, instant, newGuards);
    }
  }

  /** Flattens one effect tree into records. */
  private final class Collector implements EffectVisitor<List<EffectRecord>, Scope> {
    private final String owner;

    Collector(String owner) {
      this.owner = owner;
    }

    @Override
    public List<EffectRecord> visitLiteralEffect(LiteralEffect effect, Scope scope) {
      if (!indexSpace.hasLiteral(effect.getLiteral())) {
        throw new EncodingException.IndexOutOfRange(
            "literal", effect.getLiteral(), indexSpace.numLiterals());
      }
      EffectRecord.Instant instant = resolveInstant(scope);
      if (instant == EffectRecord.Instant.CONTINUOUS) {
        throw new EncodingException.UnsupportedConstruct(
            "literal effect " + effect + " of " + owner + " cannot be continuous");
      }
      EffectRecord.Kind kind = effect.isAdd() ? EffectRecord.Kind.ADD : EffectRecord.Kind.DELETE;
      return checkGuardStages(
          new EffectRecord(scope.actor, instant, effect.getLiteral(), kind, scope.guards, null),
          scope);
    }

    @Override
    public List<EffectRecord> visitAssignment(AssignmentEffect effect, Scope scope) {
      if (!indexSpace.hasFluent(effect.getFluent())) {
        throw new EncodingException.IndexOutOfRange(
            "fluent", effect.getFluent(), indexSpace.numFluents());
      }
      EffectRecord.Instant instant = resolveInstant(scope);
      EffectRecord.Kind kind = EffectRecord.Kind.valueOf(effect.getOperator().name());
      if (instant == EffectRecord.Instant.CONTINUOUS && !kind.isAdditive()) {
        throw new EncodingException.UnsupportedConstruct(
            "continuous effect " + effect + " of " + owner + " must increase or decrease");
      }
      return checkGuardStages(new EffectRecord(
          scope.actor, instant, effect.getFluent(), kind, scope.guards, effect.getValue()), scope);
    }

    @Override
    public List<EffectRecord> visitConditional(ConditionalEffect effect, Scope scope) {
      return effect.getEffect().accept(this, scope.withGuard(effect.getCondition()));
    }

    @Override
    public List<EffectRecord> visitForall(ForallEffect effect, Scope scope) {
      return collect(effect.getInstances(), scope);
    }

    @Override
    public List<EffectRecord> visitTimed(TimedEffect effect, Scope scope) {
      if (scope.instant != null) {
        throw new EncodingException.UnsupportedConstruct(
            "nested time qualifier " + effect + " in " + owner);
      }
      EffectRecord.Instant instant;
      switch (effect.getTimeSpec()) {
        case AT_START:
          instant = EffectRecord.Instant.START;
          break;
        case AT_END:
          instant = EffectRecord.Instant.END;
          break;
        default:
          instant = EffectRecord.Instant.CONTINUOUS;
      }
      checkQualifier(scope, instant, effect);
      return effect.getEffect().accept(this, scope.withInstant(instant));
    }

    @Override
    public List<EffectRecord> visitList(EffectList effect, Scope scope) {
      return collect(effect.getEffects(), scope);
    }

    private List<EffectRecord> collect(List<Effect> effects, Scope scope) {
      List<EffectRecord> result = new ArrayList<>();
      for (Effect child : effects) {
        result.addAll(child.accept(this, scope));
      }
      return result;
    }

    /**
     * Timed guards are read at the start or at the end of a durative action, never after the
     * effect happens.
     */
    private List<EffectRecord> checkGuardStages(EffectRecord record, Scope scope) {
      Set<TimeSpec> stages = record.getGuardStages();
      if (!stages.isEmpty()) {
        String problem = null;
        if (scope.kind != ActionKind.DURATIVE) {
          problem = "only durative actions have timed guards";
        } else if (stages.contains(TimeSpec.OVER_ALL) || stages.contains(TimeSpec.CONTINUOUS)) {
          problem = "guards hold at start or at end";
        } else if (record.getInstant() == EffectRecord.Instant.CONTINUOUS) {
          problem = "continuous effects take no timed guard";
        } else if (record.getInstant() == EffectRecord.Instant.START
            && stages.contains(TimeSpec.AT_END)) {
          problem = "an at start effect cannot depend on the end of its action";
        }
        if (problem != null) {
          throw new EncodingException.UnsupportedConstruct(
              "guard of " + record + " in " + owner + ": " + problem);
        }
      }
      return Collections.singletonList(record);
    }

    private void checkQualifier(Scope scope, EffectRecord.Instant instant, Effect effect) {
      boolean allowed;
      if (scope.kind == null) {
        allowed = false;
      } else {
        switch (scope.kind) {
          case DURATIVE:
            allowed = true;
            break;
          case PROCESS:
            allowed = instant == EffectRecord.Instant.CONTINUOUS;
            break;
          default:
            allowed = instant != EffectRecord.Instant.CONTINUOUS;
        }
      }
      if (!allowed) {
        throw new EncodingException.UnsupportedConstruct(
            "qualifier of " + effect + " is not allowed in " + owner);
      }
    }

    /** The instant of an effect, applying the default of its actor when it is unqualified. */
    private EffectRecord.Instant resolveInstant(Scope scope) {
      if (scope.instant != null) {
        // Instantaneous actions and events start and end at the same layer.
        if (scope.kind != ActionKind.DURATIVE && scope.instant == EffectRecord.Instant.END) {
          return EffectRecord.Instant.START;
        }
        return scope.instant;
      }
      if (scope.kind == null) {
        return EffectRecord.Instant.TIMED;
      }
      switch (scope.kind) {
        case DURATIVE:
          throw new EncodingException.UnsupportedConstruct(
              "effects of durative action " + owner + " need a time qualifier");
        case PROCESS:
          return EffectRecord.Instant.CONTINUOUS;
        default:
          return EffectRecord.Instant.START;
      }
    }
  }
}
