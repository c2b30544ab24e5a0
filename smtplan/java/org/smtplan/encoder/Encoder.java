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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.smtplan.PlannerOptions;
import org.smtplan.encoder.LayerVariables.Phase;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.Comparison;
import org.smtplan.problem.Condition;
import org.smtplan.problem.ConjunctiveCondition;
import org.smtplan.problem.Expression;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.problem.NumberExpression;
import org.smtplan.problem.SpecialValue;
import org.smtplan.problem.TimeSpec;
import org.smtplan.problem.TimedInitialLiteral;
import org.smtplan.solver.SolveStatus;
import org.smtplan.solver.SolverSession;

/**
 * Builds the constraint formula of a ground problem for a growing horizon.
 *
 * <p>Layer {@code h} is a happening at {@code time(h)}: actions start and end there, and their
 * discrete effects turn the pre-state of the layer into its post-state. Between two layers time
 * passes, running actions are checked against their invariants, and continuous effects change the
 * fluents. The formula for horizon {@code H} is the conjunction of the layer constraints of
 * layers {@code 0..H} and of a horizon literal that closes the plan at {@code H}; only the
 * horizon literal is passed to the solver as an assumption, so layers are encoded once and shared
 * by every horizon.
 *
 * <p>Usage:
 *
 * <pre>
 *   Encoder encoder = new Encoder(problem, options, new SolverSession(options));
 *   for (int h = 0; encoder.encode(h); ++h) {
 *     if (encoder.solve() == SolveStatus.SATISFIABLE) {
 *       return encoder.solution();
 *     }
 *   }
 * </pre>
 */
public final class Encoder {
  private static final Logger logger = Logger.getLogger(Encoder.class.getName());

  private final GroundProblem problem;
  private final IndexSpace indexSpace;
  private final SolverSession session;
  private final CpModel model;
  private final EffectIndex effects;
  private final LayerVariables variables;
  private final ExpressionTranslator translator;
  private final FixedPoint fixedPoint;
  private final boolean explanatoryNames;
  private final Map<Integer, Literal> horizonLiterals = new HashMap<>();
  private int encodedLayers;
  private int horizon = -1;

  /**
   * Creates an encoder posting into the model of {@code session}.
   *
   * @throws EncodingException if the problem is structurally invalid
   */
  public Encoder(GroundProblem problem, PlannerOptions options, SolverSession session) {
    this.problem = problem;
    this.indexSpace = problem.getIndexSpace();
    this.session = session;
    this.model = session.model();
    if (problem.getActions().size() != indexSpace.numActions()) {
      throw new EncodingException.InconsistentIndexSpace(
          "actions", indexSpace.numActions(), problem.getActions().size());
    }
    this.effects = EffectIndex.build(problem);
    this.variables = new LayerVariables(model, indexSpace, effects, options);
    this.explanatoryNames = options.getExplanatoryVarNames();
    this.translator = new ExpressionTranslator(model, variables, explanatoryNames);
    this.fixedPoint = variables.fixedPoint();
  }

  /**
   * Builds the formula for horizon {@code horizon}: layers not yet encoded are added and the
   * horizon literal of {@code horizon} becomes the only assumption.
   *
   * @return false if {@code horizon} exceeds the configured upper bound; nothing is added then
   * @throws EncodingException on structural errors of the problem
   */
  public boolean encode(int horizon) {
    if (horizon < 0) {
      throw new IllegalArgumentException("negative horizon " + horizon);
    }
    try {
      variables.ensureLayers(horizon);
    } catch (EncodingException.HorizonLimitExceeded e) {
      logger.warning(e.getMessage());
      return false;
    }
    if (encodedLayers == 0) {
      checkProblem();
    }
    while (encodedLayers <= horizon) {
      encodeLayer(encodedLayers);
      logger.fine("Encoded layer " + encodedLayers);
      ++encodedLayers;
    }
    session.assume(horizonLiteral(horizon));
    this.horizon = horizon;
    logger.info("Encoded horizon " + horizon + ": " + session.modelStats());
    return true;
  }

  /** Solves the formula of the last encoded horizon. */
  public SolveStatus solve() {
    if (horizon < 0) {
      throw new IllegalStateException("nothing encoded yet");
    }
    return session.solve();
  }

  /**
   * Returns the plan found by the last {@link #solve()}.
   *
   * @throws IllegalStateException if the last solve was not satisfiable
   */
  public Solution solution() {
    if (session.lastStatus() != SolveStatus.SATISFIABLE) {
      throw new IllegalStateException("no plan, last status is " + session.lastStatus());
    }
    return new Solution(problem, variables, session, horizon);
  }

  /** The last encoded horizon, or -1. */
  public int horizon() {
    return horizon;
  }

  public LayerVariables variables() {
    return variables;
  }

  private void checkProblem() {
    for (GroundAction action : problem.getActions()) {
      if (action.getKind() == ActionKind.DURATIVE) {
        checkDurationBounds(action);
      }
    }
    for (int f = 0; f < indexSpace.numFluents(); ++f) {
      if (problem.getInitialValue(f) == null) {
        throw new EncodingException.UndefinedFluent(indexSpace.fluentName(f));
      }
    }
  }

  private void encodeLayer(int h) {
    encodeTiming(h);
    for (GroundAction action : problem.getActions()) {
      switch (action.getKind()) {
        case INSTANTANEOUS:
          encodeInstantaneous(action, h);
          break;
        case DURATIVE:
          encodeDurative(action, h);
          break;
        case PROCESS:
          encodeProcess(action, h);
          break;
        case EVENT:
          encodeEvent(action, h);
          break;
        default:
          throw new IllegalStateException("unknown action kind " + action.getKind());
      }
    }
    for (TimedInitialLiteral til : problem.getTimedInitialLiterals()) {
      encodeTimedInitialLiteral(til, h);
    }
    if (h == 0) {
      encodeInitialState();
    }
    for (int l = 0; l < indexSpace.numLiterals(); ++l) {
      encodeLiteralSupport(l, h);
    }
    for (int f = 0; f < indexSpace.numFluents(); ++f) {
      encodeFluentSupport(f, h);
    }
  }

  private void encodeTiming(int h) {
    IntVar time = variables.time(h);
    if (h == 0) {
      model.addEquality(time, 0);
      return;
    }
    IntVar previous = variables.time(h - 1);
    model.addGreaterOrEqual(time, previous);
    model.addEquality(
        variables.interval(h - 1), LinearExpr.newBuilder().add(time).addTerm(previous, -1));
  }

  private void encodeInstantaneous(GroundAction action, int h) {
    final int a = action.getIndex();
    BoolVar start = variables.starts(a, h);
    model.addEquality(variables.ends(a, h), start);
    model.addEquality(variables.running(a, h), 0);
    model.addEquality(variables.duration(a, h), 0);
    Literal condition = translator.translate(action.getCondition(),
        EncodingContext.condition(a, h, Phase.PRE, TimeSpec.AT_START).enforcedBy(start));
    model.addImplication(start, condition);
  }

  private void encodeDurative(GroundAction action, int h) {
    final int a = action.getIndex();
    BoolVar start = variables.starts(a, h);
    BoolVar end = variables.ends(a, h);
    BoolVar running = variables.running(a, h);
    IntVar duration = variables.duration(a, h);

    model.addImplication(start, translator.translate(action.getCondition(),
        EncodingContext.condition(a, h, Phase.PRE, TimeSpec.AT_START).enforcedBy(start)));
    model.addImplication(start, translator.translate(
        action.getDurationConstraint(), EncodingContext.duration(a, h).enforcedBy(start)));
    model.addImplication(end, translator.translate(action.getCondition(),
        EncodingContext.condition(a, h, Phase.PRE, TimeSpec.AT_END).enforcedBy(end)));
    model.addImplication(running, translator.translate(action.getCondition(),
        EncodingContext.condition(a, h, Phase.POST, TimeSpec.OVER_ALL).enforcedBy(running)));

    if (h == 0) {
      model.addEquality(end, 0);
      model.addEquality(running, start);
      return;
    }
    BoolVar wasRunning = variables.running(a, h - 1);
    model.addImplication(wasRunning, translator.translate(action.getCondition(),
        EncodingContext.condition(a, h, Phase.PRE, TimeSpec.OVER_ALL).enforcedBy(wasRunning)));

    // running(h) <-> start(h) or (running(h-1) and not end(h))
    Literal carried = translator.and(listOf(wasRunning, end.not()));
    model.addBoolOr(new Literal[] {start, carried}).onlyEnforceIf(running);
    model.addImplication(start, running);
    model.addImplication(carried, running);
    model.addImplication(end, wasRunning);
    model.addImplication(start, wasRunning.not());

    model.addEquality(duration, variables.duration(a, h - 1)).onlyEnforceIf(start.not());

    // The occurrence ending at h started at the last start layer k < h.
    IntVar endTime = variables.time(h);
    for (int k = h - 1; k >= 0; --k) {
      List<Literal> enforcement = lastStart(a, k, h);
      enforcement.add(end);
      model.addEquality(
              LinearExpr.newBuilder().add(endTime).addTerm(variables.time(k), -1), duration)
          .onlyEnforceIf(enforcement.toArray(new Literal[0]));
    }
  }

  private void encodeProcess(GroundAction action, int h) {
    final int a = action.getIndex();
    model.addEquality(variables.starts(a, h), 0);
    model.addEquality(variables.ends(a, h), 0);
    model.addEquality(variables.duration(a, h), 0);
    Literal condition = translator.translate(
        action.getCondition(), EncodingContext.state(h, Phase.POST));
    equivalent(variables.running(a, h), condition);
  }

  private void encodeEvent(GroundAction action, int h) {
    final int a = action.getIndex();
    BoolVar start = variables.starts(a, h);
    model.addEquality(variables.ends(a, h), start);
    model.addEquality(variables.running(a, h), 0);
    model.addEquality(variables.duration(a, h), 0);
    Literal condition = translator.translate(
        action.getCondition(), EncodingContext.state(h, Phase.PRE));
    equivalent(start, condition);
  }

  private void encodeTimedInitialLiteral(TimedInitialLiteral til, int h) {
    final int i = til.getIndex();
    BoolVar happens = variables.timedInitial(i, h);
    BoolVar occurred = variables.timedInitialOccurred(i, h);
    model.addEquality(variables.time(h), fixedPoint.toScaled(til.getTime()))
        .onlyEnforceIf(happens);
    if (h == 0) {
      model.addEquality(occurred, happens);
      return;
    }
    BoolVar occurredBefore = variables.timedInitialOccurred(i, h - 1);
    model.addImplication(happens, occurredBefore.not());
    model.addBoolOr(new Literal[] {occurredBefore, happens}).onlyEnforceIf(occurred);
    model.addImplication(occurredBefore, occurred);
    model.addImplication(happens, occurred);
  }

  private void encodeInitialState() {
    for (int l = 0; l < indexSpace.numLiterals(); ++l) {
      model.addEquality(
          variables.literal(l, 0, Phase.PRE), problem.isInitiallyTrue(l) ? 1 : 0);
    }
    for (int f = 0; f < indexSpace.numFluents(); ++f) {
      model.addEquality(
          variables.fluent(f, 0, Phase.PRE), fixedPoint.toScaled(problem.getInitialValue(f)));
    }
  }

  /** post(l) holds iff an active effect adds l, or l held and no active effect deletes it. */
  private void encodeLiteralSupport(int l, int h) {
    BoolVar pre = variables.literal(l, h, Phase.PRE);
    BoolVar post = variables.literal(l, h, Phase.POST);
    if (h > 0) {
      model.addEquality(pre, variables.literal(l, h - 1, Phase.POST));
    }
    List<Literal> adders = activations(effects.literalAdders(l), h);
    List<Literal> deleters = activations(effects.literalDeleters(l), h);

    for (Literal adder : adders) {
      model.addImplication(adder, post);
    }
    List<Literal> support = new ArrayList<>(adders);
    support.add(pre);
    model.addBoolOr(support.toArray(new Literal[0])).onlyEnforceIf(post);
    for (Literal deleter : deleters) {
      if (adders.isEmpty()) {
        model.addImplication(deleter, post.not());
      } else {
        model.addBoolOr(adders.toArray(new Literal[0]))
            .onlyEnforceIf(new Literal[] {post, deleter});
      }
    }
    List<Literal> loss = new ArrayList<>(deleters);
    loss.add(post);
    loss.add(pre.not());
    model.addBoolOr(loss.toArray(new Literal[0]));
  }

  private void encodeFluentSupport(int f, int h) {
    IntVar pre = variables.fluent(f, h, Phase.PRE);
    IntVar post = variables.fluent(f, h, Phase.POST);
    if (h > 0) {
      encodeFlow(f, h);
    }

    List<EffectRecord> records = effects.fluentEffects(f);
    List<Literal> active = activations(records, h);
    LinearExprBuilder sum = LinearExpr.newBuilder().add(pre);
    List<Literal> assigning = new ArrayList<>();
    for (int e = 0; e < records.size(); ++e) {
      EffectRecord record = records.get(e);
      Literal activation = active.get(e);
      if (translator.isFalse(activation)) {
        continue;
      }
      EncodingContext context =
          EncodingContext.effect(effectActor(record), h).enforcedBy(activation);
      if (record.getKind().isAssigning()) {
        LinearExpr value = translator.translate(assignedValue(record), context);
        model.addEquality(post, value).onlyEnforceIf(activation);
        assigning.add(activation);
        for (int other = 0; other < records.size(); ++other) {
          if (other != e && !translator.isFalse(active.get(other))) {
            model.addBoolOr(new Literal[] {activation.not(), active.get(other).not()});
          }
        }
      } else {
        LinearExpr value = translator.translate(record.getValue(), context);
        IntVar delta = newDelta("delta", f, h);
        long sign = record.getKind() == EffectRecord.Kind.DECREASE ? -1 : 1;
        model.addEquality(delta, LinearExpr.term(value, sign)).onlyEnforceIf(activation);
        model.addEquality(delta, 0).onlyEnforceIf(activation.not());
        sum.add(delta);
      }
    }
    Literal anyAssign = translator.or(assigning);
    if (translator.isFalse(anyAssign)) {
      model.addEquality(post, sum);
    } else {
      model.addEquality(post, sum).onlyEnforceIf(anyAssign.not());
    }
  }

  /** pre(f, h) = post(f, h-1) plus the flows of the actions running over interval h-1. */
  private void encodeFlow(int f, int h) {
    LinearExprBuilder sum = LinearExpr.newBuilder().add(variables.fluent(f, h - 1, Phase.POST));
    for (EffectRecord record : effects.continuousEffects(f)) {
      final int a = record.getActor();
      BoolVar running = variables.running(a, h - 1);
      EncodingContext context = EncodingContext.continuousEffect(a, h - 1);
      List<Literal> conditions = new ArrayList<>();
      conditions.add(running);
      for (Condition guard : record.getGuards()) {
        conditions.add(translator.translate(guard, context.enforcedBy(running)));
      }
      Literal activation = translator.and(conditions);
      LinearExpr value = translator.translate(record.getValue(), context.enforcedBy(activation));
      IntVar flow = newDelta("flow", f, h);
      long sign = record.getKind() == EffectRecord.Kind.DECREASE ? -1 : 1;
      model.addEquality(flow, LinearExpr.term(value, sign)).onlyEnforceIf(activation);
      model.addEquality(flow, 0).onlyEnforceIf(activation.not());
      sum.add(flow);
    }
    model.addEquality(variables.fluent(f, h, Phase.PRE), sum);
  }

  /** Activation literal of each discrete record at layer {@code h}, in record order. */
  private List<Literal> activations(List<EffectRecord> records, int h) {
    List<Literal> result = new ArrayList<>(records.size());
    for (EffectRecord record : records) {
      Literal occurrence = occurrence(record, h);
      List<Literal> conditions = new ArrayList<>();
      conditions.add(occurrence);
      for (Condition guard : record.getGuards()) {
        conditions.add(guard(record, guard, h, occurrence));
      }
      result.add(translator.and(conditions));
    }
    return result;
  }

  /**
   * Translates one guard of a record happening at layer {@code h}. A guard without time qualifier
   * reads the pre-state of {@code h}. A timed guard of an at-end effect reads its {@code at end}
   * part at {@code h} and its {@code at start} part at the layer where the occurrence started.
   */
  private Literal guard(EffectRecord record, Condition guard, int h, Literal occurrence) {
    if (EffectRecord.timeQualifiers(guard).isEmpty()) {
      return translator.translate(
          guard, EncodingContext.effect(effectActor(record), h).enforcedBy(occurrence));
    }
    final int a = record.getActor();
    if (record.getInstant() == EffectRecord.Instant.START) {
      return translator.translate(guard,
          EncodingContext.condition(a, h, Phase.PRE, TimeSpec.AT_START).enforcedBy(occurrence));
    }
    List<Literal> parts = new ArrayList<>();
    parts.add(translator.translate(guard,
        EncodingContext.condition(a, h, Phase.PRE, TimeSpec.AT_END).enforcedBy(occurrence)));
    List<Literal> startOptions = new ArrayList<>();
    for (int k = h - 1; k >= 0; --k) {
      Literal startedAtK = translator.and(lastStart(a, k, h));
      Literal used = translator.and(listOf(occurrence, startedAtK));
      Literal held = translator.translate(guard,
          EncodingContext.condition(a, k, Phase.PRE, TimeSpec.AT_START).enforcedBy(used));
      startOptions.add(translator.and(listOf(startedAtK, held)));
    }
    parts.add(translator.or(startOptions));
    return translator.and(parts);
  }

  /** Literals stating that {@code k} is the last layer before {@code h} where {@code a} starts. */
  private List<Literal> lastStart(int a, int k, int h) {
    List<Literal> literals = new ArrayList<>();
    literals.add(variables.starts(a, k));
    for (int j = k + 1; j < h; ++j) {
      literals.add(variables.starts(a, j).not());
    }
    return literals;
  }

  private Literal occurrence(EffectRecord record, int h) {
    switch (record.getInstant()) {
      case START:
        return variables.starts(record.getActor(), h);
      case END:
        return variables.ends(record.getActor(), h);
      case TIMED:
        return variables.timedInitial(record.getActor(), h);
      default:
        throw new IllegalStateException("no discrete occurrence for " + record);
    }
  }

  private static int effectActor(EffectRecord record) {
    return record.isTimedInitial() ? EncodingContext.NO_ACTION : record.getActor();
  }

  /** The new value of an assigning effect, in terms of the pre-value of its target. */
  private static Expression assignedValue(EffectRecord record) {
    Expression current = Expression.fluent(record.getTarget());
    switch (record.getKind()) {
      case ASSIGN:
        return record.getValue();
      case SCALE_UP:
        return Expression.times(current, record.getValue());
      case SCALE_DOWN:
        return Expression.divide(current, record.getValue());
      default:
        throw new IllegalStateException(record.getKind() + " is not an assignment");
    }
  }

  private void equivalent(Literal left, Literal right) {
    model.addImplication(left, right);
    model.addImplication(right, left);
  }

  private IntVar newDelta(String what, int f, int h) {
    long bound = fixedPoint.valueBound();
    String name = explanatoryNames ? what + "[" + indexSpace.fluentName(f) + "]@" + h : "";
    return model.newIntVar(-2 * bound, 2 * bound, name);
  }

  /**
   * The literal closing the plan at {@code h}: the goal holds, nothing starts, no durative action
   * is still running, and timed initial literals that did not happen yet lie after time(h).
   */
  private Literal horizonLiteral(int h) {
    Literal existing = horizonLiterals.get(h);
    if (existing != null) {
      return existing;
    }
    BoolVar closes = model.newBoolVar(explanatoryNames ? "horizon@" + h : "g_" + h);
    Literal goal =
        translator.translate(problem.getGoal(), EncodingContext.goal(h).enforcedBy(closes));
    model.addImplication(closes, goal);
    for (GroundAction action : problem.getActions()) {
      final int a = action.getIndex();
      switch (action.getKind()) {
        case INSTANTANEOUS:
          model.addImplication(closes, variables.starts(a, h).not());
          break;
        case DURATIVE:
          model.addImplication(closes, variables.starts(a, h).not());
          model.addImplication(closes, variables.running(a, h).not());
          break;
        default:
          break;
      }
    }
    for (TimedInitialLiteral til : problem.getTimedInitialLiterals()) {
      model.addLessThan(variables.time(h), fixedPoint.toScaled(til.getTime()))
          .onlyEnforceIf(
              new Literal[] {closes, variables.timedInitialOccurred(til.getIndex(), h).not()});
    }
    horizonLiterals.put(h, closes);
    return closes;
  }

  /** Rejects duration constraints whose constant bounds leave no possible duration. */
  private static void checkDurationBounds(GroundAction action) {
    List<Condition> conjuncts = new ArrayList<>();
    Condition constraint = action.getDurationConstraint();
    if (constraint instanceof ConjunctiveCondition) {
      conjuncts.addAll(((ConjunctiveCondition) constraint).getOperands());
    } else {
      conjuncts.add(constraint);
    }
    BigDecimal min = null;
    BigDecimal max = null;
    for (Condition conjunct : conjuncts) {
      if (!(conjunct instanceof Comparison)) {
        continue;
      }
      Comparison comparison = (Comparison) conjunct;
      if (!isDuration(comparison.getLeft())
          || !(comparison.getRight() instanceof NumberExpression)) {
        continue;
      }
      BigDecimal bound = ((NumberExpression) comparison.getRight()).getValue();
      switch (comparison.getOperator()) {
        case GREATER:
        case GREATER_OR_EQUAL:
          min = min == null ? bound : min.max(bound);
          break;
        case LESS:
        case LESS_OR_EQUAL:
          max = max == null ? bound : max.min(bound);
          break;
        case EQUAL:
          min = min == null ? bound : min.max(bound);
          max = max == null ? bound : max.min(bound);
          break;
      }
    }
    if (min != null && max != null && min.compareTo(max) > 0) {
      throw new EncodingException.MalformedDuration(
          action.getName(), min.toPlainString(), max.toPlainString());
    }
    if (max != null && max.signum() < 0) {
      throw new EncodingException.MalformedDuration(action.getName(), "0", max.toPlainString());
    }
  }

  private static boolean isDuration(Expression expression) {
    return expression instanceof SpecialValue
        && ((SpecialValue) expression).getKind() == SpecialValue.Kind.DURATION;
  }

  private static List<Literal> listOf(Literal... literals) {
    List<Literal> list = new ArrayList<>();
    for (Literal literal : literals) {
      list.add(literal);
    }
    return list;
  }
}
