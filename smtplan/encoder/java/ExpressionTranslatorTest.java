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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smtplan.PlannerOptions;
import org.smtplan.encoder.LayerVariables.Phase;
import org.smtplan.problem.Condition;
import org.smtplan.problem.Expression;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.problem.TimeSpec;
import org.smtplan.solver.SolveStatus;
import org.smtplan.solver.SolverSession;

/** Tests the translation of conditions and expressions. */
public final class ExpressionTranslatorTest {
  private SolverSession session;
  private CpModel model;
  private LayerVariables variables;
  private ExpressionTranslator translator;

  @BeforeEach
  public void setUp() {
    Loader.loadNativeLibraries();
    PlannerOptions options = PlannerOptions.newBuilder().setNumWorkers(1).build();
    session = new SolverSession(options);
    model = session.model();
    IndexSpace space = IndexSpace.ofSizes(4, 2, 1);
    EffectIndex effects = EffectIndex.build(GroundProblem.newBuilder(space).build());
    variables = new LayerVariables(model, space, effects, options);
    variables.ensureLayers(1);
    translator = new ExpressionTranslator(model, variables, false);
  }

  private void fixFluent(int fluent, long scaled) {
    model.addEquality(variables.fluent(fluent, 0, Phase.PRE), scaled);
  }

  private SolveStatus solveWith(Literal literal) {
    model.addBoolOr(new Literal[] {literal});
    return session.solve();
  }

  @Test
  public void booleanHelpersSimplify() {
    Literal a = variables.literal(0, 0, Phase.PRE);
    Literal t = translator.trueLiteral();
    Literal f = translator.falseLiteral();

    assertThat(translator.isTrue(translator.and(Collections.<Literal>emptyList()))).isTrue();
    assertThat(translator.isFalse(translator.or(Collections.<Literal>emptyList()))).isTrue();
    assertThat(translator.and(Arrays.asList(t, a)).getIndex()).isEqualTo(a.getIndex());
    assertThat(translator.isFalse(translator.and(Arrays.asList(a, f)))).isTrue();
    assertThat(translator.isTrue(translator.or(Arrays.asList(f, t)))).isTrue();
    assertThat(translator.isFalse(t.not())).isTrue();
    assertThat(translator.numAuxiliaries()).isEqualTo(0);
  }

  @Test
  public void literalsReadTheContextPhase() {
    EncodingContext context = EncodingContext.state(1, Phase.POST);
    Literal literal = translator.translate(Condition.literal(2), context);
    assertThat(literal.getIndex()).isEqualTo(variables.literal(2, 1, Phase.POST).getIndex());

    Literal goal = translator.translate(Condition.literal(2), EncodingContext.goal(0));
    assertThat(goal.getIndex()).isEqualTo(variables.literal(2, 0, Phase.POST).getIndex());
  }

  @Test
  public void conditionStagesSelectTheirConjuncts() {
    Condition condition = Condition.and(
        Condition.atStart(Condition.literal(0)),
        Condition.atEnd(Condition.literal(1)),
        Condition.overAll(Condition.literal(2)),
        Condition.literal(3));

    Literal atEnd = translator.translate(
        condition, EncodingContext.condition(0, 1, Phase.PRE, TimeSpec.AT_END));
    assertThat(atEnd.getIndex()).isEqualTo(variables.literal(1, 1, Phase.PRE).getIndex());

    Literal overAll = translator.translate(
        condition, EncodingContext.condition(0, 1, Phase.POST, TimeSpec.OVER_ALL));
    assertThat(overAll.getIndex()).isEqualTo(variables.literal(2, 1, Phase.POST).getIndex());

    Literal atStart = translator.translate(
        condition, EncodingContext.condition(0, 0, Phase.PRE, TimeSpec.AT_START));
    model.addBoolOr(new Literal[] {atStart});
    model.addEquality(variables.literal(3, 0, Phase.PRE), 0);
    assertThat(session.solve()).isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void qualifierBelowNegationIsUnsupported() {
    Condition condition = Condition.not(Condition.atStart(Condition.literal(0)));
    assertThrows(EncodingException.UnsupportedConstruct.class,
        () -> translator.translate(
            condition, EncodingContext.condition(0, 0, Phase.PRE, TimeSpec.AT_START)));
  }

  @Test
  public void modeIsolation() {
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(
            Condition.atStart(Condition.literal(0)), EncodingContext.goal(1)));
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(Expression.duration(), EncodingContext.goal(1)));
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(Condition.literal(0), EncodingContext.duration(0, 0)));
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(Expression.elapsed(), EncodingContext.effect(0, 0)));
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(Expression.totalTime(), EncodingContext.effect(0, 0)));
    assertThrows(EncodingException.ModeMismatch.class,
        () -> translator.translate(Expression.duration(), EncodingContext.state(0, Phase.PRE)));
  }

  @Test
  public void specialValuesResolveByMode() {
    LinearExpr duration =
        translator.translate(Expression.duration(), EncodingContext.duration(0, 1));
    assertThat(duration.getVariableIndex(0)).isEqualTo(variables.duration(0, 1).getIndex());
    LinearExpr elapsed =
        translator.translate(Expression.elapsed(), EncodingContext.continuousEffect(0, 0));
    assertThat(elapsed.getVariableIndex(0)).isEqualTo(variables.interval(0).getIndex());
    LinearExpr total = translator.translate(Expression.totalTime(), EncodingContext.goal(1));
    assertThat(total.getVariableIndex(0)).isEqualTo(variables.time(1).getIndex());
  }

  @Test
  public void constantsFold() {
    EncodingContext context = EncodingContext.state(0, Phase.PRE);
    LinearExpr sum = translator.translate(
        Expression.times(Expression.plus(Expression.constant(1.5), Expression.constant(2)),
            Expression.constant(2)),
        context);
    assertThat(sum.numElements()).isEqualTo(0);
    assertThat(sum.getOffset()).isEqualTo(7000);

    Literal comparison = translator.translate(
        Condition.lessThan(Expression.constant(1), Expression.constant(2)), context);
    assertThat(translator.isTrue(comparison)).isTrue();
    Literal equal = translator.translate(
        Condition.equalTo(Expression.constant(1), Expression.constant(2)), context);
    assertThat(translator.isFalse(equal)).isTrue();
  }

  @Test
  public void inexactConstants() {
    EncodingContext context = EncodingContext.state(0, Phase.PRE);
    assertThrows(EncodingException.InexactConstant.class,
        () -> translator.translate(Expression.constant(0.0001), context));
    assertThrows(EncodingException.InexactConstant.class,
        () -> translator.translate(
            Expression.divide(Expression.constant(1), Expression.constant(3)), context));
  }

  @Test
  public void divisionByConstantZero() {
    assertThrows(EncodingException.UnsupportedConstruct.class,
        () -> translator.translate(
            Expression.divide(Expression.fluent(0), Expression.constant(0)),
            EncodingContext.state(0, Phase.PRE)));
  }

  @Test
  public void productOfFluents() {
    fixFluent(0, 1500);
    fixFluent(1, 2000);
    Literal product = translator.translate(
        Condition.equalTo(
            Expression.times(Expression.fluent(0), Expression.fluent(1)), Expression.constant(3)),
        EncodingContext.state(0, Phase.PRE));
    assertThat(solveWith(product)).isEqualTo(SolveStatus.SATISFIABLE);
  }

  @Test
  public void scaledProductAndQuotient() {
    fixFluent(0, 4000);
    EncodingContext context = EncodingContext.state(0, Phase.PRE);
    Literal scaled = translator.translate(
        Condition.equalTo(
            Expression.times(Expression.fluent(0), Expression.constant(0.25)),
            Expression.divide(Expression.fluent(0), Expression.constant(4))),
        context);
    assertThat(solveWith(scaled)).isEqualTo(SolveStatus.SATISFIABLE);
  }

  @Test
  public void unrepresentableQuotientsAreExcluded() {
    fixFluent(0, 3000);
    fixFluent(1, 1000);
    Literal quotient = translator.translate(
        Condition.greaterThan(
            Expression.divide(Expression.fluent(1), Expression.fluent(0)), Expression.constant(0)),
        EncodingContext.state(0, Phase.PRE));
    assertThat(solveWith(quotient)).isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void quotientsByZeroOnlyMatterWhenUsed() {
    fixFluent(0, 0);
    fixFluent(1, 1000);
    BoolVar used = model.newBoolVar("used");
    Literal quotient = translator.translate(
        Condition.greaterThan(
            Expression.divide(Expression.fluent(1), Expression.fluent(0)), Expression.constant(1)),
        EncodingContext.state(0, Phase.PRE).enforcedBy(used));
    model.addImplication(used, quotient);

    assertThat(session.solve()).isEqualTo(SolveStatus.SATISFIABLE);
    assertThat(session.booleanValue(used)).isFalse();
    assertThat(solveWith(used)).isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void inexactValuesOnlyMatterWhenUsed() {
    fixFluent(0, 1000);
    fixFluent(1, 1);
    BoolVar used = model.newBoolVar("used");
    EncodingContext context = EncodingContext.state(0, Phase.PRE).enforcedBy(used);
    LinearExpr third = translator.translate(
        Expression.divide(Expression.fluent(0), Expression.constant(3)), context);
    LinearExpr square = translator.translate(
        Expression.times(Expression.fluent(1), Expression.fluent(1)), context);
    assertThat(third.numElements()).isEqualTo(1);
    assertThat(square.numElements()).isEqualTo(1);

    assertThat(session.solve()).isEqualTo(SolveStatus.SATISFIABLE);
    assertThat(solveWith(used)).isEqualTo(SolveStatus.UNSATISFIABLE);
  }

  @Test
  public void strictComparisonsAreNegatedExactly() {
    fixFluent(0, 2000);
    EncodingContext context = EncodingContext.state(0, Phase.PRE);
    Literal less = translator.translate(
        Condition.lessThan(Expression.fluent(0), Expression.constant(2)), context);
    assertThat(solveWith(less.not())).isEqualTo(SolveStatus.SATISFIABLE);
    assertThat(session.booleanValue(less)).isFalse();
  }

  @Test
  public void disjunctionAndImplication() {
    EncodingContext context = EncodingContext.state(0, Phase.PRE);
    Literal b = variables.literal(1, 0, Phase.PRE);
    Literal implication = translator.translate(
        Condition.imply(Condition.literal(0), Condition.literal(1)), context);
    Literal exists = translator.translate(
        Condition.exists(Arrays.asList(Condition.literal(0), Condition.literal(1))), context);
    model.addBoolOr(new Literal[] {implication});
    model.addBoolOr(new Literal[] {exists});
    model.addBoolOr(new Literal[] {b.not()});
    assertThat(session.solve()).isEqualTo(SolveStatus.UNSATISFIABLE);
  }
}
