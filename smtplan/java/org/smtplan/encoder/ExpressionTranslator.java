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
import com.google.ortools.sat.Constraint;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.Literal;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.smtplan.problem.BinaryExpression;
import org.smtplan.problem.Comparison;
import org.smtplan.problem.Condition;
import org.smtplan.problem.ConditionVisitor;
import org.smtplan.problem.ConjunctiveCondition;
import org.smtplan.problem.DisjunctiveCondition;
import org.smtplan.problem.Expression;
import org.smtplan.problem.ExpressionVisitor;
import org.smtplan.problem.FluentTerm;
import org.smtplan.problem.ImplyCondition;
import org.smtplan.problem.LiteralCondition;
import org.smtplan.problem.NegatedCondition;
import org.smtplan.problem.NegatedExpression;
import org.smtplan.problem.NumberExpression;
import org.smtplan.problem.QuantifiedCondition;
import org.smtplan.problem.SpecialValue;
import org.smtplan.problem.TimeSpec;
import org.smtplan.problem.TimedCondition;

/**
 * Translates condition and arithmetic trees into CP-SAT literals and linear expressions.
 *
 * <p>Every Boolean node becomes a literal equivalent to the node: n-ary connectives and
 * comparisons are reified with a fresh Boolean variable. Every numeric node becomes a linear
 * expression over scaled integers; products and quotients that are not linear get an auxiliary
 * variable tied to its operands by an exact multiplication constraint.
 *
 * <p>The translator keeps no per-translation state: the {@link EncodingContext} passed down the
 * tree decides what each leaf resolves to.
 */
public final class ExpressionTranslator
    implements ConditionVisitor<Literal, EncodingContext>,
        ExpressionVisitor<LinearExpr, EncodingContext> {
  private final CpModel model;
  private final LayerVariables variables;
  private final FixedPoint fixedPoint;
  private final boolean explanatoryNames;
  private final Literal trueLiteral;
  private final Literal falseLiteral;
  private int numAuxiliaries;

  public ExpressionTranslator(CpModel model, LayerVariables variables, boolean explanatoryNames) {
    this.model = model;
    this.variables = variables;
    this.fixedPoint = variables.fixedPoint();
    this.explanatoryNames = explanatoryNames;
    this.trueLiteral = model.trueLiteral();
    this.falseLiteral = model.falseLiteral();
  }

  /** Returns a literal equivalent to {@code condition} under {@code context}. */
  public Literal translate(Condition condition, EncodingContext context) {
    return condition.accept(this, context);
  }

  /** Returns the scaled value of {@code expression} under {@code context}. */
  public LinearExpr translate(Expression expression, EncodingContext context) {
    return expression.accept(this, context);
  }

  /** Number of auxiliary variables created so far. */
  public int numAuxiliaries() {
    return numAuxiliaries;
  }

  // Boolean helpers.

  public Literal trueLiteral() {
    return trueLiteral;
  }

  public Literal falseLiteral() {
    return falseLiteral;
  }

  public boolean isTrue(Literal literal) {
    return literal.getIndex() == trueLiteral.getIndex()
        || literal.getIndex() == falseLiteral.not().getIndex();
  }

  public boolean isFalse(Literal literal) {
    return literal.getIndex() == falseLiteral.getIndex()
        || literal.getIndex() == trueLiteral.not().getIndex();
  }

  /** Returns a literal equivalent to the conjunction of {@code operands}, of any arity. */
  public Literal and(List<Literal> operands) {
    List<Literal> kept = new ArrayList<>();
    for (Literal operand : operands) {
      if (isFalse(operand)) {
        return falseLiteral;
      }
      if (!isTrue(operand)) {
        kept.add(operand);
      }
    }
    if (kept.isEmpty()) {
      return trueLiteral;
    }
    if (kept.size() == 1) {
      return kept.get(0);
    }
    BoolVar result = newAuxiliaryBool("and");
    Literal[] clause = new Literal[kept.size() + 1];
    for (int i = 0; i < kept.size(); ++i) {
      clause[i] = kept.get(i).not();
    }
    clause[kept.size()] = result;
    model.addBoolAnd(kept.toArray(new Literal[0])).onlyEnforceIf(result);
    model.addBoolOr(clause);
    return result;
  }

  /** Returns a literal equivalent to the disjunction of {@code operands}, of any arity. */
  public Literal or(List<Literal> operands) {
    List<Literal> kept = new ArrayList<>();
    for (Literal operand : operands) {
      if (isTrue(operand)) {
        return trueLiteral;
      }
      if (!isFalse(operand)) {
        kept.add(operand);
      }
    }
    if (kept.isEmpty()) {
      return falseLiteral;
    }
    if (kept.size() == 1) {
      return kept.get(0);
    }
    BoolVar result = newAuxiliaryBool("or");
    model.addBoolOr(kept.toArray(new Literal[0])).onlyEnforceIf(result);
    for (Literal operand : kept) {
      model.addImplication(operand, result);
    }
    return result;
  }

  // Conditions.

  @Override
  public Literal visitLiteral(LiteralCondition condition, EncodingContext context) {
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    if (context.getMode() == EncodingContext.Mode.DURATION) {
      throw new EncodingException.ModeMismatch("literal " + condition, context.getMode());
    }
    return variables.literal(condition.getLiteral(), context.getLayer(), context.getPhase());
  }

  @Override
  public Literal visitNegation(NegatedCondition condition, EncodingContext context) {
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    return condition.getOperand().accept(this, context).not();
  }

  @Override
  public Literal visitConjunction(ConjunctiveCondition condition, EncodingContext context) {
    return and(translateAll(condition.getOperands(), context));
  }

  @Override
  public Literal visitDisjunction(DisjunctiveCondition condition, EncodingContext context) {
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    return or(translateAll(condition.getOperands(), context));
  }

  @Override
  public Literal visitImplication(ImplyCondition condition, EncodingContext context) {
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    List<Literal> operands = new ArrayList<>();
    operands.add(condition.getAntecedent().accept(this, context).not());
    operands.add(condition.getConsequent().accept(this, context));
    return or(operands);
  }

  @Override
  public Literal visitQuantified(QuantifiedCondition condition, EncodingContext context) {
    // Grounding already enumerated the instances.
    if (condition.getQuantifier() == QuantifiedCondition.Quantifier.FORALL) {
      return and(translateAll(condition.getInstances(), context));
    }
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    return or(translateAll(condition.getInstances(), context));
  }

  @Override
  public Literal visitTimed(TimedCondition condition, EncodingContext context) {
    if (context.getMode() != EncodingContext.Mode.CONDITION) {
      throw new EncodingException.ModeMismatch(
          "time qualifier " + condition.getTimeSpec(), context.getMode());
    }
    if (!context.isTemporalAllowed()) {
      throw new EncodingException.UnsupportedConstruct(
          "time qualifier in " + condition + " is nested below another operator");
    }
    if (condition.getTimeSpec() != context.getStage()) {
      return trueLiteral;
    }
    return condition.getOperand().accept(this, context.selected());
  }

  @Override
  public Literal visitComparison(Comparison condition, EncodingContext context) {
    if (context.getStage() != null) {
      return unqualified(condition, context);
    }
    LinearExpr left = condition.getLeft().accept(this, context);
    LinearExpr right = condition.getRight().accept(this, context);
    Comparison.Operator operator = condition.getOperator();
    if (isConstant(left) && isConstant(right)) {
      return holds(operator, left.getOffset(), right.getOffset()) ? trueLiteral : falseLiteral;
    }
    BoolVar result = newAuxiliaryBool("cmp");
    post(operator, left, right).onlyEnforceIf(result);
    if (operator == Comparison.Operator.EQUAL) {
      model.addDifferent(left, right).onlyEnforceIf(result.not());
    } else {
      post(operator.negate(), left, right).onlyEnforceIf(result.not());
    }
    return result;
  }

  private Constraint post(
      Comparison.Operator operator, LinearExpr left, LinearExpr right) {
    switch (operator) {
      case LESS:
        return model.addLessThan(left, right);
      case LESS_OR_EQUAL:
        return model.addLessOrEqual(left, right);
      case EQUAL:
        return model.addEquality(left, right);
      case GREATER_OR_EQUAL:
        return model.addGreaterOrEqual(left, right);
      case GREATER:
        return model.addGreaterThan(left, right);
      default:
        throw new IllegalStateException("unknown comparison " + operator);
    }
  }

  private static boolean holds(Comparison.Operator operator, long left, long right) {
    switch (operator) {
      case LESS:
        return left < right;
      case LESS_OR_EQUAL:
        return left <= right;
      case EQUAL:
        return left == right;
      case GREATER_OR_EQUAL:
        return left >= right;
      case GREATER:
        return left > right;
      default:
        throw new IllegalStateException("unknown comparison " + operator);
    }
  }

  /**
   * A subformula without time qualifier, met while selecting a condition stage. It belongs to the
   * start of the action.
   */
  private Literal unqualified(Condition condition, EncodingContext context) {
    if (context.getStage() != TimeSpec.AT_START) {
      return trueLiteral;
    }
    return condition.accept(this, context.selected());
  }

  private List<Literal> translateAll(List<Condition> conditions, EncodingContext context) {
    List<Literal> literals = new ArrayList<>(conditions.size());
    for (Condition operand : conditions) {
      literals.add(operand.accept(this, context));
    }
    return literals;
  }

  // Numeric expressions.

  @Override
  public LinearExpr visitNumber(NumberExpression expression, EncodingContext context) {
    return LinearExpr.constant(fixedPoint.toScaled(expression.getValue()));
  }

  @Override
  public LinearExpr visitFluent(FluentTerm expression, EncodingContext context) {
    return variables.fluent(expression.getFluent(), context.getLayer(), context.getPhase()).build();
  }

  @Override
  public LinearExpr visitBinary(BinaryExpression expression, EncodingContext context) {
    LinearExpr left = expression.getLeft().accept(this, context);
    LinearExpr right = expression.getRight().accept(this, context);
    switch (expression.getOperator()) {
      case PLUS:
        return LinearExpr.newBuilder().add(left).add(right).build();
      case MINUS:
        return LinearExpr.newBuilder().add(left).addTerm(right, -1).build();
      case MULTIPLY:
        return multiply(left, right, context);
      case DIVIDE:
        return divide(left, right, context);
      default:
        throw new IllegalStateException("unknown operator " + expression.getOperator());
    }
  }

  @Override
  public LinearExpr visitUnaryMinus(NegatedExpression expression, EncodingContext context) {
    return LinearExpr.term(expression.getOperand().accept(this, context), -1);
  }

  @Override
  public LinearExpr visitSpecialValue(SpecialValue expression, EncodingContext context) {
    switch (expression.getKind()) {
      case DURATION:
        if (context.getAction() == EncodingContext.NO_ACTION
            || context.getMode() == EncodingContext.Mode.GOAL
            || context.getMode() == EncodingContext.Mode.LITERAL) {
          throw new EncodingException.ModeMismatch(expression.toString(), context.getMode());
        }
        return variables.duration(context.getAction(), context.getLayer()).build();
      case HASHT:
        if (!context.isContinuous()) {
          throw new EncodingException.ModeMismatch(expression.toString(), context.getMode());
        }
        return variables.interval(context.getLayer()).build();
      case TOTAL_TIME:
        if (context.getMode() != EncodingContext.Mode.GOAL) {
          throw new EncodingException.ModeMismatch(expression.toString(), context.getMode());
        }
        return variables.time(context.getLayer()).build();
      default:
        throw new IllegalStateException("unknown special value " + expression.getKind());
    }
  }

  /** Scaled product: {@code (x * y) / scale}. */
  private LinearExpr multiply(LinearExpr left, LinearExpr right, EncodingContext context) {
    final long scale = fixedPoint.scale();
    if (isConstant(left) && isConstant(right)) {
      BigDecimal product =
          fixedPoint.toDecimal(left.getOffset()).multiply(fixedPoint.toDecimal(right.getOffset()));
      return LinearExpr.constant(fixedPoint.toScaled(product));
    }
    if (isConstant(left) || isConstant(right)) {
      long factor = isConstant(left) ? left.getOffset() : right.getOffset();
      LinearExpr operand = isConstant(left) ? right : left;
      return rescale(operand, factor, scale, context);
    }
    LinearExpr product = newProduct(materialize(left, context), materialize(right, context));
    return rescale(product, 1, scale, context);
  }

  /**
   * Scaled quotient: {@code (x * scale) / y}. A divisor of zero forces the numerator to zero and
   * leaves the quotient free.
   */
  private LinearExpr divide(LinearExpr left, LinearExpr right, EncodingContext context) {
    final long scale = fixedPoint.scale();
    if (isConstant(right)) {
      long divisor = right.getOffset();
      if (divisor == 0) {
        throw new EncodingException.UnsupportedConstruct("division by the constant zero");
      }
      if (isConstant(left)) {
        BigDecimal quotient;
        try {
          quotient = fixedPoint.toDecimal(left.getOffset())
              .divide(fixedPoint.toDecimal(divisor));
        } catch (ArithmeticException e) {
          throw new EncodingException.InexactConstant(
              fixedPoint.toDecimal(left.getOffset()) + " / " + fixedPoint.toDecimal(divisor),
              scale);
        }
        return LinearExpr.constant(fixedPoint.toScaled(quotient));
      }
      return rescale(left, scale, divisor, context);
    }
    // result * y == x * scale
    IntVar result = newAuxiliaryInt("quot", fixedPoint.valueBound());
    IntVar product = newAuxiliaryInt("prod", fixedPoint.productBound());
    model.addMultiplicationEquality(product, result, materialize(right, context));
    enforce(model.addEquality(product, LinearExpr.term(left, scale)), context);
    return result.build();
  }

  /**
   * Returns {@code expr * numerator / denominator}. The result is exact: when the division does not
   * reduce to an integer coefficient an auxiliary variable {@code r} with
   * {@code r * denominator == expr * numerator} is introduced.
   */
  private LinearExpr rescale(
      LinearExpr expr, long numerator, long denominator, EncodingContext context) {
    long gcd = gcd(Math.abs(numerator), Math.abs(denominator));
    long num = numerator / gcd;
    long den = denominator / gcd;
    if (den < 0) {
      num = -num;
      den = -den;
    }
    if (den == 1) {
      return LinearExpr.term(expr, num);
    }
    IntVar result = newAuxiliaryInt("scaled", fixedPoint.valueBound());
    enforce(
        model.addEquality(LinearExpr.term(result, den), LinearExpr.term(expr, num)), context);
    return result.build();
  }

  private LinearExpr newProduct(LinearExpr left, LinearExpr right) {
    IntVar product = newAuxiliaryInt("prod", fixedPoint.productBound());
    model.addMultiplicationEquality(product, left, right);
    return product.build();
  }

  /**
   * Returns a bounded operand for a multiplication constraint. Anything but a plain variable is
   * copied into an auxiliary that is only tied to {@code expr} under the enforcement literal, so
   * the product stays within its domain when the expression is not used.
   */
  private LinearExpr materialize(LinearExpr expr, EncodingContext context) {
    if (expr.numElements() == 1 && expr.getOffset() == 0 && expr.getCoefficient(0) == 1) {
      return expr;
    }
    IntVar var = newAuxiliaryInt("operand", fixedPoint.valueBound());
    enforce(model.addEquality(var, expr), context);
    return var.build();
  }

  private void enforce(Constraint constraint, EncodingContext context) {
    Literal enforcement = context.getEnforcement();
    if (enforcement != null && !isTrue(enforcement)) {
      constraint.onlyEnforceIf(enforcement);
    }
  }

  private static boolean isConstant(LinearExpr expr) {
    return expr.numElements() == 0;
  }

  private static long gcd(long a, long b) {
    while (b != 0) {
      long t = a % b;
      a = b;
      b = t;
    }
    return a == 0 ? 1 : a;
  }

  private BoolVar newAuxiliaryBool(String what) {
    return model.newBoolVar(auxiliaryName(what));
  }

  private IntVar newAuxiliaryInt(String what, long bound) {
    return model.newIntVar(-bound, bound, auxiliaryName(what));
  }

  private String auxiliaryName(String what) {
    int id = numAuxiliaries++;
    return explanatoryNames ? what + "#" + id : "x" + id;
  }
}
