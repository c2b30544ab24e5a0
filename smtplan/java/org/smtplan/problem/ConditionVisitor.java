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

/**
 * Visitor over condition trees. Each method returns the value built for its node; children are
 * visited by the implementation itself, which makes the traversal order explicit.
 *
 * @param <R> the value built for each node
 * @param <C> the context threaded through the traversal
 */
public interface ConditionVisitor<R, C> {
  R visitLiteral(LiteralCondition condition, C context);

  R visitNegation(NegatedCondition condition, C context);

  R visitConjunction(ConjunctiveCondition condition, C context);

  R visitDisjunction(DisjunctiveCondition condition, C context);

  R visitImplication(ImplyCondition condition, C context);

  R visitQuantified(QuantifiedCondition condition, C context);

  R visitTimed(TimedCondition condition, C context);

  R visitComparison(Comparison condition, C context);
}
