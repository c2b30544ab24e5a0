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
 * Visitor over numeric expression trees.
 *
 * @param <R> the value built for each node
 * @param <C> the context threaded through the traversal
 */
public interface ExpressionVisitor<R, C> {
  R visitNumber(NumberExpression expression, C context);

  R visitFluent(FluentTerm expression, C context);

  R visitBinary(BinaryExpression expression, C context);

  R visitUnaryMinus(NegatedExpression expression, C context);

  R visitSpecialValue(SpecialValue expression, C context);
}
