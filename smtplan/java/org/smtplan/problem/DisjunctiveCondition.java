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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** N-ary disjunction. The empty disjunction is false. */
public final class DisjunctiveCondition implements Condition {
  private final List<Condition> operands;

  public DisjunctiveCondition(List<Condition> operands) {
    for (Condition operand : operands) {
      if (operand == null) {
        throw new NullPointerException("null operand in (or ...)");
      }
    }
    this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
  }

  public List<Condition> getOperands() {
    return operands;
  }

  @Override
  public <R, C> R accept(ConditionVisitor<R, C> visitor, C context) {
    return visitor.visitDisjunction(this, context);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(or");
    for (Condition operand : operands) {
      sb.append(' ').append(operand);
    }
    return sb.append(')').toString();
  }
}
