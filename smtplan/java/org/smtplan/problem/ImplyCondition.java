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

import java.util.Objects;

/** Implication {@code (imply antecedent consequent)}. */
public final class ImplyCondition implements Condition {
  private final Condition antecedent;
  private final Condition consequent;

  public ImplyCondition(Condition antecedent, Condition consequent) {
    this.antecedent = Objects.requireNonNull(antecedent);
    this.consequent = Objects.requireNonNull(consequent);
  }

  public Condition getAntecedent() {
    return antecedent;
  }

  public Condition getConsequent() {
    return consequent;
  }

  @Override
  public <R, C> R accept(ConditionVisitor<R, C> visitor, C context) {
    return visitor.visitImplication(this, context);
  }

  @Override
  public String toString() {
    return "(imply " + antecedent + " " + consequent + ")";
  }
}
