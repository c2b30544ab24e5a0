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
import java.util.Objects;

/**
 * A quantified condition whose instances were enumerated by grounding. A universal quantifier
 * behaves as the conjunction of its instances, an existential one as their disjunction.
 */
public final class QuantifiedCondition implements Condition {
  /** The quantifier of the original lifted formula. */
  public enum Quantifier {
    FORALL,
    EXISTS
  }

  private final Quantifier quantifier;
  private final List<Condition> instances;

  public QuantifiedCondition(Quantifier quantifier, List<Condition> instances) {
    this.quantifier = Objects.requireNonNull(quantifier);
    this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
  }

  public Quantifier getQuantifier() {
    return quantifier;
  }

  public List<Condition> getInstances() {
    return instances;
  }

  @Override
  public <R, C> R accept(ConditionVisitor<R, C> visitor, C context) {
    return visitor.visitQuantified(this, context);
  }

  @Override
  public String toString() {
    return "(" + quantifier.name().toLowerCase() + " " + instances + ")";
  }
}
