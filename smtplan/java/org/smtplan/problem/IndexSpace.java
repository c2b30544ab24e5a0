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

/**
 * Fixed-size identifier spaces for ground literals, ground numeric fluents and ground actions.
 *
 * <p>The grounding step assigns every ground entity a dense index; the encoder only ever sees those
 * indices. Names are kept for variable naming and diagnostics.
 */
public final class IndexSpace {
  /** Builder that hands out indices in insertion order. */
  public static final class Builder {
    private final List<String> literals = new ArrayList<>();
    private final List<String> fluents = new ArrayList<>();
    private final List<String> actions = new ArrayList<>();

    private Builder() {}

    /** Registers a ground literal and returns its index. */
    public int addLiteral(String name) {
      literals.add(checkName(name));
      return literals.size() - 1;
    }

    /** Registers a ground numeric fluent and returns its index. */
    public int addFluent(String name) {
      fluents.add(checkName(name));
      return fluents.size() - 1;
    }

    /** Registers a ground action and returns its index. */
    public int addAction(String name) {
      actions.add(checkName(name));
      return actions.size() - 1;
    }

    public IndexSpace build() {
      return new IndexSpace(literals, fluents, actions);
    }

    private static String checkName(String name) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("ground entities need a non-empty name");
      }
      return name;
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Creates an index space with generated names, as produced by a grounder that kept no names. */
  public static IndexSpace ofSizes(int numLiterals, int numFluents, int numActions) {
    if (numLiterals < 0 || numFluents < 0 || numActions < 0) {
      throw new IllegalArgumentException("index space sizes must be non-negative");
    }
    Builder builder = newBuilder();
    for (int i = 0; i < numLiterals; ++i) {
      builder.addLiteral("lit" + i);
    }
    for (int i = 0; i < numFluents; ++i) {
      builder.addFluent("pne" + i);
    }
    for (int i = 0; i < numActions; ++i) {
      builder.addAction("op" + i);
    }
    return builder.build();
  }

  private final List<String> literalNames;
  private final List<String> fluentNames;
  private final List<String> actionNames;

  private IndexSpace(List<String> literals, List<String> fluents, List<String> actions) {
    this.literalNames = Collections.unmodifiableList(new ArrayList<>(literals));
    this.fluentNames = Collections.unmodifiableList(new ArrayList<>(fluents));
    this.actionNames = Collections.unmodifiableList(new ArrayList<>(actions));
  }

  public int numLiterals() {
    return literalNames.size();
  }

  public int numFluents() {
    return fluentNames.size();
  }

  public int numActions() {
    return actionNames.size();
  }

  public boolean hasLiteral(int index) {
    return index >= 0 && index < literalNames.size();
  }

  public boolean hasFluent(int index) {
    return index >= 0 && index < fluentNames.size();
  }

  public boolean hasAction(int index) {
    return index >= 0 && index < actionNames.size();
  }

  public String literalName(int index) {
    return literalNames.get(index);
  }

  public String fluentName(int index) {
    return fluentNames.get(index);
  }

  public String actionName(int index) {
    return actionNames.get(index);
  }

  @Override
  public String toString() {
    return "IndexSpace(literals=" + numLiterals() + ", fluents=" + numFluents() + ", actions="
        + numActions() + ")";
  }
}
