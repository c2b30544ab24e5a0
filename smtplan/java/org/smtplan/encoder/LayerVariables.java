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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.smtplan.PlannerOptions;
import org.smtplan.problem.IndexSpace;

/**
 * Allocates and caches the solver variables of every layer.
 *
 * <p>Layers are append-only: growing the horizon allocates the missing layers and leaves the
 * variables of earlier layers untouched, so constraints already posted on them stay valid.
 */
public final class LayerVariables {
  private static final Logger logger = Logger.getLogger(LayerVariables.class.getName());

  /** Value of a literal or fluent before or after the effects of a layer. */
  public enum Phase {
    PRE,
    POST
  }

  /** All variables of one layer. */
  private static final class Layer {
    IntVar time;
    IntVar interval;
    BoolVar[] starts;
    BoolVar[] ends;
    BoolVar[] running;
    IntVar[] duration;
    BoolVar[] preLiteral;
    BoolVar[] postLiteral;
    IntVar[] preFluent;
    IntVar[] postFluent;
    BoolVar[] timedInitial;
    BoolVar[] timedInitialOccurred;
  }

  private final CpModel model;
  private final IndexSpace indexSpace;
  private final int numTimedInitialLiterals;
  private final FixedPoint fixedPoint;
  private final int upperBound;
  private final boolean explanatoryNames;
  private final List<Layer> layers = new ArrayList<>();

  /**
   * Creates an allocator for {@code indexSpace}.
   *
   * @throws EncodingException.InconsistentIndexSpace if {@code effects} was built over an index
   *     space of different sizes
   */
  public LayerVariables(
      CpModel model, IndexSpace indexSpace, EffectIndex effects, PlannerOptions options) {
    if (effects.numLiterals() != indexSpace.numLiterals()) {
      throw new EncodingException.InconsistentIndexSpace(
          "literals", effects.numLiterals(), indexSpace.numLiterals());
    }
    if (effects.numFluents() != indexSpace.numFluents()) {
      throw new EncodingException.InconsistentIndexSpace(
          "fluents", effects.numFluents(), indexSpace.numFluents());
    }
    if (effects.numActions() != indexSpace.numActions()) {
      throw new EncodingException.InconsistentIndexSpace(
          "actions", effects.numActions(), indexSpace.numActions());
    }
    this.model = model;
    this.indexSpace = indexSpace;
    this.numTimedInitialLiterals = effects.numTimedInitialLiterals();
    this.fixedPoint = new FixedPoint(options);
    this.upperBound = options.getUpperBound();
    this.explanatoryNames = options.getExplanatoryVarNames();
  }

  /** Number of allocated layers; layers {@code 0..numLayers()-1} are addressable. */
  public int numLayers() {
    return layers.size();
  }

  /**
   * Makes layers {@code 0..horizon} addressable.
   *
   * @return the number of layers allocated by this call
   * @throws EncodingException.HorizonLimitExceeded if {@code horizon} is above the upper bound
   */
  public int ensureLayers(int horizon) {
    if (horizon > upperBound) {
      throw new EncodingException.HorizonLimitExceeded(horizon, upperBound);
    }
    int allocated = 0;
    while (layers.size() <= horizon) {
      layers.add(allocateLayer(layers.size()));
      ++allocated;
    }
    if (allocated > 0) {
      logger.fine("Allocated " + allocated + " layers, " + numLayers() + " in total");
    }
    return allocated;
  }

  private Layer allocateLayer(int h) {
    final int numActions = indexSpace.numActions();
    final int numLiterals = indexSpace.numLiterals();
    final int numFluents = indexSpace.numFluents();
    final long timeBound = fixedPoint.timeBound();
    final long valueBound = fixedPoint.valueBound();

    Layer layer = new Layer();
    layer.time = model.newIntVar(0, timeBound, name("time", "t", h));
    layer.interval = model.newIntVar(0, timeBound, name("interval", "d", h));

    layer.starts = new BoolVar[numActions];
    layer.ends = new BoolVar[numActions];
    layer.running = new BoolVar[numActions];
    layer.duration = new IntVar[numActions];
    for (int a = 0; a < numActions; ++a) {
      String action = indexSpace.actionName(a);
      layer.starts[a] = model.newBoolVar(name("sta[" + action + "]", "s" + a, h));
      layer.ends[a] = model.newBoolVar(name("end[" + action + "]", "e" + a, h));
      layer.running[a] = model.newBoolVar(name("run[" + action + "]", "r" + a, h));
      layer.duration[a] = model.newIntVar(0, timeBound, name("dur[" + action + "]", "u" + a, h));
    }

    layer.preLiteral = new BoolVar[numLiterals];
    layer.postLiteral = new BoolVar[numLiterals];
    for (int l = 0; l < numLiterals; ++l) {
      String literal = indexSpace.literalName(l);
      layer.preLiteral[l] = model.newBoolVar(name("pre_lit[" + literal + "]", "lp" + l, h));
      layer.postLiteral[l] = model.newBoolVar(name("pos_lit[" + literal + "]", "lq" + l, h));
    }

    layer.preFluent = new IntVar[numFluents];
    layer.postFluent = new IntVar[numFluents];
    for (int f = 0; f < numFluents; ++f) {
      String fluent = indexSpace.fluentName(f);
      layer.preFluent[f] =
          model.newIntVar(-valueBound, valueBound, name("pre_pne[" + fluent + "]", "fp" + f, h));
      layer.postFluent[f] =
          model.newIntVar(-valueBound, valueBound, name("pos_pne[" + fluent + "]", "fq" + f, h));
    }

    layer.timedInitial = new BoolVar[numTimedInitialLiterals];
    layer.timedInitialOccurred = new BoolVar[numTimedInitialLiterals];
    for (int i = 0; i < numTimedInitialLiterals; ++i) {
      layer.timedInitial[i] = model.newBoolVar(name("til[" + i + "]", "k" + i, h));
      layer.timedInitialOccurred[i] = model.newBoolVar(name("til_done[" + i + "]", "kd" + i, h));
    }
    return layer;
  }

  private String name(String explanatory, String terse, int h) {
    return explanatoryNames ? explanatory + "@" + h : terse + "_" + h;
  }

  /** Time of layer {@code h}. */
  public IntVar time(int h) {
    return layer(h).time;
  }

  /** Length of the interval between layer {@code h} and layer {@code h + 1}. */
  public IntVar interval(int h) {
    return layer(h).interval;
  }

  public BoolVar starts(int action, int h) {
    return layer(h).starts[checkAction(action)];
  }

  public BoolVar ends(int action, int h) {
    return layer(h).ends[checkAction(action)];
  }

  /** True when {@code action} runs during the interval between layers {@code h} and {@code h+1}. */
  public BoolVar running(int action, int h) {
    return layer(h).running[checkAction(action)];
  }

  /** Duration of the occurrence of {@code action} that is current at layer {@code h}. */
  public IntVar duration(int action, int h) {
    return layer(h).duration[checkAction(action)];
  }

  public BoolVar literal(int literal, int h, Phase phase) {
    Layer layer = layer(h);
    if (!indexSpace.hasLiteral(literal)) {
      throw new EncodingException.IndexOutOfRange("literal", literal, indexSpace.numLiterals());
    }
    return phase == Phase.PRE ? layer.preLiteral[literal] : layer.postLiteral[literal];
  }

  public IntVar fluent(int fluent, int h, Phase phase) {
    Layer layer = layer(h);
    if (!indexSpace.hasFluent(fluent)) {
      throw new EncodingException.IndexOutOfRange("fluent", fluent, indexSpace.numFluents());
    }
    return phase == Phase.PRE ? layer.preFluent[fluent] : layer.postFluent[fluent];
  }

  /** True when timed initial literal {@code til} happens at layer {@code h}. */
  public BoolVar timedInitial(int til, int h) {
    return layer(h).timedInitial[checkTimedInitial(til)];
  }

  /** True when timed initial literal {@code til} happened at some layer up to {@code h}. */
  public BoolVar timedInitialOccurred(int til, int h) {
    return layer(h).timedInitialOccurred[checkTimedInitial(til)];
  }

  FixedPoint fixedPoint() {
    return fixedPoint;
  }

  private Layer layer(int h) {
    if (h < 0 || h >= layers.size()) {
      throw new EncodingException.IndexOutOfRange("layer", h, layers.size());
    }
    return layers.get(h);
  }

  private int checkAction(int action) {
    if (!indexSpace.hasAction(action)) {
      throw new EncodingException.IndexOutOfRange("action", action, indexSpace.numActions());
    }
    return action;
  }

  private int checkTimedInitial(int til) {
    if (til < 0 || til >= numTimedInitialLiterals) {
      throw new EncodingException.IndexOutOfRange(
          "timed initial literal", til, numTimedInitialLiterals);
    }
    return til;
  }
}
