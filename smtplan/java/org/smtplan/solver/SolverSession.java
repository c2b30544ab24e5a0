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

package org.smtplan.solver;

import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.LinearArgument;
import com.google.ortools.sat.Literal;
import com.google.ortools.sat.SatParameters;
import java.util.logging.Logger;
import org.smtplan.PlannerOptions;

/**
 * A CP-SAT model and solver kept alive across solve attempts.
 *
 * <p>Constraints are only ever added to the model. Which horizon is being asked for is selected
 * through assumptions, so that the formula built for earlier horizons is reused.
 */
public final class SolverSession {
  private static final Logger logger = Logger.getLogger(SolverSession.class.getName());

  private final CpModel model;
  private final CpSolver solver;
  private SolveStatus lastStatus;

  public SolverSession(PlannerOptions options) {
    Loader.loadNativeLibraries();
    this.model = new CpModel();
    this.solver = new CpSolver();
    SatParameters.Builder parameters = solver.getParameters();
    if (options.getSolverTimeLimit() > 0) {
      parameters.setMaxTimeInSeconds(options.getSolverTimeLimit());
    }
    if (options.getNumWorkers() > 0) {
      parameters.setNumWorkers(options.getNumWorkers());
    }
    parameters.setRandomSeed(options.getRandomSeed());
    if (options.getLogSearchProgress()) {
      solver.setLogCallback(line -> logger.info(line));
      parameters.setLogToStdout(false).setLogSearchProgress(true);
    }
  }

  /** The model constraints are added to. */
  public CpModel model() {
    return model;
  }

  /** Replaces the current assumptions by {@code literals}. */
  public void assume(Literal... literals) {
    model.clearAssumptions();
    model.addAssumptions(literals);
  }

  /**
   * Solves the model under the current assumptions.
   *
   * @throws IllegalStateException if CP-SAT rejects the model as invalid
   */
  public SolveStatus solve() {
    CpSolverStatus status = solver.solve(model);
    switch (status) {
      case OPTIMAL:
      case FEASIBLE:
        lastStatus = SolveStatus.SATISFIABLE;
        break;
      case INFEASIBLE:
        lastStatus = SolveStatus.UNSATISFIABLE;
        break;
      case MODEL_INVALID:
        lastStatus = null;
        throw new IllegalStateException("invalid model: " + solver.getSolutionInfo());
      default:
        lastStatus = SolveStatus.UNKNOWN;
        break;
    }
    logger.info("Solved " + modelStats() + ": " + lastStatus + " in " + solver.wallTime() + "s");
    return lastStatus;
  }

  /** Status of the last solve, or null before the first one. */
  public SolveStatus lastStatus() {
    return lastStatus;
  }

  /** Value of {@code expr} in the last satisfying assignment. */
  public long value(LinearArgument expr) {
    checkSatisfiable();
    return solver.value(expr);
  }

  /** Value of {@code literal} in the last satisfying assignment. */
  public boolean booleanValue(Literal literal) {
    checkSatisfiable();
    return solver.booleanValue(literal);
  }

  /** Short description of the model size. */
  public String modelStats() {
    return model.model().getVariablesCount() + " variables, "
        + model.model().getConstraintsCount() + " constraints";
  }

  private void checkSatisfiable() {
    if (lastStatus != SolveStatus.SATISFIABLE) {
      throw new IllegalStateException("no satisfying assignment, last status is " + lastStatus);
    }
  }
}
