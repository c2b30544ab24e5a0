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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.smtplan.encoder.LayerVariables.Phase;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.solver.SolverSession;

/**
 * Read-only view of the satisfying assignment found for a horizon. Values are read from the
 * session on demand; the view is invalidated by the next solve.
 */
public final class Solution {
  private final GroundProblem problem;
  private final LayerVariables variables;
  private final SolverSession session;
  private final FixedPoint fixedPoint;
  private final int horizon;

  Solution(GroundProblem problem, LayerVariables variables, SolverSession session, int horizon) {
    this.problem = problem;
    this.variables = variables;
    this.session = session;
    this.fixedPoint = variables.fixedPoint();
    this.horizon = horizon;
  }

  public int horizon() {
    return horizon;
  }

  public double time(int h) {
    return fixedPoint.toDouble(session.value(variables.time(checkLayer(h))));
  }

  public boolean isStarted(int action, int h) {
    return session.booleanValue(variables.starts(action, checkLayer(h)));
  }

  public boolean isEnded(int action, int h) {
    return session.booleanValue(variables.ends(action, checkLayer(h)));
  }

  public boolean isRunning(int action, int h) {
    return session.booleanValue(variables.running(action, checkLayer(h)));
  }

  public double duration(int action, int h) {
    return fixedPoint.toDouble(session.value(variables.duration(action, checkLayer(h))));
  }

  public boolean literal(int literal, int h, Phase phase) {
    return session.booleanValue(variables.literal(literal, checkLayer(h), phase));
  }

  public double fluent(int fluent, int h, Phase phase) {
    return fixedPoint.toDouble(session.value(variables.fluent(fluent, checkLayer(h), phase)));
  }

  /** Whether timed initial literal {@code til} happens at layer {@code h}. */
  public boolean timedInitial(int til, int h) {
    return session.booleanValue(variables.timedInitial(til, checkLayer(h)));
  }

  /**
   * The instantaneous and durative action occurrences of the plan, ordered by start time. Events
   * and processes are not part of the plan.
   */
  public List<ScheduledAction> scheduledActions() {
    List<ScheduledAction> plan = new ArrayList<>();
    for (GroundAction action : problem.getActions()) {
      final int a = action.getIndex();
      if (action.getKind() == ActionKind.INSTANTANEOUS) {
        for (int h = 0; h <= horizon; ++h) {
          if (isStarted(a, h)) {
            plan.add(new ScheduledAction(a, action.getName(), h, h, time(h), 0.0));
          }
        }
      } else if (action.getKind() == ActionKind.DURATIVE) {
        int start = -1;
        for (int h = 0; h <= horizon; ++h) {
          if (isStarted(a, h)) {
            start = h;
          } else if (start >= 0 && isEnded(a, h)) {
            plan.add(new ScheduledAction(
                a, action.getName(), start, h, time(start), duration(a, start)));
            start = -1;
          }
        }
      }
    }
    Collections.sort(plan, Comparator.comparingDouble(ScheduledAction::getStartTime)
        .thenComparingInt(ScheduledAction::getStartLayer)
        .thenComparingInt(ScheduledAction::getAction));
    return plan;
  }

  private int checkLayer(int h) {
    if (h < 0 || h > horizon) {
      throw new EncodingException.IndexOutOfRange("layer", h, horizon + 1);
    }
    return h;
  }
}
