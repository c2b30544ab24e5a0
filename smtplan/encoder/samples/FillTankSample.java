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

// [START program]
package org.smtplan.encoder.samples;
// [START import]
import org.smtplan.PlannerOptions;
import org.smtplan.encoder.Encoder;
import org.smtplan.encoder.ScheduledAction;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.Condition;
import org.smtplan.problem.Effect;
import org.smtplan.problem.Expression;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.solver.SolveStatus;
import org.smtplan.solver.SolverSession;
// [END import]

/**
 * A durative action whose length is bounded, and a process filling a tank while it runs: the
 * tank level at the end of the plan depends on the chosen duration.
 */
public class FillTankSample {
  public static void main(String[] args) {
    // [START problem]
    IndexSpace.Builder names = IndexSpace.newBuilder();
    int open = names.addLiteral("(valve-open)");
    int level = names.addFluent("(level)");
    int fill = names.addAction("(fill)");
    IndexSpace indexSpace = names.build();

    GroundAction fillAction = GroundAction.newBuilder(fill, ActionKind.DURATIVE)
        .setName("fill")
        .setDurationConstraint(
            Condition.durationBetween(Expression.constant(1), Expression.constant(8)))
        .setCondition(Condition.atStart(Condition.not(Condition.literal(open))))
        .setEffect(Effect.all(
            Effect.atStart(Effect.add(open)),
            Effect.atEnd(Effect.delete(open)),
            Effect.continuous(Effect.increase(level,
                Expression.times(Expression.elapsed(), Expression.constant(1.5))))))
        .build();
    GroundProblem problem = GroundProblem.newBuilder(indexSpace)
        .addAction(fillAction)
        .setInitialValue(level, 0)
        .setGoal(Condition.and(
            Condition.not(Condition.literal(open)),
            Condition.greaterOrEqual(Expression.fluent(level), Expression.constant(6))))
        .build();
    // [END problem]

    // [START solve]
    PlannerOptions options = PlannerOptions.newBuilder().setUpperBound(4).build();
    Encoder encoder = new Encoder(problem, options, new SolverSession(options));
    for (int h = 0; encoder.encode(h); ++h) {
      if (encoder.solve() == SolveStatus.SATISFIABLE) {
        for (ScheduledAction action : encoder.solution().scheduledActions()) {
          System.out.println(action);
        }
        return;
      }
    }
    System.out.println("No plan within the upper bound");
    // [END solve]
  }

  private FillTankSample() {}
}
// [END program]
