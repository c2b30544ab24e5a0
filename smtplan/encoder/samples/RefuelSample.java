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
import org.smtplan.encoder.Solution;
import org.smtplan.problem.ActionKind;
import org.smtplan.problem.Condition;
import org.smtplan.problem.Expression;
import org.smtplan.problem.Effect;
import org.smtplan.problem.GroundAction;
import org.smtplan.problem.GroundProblem;
import org.smtplan.problem.IndexSpace;
import org.smtplan.solver.SolveStatus;
import org.smtplan.solver.SolverSession;
// [END import]

/** Searches the shortest horizon at which a numeric goal becomes reachable. */
public class RefuelSample {
  public static void main(String[] args) {
    // [START problem]
    IndexSpace.Builder names = IndexSpace.newBuilder();
    int fuel = names.addFluent("(fuel)");
    int burn = names.addAction("(burn)");
    IndexSpace indexSpace = names.build();

    GroundAction burnAction = GroundAction.newBuilder(burn, ActionKind.INSTANTANEOUS)
        .setName("burn")
        .setCondition(Condition.greaterOrEqual(Expression.fluent(fuel), Expression.constant(3)))
        .setEffect(Effect.assign(fuel,
            Expression.minus(Expression.fluent(fuel), Expression.constant(3))))
        .build();
    GroundProblem problem = GroundProblem.newBuilder(indexSpace)
        .addAction(burnAction)
        .setInitialValue(fuel, 10)
        .setGoal(Condition.lessOrEqual(Expression.fluent(fuel), Expression.constant(5)))
        .build();
    // [END problem]

    // [START encoder]
    PlannerOptions options = PlannerOptions.newBuilder().setUpperBound(10).build();
    Encoder encoder = new Encoder(problem, options, new SolverSession(options));
    // [END encoder]

    // Grow the horizon until a plan exists.
    // [START search]
    for (int h = 0; encoder.encode(h); ++h) {
      SolveStatus status = encoder.solve();
      System.out.println("Horizon " + h + ": " + status);
      if (status == SolveStatus.SATISFIABLE) {
        Solution solution = encoder.solution();
        for (ScheduledAction action : solution.scheduledActions()) {
          System.out.println(action);
        }
        break;
      }
    }
    // [END search]
  }

  private RefuelSample() {}
}
// [END program]
