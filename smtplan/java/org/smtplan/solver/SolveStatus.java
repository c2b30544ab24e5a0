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

/** Outcome of one solve. */
public enum SolveStatus {
  /** A satisfying assignment was found; its values can be read from the session. */
  SATISFIABLE,
  /** The formula has no model under the current assumptions. */
  UNSATISFIABLE,
  /** The search stopped before deciding, e.g. on the time limit. */
  UNKNOWN
}
