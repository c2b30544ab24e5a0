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

/** Kinds of ground actions the encoder understands. */
public enum ActionKind {
  /** Starts and ends at the same layer, with a zero duration. */
  INSTANTANEOUS,
  /** Has a duration constraint and distinct start and end happenings. */
  DURATIVE,
  /** Runs exactly while its condition holds, contributing continuous effects. */
  PROCESS,
  /** Fires at every layer where its condition holds. */
  EVENT
}
