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

/** Temporal qualifier of a condition or an effect inside an action. */
public enum TimeSpec {
  AT_START("at start"),
  AT_END("at end"),
  OVER_ALL("over all"),
  /** Only for effects: the effect applies continuously while the action runs. */
  CONTINUOUS("continuous");

  private final String keyword;

  TimeSpec(String keyword) {
    this.keyword = keyword;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
