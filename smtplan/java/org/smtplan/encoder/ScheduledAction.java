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

import java.util.Objects;

/** An action occurrence of a plan: where it starts and ends, and when. */
public final class ScheduledAction {
  private final int action;
  private final String name;
  private final int startLayer;
  private final int endLayer;
  private final double startTime;
  private final double duration;

  public ScheduledAction(
      int action, String name, int startLayer, int endLayer, double startTime, double duration) {
    this.action = action;
    this.name = Objects.requireNonNull(name);
    this.startLayer = startLayer;
    this.endLayer = endLayer;
    this.startTime = startTime;
    this.duration = duration;
  }

  public int getAction() {
    return action;
  }

  public String getName() {
    return name;
  }

  public int getStartLayer() {
    return startLayer;
  }

  public int getEndLayer() {
    return endLayer;
  }

  public double getStartTime() {
    return startTime;
  }

  /** Zero for instantaneous actions. */
  public double getDuration() {
    return duration;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScheduledAction)) {
      return false;
    }
    ScheduledAction other = (ScheduledAction) o;
    return action == other.action
        && startLayer == other.startLayer
        && endLayer == other.endLayer
        && Double.compare(startTime, other.startTime) == 0
        && Double.compare(duration, other.duration) == 0
        && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(action, name, startLayer, endLayer, startTime, duration);
  }

  /** Formats the occurrence the way plans are usually printed: {@code 0.000: (name) [1.000]}. */
  @Override
  public String toString() {
    return String.format("%.3f: (%s) [%.3f]", startTime, name, duration);
  }
}
