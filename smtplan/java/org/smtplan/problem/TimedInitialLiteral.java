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

import java.math.BigDecimal;
import java.util.Objects;

/** A change of the world scheduled at a fixed absolute time, independent of any action. */
public final class TimedInitialLiteral {
  private final int index;
  private final BigDecimal time;
  private final Effect effect;

  public TimedInitialLiteral(int index, BigDecimal time, Effect effect) {
    if (time.signum() < 0) {
      throw new IllegalArgumentException("timed initial literal at negative time " + time);
    }
    this.index = index;
    this.time = time;
    this.effect = Objects.requireNonNull(effect);
  }

  public int getIndex() {
    return index;
  }

  public BigDecimal getTime() {
    return time;
  }

  public Effect getEffect() {
    return effect;
  }

  @Override
  public String toString() {
    return "(at " + time.toPlainString() + " " + effect + ")";
  }
}
