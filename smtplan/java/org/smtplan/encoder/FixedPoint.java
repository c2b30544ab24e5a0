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

import java.math.BigDecimal;
import java.math.MathContext;
import org.smtplan.PlannerOptions;

/** Fixed-point representation of real values: {@code v} is stored as {@code v * scale}. */
final class FixedPoint {
  private final long scale;
  private final long valueBound;
  private final long timeBound;

  FixedPoint(PlannerOptions options) {
    this.scale = options.getScale();
    this.valueBound = options.getNumericBound() * scale;
    this.timeBound = options.getMaxTime() * scale;
  }

  long scale() {
    return scale;
  }

  /** Bound of the absolute value of every scaled numeric variable. */
  long valueBound() {
    return valueBound;
  }

  /** Bound of every scaled time and duration. */
  long timeBound() {
    return timeBound;
  }

  /** Bound of the absolute value of a product of two scaled values. */
  long productBound() {
    return valueBound * valueBound;
  }

  /**
   * Returns {@code value * scale}.
   *
   * @throws EncodingException.InexactConstant if the result is not an integer or overflows
   */
  long toScaled(BigDecimal value) {
    try {
      return value.multiply(BigDecimal.valueOf(scale)).longValueExact();
    } catch (ArithmeticException e) {
      throw new EncodingException.InexactConstant(value.toPlainString(), scale);
    }
  }

  double toDouble(long scaled) {
    return (double) scaled / scale;
  }

  BigDecimal toDecimal(long scaled) {
    try {
      return BigDecimal.valueOf(scaled).divide(BigDecimal.valueOf(scale));
    } catch (ArithmeticException e) {
      // Non-terminating expansion, only for scales that are not powers of ten.
      return BigDecimal.valueOf(scaled).divide(BigDecimal.valueOf(scale), MathContext.DECIMAL64);
    }
  }
}
