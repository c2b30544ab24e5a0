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

package org.smtplan;

import java.util.Properties;

/**
 * Options of the encoder and of the solver session.
 *
 * <p>Real values are encoded as fixed-point integers: a value {@code v} is represented by
 * {@code v * scale}. {@code numericBound} and {@code maxTime} bound the domains of fluent values
 * and of times.
 */
public final class PlannerOptions {
  /** Prefix of the keys understood by {@link #fromProperties}. */
  public static final String PROPERTY_PREFIX = "smtplan.";

  /** Largest scaled bound whose square, plus a rescaling term, still fits in a long. */
  static final long MAX_SCALED_BOUND = 2_000_000_000L;

  /** Builder for {@link PlannerOptions}. */
  public static final class Builder {
    private int upperBound = 100;
    private long scale = 1000;
    private long numericBound = 1_000_000;
    private long maxTime = 100_000;
    private boolean explanatoryVarNames = false;
    private double solverTimeLimit = 0.0;
    private int numWorkers = 0;
    private int randomSeed = 0;
    private boolean logSearchProgress = false;

    private Builder() {}

    /** Largest horizon the encoder accepts. */
    public Builder setUpperBound(int upperBound) {
      this.upperBound = upperBound;
      return this;
    }

    /** Fixed-point factor; 1000 gives a resolution of 0.001. */
    public Builder setScale(long scale) {
      this.scale = scale;
      return this;
    }

    /** Absolute bound of every fluent value, in problem units. */
    public Builder setNumericBound(long numericBound) {
      this.numericBound = numericBound;
      return this;
    }

    /** Bound of every layer time and action duration, in problem units. */
    public Builder setMaxTime(long maxTime) {
      this.maxTime = maxTime;
      return this;
    }

    public Builder setExplanatoryVarNames(boolean explanatoryVarNames) {
      this.explanatoryVarNames = explanatoryVarNames;
      return this;
    }

    /** Time limit of a single solve, in seconds. Zero means no limit. */
    public Builder setSolverTimeLimit(double solverTimeLimit) {
      this.solverTimeLimit = solverTimeLimit;
      return this;
    }

    /** Number of CP-SAT workers. Zero keeps the solver default. */
    public Builder setNumWorkers(int numWorkers) {
      this.numWorkers = numWorkers;
      return this;
    }

    public Builder setRandomSeed(int randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    /** Forwards the CP-SAT search log to the session logger. */
    public Builder setLogSearchProgress(boolean logSearchProgress) {
      this.logSearchProgress = logSearchProgress;
      return this;
    }

    public PlannerOptions build() {
      if (upperBound < 0) {
        throw new IllegalArgumentException("upperBound must be non-negative: " + upperBound);
      }
      if (scale <= 0) {
        throw new IllegalArgumentException("scale must be positive: " + scale);
      }
      if (numericBound <= 0 || maxTime <= 0) {
        throw new IllegalArgumentException("numericBound and maxTime must be positive");
      }
      // Products of two scaled values must fit in a long.
      if (numericBound > MAX_SCALED_BOUND / scale) {
        throw new IllegalArgumentException(
            "numericBound " + numericBound + " too large for scale " + scale);
      }
      if (maxTime > numericBound) {
        throw new IllegalArgumentException(
            "maxTime " + maxTime + " exceeds numericBound " + numericBound);
      }
      if (solverTimeLimit < 0 || numWorkers < 0) {
        throw new IllegalArgumentException("solverTimeLimit and numWorkers must be non-negative");
      }
      return new PlannerOptions(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns the default options. */
  public static PlannerOptions defaults() {
    return newBuilder().build();
  }

  /**
   * Reads options from {@code smtplan.*} keys; missing keys keep their default.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static PlannerOptions fromProperties(Properties properties) {
    Builder builder = newBuilder();
    try {
      String value = properties.getProperty(PROPERTY_PREFIX + "upperBound");
      if (value != null) {
        builder.setUpperBound(Integer.parseInt(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "scale");
      if (value != null) {
        builder.setScale(Long.parseLong(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "numericBound");
      if (value != null) {
        builder.setNumericBound(Long.parseLong(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "maxTime");
      if (value != null) {
        builder.setMaxTime(Long.parseLong(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "explanatoryVarNames");
      if (value != null) {
        builder.setExplanatoryVarNames(Boolean.parseBoolean(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "solverTimeLimit");
      if (value != null) {
        builder.setSolverTimeLimit(Double.parseDouble(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "numWorkers");
      if (value != null) {
        builder.setNumWorkers(Integer.parseInt(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "randomSeed");
      if (value != null) {
        builder.setRandomSeed(Integer.parseInt(value.trim()));
      }
      value = properties.getProperty(PROPERTY_PREFIX + "logSearchProgress");
      if (value != null) {
        builder.setLogSearchProgress(Boolean.parseBoolean(value.trim()));
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("malformed planner option: " + e.getMessage(), e);
    }
    return builder.build();
  }

  private final int upperBound;
  private final long scale;
  private final long numericBound;
  private final long maxTime;
  private final boolean explanatoryVarNames;
  private final double solverTimeLimit;
  private final int numWorkers;
  private final int randomSeed;
  private final boolean logSearchProgress;

  private PlannerOptions(Builder builder) {
    this.upperBound = builder.upperBound;
    this.scale = builder.scale;
    this.numericBound = builder.numericBound;
    this.maxTime = builder.maxTime;
    this.explanatoryVarNames = builder.explanatoryVarNames;
    this.solverTimeLimit = builder.solverTimeLimit;
    this.numWorkers = builder.numWorkers;
    this.randomSeed = builder.randomSeed;
    this.logSearchProgress = builder.logSearchProgress;
  }

  public Builder toBuilder() {
    return newBuilder()
        .setUpperBound(upperBound)
        .setScale(scale)
        .setNumericBound(numericBound)
        .setMaxTime(maxTime)
        .setExplanatoryVarNames(explanatoryVarNames)
        .setSolverTimeLimit(solverTimeLimit)
        .setNumWorkers(numWorkers)
        .setRandomSeed(randomSeed)
        .setLogSearchProgress(logSearchProgress);
  }

  public int getUpperBound() {
    return upperBound;
  }

  public long getScale() {
    return scale;
  }

  public long getNumericBound() {
    return numericBound;
  }

  public long getMaxTime() {
    return maxTime;
  }

  public boolean getExplanatoryVarNames() {
    return explanatoryVarNames;
  }

  public double getSolverTimeLimit() {
    return solverTimeLimit;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  public int getRandomSeed() {
    return randomSeed;
  }

  public boolean getLogSearchProgress() {
    return logSearchProgress;
  }

  @Override
  public String toString() {
    return "PlannerOptions(upperBound=" + upperBound + ", scale=" + scale + ", numericBound="
        + numericBound + ", maxTime=" + maxTime + ", solverTimeLimit=" + solverTimeLimit + ")";
  }
}
