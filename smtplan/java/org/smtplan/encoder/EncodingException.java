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

/**
 * Structural error found while building a formula. These are defects of the grounded input or of
 * the encoder itself; the formula being built is abandoned rather than left silently wrong.
 */
public class EncodingException extends RuntimeException {
  public EncodingException(String msg) {
    super(msg);
  }

  /** Exception thrown when a literal, fluent, action or layer index is out of range. */
  public static class IndexOutOfRange extends EncodingException {
    public IndexOutOfRange(String kind, int index, int size) {
      super(kind + " index " + index + " outside [0, " + size + ")");
    }
  }

  /** Exception thrown when a node kind is met in a translation mode that cannot give it meaning. */
  public static class ModeMismatch extends EncodingException {
    public ModeMismatch(String node, EncodingContext.Mode mode) {
      super(node + " cannot be translated in " + mode + " mode");
    }
  }

  /** Exception thrown for constructs the encoder does not support. */
  public static class UnsupportedConstruct extends EncodingException {
    public UnsupportedConstruct(String msg) {
      super(msg);
    }
  }

  /** Exception thrown when the duration bounds of an action cannot be satisfied. */
  public static class MalformedDuration extends EncodingException {
    public MalformedDuration(String action, String min, String max) {
      super("duration of " + action + " has minimum " + min + " above maximum " + max);
    }
  }

  /** Exception thrown when a constant cannot be represented at the configured scale. */
  public static class InexactConstant extends EncodingException {
    public InexactConstant(String value, long scale) {
      super(value + " is not representable at resolution 1/" + scale);
    }
  }

  /** Exception thrown when the sizes seen by two components disagree. */
  public static class InconsistentIndexSpace extends EncodingException {
    public InconsistentIndexSpace(String what, int expected, int actual) {
      super(what + ": expected " + expected + " but got " + actual);
    }
  }

  /** Exception thrown when a fluent has no initial value. */
  public static class UndefinedFluent extends EncodingException {
    public UndefinedFluent(String fluent) {
      super("fluent " + fluent + " has no initial value");
    }
  }

  /** Exception thrown when a horizon beyond the configured upper bound is requested. */
  public static class HorizonLimitExceeded extends EncodingException {
    public HorizonLimitExceeded(int horizon, int upperBound) {
      super("horizon " + horizon + " exceeds the upper bound " + upperBound);
    }
  }
}
