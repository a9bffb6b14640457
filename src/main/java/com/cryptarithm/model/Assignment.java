// Copyright 2010-2025 Google LLC
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

package com.cryptarithm.model;

import java.util.Arrays;

/**
 * Values of the variables along one search path. A variable is either unassigned or holds a digit.
 *
 * <p>Indexed by the dense variable indices of {@link CryptarithmProblem}. A single instance is
 * mutated in place while the search descends and backtracks.
 */
public final class Assignment {
  public static final int UNASSIGNED = -1;

  /** Creates an assignment with every variable unassigned. */
  public Assignment(int numVariables) {
    this.values = new int[numVariables];
    Arrays.fill(values, UNASSIGNED);
    this.numAssigned = 0;
  }

  public int numVariables() {
    return values.length;
  }

  public int numAssigned() {
    return numAssigned;
  }

  /** Returns true if every variable holds a value. */
  public boolean isComplete() {
    return numAssigned == values.length;
  }

  public boolean isAssigned(int var) {
    return values[var] != UNASSIGNED;
  }

  /**
   * Returns the value of an assigned variable.
   *
   * @throws IllegalStateException if the variable is unassigned
   */
  public int value(int var) {
    if (values[var] == UNASSIGNED) {
      throw new IllegalStateException("Assignment.value: variable #" + var + " is unassigned");
    }
    return values[var];
  }

  /** Assigns a non-negative value, replacing any previous one. */
  public void assign(int var, int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Assignment.assign: negative value " + value);
    }
    if (values[var] == UNASSIGNED) {
      numAssigned++;
    }
    values[var] = value;
  }

  public void unassign(int var) {
    if (values[var] != UNASSIGNED) {
      numAssigned--;
      values[var] = UNASSIGNED;
    }
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }

  private final int[] values;
  private int numAssigned;
}
