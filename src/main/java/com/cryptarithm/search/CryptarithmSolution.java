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

package com.cryptarithm.search;

import com.cryptarithm.model.Assignment;
import com.cryptarithm.model.CryptarithmProblem;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A digit for every symbol of a puzzle. Immutable. */
public final class CryptarithmSolution {
  /**
   * Captures a complete assignment.
   *
   * @throws IllegalArgumentException if the assignment does not match the problem or is partial
   */
  public CryptarithmSolution(CryptarithmProblem problem, Assignment assignment) {
    if (assignment.numVariables() != problem.numVariables() || !assignment.isComplete()) {
      throw new IllegalArgumentException(
          "CryptarithmSolution: a complete assignment of " + problem.numVariables()
          + " variables is required, got " + assignment);
    }
    Map<Character, Integer> map = new LinkedHashMap<>();
    for (int var = 0; var < problem.numVariables(); ++var) {
      map.put(problem.letter(var), assignment.value(var));
    }
    this.base = problem.base();
    this.digits = Collections.unmodifiableMap(map);
  }

  /**
   * Returns the digit of a symbol.
   *
   * @throws IllegalArgumentException if the symbol is not part of the puzzle
   */
  public int value(char letter) {
    Integer digit = digits.get(letter);
    if (digit == null) {
      throw new IllegalArgumentException("CryptarithmSolution.value: unknown symbol " + letter);
    }
    return digit;
  }

  /** Returns the numeric value of a word made of the puzzle's symbols. */
  public long numberOf(String word) {
    long result = 0;
    for (int i = 0; i < word.length(); ++i) {
      result = result * base + value(word.charAt(i));
    }
    return result;
  }

  public int base() {
    return base;
  }

  /** Returns the digits by symbol, in order of first occurrence. */
  public Map<Character, Integer> asMap() {
    return digits;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CryptarithmSolution)) {
      return false;
    }
    CryptarithmSolution other = (CryptarithmSolution) o;
    return base == other.base && digits.equals(other.digits);
  }

  @Override
  public int hashCode() {
    return 31 * base + digits.hashCode();
  }

  @Override
  public String toString() {
    return digits.toString();
  }

  private final int base;
  private final Map<Character, Integer> digits;
}
