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

/** Evaluates the constraints of a puzzle against an assignment. */
public final class ConstraintEvaluator {
  public ConstraintEvaluator(CryptarithmProblem problem) {
    this.problem = problem;
    this.operandWords = new int[problem.numOperands()][];
    for (int i = 0; i < operandWords.length; ++i) {
      operandWords[i] = problem.operandWord(i);
    }
    this.answerWord = problem.answerWord();
  }

  /**
   * Returns the positional value of a word, most significant symbol first.
   *
   * @param word variable indices of the word
   * @throws IllegalStateException if a symbol of the word is unassigned
   */
  public long value(int[] word, Assignment assignment) {
    long result = 0;
    for (int i = 0; i < word.length; ++i) {
      result += assignment.value(word[i]) * problem.power(word.length - 1 - i);
    }
    return result;
  }

  /** Returns true if no two assigned variables hold the same value. Unassigned ones are ignored. */
  public boolean allDifferent(Assignment assignment) {
    for (int var = 1; var < assignment.numVariables(); ++var) {
      if (!assignment.isAssigned(var)) {
        continue;
      }
      final int value = assignment.value(var);
      for (int other = 0; other < var; ++other) {
        if (assignment.isAssigned(other) && assignment.value(other) == value) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Returns true if the operands add up to the answer.
   *
   * @throws IllegalStateException if the assignment is not complete
   */
  public boolean equationHolds(Assignment assignment) {
    if (!assignment.isComplete()) {
      throw new IllegalStateException(
          "ConstraintEvaluator.equationHolds: " + assignment.numAssigned() + " of "
          + assignment.numVariables() + " variables assigned");
    }
    long sum = 0;
    for (int[] operand : operandWords) {
      sum += value(operand, assignment);
    }
    return sum == value(answerWord, assignment);
  }

  private final CryptarithmProblem problem;
  private final int[][] operandWords;
  private final int[] answerWord;
}
