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

package com.cryptarithm.util;

import com.cryptarithm.model.CryptarithmProblem;
import com.cryptarithm.search.CryptarithmSolution;
import com.cryptarithm.search.SearchResult;
import java.util.ArrayList;
import java.util.List;

/** Renders solutions as digit strings. */
public final class SolutionFormatter {
  /**
   * Returns the digits of a word under a solution, e.g. {@code "9567"} for {@code SEND}. Bases up
   * to 36 use one character per digit; larger bases separate decimal digit values with dots.
   */
  public static String wordToNumber(String word, CryptarithmSolution solution) {
    final int base = solution.base();
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < word.length(); ++i) {
      final int digit = solution.value(word.charAt(i));
      if (base <= Character.MAX_RADIX) {
        builder.append(Character.toUpperCase(Character.forDigit(digit, base)));
      } else {
        if (i > 0) {
          builder.append('.');
        }
        builder.append(digit);
      }
    }
    return builder.toString();
  }

  /** Returns {@code "9567 + 1085 = 10652"}, or {@code "No solution"}. */
  public static String formatEquation(CryptarithmProblem problem, SearchResult result) {
    if (!result.hasSolution()) {
      return "No solution";
    }
    final CryptarithmSolution solution = result.solution();
    final List<String> numbers = new ArrayList<>();
    for (String operand : problem.operands()) {
      numbers.add(wordToNumber(operand, solution));
    }
    return String.join(" + ", numbers) + " = " + wordToNumber(problem.answer(), solution);
  }

  private SolutionFormatter() {}
}
