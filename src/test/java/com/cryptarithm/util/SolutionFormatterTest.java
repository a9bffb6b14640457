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

import static com.google.common.truth.Truth.assertThat;

import com.cryptarithm.model.Assignment;
import com.cryptarithm.model.CryptarithmProblem;
import com.cryptarithm.search.CryptarithmSolution;
import com.cryptarithm.search.SearchResult;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

public final class SolutionFormatterTest {
  private static CryptarithmSolution solution(CryptarithmProblem problem, int... values) {
    final Assignment assignment = new Assignment(problem.numVariables());
    for (int var = 0; var < values.length; ++var) {
      assignment.assign(var, values[var]);
    }
    return new CryptarithmSolution(problem, assignment);
  }

  @Test
  public void testFormatEquation() {
    final CryptarithmProblem problem =
        new CryptarithmProblem(Arrays.asList("SEND", "MORE"), "MONEY");
    // S E N D M O R Y
    final SearchResult result = SearchResult.feasible(
        solution(problem, 9, 5, 6, 7, 1, 0, 8, 2), "backtracking", 1, 1, 0, 0.0);

    assertThat(SolutionFormatter.wordToNumber("SEND", result.solution())).isEqualTo("9567");
    assertThat(SolutionFormatter.formatEquation(problem, result))
        .isEqualTo("9567 + 1085 = 10652");
  }

  @Test
  public void testFormatEquation_leadingZerosAreKept() {
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("AB"), "AB");
    final SearchResult result =
        SearchResult.feasible(solution(problem, 0, 1), "backtracking", 3, 3, 1, 0.0);

    assertThat(SolutionFormatter.formatEquation(problem, result)).isEqualTo("01 = 01");
  }

  @Test
  public void testFormatEquation_noSolution() {
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("AB"), "BA");

    assertThat(
            SolutionFormatter.formatEquation(
                problem, SearchResult.infeasible("forward_checking", 0, 0, 0, 0.0)))
        .isEqualTo("No solution");
  }

  @Test
  public void testWordToNumber_hexadecimal() {
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("AB"), "C", 16);

    assertThat(SolutionFormatter.wordToNumber("ABC", solution(problem, 15, 10, 3)))
        .isEqualTo("FA3");
  }

  @Test
  public void testWordToNumber_largeBase() {
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("AB"), "C", 60);

    assertThat(SolutionFormatter.wordToNumber("ABC", solution(problem, 59, 0, 12)))
        .isEqualTo("59.0.12");
  }
}
