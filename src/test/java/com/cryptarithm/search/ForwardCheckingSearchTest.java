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

import static com.google.common.truth.Truth.assertThat;

import com.cryptarithm.model.CryptarithmProblem;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Tests the forward-checking engine directly, with degree ordering. */
public final class ForwardCheckingSearchTest {
  private static ForwardCheckingSearch newSearch(CryptarithmProblem problem) {
    return new ForwardCheckingSearch(
        problem, VariableOrdering.DEGREE.order(problem, new Random(0)), false);
  }

  private static BacktrackingSearch newBacktracking(CryptarithmProblem problem) {
    return new BacktrackingSearch(
        problem, VariableOrdering.DEGREE.order(problem, new Random(0)), false);
  }

  @Test
  public void testSearch_identityPuzzle() {
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("AB"), "AB");
    final ForwardCheckingSearch search = newSearch(problem);

    assertThat(search.search()).isTrue();
    assertThat(search.assignment().value(0)).isEqualTo(0);
    assertThat(search.assignment().value(1)).isEqualTo(1);
    // B never sees the value taken by A.
    assertThat(search.numNodes()).isEqualTo(3L);
    assertThat(search.numBranches()).isEqualTo(2L);
    assertThat(search.numFailures()).isEqualTo(0L);
  }

  @Test
  public void testSearch_wipeoutPrunesBeforeDescending() {
    // Base 3 with A, C in {1, 2} and B first: B=1, A=2 leaves C without a value.
    final CryptarithmProblem problem =
        new CryptarithmProblem(Arrays.asList("AB", "CB", "B"), "AC", 3);
    problem.setForbidLeadingZeros(true);
    final ForwardCheckingSearch search = newSearch(problem);
    final BacktrackingSearch backtracking = newBacktracking(problem);

    assertThat(search.search()).isFalse();
    assertThat(backtracking.search()).isFalse();
    assertThat(search.numNodes()).isEqualTo(8L);
    assertThat(search.numBranches()).isEqualTo(9L);
    assertThat(search.numFailures()).isEqualTo(4L);
    assertThat(search.numNodes()).isLessThan(backtracking.numNodes());
    assertThat(search.assignment().numAssigned()).isEqualTo(0);
  }

  @Test
  public void testSearch_sendMoreMoneyWithoutLeadingZeros() {
    final CryptarithmProblem problem =
        new CryptarithmProblem(Arrays.asList("SEND", "MORE"), "MONEY");
    problem.setForbidLeadingZeros(true);
    final ForwardCheckingSearch search = newSearch(problem);

    assertThat(search.search()).isTrue();
    final CryptarithmSolution solution = new CryptarithmSolution(problem, search.assignment());
    assertThat(solution.numberOf("SEND")).isEqualTo(9567L);
    assertThat(solution.numberOf("MORE")).isEqualTo(1085L);
    assertThat(solution.numberOf("MONEY")).isEqualTo(10652L);
  }

  @Test
  public void testSearch_followsBacktrackingTraversal() {
    // Forward checking only skips subtrees without solutions, so with the same order it reaches
    // the same first solution, in no more branches.
    final CryptarithmProblem problem = new CryptarithmProblem(Arrays.asList("TO", "GO"), "OUT");
    final ForwardCheckingSearch search = newSearch(problem);
    final BacktrackingSearch backtracking = newBacktracking(problem);

    assertThat(search.search()).isTrue();
    assertThat(backtracking.search()).isTrue();
    assertThat(new CryptarithmSolution(problem, search.assignment()))
        .isEqualTo(new CryptarithmSolution(problem, backtracking.assignment()));
    assertThat(search.numBranches()).isEqualTo(703L);
    assertThat(backtracking.numBranches()).isEqualTo(985L);
  }
}
