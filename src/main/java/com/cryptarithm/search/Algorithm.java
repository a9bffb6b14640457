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

import com.cryptarithm.model.CryptarithmProblem;
import java.util.Locale;

/** Search algorithms of {@link CryptarithmSolver}. */
public enum Algorithm {
  /** Chronological backtracking with an incremental all-different check. */
  BACKTRACKING("backtracking") {
    @Override
    SearchEngine newEngine(CryptarithmProblem problem, int[] order, boolean logSearchProgress) {
      return new BacktrackingSearch(problem, order, logSearchProgress);
    }
  },

  /** Backtracking that also prunes the assigned digit from the domains of unassigned variables. */
  FORWARD_CHECKING("forward_checking") {
    @Override
    SearchEngine newEngine(CryptarithmProblem problem, int[] order, boolean logSearchProgress) {
      return new ForwardCheckingSearch(problem, order, logSearchProgress);
    }
  };

  Algorithm(String solverName) {
    this.solverName = solverName;
  }

  /** Returns the name reported in search statistics. */
  public String solverName() {
    return solverName;
  }

  abstract SearchEngine newEngine(
      CryptarithmProblem problem, int[] order, boolean logSearchProgress);

  /** Parses {@code bt}, {@code backtracking}, {@code fc} or {@code forward_checking}. */
  public static Algorithm fromName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "bt":
      case "backtrack":
      case "backtracking":
        return BACKTRACKING;
      case "fc":
      case "forward_checking":
        return FORWARD_CHECKING;
      default:
        throw new IllegalArgumentException("Algorithm.fromName: unknown algorithm " + name);
    }
  }

  private final String solverName;
}
