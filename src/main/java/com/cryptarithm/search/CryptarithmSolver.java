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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves cryptarithmetic puzzles with backtracking or forward checking.
 *
 * <p>The solver holds no state between calls: everything that configures a search is passed in
 * the {@link SearchParameters} of each call, and each call returns its own {@link SearchResult}.
 * The first solution found is returned.
 */
public final class CryptarithmSolver {
  private static final Logger logger = Logger.getLogger(CryptarithmSolver.class.getName());

  public CryptarithmSolver() {}

  /** Solves the given puzzle with backtracking and degree ordering. */
  public SearchResult solve(CryptarithmProblem problem) {
    return solve(problem, SearchParameters.getDefaultInstance());
  }

  /** Solves the given puzzle with the given parameters. */
  public SearchResult solve(CryptarithmProblem problem, SearchParameters parameters) {
    final long start = System.nanoTime();
    final String solverName = parameters.getAlgorithm().solverName();
    if (!problem.hasEnoughDigits()) {
      logger.fine(() -> "Skipping search, " + problem.numVariables() + " symbols for "
          + problem.base() + " digits: " + problem);
      return SearchResult.infeasible(solverName, 0, 0, 0, secondsSince(start));
    }

    final int[] order =
        parameters.getVariableOrdering().order(problem, parameters.newRandom());
    final SearchEngine engine = parameters.getAlgorithm().newEngine(
        problem, order, parameters.getLogSearchProgress());
    final boolean found = engine.search();
    final double wallTime = secondsSince(start);

    final SearchResult result;
    if (found) {
      result = SearchResult.feasible(new CryptarithmSolution(problem, engine.assignment()),
          solverName, engine.numNodes(), engine.numBranches(), engine.numFailures(), wallTime);
    } else {
      result = SearchResult.infeasible(solverName, engine.numNodes(), engine.numBranches(),
          engine.numFailures(), wallTime);
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(problem + ": " + result.status() + " after " + result.numNodes() + " nodes, "
          + result.numBranches() + " branches, " + result.numFailures() + " failures, "
          + result.wallTime() + " s");
    }
    return result;
  }

  private static double secondsSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1e9;
  }
}
