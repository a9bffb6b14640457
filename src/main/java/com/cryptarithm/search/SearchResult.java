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

/**
 * Result of a solve: the status, the solution when there is one, and search statistics.
 *
 * <p>Statistics are zero when the puzzle was rejected before any search.
 */
public final class SearchResult {
  /** Creates the result of a successful solve. */
  public static SearchResult feasible(CryptarithmSolution solution, String solverName,
      long numNodes, long numBranches, long numFailures, double wallTime) {
    if (solution == null) {
      throw new IllegalArgumentException("SearchResult.feasible: solution must not be null");
    }
    return new SearchResult(SearchStatus.FEASIBLE, solution, solverName, numNodes, numBranches,
        numFailures, wallTime);
  }

  /** Creates the result of a solve that proved the puzzle has no solution. */
  public static SearchResult infeasible(String solverName, long numNodes, long numBranches,
      long numFailures, double wallTime) {
    return new SearchResult(
        SearchStatus.INFEASIBLE, null, solverName, numNodes, numBranches, numFailures, wallTime);
  }

  private SearchResult(SearchStatus status, CryptarithmSolution solution, String solverName,
      long numNodes, long numBranches, long numFailures, double wallTime) {
    this.status = status;
    this.solution = solution;
    this.solverName = solverName;
    this.numNodes = numNodes;
    this.numBranches = numBranches;
    this.numFailures = numFailures;
    this.wallTime = wallTime;
  }

  public SearchStatus status() {
    return status;
  }

  public boolean hasSolution() {
    return solution != null;
  }

  /**
   * Returns the solution.
   *
   * @throws IllegalStateException if the puzzle is infeasible
   */
  public CryptarithmSolution solution() {
    if (solution == null) {
      throw new IllegalStateException("SearchResult.solution: status is " + status);
    }
    return solution;
  }

  /** Returns the name of the algorithm that produced this result. */
  public String solverName() {
    return solverName;
  }

  /** Returns the number of search nodes, that is of recursive search calls. */
  public long numNodes() {
    return numNodes;
  }

  /** Returns the number of tentative assignments. */
  public long numBranches() {
    return numBranches;
  }

  /** Returns the number of rejected tentative assignments and failed complete assignments. */
  public long numFailures() {
    return numFailures;
  }

  /** Returns the wall time of the solve, in seconds. */
  public double wallTime() {
    return wallTime;
  }

  /** Returns the statistics as a multi-line string. */
  public String responseStats() {
    return String.format("Statistics (%s)%n  - status    : %s%n  - nodes     : %d%n"
            + "  - branches  : %d%n  - failures  : %d%n  - wall time : %f s",
        solverName, status, numNodes, numBranches, numFailures, wallTime);
  }

  @Override
  public String toString() {
    return status + (solution == null ? "" : " " + solution);
  }

  private final SearchStatus status;
  private final CryptarithmSolution solution;
  private final String solverName;
  private final long numNodes;
  private final long numBranches;
  private final long numFailures;
  private final double wallTime;
}
