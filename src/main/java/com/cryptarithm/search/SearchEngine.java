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
import java.util.logging.Logger;

/**
 * Depth-first search over a fixed variable order, shared by the backtracking and forward-checking
 * engines. An engine runs once: create a new one for every solve.
 */
abstract class SearchEngine {
  private static final Logger logger = Logger.getLogger(SearchEngine.class.getName());

  SearchEngine(CryptarithmProblem problem, int[] order, boolean logSearchProgress) {
    if (order.length != problem.numVariables()) {
      throw new IllegalArgumentException("SearchEngine: order has " + order.length
          + " variables, expected " + problem.numVariables());
    }
    this.problem = problem;
    this.order = order.clone();
    this.logSearchProgress = logSearchProgress;
    this.evaluator = new ConstraintEvaluator(problem);
    this.assignment = new Assignment(problem.numVariables());
  }

  /**
   * Runs the search. Returns true if {@link #assignment()} then holds a solution; otherwise every
   * variable is unassigned again.
   */
  final boolean search() {
    if (searched) {
      throw new IllegalStateException("SearchEngine.search: an engine can only search once");
    }
    searched = true;
    return run();
  }

  abstract boolean run();

  /** Returns the first unassigned variable in the search order, or -1 if there is none. */
  final int selectVariable() {
    for (int var : order) {
      if (!assignment.isAssigned(var)) {
        return var;
      }
    }
    return -1;
  }

  /** Checks the equation on a complete assignment. */
  final boolean acceptLeaf() {
    if (evaluator.equationHolds(assignment)) {
      return true;
    }
    numFailures++;
    return false;
  }

  /** Counts a search node and traces it if requested. */
  final void enterNode(int depth) {
    numNodes++;
    if (logSearchProgress) {
      logger.info(depth + " - " + problem.describe(assignment));
    }
  }

  final Assignment assignment() {
    return assignment;
  }

  final long numNodes() {
    return numNodes;
  }

  final long numBranches() {
    return numBranches;
  }

  final long numFailures() {
    return numFailures;
  }

  final CryptarithmProblem problem;
  final int[] order;
  final ConstraintEvaluator evaluator;
  final Assignment assignment;
  private final boolean logSearchProgress;
  private boolean searched = false;

  long numNodes;
  long numBranches;
  long numFailures;
}
