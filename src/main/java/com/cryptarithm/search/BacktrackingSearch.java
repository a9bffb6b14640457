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
import com.cryptarithm.model.Domains;

/**
 * Chronological backtracking.
 *
 * <p>Tries the initial domain of each variable in ascending order and rejects a value as soon as
 * it repeats an assigned one. The equation is only checked on complete assignments.
 */
final class BacktrackingSearch extends SearchEngine {
  BacktrackingSearch(CryptarithmProblem problem, int[] order, boolean logSearchProgress) {
    super(problem, order, logSearchProgress);
    this.domains = problem.initialDomains();
  }

  @Override
  boolean run() {
    return backtrack(0);
  }

  private boolean backtrack(int depth) {
    enterNode(depth);
    final int var = selectVariable();
    if (var < 0) {
      return acceptLeaf();
    }
    for (int value = domains.min(var); value >= 0; value = domains.nextValue(var, value + 1)) {
      numBranches++;
      assignment.assign(var, value);
      if (!evaluator.allDifferent(assignment)) {
        numFailures++;
        continue;
      }
      if (backtrack(depth + 1)) {
        return true;
      }
    }
    assignment.unassign(var);
    return false;
  }

  // Read-only: shared by every branch.
  private final Domains domains;
}
