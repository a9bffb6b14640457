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
 * Backtracking with forward checking on the all-different relation.
 *
 * <p>Assigning a digit removes it from the domain of every other unassigned variable. If one of
 * those domains becomes empty the value is abandoned without descending. The domains are restored
 * before the next value is tried, whatever the outcome of the current one.
 */
final class ForwardCheckingSearch extends SearchEngine {
  ForwardCheckingSearch(CryptarithmProblem problem, int[] order, boolean logSearchProgress) {
    super(problem, order, logSearchProgress);
  }

  @Override
  boolean run() {
    return forwardCheck(problem.initialDomains(), 0);
  }

  private boolean forwardCheck(Domains domains, int depth) {
    enterNode(depth);
    final int var = selectVariable();
    if (var < 0) {
      return acceptLeaf();
    }
    for (int value = domains.min(var); value >= 0; value = domains.nextValue(var, value + 1)) {
      numBranches++;
      assignment.assign(var, value);
      final Domains snapshot = domains.copy();
      try {
        if (pruneOthers(domains, var, value)) {
          numFailures++;
          continue;
        }
        if (!evaluator.allDifferent(assignment)) {
          numFailures++;
          continue;
        }
        if (forwardCheck(domains, depth + 1)) {
          return true;
        }
      } finally {
        domains.restore(snapshot);
      }
    }
    assignment.unassign(var);
    return false;
  }

  /**
   * Removes {@code value} from the domains of the unassigned variables other than {@code var}.
   * Returns true if any of them became empty.
   */
  private boolean pruneOthers(Domains domains, int var, int value) {
    boolean wipeout = false;
    for (int other : order) {
      if (other == var || assignment.isAssigned(other)) {
        continue;
      }
      if (domains.remove(other, value) && domains.isEmpty(other)) {
        wipeout = true;
      }
    }
    return wipeout;
  }
}
