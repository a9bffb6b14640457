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

package com.cryptarithm.sat;

import com.cryptarithm.model.Assignment;
import com.cryptarithm.model.CryptarithmProblem;
import com.cryptarithm.model.Domains;
import com.cryptarithm.search.CryptarithmSolution;
import com.cryptarithm.search.SearchResult;
import com.google.ortools.Loader;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import java.util.logging.Logger;

/**
 * Solves cryptarithmetic puzzles with the OR-Tools CP-SAT solver.
 *
 * <p>The model has one integer variable per symbol, an AllDifferent constraint and a single linear
 * equality {@code sum(operands) - answer == 0}. Results have the same shape as those of {@link
 * com.cryptarithm.search.CryptarithmSolver}, which makes the two solvers easy to cross-check.
 */
public final class CpSatCryptarithmSolver {
  private static final Logger logger = Logger.getLogger(CpSatCryptarithmSolver.class.getName());

  public static final String SOLVER_NAME = "cp_sat";

  /** Loads the OR-Tools native libraries if needed. */
  public CpSatCryptarithmSolver() {
    Loader.loadNativeLibraries();
  }

  /**
   * Builds the CP-SAT model of a puzzle.
   *
   * @return the variables of the model, indexed like the symbols of the problem
   */
  static IntVar[] buildModel(CryptarithmProblem problem, Domains domains, CpModel model) {
    final IntVar[] letters = new IntVar[problem.numVariables()];
    for (int var = 0; var < letters.length; ++var) {
      // Initial domains are intervals: 0..B-1, or 1..B-1 for a leading symbol.
      letters[var] = model.newIntVar(
          domains.min(var), domains.max(var), String.valueOf(problem.letter(var)));
    }
    model.addAllDifferent(letters);

    final LinearExprBuilder equation = LinearExpr.newBuilder();
    for (int i = 0; i < problem.numOperands(); ++i) {
      addWord(equation, letters, problem, problem.operandWord(i), 1);
    }
    addWord(equation, letters, problem, problem.answerWord(), -1);
    model.addEquality(equation, 0);
    return letters;
  }

  private static void addWord(LinearExprBuilder equation, IntVar[] letters,
      CryptarithmProblem problem, int[] word, long sign) {
    for (int i = 0; i < word.length; ++i) {
      equation.addTerm(letters[word[i]], sign * problem.power(word.length - 1 - i));
    }
  }

  /**
   * Solves the given puzzle.
   *
   * @throws IllegalStateException if CP-SAT neither finds a solution nor proves infeasibility
   */
  public SearchResult solve(CryptarithmProblem problem) {
    if (!problem.hasEnoughDigits()) {
      return SearchResult.infeasible(SOLVER_NAME, 0, 0, 0, 0.0);
    }
    final Domains domains = problem.initialDomains();
    for (int var = 0; var < problem.numVariables(); ++var) {
      if (domains.isEmpty(var)) {
        return SearchResult.infeasible(SOLVER_NAME, 0, 0, 0, 0.0);
      }
    }
    final CpModel model = new CpModel();
    final IntVar[] letters = buildModel(problem, domains, model);

    final CpSolver solver = new CpSolver();
    final CpSolverStatus status = solver.solve(model);
    logger.fine(() -> problem + ": " + status + "\n" + solver.responseStats());

    if (status == CpSolverStatus.OPTIMAL || status == CpSolverStatus.FEASIBLE) {
      final Assignment assignment = new Assignment(letters.length);
      for (int var = 0; var < letters.length; ++var) {
        assignment.assign(var, (int) solver.value(letters[var]));
      }
      return SearchResult.feasible(new CryptarithmSolution(problem, assignment), SOLVER_NAME, 0,
          solver.numBranches(), solver.numConflicts(), solver.wallTime());
    }
    if (status == CpSolverStatus.INFEASIBLE) {
      return SearchResult.infeasible(
          SOLVER_NAME, 0, solver.numBranches(), solver.numConflicts(), solver.wallTime());
    }
    throw new IllegalStateException(
        "CpSatCryptarithmSolver.solve: status " + status + ", " + solver.responseStats());
  }
}
