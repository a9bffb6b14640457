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

package com.cryptarithm.samples;

import com.cryptarithm.model.CryptarithmProblem;
import com.cryptarithm.sat.CpSatCryptarithmSolver;
import com.cryptarithm.search.Algorithm;
import com.cryptarithm.search.CryptarithmSolver;
import com.cryptarithm.search.SearchParameters;
import com.cryptarithm.search.SearchResult;
import com.cryptarithm.search.VariableOrdering;
import com.cryptarithm.util.SolutionFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Solves a cryptarithm from the command line.
 *
 * <pre>
 * CryptarithmSample [bt|fc|cpsat] [deg|random] WORD... ANSWER
 * CryptarithmSample fc deg send more money
 * </pre>
 *
 * <p>Without arguments, solves SEND + MORE = MONEY with backtracking.
 */
public final class CryptarithmSample {
  private static final Logger logger = Logger.getLogger(CryptarithmSample.class.getName());

  static final String USAGE =
      "Usage: CryptarithmSample [bt|fc|cpsat] [deg|random] WORD... ANSWER (at least two words)";

  static SearchResult solve(String solverName, String ordering, CryptarithmProblem problem) {
    if (solverName.equalsIgnoreCase("cpsat")) {
      return new CpSatCryptarithmSolver().solve(problem);
    }
    final SearchParameters parameters = SearchParameters.newBuilder()
                                            .setAlgorithm(Algorithm.fromName(solverName))
                                            .setVariableOrdering(VariableOrdering.fromName(ordering))
                                            .build();
    return new CryptarithmSolver().solve(problem, parameters);
  }

  public static void main(String[] args) throws Exception {
    String solverName = "bt";
    String ordering = "deg";
    List<String> words = new ArrayList<>();
    for (String arg : args) {
      words.add(arg.toUpperCase(Locale.ROOT));
    }
    if (words.size() > 0 && isSolverName(args[0])) {
      solverName = args[0];
      words.remove(0);
      if (words.size() > 0 && isOrderingName(args[1])) {
        ordering = args[1];
        words.remove(0);
      }
    }
    if (args.length == 0) {
      words = List.of("SEND", "MORE", "MONEY");
    } else if (words.size() < 2) {
      logger.warning(USAGE);
      return;
    }

    final CryptarithmProblem problem =
        new CryptarithmProblem(words.subList(0, words.size() - 1), words.get(words.size() - 1));
    logger.info("Solving " + problem);
    final SearchResult result = solve(solverName, ordering, problem);
    logger.info(SolutionFormatter.formatEquation(problem, result));
    logger.info(result.responseStats());
  }

  private static boolean isSolverName(String arg) {
    return arg.equalsIgnoreCase("bt") || arg.equalsIgnoreCase("fc")
        || arg.equalsIgnoreCase("cpsat");
  }

  private static boolean isOrderingName(String arg) {
    return arg.equalsIgnoreCase("deg") || arg.equalsIgnoreCase("random");
  }

  private CryptarithmSample() {}
}
