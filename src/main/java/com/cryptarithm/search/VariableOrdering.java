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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/** Static order in which a search selects its variables. */
public enum VariableOrdering {
  /**
   * Most frequent symbols first, counting every occurrence in the operands and the answer. Ties
   * keep the order of first occurrence.
   */
  DEGREE {
    @Override
    public int[] order(CryptarithmProblem problem, Random random) {
      final int[] counts = new int[problem.numVariables()];
      for (int i = 0; i < problem.numOperands(); ++i) {
        for (int var : problem.operandWord(i)) {
          counts[var]++;
        }
      }
      for (int var : problem.answerWord()) {
        counts[var]++;
      }
      // Variable indices follow first occurrence, and the sort is stable.
      List<Integer> vars = indices(problem.numVariables());
      vars.sort((a, b) -> Integer.compare(counts[b], counts[a]));
      return toArray(vars);
    }
  },

  /** Uniform random permutation. */
  RANDOM {
    @Override
    public int[] order(CryptarithmProblem problem, Random random) {
      List<Integer> vars = indices(problem.numVariables());
      Collections.shuffle(vars, random);
      return toArray(vars);
    }
  };

  /** Returns every variable index of the problem exactly once, in selection order. */
  public abstract int[] order(CryptarithmProblem problem, Random random);

  /** Parses {@code deg}, {@code degree} or {@code random}, ignoring case. */
  public static VariableOrdering fromName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "deg":
      case "degree":
        return DEGREE;
      case "random":
        return RANDOM;
      default:
        throw new IllegalArgumentException("VariableOrdering.fromName: unknown ordering " + name);
    }
  }

  private static List<Integer> indices(int n) {
    List<Integer> vars = new ArrayList<>(n);
    for (int var = 0; var < n; ++var) {
      vars.add(var);
    }
    return vars;
  }

  private static int[] toArray(List<Integer> vars) {
    int[] result = new int[vars.size()];
    for (int i = 0; i < result.length; ++i) {
      result[i] = vars.get(i);
    }
    return result;
  }
}
