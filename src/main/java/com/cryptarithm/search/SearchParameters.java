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

import java.util.Objects;
import java.util.Random;

/**
 * Immutable configuration of a single {@link CryptarithmSolver#solve} call.
 *
 * <p>Use {@link #newBuilder()} to create one:
 *
 * <pre>{@code
 * SearchParameters parameters =
 *     SearchParameters.newBuilder()
 *         .setAlgorithm(Algorithm.FORWARD_CHECKING)
 *         .setVariableOrdering(VariableOrdering.RANDOM)
 *         .setRandomSeed(42)
 *         .build();
 * }</pre>
 */
public final class SearchParameters {
  /** Returns backtracking with degree ordering and no search log. */
  public static SearchParameters getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns a builder initialized with the fields of this instance. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.algorithm = algorithm;
    builder.variableOrdering = variableOrdering;
    builder.hasRandomSeed = hasRandomSeed;
    builder.randomSeed = randomSeed;
    builder.logSearchProgress = logSearchProgress;
    return builder;
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  public VariableOrdering getVariableOrdering() {
    return variableOrdering;
  }

  public boolean hasRandomSeed() {
    return hasRandomSeed;
  }

  public long getRandomSeed() {
    return randomSeed;
  }

  public boolean getLogSearchProgress() {
    return logSearchProgress;
  }

  /** Returns the generator used by {@link VariableOrdering#RANDOM}, seeded if a seed was set. */
  Random newRandom() {
    return hasRandomSeed ? new Random(randomSeed) : new Random();
  }

  @Override
  public String toString() {
    return "algorithm: " + algorithm + ", variable_ordering: " + variableOrdering
        + (hasRandomSeed ? ", random_seed: " + randomSeed : "")
        + ", log_search_progress: " + logSearchProgress;
  }

  /** Builder of {@link SearchParameters}. */
  public static final class Builder {
    private Builder() {}

    public Builder setAlgorithm(Algorithm algorithm) {
      this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
      return this;
    }

    public Builder setVariableOrdering(VariableOrdering variableOrdering) {
      this.variableOrdering = Objects.requireNonNull(variableOrdering, "variableOrdering");
      return this;
    }

    public Builder setRandomSeed(long randomSeed) {
      this.hasRandomSeed = true;
      this.randomSeed = randomSeed;
      return this;
    }

    public Builder clearRandomSeed() {
      this.hasRandomSeed = false;
      this.randomSeed = 0;
      return this;
    }

    /** Logs every search node at INFO level. */
    public Builder setLogSearchProgress(boolean logSearchProgress) {
      this.logSearchProgress = logSearchProgress;
      return this;
    }

    public SearchParameters build() {
      return new SearchParameters(this);
    }

    private Algorithm algorithm = Algorithm.BACKTRACKING;
    private VariableOrdering variableOrdering = VariableOrdering.DEGREE;
    private boolean hasRandomSeed = false;
    private long randomSeed = 0;
    private boolean logSearchProgress = false;
  }

  private SearchParameters(Builder builder) {
    this.algorithm = builder.algorithm;
    this.variableOrdering = builder.variableOrdering;
    this.hasRandomSeed = builder.hasRandomSeed;
    this.randomSeed = builder.randomSeed;
    this.logSearchProgress = builder.logSearchProgress;
  }

  private static final SearchParameters DEFAULT_INSTANCE = newBuilder().build();

  private final Algorithm algorithm;
  private final VariableOrdering variableOrdering;
  private final boolean hasRandomSeed;
  private final long randomSeed;
  private final boolean logSearchProgress;
}
