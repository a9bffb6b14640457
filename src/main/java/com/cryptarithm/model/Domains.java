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

package com.cryptarithm.model;

import java.util.BitSet;

/**
 * Candidate digits of every variable.
 *
 * <p>Each domain is {@code 0..base-1} minus the values removed from it, so memory grows with the
 * number of removals rather than with the base. Values are visited in ascending order with {@link
 * #nextValue(int, int)}. Forward checking mutates a working instance and rolls it back with {@link
 * #copy()} and {@link #restore(Domains)}.
 */
public final class Domains {
  /** Creates domains holding {@code 0..base-1} for every variable. */
  public Domains(int numVariables, int base) {
    if (base <= 0) {
      throw new IllegalArgumentException("Domains: base must be positive, got " + base);
    }
    this.base = base;
    this.removed = new BitSet[numVariables];
    for (int var = 0; var < numVariables; ++var) {
      removed[var] = new BitSet();
    }
  }

  private Domains(int base, BitSet[] removed) {
    this.base = base;
    this.removed = removed;
  }

  public int numVariables() {
    return removed.length;
  }

  public boolean contains(int var, int value) {
    return value >= 0 && value < base && !removed[var].get(value);
  }

  /** Removes a value from a domain. Returns true if it was present. */
  public boolean remove(int var, int value) {
    if (!contains(var, value)) {
      return false;
    }
    removed[var].set(value);
    return true;
  }

  public int size(int var) {
    return base - removed[var].cardinality();
  }

  public boolean isEmpty(int var) {
    return size(var) == 0;
  }

  /** Returns the smallest candidate of a variable that is at least {@code from}, or -1. */
  public int nextValue(int var, int from) {
    if (from >= base) {
      return -1;
    }
    final int value = removed[var].nextClearBit(Math.max(from, 0));
    return value < base ? value : -1;
  }

  /** Returns the smallest candidate, or -1 if the domain is empty. */
  public int min(int var) {
    return nextValue(var, 0);
  }

  /** Returns the largest candidate, or -1 if the domain is empty. */
  public int max(int var) {
    return removed[var].previousClearBit(base - 1);
  }

  /** Returns the candidate values of a variable in ascending order, as a snapshot. */
  public int[] values(int var) {
    final int[] result = new int[size(var)];
    int i = 0;
    for (int value = min(var); value >= 0; value = nextValue(var, value + 1)) {
      result[i++] = value;
    }
    return result;
  }

  /** Returns an independent deep copy. */
  public Domains copy() {
    BitSet[] copies = new BitSet[removed.length];
    for (int var = 0; var < removed.length; ++var) {
      copies[var] = (BitSet) removed[var].clone();
    }
    return new Domains(base, copies);
  }

  /** Overwrites every domain with the content of a snapshot taken by {@link #copy()}. */
  public void restore(Domains snapshot) {
    if (snapshot.removed.length != removed.length || snapshot.base != base) {
      throw new IllegalArgumentException(
          "Domains.restore: snapshot has " + snapshot.removed.length + " variables in base "
          + snapshot.base + ", expected " + removed.length + " in base " + base);
    }
    for (int var = 0; var < removed.length; ++var) {
      removed[var].clear();
      removed[var].or(snapshot.removed[var]);
    }
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("[");
    for (int var = 0; var < removed.length; ++var) {
      if (var > 0) {
        builder.append(", ");
      }
      builder.append("0..").append(base - 1);
      if (!removed[var].isEmpty()) {
        builder.append(" \\ ").append(removed[var]);
      }
    }
    return builder.append(']').toString();
  }

  private final int base;
  // Values taken out of 0..base-1, per variable.
  private final BitSet[] removed;
}
