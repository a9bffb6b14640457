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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public final class DomainsTest {
  @Test
  public void testDomains_removeAndSize() {
    final Domains domains = new Domains(2, 4);

    assertThat(domains.remove(0, 2)).isTrue();
    assertThat(domains.remove(0, 2)).isFalse();
    assertThat(domains.size(0)).isEqualTo(3);
    assertThat(domains.values(0)).isEqualTo(new int[] {0, 1, 3});
    assertThat(domains.size(1)).isEqualTo(4);
  }

  @Test
  public void testDomains_emptyAfterRemovingEverything() {
    final Domains domains = new Domains(1, 2);
    domains.remove(0, 0);
    assertThat(domains.isEmpty(0)).isFalse();
    domains.remove(0, 1);

    assertThat(domains.isEmpty(0)).isTrue();
    assertThat(domains.values(0)).isEmpty();
  }

  @Test
  public void testDomains_copyIsIndependent() {
    final Domains domains = new Domains(2, 3);
    final Domains copy = domains.copy();
    copy.remove(1, 0);

    assertThat(domains.contains(1, 0)).isTrue();
    assertThat(copy.contains(1, 0)).isFalse();
  }

  @Test
  public void testDomains_restoreUndoesPruning() {
    final Domains domains = new Domains(3, 5);
    domains.remove(2, 4);
    final Domains snapshot = domains.copy();

    domains.remove(0, 1);
    domains.remove(1, 1);
    domains.remove(2, 1);
    domains.restore(snapshot);

    assertThat(domains.values(0)).isEqualTo(new int[] {0, 1, 2, 3, 4});
    assertThat(domains.values(1)).isEqualTo(new int[] {0, 1, 2, 3, 4});
    assertThat(domains.values(2)).isEqualTo(new int[] {0, 1, 2, 3});
    // The snapshot stays usable.
    domains.remove(0, 0);
    domains.restore(snapshot);
    assertThat(domains.contains(0, 0)).isTrue();
  }

  @Test
  public void testDomains_nextValueSkipsRemovedValues() {
    final Domains domains = new Domains(1, 6);
    domains.remove(0, 0);
    domains.remove(0, 2);
    domains.remove(0, 5);

    assertThat(domains.min(0)).isEqualTo(1);
    assertThat(domains.nextValue(0, 2)).isEqualTo(3);
    assertThat(domains.nextValue(0, 5)).isEqualTo(-1);
    assertThat(domains.nextValue(0, 6)).isEqualTo(-1);
    assertThat(domains.max(0)).isEqualTo(4);
  }

  @Test
  public void testDomains_largestBase() {
    final Domains domains = new Domains(3, Integer.MAX_VALUE);
    domains.remove(1, 0);
    domains.remove(1, 1);
    final Domains copy = domains.copy();

    assertThat(domains.size(0)).isEqualTo(Integer.MAX_VALUE);
    assertThat(domains.min(1)).isEqualTo(2);
    assertThat(domains.max(1)).isEqualTo(Integer.MAX_VALUE - 1);
    assertThat(domains.nextValue(0, Integer.MAX_VALUE - 1)).isEqualTo(Integer.MAX_VALUE - 1);
    assertThat(copy.size(1)).isEqualTo(Integer.MAX_VALUE - 2);
    assertThat(domains.contains(2, Integer.MAX_VALUE)).isFalse();
  }

  @Test
  public void testDomains_restoreRejectsMismatchedSnapshot() {
    final Domains domains = new Domains(3, 5);

    assertThrows(IllegalArgumentException.class, () -> domains.restore(new Domains(2, 5)));
    assertThrows(IllegalArgumentException.class, () -> domains.restore(new Domains(3, 6)));
  }
}
