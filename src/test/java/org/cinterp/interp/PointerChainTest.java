/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.cinterp.interp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PointerChainTest {

  private final PointerChain chain = new PointerChain();

  /** Unlinked null Pointers; they compare equal, so members are checked by identity. */
  private final Pointer p1 = new Pointer();
  private final Pointer p2 = new Pointer();
  private final Pointer p3 = new Pointer();

  private List<Pointer> members() {
    List<Pointer> result = new ArrayList<>();
    chain.forEach(result::add);
    return result;
  }

  @Test
  public void addAndRemove() {
    assertThat(chain.isEmpty()).isTrue();
    long h1 = chain.add(p1);
    long h2 = chain.add(p2);
    long h3 = chain.add(p3);
    assertThat(chain.size()).isEqualTo(3);
    assertThat(members()).containsExactly(p1, p2, p3).inOrder();
    chain.remove(h2, p2);
    assertThat(members()).hasSize(2);
    assertThat(members().get(1)).isSameInstanceAs(p3);
    chain.remove(h1, p1);
    chain.remove(h3, p3);
    assertThat(chain.isEmpty()).isTrue();
    assertThat(members()).isEmpty();
  }

  @Test
  public void slotsAreReused() {
    long h1 = chain.add(p1);
    chain.add(p2);
    chain.remove(h1, p1);
    long h3 = chain.add(p3);
    // Same slot, new generation.
    assertThat((int) h3).isEqualTo((int) h1);
    assertThat(h3).isNotEqualTo(h1);
    assertThat(members().get(0)).isSameInstanceAs(p3);
    assertThat(members().get(1)).isSameInstanceAs(p2);
  }

  @Test
  public void staleHandle() {
    long h1 = chain.add(p1);
    chain.remove(h1, p1);
    assertThrows(IllegalStateException.class, () -> chain.remove(h1, p1));
    chain.add(p2);
    // The slot now holds p2 under a newer generation.
    assertThrows(IllegalStateException.class, () -> chain.remove(h1, p1));
    assertThat(chain.size()).isEqualTo(1);
  }

  @Test
  public void wrongPointerOrHandle() {
    long h1 = chain.add(p1);
    assertThrows(IllegalStateException.class, () -> chain.remove(h1, p2));
    assertThrows(
        IllegalStateException.class, () -> chain.remove(PointerChain.NO_HANDLE, p1));
    assertThrows(IllegalStateException.class, () -> chain.remove(h1 + 7, p1));
    chain.remove(h1, p1);
  }

  @Test
  public void grows() {
    List<Pointer> ptrs = new ArrayList<>();
    List<Long> handles = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      Pointer p = new Pointer();
      ptrs.add(p);
      handles.add(chain.add(p));
    }
    assertThat(chain.size()).isEqualTo(50);
    assertThat(members()).containsExactlyElementsIn(ptrs).inOrder();
    for (int i = 0; i < 50; i += 2) {
      chain.remove(handles.get(i), ptrs.get(i));
    }
    assertThat(chain.size()).isEqualTo(25);
  }
}
