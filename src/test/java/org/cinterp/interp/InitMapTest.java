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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InitMapTest {

  @Test
  public void initializeAll() {
    InitMap map = new InitMap(3);
    assertThat(map.uninitializedCount()).isEqualTo(3);
    assertThat(map.initializeElement(1)).isFalse();
    assertThat(map.isElementInitialized(1)).isTrue();
    assertThat(map.isElementInitialized(0)).isFalse();
    // Initializing twice doesn't count twice.
    assertThat(map.initializeElement(1)).isFalse();
    assertThat(map.uninitializedCount()).isEqualTo(2);
    assertThat(map.initializeElement(0)).isFalse();
    assertThat(map.initializeElement(2)).isTrue();
    assertThat(map.isAllInitialized()).isTrue();
  }

  @Test
  public void spansWords() {
    InitMap map = new InitMap(130);
    for (int i = 0; i < 130; i += 2) {
      map.initializeElement(i);
    }
    assertThat(map.uninitializedCount()).isEqualTo(65);
    assertThat(map.isElementInitialized(64)).isTrue();
    assertThat(map.isElementInitialized(65)).isFalse();
    assertThat(map.isElementInitialized(128)).isTrue();
    assertThat(map.isElementInitialized(129)).isFalse();
    // Indices outside the map are never initialized.
    assertThat(map.isElementInitialized(-1)).isFalse();
    assertThat(map.isElementInitialized(1000)).isFalse();
  }

  @Test
  public void copyIsIndependent() {
    InitMap map = new InitMap(2);
    map.initializeElement(0);
    InitMap copy = map.copy();
    copy.initializeElement(1);
    assertThat(copy.isAllInitialized()).isTrue();
    assertThat(map.isAllInitialized()).isFalse();
    assertThat(map.isElementInitialized(1)).isFalse();
    assertThat(copy.isElementInitialized(0)).isTrue();
  }

  @Test
  public void emptyMap() {
    InitMap map = new InitMap(0);
    assertThat(map.isAllInitialized()).isTrue();
    assertThrows(IllegalArgumentException.class, () -> new InitMap(-1));
  }
}
