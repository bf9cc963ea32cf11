/*
 * Copyright 2018 University of California, Riverside
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
package cn.edu.pku.asic.h3columnar.common.utils;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelTest {

  @Test
  void partitionAlignsRanges() {
    int[] partitions = Parallel.partition(0, 1000, 64, 1, 4);
    assertThat(partitions[0]).isEqualTo(0);
    assertThat(partitions[partitions.length - 1]).isEqualTo(1000);
    for (int $i = 1; $i < partitions.length - 1; $i++)
      assertThat(partitions[$i] % 64).isZero();
    assertThat(partitions.length - 1).isLessThanOrEqualTo(4);
  }

  @Test
  void partitionRespectsMinimumRangeSize() {
    assertThat(Parallel.partition(0, 100, 1, 4096, 8)).containsExactly(0, 100);
    assertThat(Parallel.partition(5, 5, 1, 1, 8)).containsExactly(5);
  }

  @Test
  void resultsComeBackInRangeOrder() {
    List<int[]> ranges = Parallel.forEach(0, 10_000, 64, 100, (i1, i2) -> new int[] {i1, i2}, 8);
    int expectedStart = 0;
    for (int[] range : ranges) {
      assertThat(range[0]).isEqualTo(expectedStart);
      expectedStart = range[1];
    }
    assertThat(expectedStart).isEqualTo(10_000);
  }

  @Test
  void nestedCallsRunInline() {
    Set<String> innerThreads = ConcurrentHashMap.newKeySet();
    List<Integer> sums = Parallel.forEach(0, 400, 1, 100, (i1, i2) -> {
      String outer = Thread.currentThread().getName();
      List<Integer> inner = Parallel.forEach(i1, i2, 1, 10, (j1, j2) -> {
        innerThreads.add(outer + "->" + Thread.currentThread().getName());
        return j2 - j1;
      }, 4);
      return inner.stream().mapToInt(Integer::intValue).sum();
    }, 4);
    assertThat(sums.stream().mapToInt(Integer::intValue).sum()).isEqualTo(400);
    for (String pair : innerThreads) {
      String[] parts = pair.split("->");
      if (parts[0].startsWith("h3columnar-worker-"))
        assertThat(parts[1]).isEqualTo(parts[0]);
    }
  }

  @Test
  void firstFailureIsRethrownUnwrapped() {
    assertThatThrownBy(() -> Parallel.forEach(0, 1000, 1, 10, (i1, i2) -> {
      if (i1 >= 500)
        throw new IllegalStateException("range " + i1);
      return i1;
    }, 8)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void emptyInputProducesNoRanges() {
    List<Object> results = Parallel.forEach(0, (i1, i2) -> new ArrayList<>());
    assertThat(results).isEmpty();
  }
}
