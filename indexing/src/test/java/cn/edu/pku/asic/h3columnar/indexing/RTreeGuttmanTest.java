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
package cn.edu.pku.asic.h3columnar.indexing;

import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RTreeGuttmanTest {

  private static double[][] randomBoxes(Random random, int count) {
    double[][] boxes = new double[4][count];
    for (int $i = 0; $i < count; $i++) {
      boxes[0][$i] = random.nextDouble() * 100;
      boxes[1][$i] = random.nextDouble() * 100;
      boxes[2][$i] = boxes[0][$i] + random.nextDouble() * 3;
      boxes[3][$i] = boxes[1][$i] + random.nextDouble() * 3;
    }
    return boxes;
  }

  @Test
  void searchMatchesBruteForce() {
    Random random = new Random(1);
    double[][] boxes = randomBoxes(random, 1000);
    RTreeGuttman rtree = new RTreeGuttman(4, 10);
    rtree.initializeFromRects(boxes[0], boxes[1], boxes[2], boxes[3]);
    assertThat(rtree.numOfDataEntries()).isEqualTo(1000);
    assertThat(rtree.isWellFormed()).isTrue();
    assertThat(rtree.getHeight()).isPositive();

    IntArray results = new IntArray();
    for (int query = 0; query < 50; query++) {
      double x = random.nextDouble() * 100, y = random.nextDouble() * 100;
      double[] min = {x, y};
      double[] max = {x + 10, y + 10};
      rtree.search(min, max, results);
      List<Integer> expected = new ArrayList<>();
      for (int $i = 0; $i < 1000; $i++) {
        if (boxes[0][$i] <= max[0] && boxes[2][$i] >= min[0] && boxes[1][$i] <= max[1] && boxes[3][$i] >= min[1])
          expected.add($i);
      }
      assertThat(results).containsExactlyInAnyOrderElementsOf(expected);
    }
  }

  @Test
  void touchingBoxesOverlap() {
    RTreeGuttman rtree = new RTreeGuttman(2, 4);
    rtree.initializeFromRects(new double[] {0, 1}, new double[] {0, 0}, new double[] {1, 2}, new double[] {1, 1});
    IntArray results = new IntArray();
    rtree.search(new double[] {1, 1}, new double[] {1, 1}, results);
    assertThat(results).containsExactlyInAnyOrder(0, 1);
    rtree.search(new double[] {2.5, 0}, new double[] {3, 1}, results);
    assertThat(results).isEmpty();
  }

  @Test
  void emptyTreeFindsNothing() {
    RTreeGuttman rtree = new RTreeGuttman(2, 4);
    rtree.initializeFromRects(new double[0], new double[0], new double[0], new double[0]);
    IntArray results = new IntArray();
    rtree.search(new double[] {-1, -1}, new double[] {1, 1}, results);
    assertThat(results).isEmpty();
    rtree.nearest(new double[] {0, 0}, 3, i -> 0, results);
    assertThat(results).isEmpty();
    assertThat(rtree.isWellFormed()).isTrue();
  }

  @Test
  void nearestIsOrderedByDistanceThenId() {
    Random random = new Random(2);
    double[][] boxes = randomBoxes(random, 500);
    // Duplicate some boxes to create ties
    for (int $i = 0; $i < 50; $i++) {
      boxes[0][$i + 100] = boxes[0][$i];
      boxes[1][$i + 100] = boxes[1][$i];
      boxes[2][$i + 100] = boxes[2][$i];
      boxes[3][$i + 100] = boxes[3][$i];
    }
    RTreeGuttman rtree = new RTreeGuttman(3, 8);
    rtree.initializeFromRects(boxes[0], boxes[1], boxes[2], boxes[3]);
    double[] point = {50, 50};
    // Distance to the center of each box is never smaller than the distance to the box
    double[] exact = new double[500];
    for (int $i = 0; $i < 500; $i++)
      exact[$i] = Math.hypot((boxes[0][$i] + boxes[2][$i]) / 2 - point[0], (boxes[1][$i] + boxes[3][$i]) / 2 - point[1]);
    IntArray results = new IntArray();
    rtree.nearest(point, 20, i -> exact[i], results);

    List<Integer> expected = new ArrayList<>();
    for (int $i = 0; $i < 500; $i++)
      expected.add($i);
    expected.sort(Comparator.<Integer>comparingDouble(i -> exact[i]).thenComparingInt(i -> i));
    assertThat(results).containsExactlyElementsOf(expected.subList(0, 20));
  }

  @Test
  void rejectsInvalidCapacities() {
    assertThatThrownBy(() -> new RTreeGuttman(6, 10)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RTreeGuttman(0, 10)).isInstanceOf(IllegalArgumentException.class);
  }
}
