/*
 * Copyright 2020 University of California, Riverside
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
package cn.edu.pku.asic.h3columnar.raster;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AggregationsTest {

  @Test
  void modeBreaksTiesTowardsTheSmallestValue() {
    assertThat(Aggregations.MODE.aggregate(new double[] {3, 1, 3, 1, 2}, 5)).isEqualTo(1.0);
    assertThat(Aggregations.MODE.aggregate(new double[] {3, 3, 1, 9}, 3)).isEqualTo(3.0);
    assertThat(Aggregations.MEAN.aggregate(new double[] {1, 2, 3, 100}, 3)).isEqualTo(2.0);
    assertThat(Aggregations.fromName("majority")).isEqualTo(Aggregations.MODE);
  }
}
