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

/**
 * Combines the values of all the pixels that fall in one cell.
 */
@FunctionalInterface
public interface ValueAggregator {

  /**
   * Aggregates a group of values.
   * @param values the values of the group in row-major pixel order. Only the first {@code count} entries are used.
   * @param count the number of values in the group, at least one
   * @return the aggregate value
   */
  double aggregate(double[] values, int count);
}
