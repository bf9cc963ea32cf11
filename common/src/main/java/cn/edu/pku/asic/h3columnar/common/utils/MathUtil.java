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

public class MathUtil {

  private MathUtil() { /* Enforce static use only */ }

  public static int nextPowerOfTwo(int i) {
    return Integer.highestOneBit(i) << 1;
  }

  /**
   * Rounds the given non-negative value up to the closest multiple of {@code multiple}.
   * @param x the value to round
   * @param multiple a positive number
   * @return the smallest multiple of {@code multiple} that is greater than or equal to {@code x}
   */
  public static int roundUp(int x, int multiple) {
    return ((x + multiple - 1) / multiple) * multiple;
  }
}
