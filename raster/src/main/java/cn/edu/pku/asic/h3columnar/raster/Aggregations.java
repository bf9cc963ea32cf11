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

import java.util.Arrays;

/**
 * The common aggregate functions. All of them except {@link #FIRST} are independent of the order of the
 * values. {@link #MODE} breaks ties in favor of the smallest value.
 */
public enum Aggregations implements ValueAggregator {
  SUM {
    @Override
    public double aggregate(double[] values, int count) {
      double sum = 0;
      for (int $i = 0; $i < count; $i++)
        sum += values[$i];
      return sum;
    }
  },
  MEAN {
    @Override
    public double aggregate(double[] values, int count) {
      return SUM.aggregate(values, count) / count;
    }
  },
  MIN {
    @Override
    public double aggregate(double[] values, int count) {
      double min = values[0];
      for (int $i = 1; $i < count; $i++)
        min = Math.min(min, values[$i]);
      return min;
    }
  },
  MAX {
    @Override
    public double aggregate(double[] values, int count) {
      double max = values[0];
      for (int $i = 1; $i < count; $i++)
        max = Math.max(max, values[$i]);
      return max;
    }
  },
  MODE {
    @Override
    public double aggregate(double[] values, int count) {
      double[] sorted = Arrays.copyOf(values, count);
      Arrays.sort(sorted);
      double mode = sorted[0];
      int modeCount = 0;
      int runStart = 0;
      for (int $i = 1; $i <= count; $i++) {
        if ($i == count || Double.compare(sorted[$i], sorted[runStart]) != 0) {
          // Strictly greater keeps the smallest value on ties
          if ($i - runStart > modeCount) {
            modeCount = $i - runStart;
            mode = sorted[runStart];
          }
          runStart = $i;
        }
      }
      return mode;
    }
  },
  FIRST {
    @Override
    public double aggregate(double[] values, int count) {
      return values[0];
    }
  },
  COUNT {
    @Override
    public double aggregate(double[] values, int count) {
      return count;
    }
  };

  /**
   * Parses an aggregate function by name, case insensitive, e.g., "mean" or "majority".
   */
  public static Aggregations fromName(String name) {
    String normalized = name.trim().toUpperCase();
    if (normalized.equals("MAJORITY"))
      return MODE;
    if (normalized.equals("AVG") || normalized.equals("AVERAGE"))
      return MEAN;
    return valueOf(normalized);
  }
}
