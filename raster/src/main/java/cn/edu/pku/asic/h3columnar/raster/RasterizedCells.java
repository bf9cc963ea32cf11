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

import cn.edu.pku.asic.h3columnar.dggs.h3.CellArray;
import cn.edu.pku.asic.h3columnar.dggs.h3.H3CellId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of rasterizing: unique cells sorted ascending, each with the aggregate of its pixels.
 */
public class RasterizedCells {

  private final CellArray cells;
  private final double[] values;

  RasterizedCells(CellArray cells, double[] values) {
    this.cells = cells;
    this.values = values;
  }

  public CellArray getCells() {
    return cells;
  }

  public double[] getValues() {
    return values.clone();
  }

  public int size() {
    return values.length;
  }

  /**
   * The same mapping as a map in ascending cell order
   */
  public Map<H3CellId, Double> asMap() {
    Map<H3CellId, Double> map = new LinkedHashMap<>();
    for (int $i = 0; $i < values.length; $i++)
      map.put(cells.get($i), values[$i]);
    return map;
  }
}
