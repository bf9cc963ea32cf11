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

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryReader;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;
import cn.edu.pku.asic.h3columnar.dggs.core.AmbiguityException;
import cn.edu.pku.asic.h3columnar.dggs.h3.CellArray;
import cn.edu.pku.asic.h3columnar.dggs.h3.CellArrayBuilder;
import cn.edu.pku.asic.h3columnar.dggs.h3.ContainmentMode;
import cn.edu.pku.asic.h3columnar.dggs.h3.GeometryKernels;
import cn.edu.pku.asic.h3columnar.dggs.h3.H3CellId;
import cn.edu.pku.asic.h3columnar.dggs.h3.HierarchyKernels;
import cn.edu.pku.asic.h3columnar.dggs.h3.ResolutionRange;
import com.google.common.base.Preconditions;
import com.uber.h3core.util.LatLng;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.util.IndexedSortable;
import org.apache.hadoop.util.QuickSort;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between rasters and cells. A raster is a {@code double[height][width]} array in row-major order
 * with a {@link GeoTransform} that places it on longitude/latitude. A pixel belongs to the cell that
 * contains its center.
 */
public class RasterKernels {
  private static final Log LOG = LogFactory.getLog(RasterKernels.class);

  private final KernelOptions opts;

  public RasterKernels() {
    this(new KernelOptions());
  }

  public RasterKernels(KernelOptions opts) {
    this.opts = opts;
  }

  public RasterizedCells rasterize(double[][] raster, GeoTransform transform, int resolution,
                                   ValueAggregator aggregator) {
    return rasterize(raster, transform, resolution, aggregator, Double.NaN);
  }

  /**
   * Groups the pixels of a raster by the cell that contains their centers and aggregates each group.
   * Pixels are grouped in parallel but every group is reduced in row-major pixel order so the result does
   * not depend on the number of threads.
   * @param raster the pixel values, one array per row
   * @param transform places the raster on the globe
   * @param resolution the resolution of the cells
   * @param aggregator combines the values of one cell
   * @param noData pixels with this value are skipped. NaN pixels are always skipped.
   * @return the cells in ascending order with their aggregate values
   */
  public RasterizedCells rasterize(double[][] raster, GeoTransform transform, int resolution,
                                   ValueAggregator aggregator, double noData) {
    ResolutionRange.checkResolution(resolution);
    final int height = raster.length;
    final int width = height == 0 ? 0 : raster[0].length;
    for (double[] row : raster)
      Preconditions.checkArgument(row.length == width, "All rows must have %s pixels but found %s",
          width, row.length);
    Preconditions.checkArgument((long) height * width <= Integer.MAX_VALUE,
        "A raster of %s x %s pixels is too large", width, height);
    final int numPixels = height * width;
    // Map phase: the raw cell of each pixel, 0 for skipped pixels
    final long[] pixelCells = new long[numPixels];
    Parallel.forEach(0, numPixels, 1, opts.getMinChunkSize(), (i1, i2) -> {
      for (int $i = i1; $i < i2; $i++) {
        int row = $i / width;
        int col = $i % width;
        double value = raster[row][col];
        if (isNoData(value, noData))
          continue;
        Coordinate center = transform.pixelCenter(col, row);
        pixelCells[$i] = H3CellId.fromLatLng(center.y, center.x, resolution).getRawValue();
      }
      return null;
    }, opts.getParallelism());

    int count = 0;
    for (long cell : pixelCells)
      if (cell != 0)
        count++;
    final long[] keys = new long[count];
    final int[] pixels = new int[count];
    count = 0;
    for (int $i = 0; $i < numPixels; $i++) {
      if (pixelCells[$i] != 0) {
        keys[count] = pixelCells[$i];
        pixels[count] = $i;
        count++;
      }
    }
    // Sorting on (cell, pixel) keeps the pixels of each group in row-major order
    new QuickSort().sort(new IndexedSortable() {
      @Override
      public int compare(int i, int j) {
        int diff = Long.compare(keys[i], keys[j]);
        return diff != 0 ? diff : Integer.compare(pixels[i], pixels[j]);
      }

      @Override
      public void swap(int i, int j) {
        long tk = keys[i];
        keys[i] = keys[j];
        keys[j] = tk;
        int tp = pixels[i];
        pixels[i] = pixels[j];
        pixels[j] = tp;
      }
    }, 0, count);

    // Reduce phase
    CellArrayBuilder builder = new CellArrayBuilder();
    double[] aggregates = new double[count];
    int numGroups = 0;
    double[] group = new double[16];
    int groupStart = 0;
    while (groupStart < count) {
      int groupEnd = groupStart;
      while (groupEnd < count && keys[groupEnd] == keys[groupStart])
        groupEnd++;
      int groupSize = groupEnd - groupStart;
      if (group.length < groupSize)
        group = new double[Math.max(groupSize, group.length * 2)];
      for (int $i = 0; $i < groupSize; $i++) {
        int pixel = pixels[groupStart + $i];
        group[$i] = raster[pixel / width][pixel % width];
      }
      int firstPixel = pixels[groupStart];
      Coordinate center = transform.pixelCenter(firstPixel % width, firstPixel / width);
      builder.append(H3CellId.fromLatLng(center.y, center.x, resolution));
      aggregates[numGroups++] = aggregator.aggregate(group, groupSize);
      groupStart = groupEnd;
    }
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Rasterized %d pixels of a %dx%d raster into %d cells at resolution %d",
          count, width, height, numGroups, resolution));
    return new RasterizedCells(builder.build(), Arrays.copyOf(aggregates, numGroups));
  }

  private static boolean isNoData(double value, double noData) {
    return Double.isNaN(value) || value == noData;
  }

  /**
   * Writes cell values into a raster. Each pixel gets the value of the cell that contains its center at
   * {@code resolution} or of any coarser ancestor of that cell in the input. Input cells finer than
   * {@code resolution} count as their parent at {@code resolution}.
   * @param cells the cells to write, nulls are skipped
   * @param values one value per cell
   * @param resolution the resolution at which pixel centers are looked up
   * @param transform places the raster on the globe
   * @param width number of columns of the output
   * @param height number of rows of the output
   * @param fill the value of pixels that no cell covers
   * @return the raster as {@code double[height][width]}
   * @throws AmbiguityException if two cells with different values cover the same footprint, either
   * because they are equal or because one is an ancestor of the other
   */
  public double[][] cellize(CellArray cells, double[] values, int resolution, GeoTransform transform,
                            int width, int height, double fill) {
    ResolutionRange.checkResolution(resolution);
    Preconditions.checkArgument(values.length == cells.length(),
        "Expected one value per cell but found %s values for %s cells", values.length, cells.length());
    Preconditions.checkArgument(width >= 0 && height >= 0, "Invalid raster size %sx%s", width, height);
    // Footprint key -> position of the first cell with that key
    final Map<Long, Integer> positions = new HashMap<>();
    final boolean[] usedResolutions = new boolean[resolution + 1];
    for (int $i = 0; $i < cells.length(); $i++) {
      if (cells.isNull($i))
        continue;
      H3CellId cell = cells.get($i);
      if (cell.getResolution() > resolution)
        cell = cell.getParent(resolution);
      Integer existing = positions.putIfAbsent(cell.getRawValue(), $i);
      if (existing != null && Double.compare(values[existing], values[$i]) != 0)
        throw new AmbiguityException(existing, $i, String.format("Cell %s has values %s and %s",
            cell, values[existing], values[$i]));
      usedResolutions[cell.getResolution()] = true;
    }
    // Nested cells are allowed only when they agree on the value
    for (Map.Entry<Long, Integer> entry : positions.entrySet()) {
      int position = entry.getValue();
      H3CellId cell = cells.get(position);
      if (cell.getResolution() > resolution)
        cell = cell.getParent(resolution);
      for (int r = cell.getResolution() - 1; r >= 0; r--) {
        if (!usedResolutions[r])
          continue;
        Integer ancestor = positions.get(cell.getParent(r).getRawValue());
        if (ancestor != null && Double.compare(values[ancestor], values[position]) != 0)
          throw new AmbiguityException(Math.min(ancestor, position), Math.max(ancestor, position),
              String.format("Cell %s with value %s overlaps its ancestor %s with value %s",
                  cell, values[position], cells.get(ancestor), values[ancestor]));
      }
    }

    final double[][] raster = new double[height][];
    Parallel.forEach(0, height, 1, 1, (row1, row2) -> {
      for (int row = row1; row < row2; row++) {
        double[] rowValues = new double[width];
        for (int col = 0; col < width; col++) {
          rowValues[col] = fill;
          if (positions.isEmpty())
            continue;
          Coordinate center = transform.pixelCenter(col, row);
          H3CellId cell = H3CellId.fromLatLng(center.y, center.x, resolution);
          for (int r = resolution; r >= 0; r--) {
            if (!usedResolutions[r])
              continue;
            Integer position = positions.get(r == resolution ? cell.getRawValue() : cell.getParent(r).getRawValue());
            if (position != null) {
              rowValues[col] = values[position];
              break;
            }
          }
        }
        raster[row] = rowValues;
      }
      return null;
    }, opts.getParallelism());
    return raster;
  }

  /**
   * Samples the raster at the centers of the cells that cover its extent and groups the cells by the
   * sampled value. Cells whose centers fall outside the raster or on a no-data pixel are skipped.
   * @param raster the pixel values, one array per row
   * @param transform places the raster on the globe
   * @param resolution the resolution of the sampled cells
   * @param noData the no-data value, NaN pixels are always skipped
   * @param compact whether to compact the cells of each value
   * @return a map from each value to the cells that have it
   */
  public TreeMap<Double, CellArray> sampleByCellCenters(double[][] raster, GeoTransform transform,
                                                        int resolution, double noData, boolean compact) {
    ResolutionRange.checkResolution(resolution);
    int height = raster.length;
    int width = height == 0 ? 0 : raster[0].length;
    TreeMap<Double, CellArray> result = new TreeMap<>();
    if (width == 0)
      return result;
    Envelope extent = transform.getExtent(width, height);
    Geometry extentPolygon = GeometryReader.DefaultGeometryFactory.toGeometry(extent);
    CellArray candidates = new GeometryKernels(opts).polygonToCells(extentPolygon, resolution,
        ContainmentMode.CENTER);

    Map<Double, IntArray> groups = new TreeMap<>();
    for (int $i = 0; $i < candidates.length(); $i++) {
      LatLng center = candidates.get($i).getCenter();
      int[] pixel = transform.worldToPixel(center.lng, center.lat);
      if (pixel[0] < 0 || pixel[0] >= width || pixel[1] < 0 || pixel[1] >= height)
        continue;
      double value = raster[pixel[1]][pixel[0]];
      if (isNoData(value, noData))
        continue;
      groups.computeIfAbsent(value, v -> new IntArray()).add($i);
    }
    HierarchyKernels hierarchy = new HierarchyKernels(opts);
    for (Map.Entry<Double, IntArray> group : groups.entrySet()) {
      CellArrayBuilder builder = new CellArrayBuilder(group.getValue().size());
      for (int position : group.getValue())
        builder.append(candidates.get(position));
      CellArray cellsOfValue = builder.build();
      result.put(group.getKey(), compact ? hierarchy.compact(cellsOfValue) : cellsOfValue);
    }
    LOG.debug("Sampled " + candidates.length() + " cells into " + result.size() + " values");
    return result;
  }
}
