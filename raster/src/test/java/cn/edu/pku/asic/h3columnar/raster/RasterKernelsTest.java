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
import cn.edu.pku.asic.h3columnar.dggs.core.AmbiguityException;
import cn.edu.pku.asic.h3columnar.dggs.core.Feature;
import cn.edu.pku.asic.h3columnar.dggs.core.Features;
import cn.edu.pku.asic.h3columnar.dggs.core.ResolutionRangeException;
import cn.edu.pku.asic.h3columnar.dggs.h3.CellArray;
import cn.edu.pku.asic.h3columnar.dggs.h3.H3CellId;
import com.uber.h3core.util.LatLng;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterKernelsTest {

  private final RasterKernels kernels = new RasterKernels();

  /**A 3x3 raster with 0.001 degree pixels centered at the given point*/
  private static GeoTransform smallRasterAround(LatLng center) {
    return GeoTransform.northUp(center.lng - 0.0015, center.lat + 0.0015, 0.001, 0.001);
  }

  @Test
  void constantRasterKeepsItsValue() {
    double[][] raster = {{1.0, 1.0}, {1.0, 1.0}};
    GeoTransform transform = GeoTransform.northUp(-122.42, 37.78, 0.01, 0.01);
    RasterizedCells result = kernels.rasterize(raster, transform, 5, Aggregations.MEAN);
    assertThat(result.size()).isPositive();
    for (Map.Entry<H3CellId, Double> entry : result.asMap().entrySet()) {
      assertThat(entry.getKey().getResolution()).isEqualTo(5);
      assertThat(entry.getValue()).isEqualTo(1.0);
    }
  }

  @Test
  void resultDoesNotDependOnParallelism() {
    Random random = new Random(7);
    double[][] raster = new double[60][80];
    for (double[] row : raster)
      for (int $i = 0; $i < row.length; $i++)
        row[$i] = random.nextInt(5);
    GeoTransform transform = GeoTransform.northUp(10.0, 50.0, 0.01, 0.01);

    RasterKernels sequential = new RasterKernels(KernelOptions.sequential());
    RasterKernels parallel = new RasterKernels(new KernelOptions().setParallelism(8).setMinChunkSize(1));
    for (Aggregations aggregation : new Aggregations[] {Aggregations.SUM, Aggregations.MODE, Aggregations.FIRST}) {
      RasterizedCells expected = sequential.rasterize(raster, transform, 7, aggregation);
      RasterizedCells actual = parallel.rasterize(raster, transform, 7, aggregation);
      assertThat(actual.getCells()).isEqualTo(expected.getCells());
      assertThat(actual.getValues()).containsExactly(expected.getValues());
    }
  }

  @Test
  void cellsAreSortedAndCountAllPixels() {
    double[][] raster = new double[20][20];
    GeoTransform transform = GeoTransform.northUp(2.0, 48.0, 0.005, 0.005);
    RasterizedCells result = kernels.rasterize(raster, transform, 6, Aggregations.COUNT);
    long[] cells = result.getCells().toRawArray();
    for (int $i = 1; $i < cells.length; $i++)
      assertThat(cells[$i]).isGreaterThan(cells[$i - 1]);
    double total = 0;
    for (double count : result.getValues())
      total += count;
    assertThat(total).isEqualTo(400.0);
  }

  @Test
  void skipsNoDataAndNaN() {
    double[][] raster = {{Double.NaN, -9999}, {-9999, Double.NaN}};
    GeoTransform transform = GeoTransform.northUp(2.0, 48.0, 0.01, 0.01);
    assertThat(kernels.rasterize(raster, transform, 5, Aggregations.SUM, -9999).size()).isZero();
  }

  @Test
  void skippedPixelsDoNotAffectTheirNeighbors() {
    double[][] raster = new double[30][30];
    for (int row = 0; row < 30; row++)
      for (int col = 0; col < 30; col++)
        raster[row][col] = (row + col) % 3 == 0 ? Double.NaN : row * 30 + col;
    GeoTransform transform = GeoTransform.northUp(-3.7, 40.4, 0.01, 0.01);
    Map<H3CellId, Double> expected = new HashMap<>();
    for (int row = 0; row < 30; row++) {
      for (int col = 0; col < 30; col++) {
        if (Double.isNaN(raster[row][col]))
          continue;
        Coordinate center = transform.pixelCenter(col, row);
        expected.merge(H3CellId.fromLatLng(center.y, center.x, 7), raster[row][col], Double::sum);
      }
    }
    RasterizedCells result = kernels.rasterize(raster, transform, 7, Aggregations.SUM);
    assertThat(result.asMap()).isEqualTo(expected);
  }

  @Test
  void rejectsRastersWithTooManyPixels() {
    // Rows share one array so only the pixel count is large
    double[] row = new double[1 << 16];
    double[][] raster = new double[1 << 16][];
    Arrays.fill(raster, row);
    GeoTransform transform = GeoTransform.northUp(0, 0, 0.001, 0.001);
    assertThatThrownBy(() -> kernels.rasterize(raster, transform, 5, Aggregations.SUM))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("too large");
  }

  @Test
  void rejectsBadResolution() {
    double[][] raster = {{1.0}};
    GeoTransform transform = GeoTransform.northUp(0, 0, 1, 1);
    assertThatThrownBy(() -> kernels.rasterize(raster, transform, 16, Aggregations.SUM))
        .isInstanceOf(ResolutionRangeException.class);
  }

  @Test
  void cellizeStampsTheCellValue() {
    H3CellId cell = H3CellId.fromLatLng(37.775, -122.418, 5);
    GeoTransform transform = smallRasterAround(cell.getCenter());
    double[][] raster = kernels.cellize(CellArray.of(cell), new double[] {7.0}, 5, transform, 3, 3, -1);
    for (double[] row : raster)
      assertThat(row).containsOnly(7.0);

    H3CellId elsewhere = H3CellId.fromLatLng(-33.86, 151.21, 5);
    raster = kernels.cellize(CellArray.of(elsewhere), new double[] {7.0}, 5, transform, 3, 3, -1);
    for (double[] row : raster)
      assertThat(row).containsOnly(-1.0);
  }

  @Test
  void cellizeUsesCoarserAncestorsAndParentsOfFinerCells() {
    H3CellId cell = H3CellId.fromLatLng(37.775, -122.418, 5);
    GeoTransform transform = smallRasterAround(cell.getCenter());
    double[][] raster = kernels.cellize(CellArray.of(cell.getParent(3)), new double[] {2.0}, 5, transform, 3, 3, 0);
    for (double[] row : raster)
      assertThat(row).containsOnly(2.0);

    raster = kernels.cellize(CellArray.of(cell.getCenterChild(8)), new double[] {4.0}, 5, transform, 3, 3, 0);
    for (double[] row : raster)
      assertThat(row).containsOnly(4.0);
  }

  @Test
  void cellizeReportsConflictingValues() {
    H3CellId cell = H3CellId.fromLatLng(37.775, -122.418, 5);
    GeoTransform transform = smallRasterAround(cell.getCenter());
    CellArray duplicates = CellArray.of(cell, cell);
    assertThatThrownBy(() -> kernels.cellize(duplicates, new double[] {1, 2}, 5, transform, 3, 3, 0))
        .isInstanceOfSatisfying(AmbiguityException.class, e -> {
          assertThat(e.getFirstPosition()).isEqualTo(0);
          assertThat(e.getSecondPosition()).isEqualTo(1);
        });

    CellArray nested = CellArray.of(cell, null, cell.getParent(2));
    assertThatThrownBy(() -> kernels.cellize(nested, new double[] {1, 0, 2}, 5, transform, 3, 3, 0))
        .isInstanceOf(AmbiguityException.class);

    // Agreeing values are not a conflict
    double[][] raster = kernels.cellize(nested, new double[] {3, 0, 3}, 5, transform, 3, 3, 0);
    assertThat(raster[1]).containsOnly(3.0);
  }

  @Test
  void samplesCellCentersByValue() {
    double[][] raster = new double[20][20];
    for (int row = 0; row < 20; row++)
      for (int col = 0; col < 20; col++)
        raster[row][col] = col < 10 ? 1.0 : 2.0;
    GeoTransform transform = GeoTransform.northUp(2.0, 48.2, 0.01, 0.01);
    TreeMap<Double, CellArray> sampled = kernels.sampleByCellCenters(raster, transform, 7, Double.NaN, false);
    assertThat(sampled.keySet()).containsExactly(1.0, 2.0);
    for (CellArray cells : sampled.values())
      assertThat(cells.length()).isPositive();

    TreeMap<Double, CellArray> compacted = kernels.sampleByCellCenters(raster, transform, 7, Double.NaN, true);
    assertThat(compacted.get(1.0).length()).isLessThanOrEqualTo(sampled.get(1.0).length());
  }

  @Test
  void rasterFeatureIsAvailable() {
    assertThat(Features.isAvailable(Feature.RASTER)).isTrue();
  }
}
