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
package cn.edu.pku.asic.h3columnar.indexing;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryReader;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import cn.edu.pku.asic.h3columnar.dggs.core.StaleIndexException;
import cn.edu.pku.asic.h3columnar.dggs.h3.CellArray;
import cn.edu.pku.asic.h3columnar.dggs.h3.GeometryKernels;
import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * An R-tree over the footprints of the cells of one {@link CellArray}. The index refers to cells by their
 * position in the array and keeps the generation of the array it was built from. Queries that pass an
 * array check that it is the same snapshot.
 * <p>
 * Footprints are not split at the antimeridian so a footprint that crosses it has longitudes beyond 180.
 * Envelope queries also look for such footprints at longitudes shifted by 360 degrees. Nearest neighbor
 * distances are planar distances in degrees.
 */
public class CellSpatialIndex {
  private static final Log LOG = LogFactory.getLog(CellSpatialIndex.class);

  /**Generation of the indexed array*/
  private final long generation;

  /**Length of the indexed array*/
  private final int length;

  /**The footprint of each non-null cell, in entry order*/
  private final Geometry[] footprints;

  /**The array position of each entry in the tree*/
  private final int[] positions;

  /**Whether any footprint crosses the antimeridian*/
  private final boolean hasWrappedFootprints;

  private final RTreeGuttman rtree;

  private CellSpatialIndex(long generation, int length, Geometry[] footprints, int[] positions,
                           RTreeGuttman rtree) {
    this.generation = generation;
    this.length = length;
    this.footprints = footprints;
    this.positions = positions;
    this.rtree = rtree;
    boolean wrapped = false;
    for (Geometry footprint : footprints)
      wrapped |= footprint.getEnvelopeInternal().getMaxX() > 180.0;
    this.hasWrappedFootprints = wrapped;
  }

  public static CellSpatialIndex build(CellArray cells) {
    return build(cells, new KernelOptions());
  }

  /**
   * Builds an index over the footprints of all non-null cells.
   * @param cells the cells to index
   * @param opts the R-tree capacities and the parallelism used to compute the footprints
   * @return the index
   */
  public static CellSpatialIndex build(CellArray cells, KernelOptions opts) {
    KernelOptions footprintOpts = new KernelOptions(opts);
    footprintOpts.setBoolean(KernelOptions.SplitAntimeridian, false);
    Geometry[] boundaries = new GeometryKernels(footprintOpts).boundaries(cells);

    int numEntries = cells.length() - cells.getNullCount();
    Geometry[] footprints = new Geometry[numEntries];
    int[] positions = new int[numEntries];
    double[] x1 = new double[numEntries];
    double[] y1 = new double[numEntries];
    double[] x2 = new double[numEntries];
    double[] y2 = new double[numEntries];
    int iEntry = 0;
    for (int $i = 0; $i < boundaries.length; $i++) {
      if (boundaries[$i] == null)
        continue;
      Envelope mbr = boundaries[$i].getEnvelopeInternal();
      footprints[iEntry] = boundaries[$i];
      positions[iEntry] = $i;
      x1[iEntry] = mbr.getMinX();
      y1[iEntry] = mbr.getMinY();
      x2[iEntry] = mbr.getMaxX();
      y2[iEntry] = mbr.getMaxY();
      iEntry++;
    }
    RTreeGuttman rtree = new RTreeGuttman(opts.getInt(KernelOptions.RTreeMinCapacity, 8),
        opts.getInt(KernelOptions.RTreeMaxCapacity, 20));
    rtree.initializeFromRects(x1, y1, x2, y2);
    LOG.info(String.format("Indexed %d cells out of %d in an R-tree with %d nodes", numEntries,
        cells.length(), rtree.numOfNodes()));
    return new CellSpatialIndex(cells.getGeneration(), cells.length(), footprints, positions, rtree);
  }

  public long getGeneration() {
    return generation;
  }

  /**
   * Number of non-null cells in the index
   */
  public int size() {
    return footprints.length;
  }

  /**
   * Length of the indexed array including null positions
   */
  public int getArrayLength() {
    return length;
  }

  /**
   * Throws {@link StaleIndexException} if the given array is not the snapshot this index was built from.
   * @param cells the array the caller is about to resolve positions against
   */
  public void checkGeneration(CellArray cells) {
    if (cells.getGeneration() != generation)
      throw new StaleIndexException(generation, cells.getGeneration());
  }

  /**
   * Finds the cells whose footprint bounding boxes overlap or touch the given envelope.
   * @param envelope the query envelope in degrees
   * @return array positions in ascending order
   */
  public int[] queryEnvelope(Envelope envelope) {
    IntArray entries = new IntArray();
    IntArray results = new IntArray();
    if (envelope.isNull())
      return new int[0];
    rtree.search(new double[] {envelope.getMinX(), envelope.getMinY()},
        new double[] {envelope.getMaxX(), envelope.getMaxY()}, entries);
    for (int entry : entries)
      results.add(positions[entry]);
    if (hasWrappedFootprints) {
      rtree.search(new double[] {envelope.getMinX() + 360, envelope.getMinY()},
          new double[] {envelope.getMaxX() + 360, envelope.getMaxY()}, entries);
      for (int entry : entries)
        results.add(positions[entry]);
    }
    int[] sorted = results.toArray();
    Arrays.sort(sorted);
    return Arrays.stream(sorted).distinct().toArray();
  }

  public int[] queryEnvelope(CellArray cells, Envelope envelope) {
    checkGeneration(cells);
    return queryEnvelope(envelope);
  }

  /**
   * Finds the k cells nearest to a point. Distances are measured to the footprint, zero when the point
   * is inside it. Cells at the same distance are ordered by position.
   * @param point the query point as (longitude, latitude)
   * @param k the maximum number of cells to return
   * @return array positions ordered by (distance, position)
   */
  public int[] nearest(Coordinate point, int k) {
    Preconditions.checkArgument(k >= 0, "k must be non-negative but was %s", k);
    final Point queryPoint = GeometryReader.DefaultGeometryFactory.createPoint(point);
    IntArray entries = new IntArray();
    // Entries follow array order so ordering by entry ID also orders by position
    rtree.nearest(new double[] {point.x, point.y}, k, iEntry -> footprints[iEntry].distance(queryPoint), entries);
    if (hasWrappedFootprints && point.x < 0) {
      // Footprints crossing the antimeridian are stored with longitudes above 180
      final Point shiftedPoint = GeometryReader.DefaultGeometryFactory.createPoint(
          new Coordinate(point.x + 360, point.y));
      IntArray shiftedEntries = new IntArray();
      rtree.nearest(new double[] {shiftedPoint.getX(), shiftedPoint.getY()}, k,
          iEntry -> footprints[iEntry].distance(shiftedPoint), shiftedEntries);
      int[] candidates = IntStream.concat(Arrays.stream(entries.toArray()), Arrays.stream(shiftedEntries.toArray()))
          .distinct().toArray();
      double[] distances = new double[candidates.length];
      for (int $i = 0; $i < candidates.length; $i++) {
        Geometry footprint = footprints[candidates[$i]];
        distances[$i] = Math.min(footprint.distance(queryPoint), footprint.distance(shiftedPoint));
      }
      Integer[] order = new Integer[candidates.length];
      for (int $i = 0; $i < order.length; $i++)
        order[$i] = $i;
      Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> distances[i]).thenComparingInt(i -> candidates[i]));
      entries.clear();
      for (int $i = 0; $i < Math.min(k, order.length); $i++)
        entries.add(candidates[order[$i]]);
    }
    int[] results = new int[entries.size()];
    for (int $i = 0; $i < results.length; $i++)
      results[$i] = positions[entries.get($i)];
    return results;
  }

  public int[] nearest(CellArray cells, Coordinate point, int k) {
    checkGeneration(cells);
    return nearest(point, k);
  }
}
