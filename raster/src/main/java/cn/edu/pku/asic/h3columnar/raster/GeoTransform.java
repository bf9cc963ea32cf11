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

import com.google.common.base.Preconditions;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.NoninvertibleTransformationException;

/**
 * An affine transformation from pixel space to longitude/latitude with the same six coefficients, in the
 * same order, as a GDAL geotransform:
 * <pre>
 *   x = c0 + col * c1 + row * c2
 *   y = c3 + col * c4 + row * c5
 * </pre>
 * The center of pixel (col, row) is at pixel coordinates (col + 0.5, row + 0.5).
 */
public class GeoTransform {

  private final double[] coefficients;

  private final AffineTransformation pixelToWorld;

  private final AffineTransformation worldToPixel;

  public GeoTransform(double c0, double c1, double c2, double c3, double c4, double c5) {
    this.coefficients = new double[] {c0, c1, c2, c3, c4, c5};
    this.pixelToWorld = new AffineTransformation(c1, c2, c0, c4, c5, c3);
    try {
      this.worldToPixel = pixelToWorld.getInverse();
    } catch (NoninvertibleTransformationException e) {
      throw new IllegalArgumentException("Geotransform is not invertible " + this, e);
    }
  }

  /**
   * Creates a transformation from an array of six GDAL coefficients.
   * @param gdal the coefficients in GDAL order
   * @return the transformation
   */
  public static GeoTransform fromGdal(double[] gdal) {
    Preconditions.checkArgument(gdal.length == 6, "A geotransform has 6 coefficients but %s were given",
        gdal.length);
    return new GeoTransform(gdal[0], gdal[1], gdal[2], gdal[3], gdal[4], gdal[5]);
  }

  /**
   * A north-up transformation of a raster whose top-left corner is at (west, north)
   * @param west longitude of the left edge
   * @param north latitude of the top edge
   * @param pixelWidth width of a pixel in degrees
   * @param pixelHeight height of a pixel in degrees, a positive number
   * @return the transformation
   */
  public static GeoTransform northUp(double west, double north, double pixelWidth, double pixelHeight) {
    return new GeoTransform(west, pixelWidth, 0, north, 0, -pixelHeight);
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  /**
   * The world coordinates of the center of the given pixel
   * @param col the column of the pixel
   * @param row the row of the pixel
   * @return a new coordinate with longitude as x and latitude as y
   */
  public Coordinate pixelCenter(int col, int row) {
    Coordinate c = new Coordinate(col + 0.5, row + 0.5);
    pixelToWorld.transform(c, c);
    return c;
  }

  /**
   * The pixel that contains the given world point. The result may be outside the raster.
   * @param x the longitude
   * @param y the latitude
   * @return an array of two elements (col, row)
   */
  public int[] worldToPixel(double x, double y) {
    Coordinate c = new Coordinate(x, y);
    worldToPixel.transform(c, c);
    return new int[] {(int) Math.floor(c.x), (int) Math.floor(c.y)};
  }

  /**
   * The world bounds of a raster of the given size
   */
  public Envelope getExtent(int width, int height) {
    Envelope extent = new Envelope();
    Coordinate corner = new Coordinate();
    for (int[] pixel : new int[][] {{0, 0}, {width, 0}, {0, height}, {width, height}}) {
      corner.x = pixel[0];
      corner.y = pixel[1];
      pixelToWorld.transform(corner, corner);
      extent.expandToInclude(corner);
    }
    return extent;
  }

  @Override
  public String toString() {
    return String.format("GeoTransform(%g, %g, %g, %g, %g, %g)", coefficients[0], coefficients[1],
        coefficients[2], coefficients[3], coefficients[4], coefficients[5]);
  }
}
