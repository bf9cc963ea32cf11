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
package cn.edu.pku.asic.h3columnar.common.geolite;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.impl.CoordinateArraySequenceFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;

/**
 * Reads geometries from their WKB representation. Both byte orders and the extended (EWKB) SRID flag are
 * accepted. Coordinates are interpreted as (longitude, latitude) in degrees.
 */
public class GeometryReader {

  public static final GeometryFactory DefaultGeometryFactory = new GeometryFactory(
      new PrecisionModel(PrecisionModel.FLOATING), 4326, CoordinateArraySequenceFactory.instance());

  /**A shared instance that creates geometries with the default factory*/
  public static final GeometryReader DefaultInstance = new GeometryReader(DefaultGeometryFactory);

  /**The geometry factory used to create all geometries*/
  protected final GeometryFactory geometryFactory;

  /**JTS readers keep parsing state, so each thread gets its own*/
  private final ThreadLocal<WKBReader> wkbReader;

  public GeometryReader(GeometryFactory geometryFactory) {
    this.geometryFactory = geometryFactory;
    this.wkbReader = ThreadLocal.withInitial(() -> new WKBReader(this.geometryFactory));
  }

  public GeometryFactory getGeometryFactory() {
    return this.geometryFactory;
  }

  /**
   * Parses the given WKB and returns a new geometry.
   * @param wkb the WKB bytes
   * @return the parsed geometry
   * @throws ParseException if the bytes are not a well-formed WKB geometry
   */
  public Geometry parse(byte[] wkb) throws ParseException {
    if (wkb == null || wkb.length == 0)
      throw new ParseException("Empty WKB input");
    try {
      return wkbReader.get().read(wkb);
    } catch (RuntimeException e) {
      // Truncated buffers surface as index errors inside the reader
      throw new ParseException("Malformed WKB of " + wkb.length + " bytes: " + e);
    }
  }
}
