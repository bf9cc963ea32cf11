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
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.WKBWriter;

/**
 * Converts geometries to WKB format. Geometries are written as two-dimensional little endian WKB
 * which is what most columnar geometry encodings expect.
 */
public class GeometryWriter {

  /**A shared instance used by the kernels that export boundaries*/
  public static final GeometryWriter DefaultInstance = new GeometryWriter(false);

  private final boolean includeSRID;

  private final ThreadLocal<WKBWriter> wkbWriter;

  public GeometryWriter(boolean includeSRID) {
    this.includeSRID = includeSRID;
    this.wkbWriter = ThreadLocal.withInitial(() -> new WKBWriter(2, ByteOrderValues.LITTLE_ENDIAN, this.includeSRID));
  }

  public byte[] write(Geometry geometry) {
    return wkbWriter.get().write(geometry);
  }
}
