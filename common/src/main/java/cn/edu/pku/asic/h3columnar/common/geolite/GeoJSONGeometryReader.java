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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads geometries from GeoJSON text or from a geo-interface mapping, i.e., a map with a {@code type} entry
 * and a {@code coordinates} (or {@code geometries}) entry. Features are unwrapped to their geometry and
 * feature collections become geometry collections.
 */
public class GeoJSONGeometryReader {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  protected final GeometryFactory geometryFactory;

  public GeoJSONGeometryReader() {
    this(GeometryReader.DefaultGeometryFactory);
  }

  public GeoJSONGeometryReader(GeometryFactory geometryFactory) {
    this.geometryFactory = geometryFactory;
  }

  /**
   * Parses a GeoJSON string.
   * @param json the GeoJSON text of a geometry, a feature, or a feature collection
   * @return the parsed geometry
   * @throws ParseException if the text is not valid JSON or not a valid GeoJSON geometry
   */
  public Geometry parse(String json) throws ParseException {
    if (json == null)
      throw new ParseException("Null GeoJSON input");
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ParseException("Error parsing GeoJSON: " + e.getOriginalMessage());
    }
    return readGeometry(root);
  }

  /**
   * Parses a geo-interface mapping.
   * @param geoInterface a map with the same structure as a GeoJSON object
   * @return the parsed geometry
   * @throws ParseException if the mapping does not describe a valid geometry
   */
  public Geometry parse(Map<String, ?> geoInterface) throws ParseException {
    if (geoInterface == null)
      throw new ParseException("Null geo-interface input");
    JsonNode root;
    try {
      root = MAPPER.valueToTree(geoInterface);
    } catch (IllegalArgumentException e) {
      throw new ParseException("Cannot convert geo-interface mapping: " + e.getMessage());
    }
    return readGeometry(root);
  }

  protected Geometry readGeometry(JsonNode node) throws ParseException {
    if (node == null || !node.isObject())
      throw new ParseException("Expected a GeoJSON object but found " + node);
    JsonNode typeNode = node.get("type");
    if (typeNode == null || !typeNode.isTextual())
      throw new ParseException("GeoJSON object without a 'type' field");
    String geometryType = typeNode.asText().toLowerCase();
    JsonNode coordinates = node.get("coordinates");
    switch (geometryType) {
      case "feature":
        return readGeometry(node.get("geometry"));
      case "featurecollection": {
        List<Geometry> geoms = new ArrayList<>();
        for (JsonNode feature : array(node.get("features"), "features"))
          geoms.add(readGeometry(feature.get("geometry")));
        return geometryFactory.createGeometryCollection(geoms.toArray(new Geometry[0]));
      }
      case "point":
        if (array(coordinates, "coordinates").size() == 0)
          return geometryFactory.createPoint();
        return geometryFactory.createPoint(readCoordinate(coordinates));
      case "linestring":
        return geometryFactory.createLineString(readCoordinates(coordinates));
      case "polygon":
        return readPolygon(coordinates);
      case "multipoint": {
        List<Point> points = new ArrayList<>();
        for (JsonNode c : array(coordinates, "coordinates"))
          points.add(geometryFactory.createPoint(readCoordinate(c)));
        return geometryFactory.createMultiPoint(points.toArray(new Point[0]));
      }
      case "multilinestring": {
        List<LineString> lines = new ArrayList<>();
        for (JsonNode line : array(coordinates, "coordinates"))
          lines.add(geometryFactory.createLineString(readCoordinates(line)));
        return geometryFactory.createMultiLineString(lines.toArray(new LineString[0]));
      }
      case "multipolygon": {
        List<Polygon> polygons = new ArrayList<>();
        for (JsonNode polygon : array(coordinates, "coordinates"))
          polygons.add(readPolygon(polygon));
        return geometryFactory.createMultiPolygon(polygons.toArray(new Polygon[0]));
      }
      case "geometrycollection": {
        List<Geometry> geoms = new ArrayList<>();
        for (JsonNode geom : array(node.get("geometries"), "geometries"))
          geoms.add(readGeometry(geom));
        return geometryFactory.createGeometryCollection(geoms.toArray(new Geometry[0]));
      }
      default:
        throw new ParseException(String.format("Unexpected geometry type '%s'", typeNode.asText()));
    }
  }

  private Polygon readPolygon(JsonNode rings) throws ParseException {
    List<LinearRing> parts = new ArrayList<>();
    for (JsonNode ring : array(rings, "coordinates")) {
      try {
        parts.add(geometryFactory.createLinearRing(readCoordinates(ring)));
      } catch (IllegalArgumentException e) {
        // JTS rejects rings that are not closed or have too few points
        throw new ParseException("Invalid polygon ring: " + e.getMessage());
      }
    }
    if (parts.isEmpty())
      return geometryFactory.createPolygon();
    LinearRing shell = parts.remove(0);
    return geometryFactory.createPolygon(shell, parts.toArray(new LinearRing[0]));
  }

  private Coordinate[] readCoordinates(JsonNode positions) throws ParseException {
    JsonNode array = array(positions, "coordinates");
    Coordinate[] coords = new Coordinate[array.size()];
    for (int $i = 0; $i < coords.length; $i++)
      coords[$i] = readCoordinate(array.get($i));
    return coords;
  }

  private static Coordinate readCoordinate(JsonNode position) throws ParseException {
    if (position == null || !position.isArray() || position.size() < 2)
      throw new ParseException("Expected a position with at least two numbers but found " + position);
    JsonNode x = position.get(0);
    JsonNode y = position.get(1);
    if (!x.isNumber() || !y.isNumber())
      throw new ParseException("Expected numeric value but found " + position);
    return new CoordinateXY(x.doubleValue(), y.doubleValue());
  }

  private static JsonNode array(JsonNode node, String field) throws ParseException {
    if (node == null || !node.isArray())
      throw new ParseException(String.format("Expected an array in '%s' but found %s", field, node));
    return node;
  }
}
