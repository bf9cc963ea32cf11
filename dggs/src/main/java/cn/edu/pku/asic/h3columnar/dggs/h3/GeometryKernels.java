package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.geolite.GeoJSONGeometryReader;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryReader;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryWriter;
import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.LongArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidGeometryException;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.exceptions.H3Exception;
import com.uber.h3core.util.LatLng;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.densify.Densifier;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.Puntal;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conversions between cells and geometries. Geometries use longitude as x and latitude as y, in degrees.
 * <p>
 * Footprints of cells that cross the antimeridian are returned as one polygon whose longitudes go beyond
 * 180 degrees unless splitting is requested, in which case they become a multipolygon of two parts on both
 * sides of the antimeridian.
 */
public class GeometryKernels {
    private static final Log LOG = LogFactory.getLog(GeometryKernels.class);

    /**Length of one degree of latitude in kilometers*/
    static final double KM_PER_DEGREE = 111.32;

    private final KernelOptions opts;
    private final H3Core h3;
    private final GeometryFactory factory;

    public GeometryKernels() {
        this(new KernelOptions());
    }

    public GeometryKernels(KernelOptions opts) {
        this.opts = opts;
        this.h3 = H3.getInstance().getCore();
        this.factory = GeometryReader.DefaultGeometryFactory;
    }

    /**
     * The footprint of a cell as a closed counter-clockwise ring, split at the antimeridian if configured
     * in {@link KernelOptions#SplitAntimeridian}.
     * @param cell the cell
     * @return a polygon, or a multipolygon for a split footprint
     */
    public Geometry boundary(H3CellId cell) {
        return boundary(cell, opts.isSplitAntimeridian());
    }

    public Geometry boundary(H3CellId cell, boolean splitAntimeridian) {
        Polygon footprint = footprint(cell.getRawValue());
        return splitAntimeridian ? splitAtAntimeridian(footprint) : footprint;
    }

    /**
     * The footprints of all cells, {@code null} for null positions.
     */
    public Geometry[] boundaries(CellArray cells) {
        final boolean split = opts.isSplitAntimeridian();
        final Geometry[] boundaries = new Geometry[cells.length()];
        Parallel.forEach(0, cells.length(), 1, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                if (!cells.isNull($i)) {
                    Polygon footprint = footprint(cells.values[$i]);
                    boundaries[$i] = split ? splitAtAntimeridian(footprint) : footprint;
                }
            }
            return null;
        }, opts.getParallelism());
        return boundaries;
    }

    /**
     * The footprints of all cells encoded as little endian WKB, {@code null} for null positions.
     */
    public byte[][] boundariesWkb(CellArray cells) {
        Geometry[] boundaries = boundaries(cells);
        byte[][] wkbs = new byte[boundaries.length][];
        for (int $i = 0; $i < boundaries.length; $i++) {
            if (boundaries[$i] != null)
                wkbs[$i] = GeometryWriter.DefaultInstance.write(boundaries[$i]);
        }
        return wkbs;
    }

    public Point center(H3CellId cell) {
        LatLng center = h3.cellToLatLng(cell.getRawValue());
        return factory.createPoint(new Coordinate(center.lng, center.lat));
    }

    public Point[] centers(CellArray cells) {
        final Point[] centers = new Point[cells.length()];
        Parallel.forEach(0, cells.length(), 1, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                if (!cells.isNull($i)) {
                    LatLng center = h3.cellToLatLng(cells.values[$i]);
                    centers[$i] = factory.createPoint(new Coordinate(center.lng, center.lat));
                }
            }
            return null;
        }, opts.getParallelism());
        return centers;
    }

    Polygon footprint(long raw) {
        List<LatLng> vertices = h3.cellToBoundary(raw);
        Coordinate[] coords = new Coordinate[vertices.size() + 1];
        double minLng = Double.POSITIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        for (int $i = 0; $i < vertices.size(); $i++) {
            LatLng vertex = vertices.get($i);
            coords[$i] = new Coordinate(vertex.lng, vertex.lat);
            minLng = Math.min(minLng, vertex.lng);
            maxLng = Math.max(maxLng, vertex.lng);
        }
        if (maxLng - minLng > 180) {
            // Crosses the antimeridian, keep the ring contiguous
            for (int $i = 0; $i < vertices.size(); $i++) {
                if (coords[$i].x < 0)
                    coords[$i].x += 360;
            }
        }
        coords[coords.length - 1] = new Coordinate(coords[0]);
        if (!Orientation.isCCW(coords)) {
            for (int i = 0, j = coords.length - 1; i < j; i++, j--) {
                Coordinate t = coords[i];
                coords[i] = coords[j];
                coords[j] = t;
            }
        }
        return factory.createPolygon(coords);
    }

    Geometry splitAtAntimeridian(Polygon footprint) {
        Envelope mbr = footprint.getEnvelopeInternal();
        if (mbr.getMaxX() <= 180)
            return footprint;
        Geometry west = footprint.intersection(factory.toGeometry(new Envelope(mbr.getMinX(), 180, -90, 90)));
        Geometry east = footprint.intersection(factory.toGeometry(new Envelope(180, mbr.getMaxX(), -90, 90)));
        east = AffineTransformation.translationInstance(-360, 0).transform(east);
        List<Polygon> parts = new ArrayList<>();
        for (Object part : PolygonExtracter.getPolygons(west))
            parts.add((Polygon) part);
        for (Object part : PolygonExtracter.getPolygons(east))
            parts.add((Polygon) part);
        return factory.createMultiPolygon(parts.toArray(new Polygon[0]));
    }

    /**
     * Covers a polygon or multipolygon with cells.
     * @param polygonal a {@link Polygonal} geometry, or a collection of them
     * @param resolution the resolution of the cells
     * @param mode the containment test for each cell
     * @return the covering set sorted ascending
     */
    public CellArray polygonToCells(Geometry polygonal, int resolution, ContainmentMode mode) {
        ResolutionRange.checkResolution(resolution);
        List<Polygon> polygons = new ArrayList<>();
        for (Object part : PolygonExtracter.getPolygons(polygonal)) {
            if (!((Polygon) part).isEmpty())
                polygons.add((Polygon) part);
        }
        LongArray cells = new LongArray();
        for (Polygon polygon : polygons)
            cells.append(coverPolygon(polygon, resolution, mode));
        cells.sortUnique();
        return CellArray.ofTrusted(cells.toArray());
    }

    private LongArray coverPolygon(Polygon polygon, int resolution, ContainmentMode mode) {
        LongArray centerCells = new LongArray();
        List<List<LatLng>> holes = new ArrayList<>();
        for (int $i = 0; $i < polygon.getNumInteriorRing(); $i++)
            holes.add(toLatLngs(polygon.getInteriorRingN($i)));
        centerCells.appendAll(h3.polygonToCells(toLatLngs(polygon.getExteriorRing()), holes, resolution));
        if (mode == ContainmentMode.CENTER)
            return centerCells;

        // Cells whose center is outside the polygon can still touch it along its boundary
        LongArray candidates = new LongArray();
        candidates.append(boundaryCandidates(polygon.getBoundary(), resolution));
        if (mode == ContainmentMode.FULL)
            candidates.append(centerCells);
        candidates.sortUnique();
        final long[] candidateCells = candidates.toArray();
        List<LongArray> accepted = Parallel.forEach(0, candidateCells.length, 1, opts.getMinChunkSize(), (i1, i2) -> {
            // Each range prepares its own copy as prepared geometries build their indexes lazily
            PreparedGeometry prepared = PreparedGeometryFactory.prepare(polygon);
            LongArray rangeCells = new LongArray();
            for (int $i = i1; $i < i2; $i++) {
                Polygon footprint = footprint(candidateCells[$i]);
                boolean accept = mode == ContainmentMode.OVERLAP ?
                    prepared.intersects(footprint) : prepared.covers(footprint);
                if (accept)
                    rangeCells.append(candidateCells[$i]);
            }
            return rangeCells;
        }, opts.getParallelism());
        LongArray result = mode == ContainmentMode.OVERLAP ? centerCells : new LongArray();
        for (LongArray rangeCells : accepted)
            result.append(rangeCells);
        return result;
    }

    /**
     * The cells that contain the densified points of a line together with their immediate neighbors. Every
     * cell that intersects the line is among them.
     */
    private LongArray boundaryCandidates(Geometry lines, int resolution) {
        LongArray traversed = traversedCells(lines, resolution);
        LongArray candidates = new LongArray();
        for (int $i = 0; $i < traversed.size(); $i++)
            candidates.appendAll(h3.gridDisk(traversed.get($i), 1));
        return candidates;
    }

    /**
     * The cells that contain the vertices of the given line after densifying it to a quarter of the cell
     * edge length.
     */
    private LongArray traversedCells(Geometry lines, int resolution) {
        double edgeDegrees = h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.km) / KM_PER_DEGREE;
        Geometry densified = Densifier.densify(lines, edgeDegrees / 4);
        LongArray cells = new LongArray();
        for (Coordinate c : densified.getCoordinates())
            cells.append(h3.latLngToCell(c.y, c.x, resolution));
        cells.sortUnique();
        return cells;
    }

    private static List<LatLng> toLatLngs(LineString ring) {
        Coordinate[] coords = ring.getCoordinates();
        int numPoints = coords.length;
        // The library closes the ring by itself
        if (numPoints > 1 && coords[0].equals2D(coords[numPoints - 1]))
            numPoints--;
        List<LatLng> latLngs = new ArrayList<>(numPoints);
        for (int $i = 0; $i < numPoints; $i++)
            latLngs.add(new LatLng(coords[$i].y, coords[$i].x));
        return latLngs;
    }

    /**
     * One cell per point. Null, empty and out of domain points produce nulls.
     * @param points the points, longitude as x
     * @param resolution the resolution of the cells
     * @return one cell per input position
     */
    public CellArray pointsToCells(Point[] points, int resolution) {
        ResolutionRange.checkResolution(resolution);
        final int n = points.length;
        final long[] out = new long[n];
        final BitArray validity = new BitArray(n);
        Parallel.forEach(0, n, BitArray.BitsPerEntry, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                Point point = points[$i];
                if (point == null || point.isEmpty())
                    continue;
                try {
                    out[$i] = h3.latLngToCell(point.getY(), point.getX(), resolution);
                    validity.set($i, true);
                } catch (H3Exception e) {
                    // Non-finite coordinates
                    out[$i] = H3CellId.H3_NULL;
                }
            }
            return null;
        }, opts.getParallelism());
        return new CellArray(out, validity);
    }

    /**
     * Converts any geometry to cells. Points and lines are converted to the cells that contain them
     * regardless of the containment mode while polygons are covered according to the mode.
     * @param geometry the geometry
     * @param resolution the resolution of the cells
     * @param mode the containment test for polygons
     * @return the cells sorted ascending
     */
    public CellArray geometryToCells(Geometry geometry, int resolution, ContainmentMode mode) {
        ResolutionRange.checkResolution(resolution);
        LongArray cells = new LongArray();
        collectCells(geometry, resolution, mode, cells);
        cells.sortUnique();
        return CellArray.ofTrusted(cells.toArray());
    }

    private void collectCells(Geometry geometry, int resolution, ContainmentMode mode, LongArray cells) {
        if (geometry.isEmpty())
            return;
        if (geometry instanceof Puntal) {
            for (Coordinate c : geometry.getCoordinates())
                cells.append(h3.latLngToCell(c.y, c.x, resolution));
        } else if (geometry instanceof Lineal) {
            cells.append(traversedCells(geometry, resolution));
        } else if (geometry instanceof Polygonal) {
            CellArray covered = polygonToCells(geometry, resolution, mode);
            cells.append(covered.values, 0, covered.length());
        } else if (geometry instanceof GeometryCollection) {
            for (int $i = 0; $i < geometry.getNumGeometries(); $i++)
                collectCells(geometry.getGeometryN($i), resolution, mode, cells);
        } else {
            throw new IllegalArgumentException("Unsupported geometry type " + geometry.getGeometryType());
        }
    }

    /**
     * Converts WKB geometries to lists of cells, one list per input.
     * @param wkbs the WKB of each geometry, {@code null} for a missing geometry
     * @param resolution the resolution of the cells
     * @param mode the containment test for polygons
     * @param compact whether to compact the cells of each geometry
     * @param policy what to do with geometries that cannot be parsed
     * @return one list per input position, sorted ascending
     * @throws InvalidGeometryException under {@link IngestPolicy#REJECT} for the first malformed geometry
     */
    public CellListArray wkbToCells(byte[][] wkbs, int resolution, ContainmentMode mode, boolean compact,
                                    IngestPolicy policy) throws InvalidGeometryException {
        Geometry[] geometries = new Geometry[wkbs.length];
        for (int $i = 0; $i < wkbs.length; $i++) {
            if (wkbs[$i] == null)
                continue;
            try {
                geometries[$i] = checkFinite(GeometryReader.DefaultInstance.parse(wkbs[$i]));
            } catch (ParseException e) {
                geometries[$i] = handleInvalid(e, $i, policy);
            }
        }
        return geometriesToCells(geometries, resolution, mode, compact);
    }

    /**
     * Same as {@link #wkbToCells} for GeoJSON text.
     */
    public CellListArray geoJsonToCells(String[] jsons, int resolution, ContainmentMode mode, boolean compact,
                                        IngestPolicy policy) throws InvalidGeometryException {
        GeoJSONGeometryReader reader = new GeoJSONGeometryReader(factory);
        Geometry[] geometries = new Geometry[jsons.length];
        for (int $i = 0; $i < jsons.length; $i++) {
            if (jsons[$i] == null)
                continue;
            try {
                geometries[$i] = checkFinite(reader.parse(jsons[$i]));
            } catch (ParseException e) {
                geometries[$i] = handleInvalid(e, $i, policy);
            }
        }
        return geometriesToCells(geometries, resolution, mode, compact);
    }

    /**
     * Same as {@link #wkbToCells} for geo-interface mappings, i.e., maps that have the structure of GeoJSON.
     */
    public CellListArray geoInterfaceToCells(List<? extends Map<String, ?>> mappings, int resolution,
                                             ContainmentMode mode, boolean compact, IngestPolicy policy)
        throws InvalidGeometryException {
        GeoJSONGeometryReader reader = new GeoJSONGeometryReader(factory);
        Geometry[] geometries = new Geometry[mappings.size()];
        for (int $i = 0; $i < geometries.length; $i++) {
            if (mappings.get($i) == null)
                continue;
            try {
                geometries[$i] = checkFinite(reader.parse(mappings.get($i)));
            } catch (ParseException e) {
                geometries[$i] = handleInvalid(e, $i, policy);
            }
        }
        return geometriesToCells(geometries, resolution, mode, compact);
    }

    /**
     * Rejects geometries with infinite or NaN coordinates which the H3 library cannot index.
     */
    private static Geometry checkFinite(Geometry geometry) throws ParseException {
        for (Coordinate c : geometry.getCoordinates()) {
            if (!Double.isFinite(c.x) || !Double.isFinite(c.y))
                throw new ParseException("Non-finite coordinate " + c + " in " + geometry.getGeometryType());
        }
        return geometry;
    }

    private static Geometry handleInvalid(ParseException e, int position, IngestPolicy policy)
        throws InvalidGeometryException {
        if (policy == IngestPolicy.REJECT)
            throw new InvalidGeometryException("Cannot parse geometry: " + e.getMessage(), position, e);
        LOG.warn("Replacing geometry at position " + position + " with null: " + e.getMessage());
        return null;
    }

    /**
     * Converts each geometry to its cells. Geometries are expensive so every geometry may go to its own range.
     * @throws IllegalArgumentException if a geometry has coordinates the H3 library cannot index
     */
    public CellListArray geometriesToCells(Geometry[] geometries, int resolution, ContainmentMode mode,
                                           boolean compact) {
        ResolutionRange.checkResolution(resolution);
        final HierarchyKernels hierarchy = compact ? new HierarchyKernels(opts) : null;
        List<CellListArray.Chunk> chunks = Parallel.forEach(0, geometries.length, 1, 1, (i1, i2) -> {
            CellListArray.Chunk chunk = new CellListArray.Chunk();
            for (int $i = i1; $i < i2; $i++) {
                if (geometries[$i] == null) {
                    chunk.lengths.add(-1);
                    continue;
                }
                CellArray cells;
                try {
                    cells = geometryToCells(geometries[$i], resolution, mode);
                } catch (H3Exception e) {
                    throw new IllegalArgumentException("Cannot convert geometry at position " + $i
                        + " to cells: " + e.getMessage(), e);
                }
                if (hierarchy != null)
                    cells = hierarchy.compact(cells);
                chunk.values.append(cells.values, 0, cells.length());
                chunk.lengths.add(cells.length());
            }
            return chunk;
        }, opts.getParallelism());
        return CellListArray.assemble(geometries.length, chunks);
    }

    /**
     * The union of the footprints of all cells, an outline of the covered area.
     * @param cells the cells, nulls are ignored
     * @return a polygonal geometry, empty if there are no cells
     */
    public Geometry cellsToMultiPolygon(CellArray cells) {
        List<Geometry> footprints = new ArrayList<>();
        for (int $i = 0; $i < cells.length(); $i++) {
            if (!cells.isNull($i))
                footprints.add(footprint(cells.values[$i]));
        }
        if (footprints.isEmpty())
            return factory.createMultiPolygon();
        Geometry union = UnaryUnionOp.union(footprints);
        if (LOG.isDebugEnabled())
            LOG.debug("Merged " + footprints.size() + " footprints into " + union.getNumGeometries() + " polygons");
        return union;
    }
}
