package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryReader;
import cn.edu.pku.asic.h3columnar.common.geolite.GeometryWriter;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidGeometryException;
import com.uber.h3core.H3Core;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static cn.edu.pku.asic.h3columnar.dggs.h3.HierarchyKernelsTest.ingest;
import static cn.edu.pku.asic.h3columnar.dggs.h3.HierarchyKernelsTest.toSet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class GeometryKernelsTest {

    static final long SF_RES5 = H3CellIdTest.SF_RES5;

    private final H3Core h3 = H3.getInstance().getCore();
    private final GeometryFactory factory = GeometryReader.DefaultGeometryFactory;
    private final GeometryKernels kernels = new GeometryKernels();

    @Test
    void boundaryIsAClosedCounterClockwiseRing() throws InvalidCellException {
        H3CellId cell = H3CellId.validate(SF_RES5);
        Polygon boundary = (Polygon) kernels.boundary(cell, false);
        Coordinate[] ring = boundary.getExteriorRing().getCoordinates();
        assertThat(ring).hasSize(7);
        assertThat(ring[0]).isEqualTo(ring[6]);
        assertThat(Orientation.isCCW(ring)).isTrue();
        assertThat(boundary.contains(kernels.center(cell))).isTrue();
    }

    @Test
    void splitsFootprintsAtTheAntimeridian() {
        Polygon whole = null;
        for (long cell : h3.gridDisk(h3.latLngToCell(0, 180, 2), 1)) {
            Polygon footprint = kernels.footprint(cell);
            if (whole == null && footprint.getEnvelopeInternal().getMaxX() > 180)
                whole = footprint;
        }
        assertThat(whole).isNotNull();
        Geometry split = kernels.splitAtAntimeridian(whole);
        assertThat(whole.getEnvelopeInternal().getMaxX()).isGreaterThan(180);
        assertThat(split).isInstanceOf(MultiPolygon.class);
        assertThat(split.getNumGeometries()).isEqualTo(2);
        assertThat(split.getEnvelopeInternal().getMaxX()).isLessThanOrEqualTo(180);
        assertThat(split.getArea()).isCloseTo(whole.getArea(), offset(1e-9));
    }

    @Test
    void boundariesPropagateNulls() {
        CellArray cells = ingest(new Long[] {null, SF_RES5});
        Geometry[] boundaries = kernels.boundaries(cells);
        assertThat(boundaries[0]).isNull();
        assertThat(boundaries[1]).isInstanceOf(Polygon.class);
        byte[][] wkbs = kernels.boundariesWkb(cells);
        assertThat(wkbs[0]).isNull();
        assertThat(wkbs[1]).isEqualTo(GeometryWriter.DefaultInstance.write(boundaries[1]));
        Point[] centers = kernels.centers(cells);
        assertThat(centers[0]).isNull();
        assertThat(boundaries[1].contains(centers[1])).isTrue();
    }

    @Test
    void squareAroundACellCenterIsCovered() {
        long cell = h3.latLngToCell(40.7, -74.0, 9);
        Point center = kernels.center(new H3CellId(cell));
        Polygon square = square(center.getX(), center.getY(), 0.005);
        CellArray covered = kernels.polygonToCells(square, 9, ContainmentMode.CENTER);
        assertThat(covered.length()).isPositive();
        assertThat(covered.toRawArray()).contains(cell);
        assertThat(kernels.cellsToMultiPolygon(covered).covers(square.getCentroid())).isTrue();
    }

    @Test
    void containmentModesAreNested() {
        Polygon polygon = factory.createPolygon(new Coordinate[] {
            new Coordinate(-122.5, 37.7), new Coordinate(-122.35, 37.7), new Coordinate(-122.3, 37.82),
            new Coordinate(-122.45, 37.85), new Coordinate(-122.5, 37.7)});
        Set<Long> center = toSet(kernels.polygonToCells(polygon, 8, ContainmentMode.CENTER));
        Set<Long> overlap = toSet(kernels.polygonToCells(polygon, 8, ContainmentMode.OVERLAP));
        Set<Long> full = toSet(kernels.polygonToCells(polygon, 8, ContainmentMode.FULL));
        assertThat(overlap).containsAll(center).containsAll(full);
        assertThat(overlap.size()).isGreaterThan(center.size());
        assertThat(center.size()).isGreaterThan(full.size());
        for (long cell : full)
            assertThat(polygon.covers(kernels.footprint(cell))).isTrue();
        for (long cell : overlap)
            assertThat(polygon.intersects(kernels.footprint(cell))).isTrue();
    }

    @Test
    void coversMultiPolygonsWithHoles() throws ParseException {
        Geometry donut = new WKTReader(factory).read(
            "MULTIPOLYGON (((10 10, 11 10, 11 11, 10 11, 10 10), (10.3 10.3, 10.7 10.3, 10.7 10.7, 10.3 10.7, 10.3 10.3)),"
                + " ((20 20, 20.5 20, 20.5 20.5, 20 20)))");
        CellArray cells = kernels.polygonToCells(donut, 6, ContainmentMode.CENTER);
        Point[] centers = kernels.centers(cells);
        for (Point center : centers)
            assertThat(donut.contains(center)).isTrue();
        assertThat(cells.toRawArray()).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void pointsToCellsKeepsPositions() {
        Point[] points = {
            factory.createPoint(new Coordinate(-122.4, 37.8)),
            null,
            factory.createPoint(),
            factory.createPoint(new Coordinate(Double.NaN, 10))};
        CellArray cells = kernels.pointsToCells(points, 5);
        assertThat(cells.length()).isEqualTo(4);
        assertThat(cells.getRaw(0)).isEqualTo(h3.latLngToCell(37.8, -122.4, 5));
        assertThat(cells.isNull(1)).isTrue();
        assertThat(cells.isNull(2)).isTrue();
        assertThat(cells.isNull(3)).isTrue();
    }

    @Test
    void wkbInputFollowsTheIngestPolicy() throws InvalidGeometryException {
        byte[] point = GeometryWriter.DefaultInstance.write(factory.createPoint(new Coordinate(13.4, 52.5)));
        byte[] line = GeometryWriter.DefaultInstance.write(factory.createLineString(new Coordinate[] {
            new Coordinate(13.0, 52.0), new Coordinate(13.5, 52.5)}));
        byte[][] wkbs = {point, null, {1, 2, 3}, line};
        assertThatThrownBy(() -> kernels.wkbToCells(wkbs, 7, ContainmentMode.CENTER, false, IngestPolicy.REJECT))
            .isInstanceOf(InvalidGeometryException.class)
            .hasMessageContaining("position 2");
        CellListArray lists = kernels.wkbToCells(wkbs, 7, ContainmentMode.CENTER, false, IngestPolicy.NULL_OUT);
        assertThat(lists.getListLength(0)).isEqualTo(1);
        assertThat(lists.isNull(1)).isTrue();
        assertThat(lists.isNull(2)).isTrue();
        assertThat(lists.getListLength(3)).isGreaterThan(10);
    }

    @Test
    void nonFiniteCoordinatesFollowTheIngestPolicy() throws InvalidGeometryException {
        byte[] point = GeometryWriter.DefaultInstance.write(factory.createPoint(new Coordinate(10, 10)));
        byte[] infinite = GeometryWriter.DefaultInstance.write(factory.createMultiPointFromCoords(new Coordinate[] {
            new Coordinate(Double.POSITIVE_INFINITY, 10), new Coordinate(1, 1)}));
        byte[][] wkbs = {point, infinite};
        assertThatThrownBy(() -> kernels.wkbToCells(wkbs, 5, ContainmentMode.CENTER, false, IngestPolicy.REJECT))
            .isInstanceOfSatisfying(InvalidGeometryException.class, e -> assertThat(e.getPosition()).isEqualTo(1));
        CellListArray lists = kernels.wkbToCells(wkbs, 5, ContainmentMode.CENTER, false, IngestPolicy.NULL_OUT);
        assertThat(lists.getList(0).getRaw(0)).isEqualTo(h3.latLngToCell(10, 10, 5));
        assertThat(lists.isNull(1)).isTrue();

        Map<String, Object> nanMapping = new HashMap<>();
        nanMapping.put("type", "Point");
        nanMapping.put("coordinates", Arrays.asList(Double.NaN, 10.0));
        assertThat(kernels.geoInterfaceToCells(Arrays.asList(nanMapping), 5, ContainmentMode.CENTER, false,
            IngestPolicy.NULL_OUT).isNull(0)).isTrue();

        Geometry[] direct = {factory.createMultiPointFromCoords(new Coordinate[] {
            new Coordinate(Double.NEGATIVE_INFINITY, 10)})};
        assertThatThrownBy(() -> kernels.geometriesToCells(direct, 5, ContainmentMode.CENTER, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("position 0");
    }

    @Test
    void geoJsonInputCanBeCompacted() throws InvalidGeometryException {
        String polygon = "{\"type\":\"Polygon\",\"coordinates\":[[[10,10],[10.5,10],[10.5,10.5],[10,10.5],[10,10]]]}";
        CellListArray plain = kernels.geoJsonToCells(new String[] {polygon}, 8, ContainmentMode.CENTER,
            false, IngestPolicy.REJECT);
        CellListArray compacted = kernels.geoJsonToCells(new String[] {polygon}, 8, ContainmentMode.CENTER,
            true, IngestPolicy.REJECT);
        assertThat(compacted.getListLength(0)).isLessThan(plain.getListLength(0));
        CellArray uncompacted = new HierarchyKernels().uncompact(compacted.getList(0), 8);
        assertThat(uncompacted).isEqualTo(plain.getList(0));
    }

    @Test
    void geoInterfaceMappingsAreAccepted() throws InvalidGeometryException {
        Map<String, Object> point = new HashMap<>();
        point.put("type", "Point");
        point.put("coordinates", Arrays.asList(13.4, 52.5));
        Map<String, Object> unknown = new HashMap<>();
        unknown.put("type", "Circle");
        List<Map<String, Object>> mappings = Arrays.asList(point, null, unknown);

        assertThatThrownBy(() -> kernels.geoInterfaceToCells(mappings, 7, ContainmentMode.CENTER, false,
            IngestPolicy.REJECT)).isInstanceOf(InvalidGeometryException.class);
        CellListArray lists = kernels.geoInterfaceToCells(mappings, 7, ContainmentMode.CENTER, false,
            IngestPolicy.NULL_OUT);
        assertThat(lists.getList(0).getRaw(0)).isEqualTo(h3.latLngToCell(52.5, 13.4, 7));
        assertThat(lists.isNull(1)).isTrue();
        assertThat(lists.isNull(2)).isTrue();
    }

    @Test
    void resultsDoNotDependOnParallelism() {
        CellArray cells = new GeometryKernels().polygonToCells(square(5, 5, 1), 6, ContainmentMode.OVERLAP);
        GeometryKernels sequential = new GeometryKernels(KernelOptions.sequential());
        GeometryKernels parallel = new GeometryKernels(new KernelOptions().setParallelism(4).setMinChunkSize(64));
        assertThat(parallel.boundaries(cells)).isEqualTo(sequential.boundaries(cells));
        assertThat(parallel.polygonToCells(square(5, 5, 1), 6, ContainmentMode.FULL))
            .isEqualTo(sequential.polygonToCells(square(5, 5, 1), 6, ContainmentMode.FULL));
    }

    private Polygon square(double x, double y, double halfSide) {
        return (Polygon) factory.toGeometry(new Envelope(x - halfSide, x + halfSide, y - halfSide, y + halfSide));
    }
}
