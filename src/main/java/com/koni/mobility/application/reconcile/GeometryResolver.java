package com.koni.mobility.application.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.mobility.domain.model.ObservedSensor;
import com.koni.mobility.domain.model.RawGeometry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derives longitude, latitude and a WKT geometry from what a source reports.
 *
 * Point, LineString, MultiLineString and Polygon are understood; the representative position of a
 * line or polygon is its centroid (length-weighted for lines, area-weighted over the
 * outer ring for polygons). Explicit coordinates win over the geometry. Anything that
 * cannot be interpreted is logged and yields {@code null} values, never an exception.
 */
@Slf4j
@Component
public class GeometryResolver {

    public SensorLocation resolve(ObservedSensor sensor) {
        Double longitude = validLongitude(sensor.getLongitude()) ? sensor.getLongitude() : null;
        Double latitude = validLatitude(sensor.getLatitude()) ? sensor.getLatitude() : null;
        boolean explicit = longitude != null && latitude != null;
        if (!explicit && (sensor.getLongitude() != null || sensor.getLatitude() != null)) {
            log.warn("Ignoring incomplete or out-of-range coordinates: source={}, externalId={}, longitude={}, latitude={}",
                    sensor.getSource(), sensor.getExternalId(), sensor.getLongitude(), sensor.getLatitude());
        }

        RawGeometry raw = sensor.getRawGeometry();
        if (raw == null) {
            return explicit ? new SensorLocation(longitude, latitude, pointWkt(longitude, latitude)) : SensorLocation.unknown();
        }
        try {
            Parsed parsed = parse(raw);
            if (explicit) {
                return new SensorLocation(longitude, latitude, parsed.wkt);
            }
            return new SensorLocation(parsed.centroid[0], parsed.centroid[1], parsed.wkt);
        } catch (IllegalArgumentException e) {
            log.warn("Unparseable geometry, sensor keeps no geometry: source={}, externalId={}, type={}, reason={}",
                    sensor.getSource(), sensor.getExternalId(), raw.getType(), e.getMessage());
            return explicit ? new SensorLocation(longitude, latitude, pointWkt(longitude, latitude)) : SensorLocation.unknown();
        }
    }

    private Parsed parse(RawGeometry raw) {
        String type = raw.getType() == null ? "" : raw.getType().trim().toLowerCase(Locale.ROOT);
        JsonNode coordinates = raw.getCoordinates();
        if (coordinates == null || coordinates.isNull()) {
            throw new IllegalArgumentException("missing coordinates");
        }
        switch (type) {
            case "point": {
                double[] point = position(coordinates);
                return new Parsed(point, pointWkt(point[0], point[1]));
            }
            case "linestring": {
                List<double[]> line = positions(coordinates, 2);
                return new Parsed(lineCentroid(line), "LINESTRING (" + join(line) + ")");
            }
            case "multilinestring": {
                if (!coordinates.isArray() || coordinates.size() == 0) {
                    throw new IllegalArgumentException("multilinestring without lines");
                }
                List<List<double[]>> lines = new ArrayList<>();
                List<String> parts = new ArrayList<>();
                for (JsonNode lineNode : coordinates) {
                    List<double[]> line = positions(lineNode, 2);
                    lines.add(line);
                    parts.add("(" + join(line) + ")");
                }
                return new Parsed(multiLineCentroid(lines), "MULTILINESTRING (" + String.join(", ", parts) + ")");
            }
            case "polygon": {
                if (!coordinates.isArray() || coordinates.size() == 0) {
                    throw new IllegalArgumentException("polygon without rings");
                }
                List<double[]> ring = positions(coordinates.get(0), 4);
                List<String> rings = new ArrayList<>();
                for (JsonNode ringNode : coordinates) {
                    rings.add("(" + join(positions(ringNode, 4)) + ")");
                }
                return new Parsed(polygonCentroid(ring), "POLYGON (" + String.join(", ", rings) + ")");
            }
            default:
                throw new IllegalArgumentException("unsupported geometry type '" + raw.getType() + "'");
        }
    }

    private static double[] position(JsonNode node) {
        if (node == null || !node.isArray() || node.size() < 2 || !node.get(0).isNumber() || !node.get(1).isNumber()) {
            throw new IllegalArgumentException("position is not a [longitude, latitude] pair: " + node);
        }
        double longitude = node.get(0).asDouble();
        double latitude = node.get(1).asDouble();
        if (!validLongitude(longitude) || !validLatitude(latitude)) {
            throw new IllegalArgumentException("position out of range: " + node);
        }
        return new double[]{longitude, latitude};
    }

    private static List<double[]> positions(JsonNode node, int minimum) {
        if (node == null || !node.isArray() || node.size() < minimum) {
            throw new IllegalArgumentException("expected at least " + minimum + " positions: " + node);
        }
        List<double[]> result = new ArrayList<>(node.size());
        for (JsonNode position : node) {
            result.add(position(position));
        }
        return result;
    }

    private static double[] lineCentroid(List<double[]> line) {
        double length = 0;
        double x = 0;
        double y = 0;
        for (int i = 1; i < line.size(); i++) {
            double[] a = line.get(i - 1);
            double[] b = line.get(i);
            double segment = Math.hypot(b[0] - a[0], b[1] - a[1]);
            length += segment;
            x += segment * (a[0] + b[0]) / 2;
            y += segment * (a[1] + b[1]) / 2;
        }
        if (length == 0) {
            return line.get(0);
        }
        return new double[]{x / length, y / length};
    }

    private static double[] multiLineCentroid(List<List<double[]>> lines) {
        double length = 0;
        double x = 0;
        double y = 0;
        for (List<double[]> line : lines) {
            double[] centroid = lineCentroid(line);
            double lineLength = 0;
            for (int i = 1; i < line.size(); i++) {
                lineLength += Math.hypot(line.get(i)[0] - line.get(i - 1)[0], line.get(i)[1] - line.get(i - 1)[1]);
            }
            length += lineLength;
            x += lineLength * centroid[0];
            y += lineLength * centroid[1];
        }
        if (length == 0) {
            return lines.get(0).get(0);
        }
        return new double[]{x / length, y / length};
    }

    private static double[] polygonCentroid(List<double[]> ring) {
        double area = 0;
        double x = 0;
        double y = 0;
        for (int i = 0; i < ring.size() - 1; i++) {
            double[] a = ring.get(i);
            double[] b = ring.get(i + 1);
            double cross = a[0] * b[1] - b[0] * a[1];
            area += cross;
            x += (a[0] + b[0]) * cross;
            y += (a[1] + b[1]) * cross;
        }
        if (area == 0) {
            // degenerate ring
            return lineCentroid(ring);
        }
        return new double[]{x / (3 * area), y / (3 * area)};
    }

    private static boolean validLongitude(Double longitude) {
        return longitude != null && Double.isFinite(longitude) && longitude >= -180 && longitude <= 180;
    }

    private static boolean validLatitude(Double latitude) {
        return latitude != null && Double.isFinite(latitude) && latitude >= -90 && latitude <= 90;
    }

    static String pointWkt(double longitude, double latitude) {
        return "POINT (" + format(longitude) + " " + format(latitude) + ")";
    }

    private static String join(List<double[]> positions) {
        return positions.stream()
                .map(p -> format(p[0]) + " " + format(p[1]))
                .collect(Collectors.joining(", "));
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static final class Parsed {
        private final double[] centroid;
        private final String wkt;

        private Parsed(double[] centroid, String wkt) {
            this.centroid = centroid;
            this.wkt = wkt;
        }
    }
}
