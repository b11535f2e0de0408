package org.tlc4pipe.loading;

import org.locationtech.jts.geom.*;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Dibuja la sección transversal de un camión: contorno, un círculo por paquete y círculos
 * concéntricos para los tubos telescopados.
 */
final class SvgWriter {

    static final int QUADRANT_SEGMENTS = 16;
    static final String[] FILLS = {"#6baed6", "#74c476", "#fd8d3c", "#9e9ac8", "#fdd0a2", "#a1d99b", "#9ecae1", "#fdae6b"};

    private static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    private SvgWriter() {}

    static void write(TruckLoad truck, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        try (Writer w = new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8)) {
            w.write(toSVG(truck));
        }
    }

    static String toSVG(TruckLoad truck) {
        double w = truck.spec.internalWidthMm;
        double h = truck.spec.internalHeightMm;
        Polygon section = (Polygon) GF.toGeometry(new Envelope(0, w, 0, h));

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w))
          .append("\" height=\"").append(fmt(h)).append("\" viewBox=\"0 0 ")
          .append(fmt(w)).append(" ").append(fmt(h)).append("\">\n");
        sb.append("  <title>Truck ").append(truck.truckNumber).append(" - ").append(escape(truck.spec.name))
          .append(" - ").append(String.format(Locale.US, "%.1f kg", truck.totalWeightKg)).append("</title>\n");

        // Y hacia arriba como en el camión (SVG tiene Y hacia abajo)
        sb.append("  <g transform=\"translate(0,").append(fmt(h)).append(") scale(1,-1)\">\n");
        sb.append("    <path d=\"").append(pathFor(section))
          .append("\" fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"4\"/>\n");

        int colorIdx = 0;
        for (PlacedBundle p : truck.placements) {
            String fill = FILLS[colorIdx++ % FILLS.length];
            emitBundle(sb, p, fill);
        }

        sb.append("  </g>\n</svg>\n");
        return sb.toString();
    }

    // anfitrión relleno + huéspedes concéntricos sin relleno
    static void emitBundle(StringBuilder sb, PlacedBundle p, String fill) {
        Bundle b = p.bundle;
        sb.append("    <g>\n");
        sb.append("      <title>").append(escape(b.describe()))
          .append(String.format(Locale.US, " | %.1f kg", b.totalWeightKg))
          .append(b.extractionWarning ? " | heavy extraction" : "")
          .append("</title>\n");
        List<PipeType> chain = b.chain;
        for (int i = 0; i < chain.size(); i++) {
            PipeType t = chain.get(i);
            Polygon ring = circle(p.centerZ, p.centerY, t.outerDiameterMm / 2.0, t.innerDiameterMm / 2.0);
            sb.append("      <path d=\"").append(pathFor(ring))
              .append("\" fill=\"").append(i == 0 ? fill : "#ffffff")
              .append("\" fill-rule=\"evenodd\" fill-opacity=\"0.85\" stroke=\"#111\" stroke-width=\"2\"/>\n");
        }
        sb.append("    </g>\n");
    }

    // anillo (pared del tubo) como polígono con hueco
    static Polygon circle(double cz, double cy, double outerR, double innerR) {
        Point c = GF.createPoint(new Coordinate(cz, cy));
        Polygon outer = (Polygon) c.buffer(outerR, QUADRANT_SEGMENTS);
        Polygon inner = (Polygon) c.buffer(innerR, QUADRANT_SEGMENTS);
        LinearRing shell = GF.createLinearRing(outer.getExteriorRing().getCoordinates());
        LinearRing hole = GF.createLinearRing(inner.getExteriorRing().getCoordinates());
        return GF.createPolygon(shell, new LinearRing[] {hole});
    }

    // atributo "d" de un path SVG (exterior + huecos)
    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        appendLineString(sb, poly.getExteriorRing());
        for (int i = 0; i < poly.getNumInteriorRing(); i++) {
            appendLineString(sb, poly.getInteriorRingN(i));
        }
        return sb.toString().trim();
    }

    static void appendLineString(StringBuilder sb, LineString ls) {
        Coordinate[] c = ls.getCoordinates();
        if (c.length == 0) return;
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z ");
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.3f", d);
    }

    static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
