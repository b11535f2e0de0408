package org.tlc4pipe.loading;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Catálogo de tubos HDPE (inmutable tras la carga, se puede compartir entre corridas).
 * El recurso {@value #RESOURCE} trae las 4 clases SDR 26/21/17/11 (PN6/PN8/PN10/PN16), DN 20-800.
 */
public final class PipeCatalog {

    static final String RESOURCE = "pipe-catalog.csv";

    private final Map<String, PipeType> byCode;

    public PipeCatalog(List<PipeType> types) {
        Map<String, PipeType> m = new LinkedHashMap<>();
        for (PipeType t : types) {
            if (m.putIfAbsent(key(t.code), t) != null) {
                throw new IllegalArgumentException("Código duplicado en catálogo: " + t.code);
            }
        }
        this.byCode = Collections.unmodifiableMap(m);
    }

    public static PipeCatalog loadDefault() {
        try (InputStream in = PipeCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException("No se encontró " + RESOURCE + " en el classpath");
            return fromCsv(in);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + RESOURCE, e);
        }
    }

    // columnas: code,sdr,pn_class,dn_mm,wall_mm,inner_diameter_mm,weight_per_meter
    public static PipeCatalog fromCsv(InputStream in) throws IOException {
        List<String> lines = CsvSupport.readLines(in);
        if (lines.isEmpty()) throw new IOException("CSV de catálogo vacío");
        String[] h = CsvSupport.split(lines.get(0), ',');
        int iCode = CsvSupport.idx(h, "code");
        int iSdr = CsvSupport.idx(h, "sdr");
        int iPn = CsvSupport.idx(h, "pn_class");
        int iDn = CsvSupport.idx(h, "dn_mm");
        int iWall = CsvSupport.idx(h, "wall_mm");
        int iInner = CsvSupport.idx(h, "inner_diameter_mm");
        int iWeight = CsvSupport.idx(h, "weight_per_meter");

        List<PipeType> types = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String[] v = CsvSupport.split(lines.get(i), ',');
            Integer sdr = CsvSupport.parseNullableInt(CsvSupport.get(v, iSdr));
            Double dn = CsvSupport.parseNullableDouble(CsvSupport.get(v, iDn));
            Double wall = CsvSupport.parseNullableDouble(CsvSupport.get(v, iWall));
            Double inner = CsvSupport.parseNullableDouble(CsvSupport.get(v, iInner));
            Double weight = CsvSupport.parseNullableDouble(CsvSupport.get(v, iWeight));
            if (sdr == null || dn == null || wall == null || inner == null || weight == null) {
                throw new IOException("Fila de catálogo inválida (" + (i + 1) + "): " + lines.get(i));
            }
            types.add(new PipeType(CsvSupport.get(v, iCode), dn, inner, wall, CsvSupport.get(v, iPn), sdr, weight));
        }
        return new PipeCatalog(types);
    }

    public Optional<PipeType> find(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(byCode.get(key(code)));
    }

    public Optional<PipeType> find(int dnMm, String pnClass) {
        return find(codeFor(dnMm, pnClass));
    }

    public List<PipeType> all() {
        return new ArrayList<>(byCode.values());
    }

    public int size() {
        return byCode.size();
    }

    // TPE200/PN10
    static String codeFor(int dnMm, String pnClass) {
        return String.format(Locale.ROOT, "TPE%03d/%s", dnMm, pnClass.toUpperCase(Locale.ROOT));
    }

    static String pressureClassForSdr(int sdr) {
        switch (sdr) {
            case 26: return "PN6";
            case 21: return "PN8";
            case 17: return "PN10";
            case 11: return "PN16";
            default: return "SDR" + sdr;
        }
    }

    private static String key(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
