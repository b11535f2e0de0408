package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Importación de pedidos desde CSV. Nunca falla por filas malas: las reporta en {@link ParseResult#errors()}.
 */
public final class OrderCsvReader {

    private static final Logger log = LoggerFactory.getLogger(OrderCsvReader.class);

    static final String F_DN   = "dn_mm";
    static final String F_PN   = "pn_class";
    static final String F_SDR  = "sdr";
    static final String F_QTY  = "quantity";
    static final String F_CODE = "pipe_code";

    // alias de cabecera (minúsculas, espacios y guiones como '_')
    static final Map<String, String> COLUMN_ALIASES = new HashMap<>();
    static {
        for (String a : Arrays.asList("dn", "dn_mm", "diameter", "diametru", "outer_diameter", "od")) COLUMN_ALIASES.put(a, F_DN);
        for (String a : Arrays.asList("pn", "pn_class", "pressure", "pressure_class", "presiune", "clasa_presiune")) COLUMN_ALIASES.put(a, F_PN);
        COLUMN_ALIASES.put("sdr", F_SDR);
        for (String a : Arrays.asList("qty", "quantity", "cantitate", "buc", "bucati", "count", "nr")) COLUMN_ALIASES.put(a, F_QTY);
        for (String a : Arrays.asList("code", "pipe_code", "cod", "product", "produs")) COLUMN_ALIASES.put(a, F_CODE);
    }

    static final List<String> VALID_PN = Arrays.asList("6", "8", "10", "16");
    static final char[] DELIMITERS = {',', ';', '\t', '|'};

    private OrderCsvReader() {}

    /* Línea leída del CSV. */
    public static final class ParsedItem {
        final int    dnMm;
        final String pnClass;
        final int    quantity;
        final String pipeCode;
        final int    rowNumber;

        ParsedItem(int dnMm, String pnClass, int quantity, String pipeCode, int rowNumber) {
            this.dnMm = dnMm;
            this.pnClass = pnClass;
            this.quantity = quantity;
            this.pipeCode = pipeCode;
            this.rowNumber = rowNumber;
        }

        public int dnMm()        { return dnMm; }
        public String pnClass()  { return pnClass; }
        public int quantity()    { return quantity; }
        public String pipeCode() { return pipeCode; }
        public int rowNumber()   { return rowNumber; }
    }

    /* Resultado de la lectura. */
    public static final class ParseResult {
        final List<ParsedItem> items;
        final List<String> errors;
        final List<String> warnings;
        final int totalRows;

        ParseResult(List<ParsedItem> items, List<String> errors, List<String> warnings, int totalRows) {
            this.items = Collections.unmodifiableList(items);
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
            this.totalRows = totalRows;
        }

        public List<ParsedItem> items() { return items; }
        public List<String> errors()    { return errors; }
        public List<String> warnings()  { return warnings; }
        public int totalRows()          { return totalRows; }
        public int validRows()          { return items.size(); }
        public boolean hasErrors()      { return !errors.isEmpty(); }

        // ítems listos para el planificador (código + cantidad)
        public List<LoadRequest.Item> toRequestItems() {
            List<LoadRequest.Item> out = new ArrayList<>(items.size());
            for (ParsedItem it : items) out.add(new LoadRequest.Item(it.pipeCode, it.quantity));
            return out;
        }
    }

    // lee un archivo: UTF-8 y, si no decodifica, Latin-1
    public static ParseResult parse(Path file) throws IOException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} no es UTF-8, se reintenta en ISO-8859-1", file);
            content = Files.readString(file, StandardCharsets.ISO_8859_1);
        }
        return parse(content, true);
    }

    public static ParseResult parse(String content) {
        return parse(content, true);
    }

    public static ParseResult parse(String content, boolean hasHeader) {
        List<ParsedItem> items = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (content == null || content.trim().isEmpty()) {
            errors.add("Empty file");
            return new ParseResult(items, errors, warnings, 0);
        }
        content = CsvSupport.stripBom(content);

        char delimiter = detectDelimiter(content);
        List<String> lines = Arrays.asList(content.split("\\r?\\n", -1));

        Map<Integer, String> columns = new LinkedHashMap<>();
        int first;
        if (hasHeader) {
            String[] header = CsvSupport.split(lines.get(0), delimiter);
            for (int i = 0; i < header.length; i++) {
                String field = normalizeColumn(header[i]);
                if (field != null) columns.put(i, field);
                else if (!header[i].isEmpty()) warnings.add("Unrecognized column: '" + header[i] + "'");
            }
            if (!columns.containsValue(F_DN)) errors.add("Missing required column: DN/Diameter");
            if (!columns.containsValue(F_QTY)) errors.add("Missing required column: Quantity");
            first = 1;
        } else {
            // sin cabecera se asume DN, PN, cantidad
            columns.put(0, F_DN);
            columns.put(1, F_PN);
            columns.put(2, F_QTY);
            first = 0;
        }

        int dataRows = 0;
        for (int i = first; i < lines.size(); i++) {
            if (lines.get(i).trim().isEmpty()) continue;
            dataRows++;
        }
        if (!errors.isEmpty()) {
            return new ParseResult(items, errors, warnings, dataRows);
        }

        for (int i = first; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) continue;
            int rowNumber = i + 1;
            String[] v = CsvSupport.split(line, delimiter);

            Map<String, String> row = new HashMap<>();
            for (Map.Entry<Integer, String> e : columns.entrySet()) {
                row.put(e.getValue(), CsvSupport.get(v, e.getKey()));
            }

            Integer dn = parseDn(row.get(F_DN));
            String pnRaw = row.getOrDefault(F_PN, "");
            String pn = parsePn(pnRaw.isEmpty() ? row.getOrDefault(F_SDR, "") : pnRaw);
            Integer qty = parseQuantity(row.get(F_QTY));
            String code = row.getOrDefault(F_CODE, "").trim();

            List<String> rowErrors = new ArrayList<>(2);
            if (dn == null) rowErrors.add("Invalid DN value");
            if (qty == null) rowErrors.add("Invalid quantity");
            if (!rowErrors.isEmpty()) {
                errors.add("Row " + rowNumber + ": " + String.join(", ", rowErrors));
                continue;
            }
            if (pn == null) {
                pn = "PN6";
                warnings.add("Row " + rowNumber + ": PN not specified, defaulting to PN6");
            }
            if (code.isEmpty()) code = PipeCatalog.codeFor(dn, pn);

            items.add(new ParsedItem(dn, pn, qty, code, rowNumber));
        }

        if (!errors.isEmpty()) log.warn("CSV de pedido con {} filas rechazadas", errors.size());
        return new ParseResult(items, errors, warnings, dataRows);
    }

    // el delimitador más frecuente en las primeras 5 líneas
    static char detectDelimiter(String content) {
        String[] lines = content.split("\\r?\\n", 6);
        StringBuilder sample = new StringBuilder();
        for (int i = 0; i < Math.min(5, lines.length); i++) sample.append(lines[i]).append('\n');
        char best = ',';
        int bestCount = -1;
        for (char d : DELIMITERS) {
            int n = 0;
            for (int i = 0; i < sample.length(); i++) if (sample.charAt(i) == d) n++;
            if (n > bestCount) { best = d; bestCount = n; }
        }
        return best;
    }

    static String normalizeColumn(String name) {
        String cleaned = name.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return COLUMN_ALIASES.get(cleaned);
    }

    // 200 | DN200 | 200mm | Ø200 | OD200
    static Integer parseDn(String value) {
        if (value == null || value.trim().isEmpty()) return null;
        String s = value.trim().toUpperCase(Locale.ROOT);
        for (String prefix : new String[] {"DN", "Ø", "D", "OD"}) {
            if (s.startsWith(prefix)) s = s.substring(prefix.length());
        }
        for (String suffix : new String[] {"MM", "M"}) {
            if (s.endsWith(suffix)) s = s.substring(0, s.length() - suffix.length());
        }
        Double d = CsvSupport.parseNullableDouble(s.trim());
        return d == null ? null : (int) d.doubleValue();
    }

    // PN6 | 6 | PN 6 | SDR26
    static String parsePn(String value) {
        if (value == null || value.trim().isEmpty()) return null;
        String s = value.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("SDR")) {
            Integer sdr = CsvSupport.parseNullableInt(s.substring(3).trim());
            if (sdr == null) return null;
            String pn = PipeCatalog.pressureClassForSdr(sdr);
            return pn.startsWith("PN") ? pn : null;
        }
        if (s.startsWith("PN")) s = s.substring(2).trim();
        return VALID_PN.contains(s) ? "PN" + s : null;
    }

    static Integer parseQuantity(String value) {
        if (value == null || value.trim().isEmpty()) return null;
        Double d = CsvSupport.parseNullableDouble(value.trim());
        if (d == null) return null;
        int q = (int) d.doubleValue();
        return q > 0 ? q : null;
    }
}
