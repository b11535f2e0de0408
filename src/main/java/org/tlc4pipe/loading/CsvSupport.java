package org.tlc4pipe.loading;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class CsvSupport {

    private CsvSupport() {}

    // lee todas las líneas no vacías de un stream UTF-8
    static List<String> readLines(InputStream in) throws IOException {
        List<String> out = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.trim().isEmpty()) continue;
                out.add(stripBom(line));
            }
        }
        return out;
    }

    static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    static String[] split(String s, char delimiter) {
        String[] raw = s.split(Pattern.quote(String.valueOf(delimiter)), -1);
        for (int i = 0; i < raw.length; i++) raw[i] = unquote(raw[i].trim());
        return raw;
    }

    static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1).trim();
        return s;
    }

    static int idx(String[] h, String name) {
        for (int i = 0; i < h.length; i++) if (h[i].equalsIgnoreCase(name)) return i;
        throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
    }

    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }

    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }

    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
    }
}
