package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Parámetros del motor de carga. Inmutable; las variantes por corrida se derivan con {@link #toBuilder()}.
 * <p>
 * {@link #load()} lee {@value #RESOURCE} del classpath y permite sobreescribir cada clave con una
 * propiedad de sistema del mismo nombre (p. ej. {@code -Dloading.max-levels=6}).
 */
public final class LoadingSettings {

    static final String RESOURCE = "loading.properties";

    // ===================== Claves =====================
    static final String K_OVALITY          = "loading.ovality-factor";
    static final String K_DIAMETER_FACTOR  = "loading.diameter-factor";
    static final String K_BASE_CLEARANCE   = "loading.base-clearance-mm";
    static final String K_MAX_LEVELS       = "loading.max-levels";
    static final String K_PREFER_SAME_SDR  = "loading.prefer-same-sdr";
    static final String K_ALLOW_MIXED_SDR  = "loading.allow-mixed-sdr";
    static final String K_EXTRACTION_KG    = "loading.heavy-extraction-threshold-kg";
    static final String K_ROW_GAP          = "loading.row-gap-mm";
    static final String K_MAX_PIPES        = "loading.max-pipes-per-order";
    static final String K_MIN_LENGTH       = "loading.min-pipe-length-m";
    static final String K_MAX_LENGTH       = "loading.max-pipe-length-m";
    static final String K_SAFETY_MARGIN    = "loading.weight-safety-margin-pct";
    static final String K_LOW_UTIL         = "loading.low-utilization-pct";
    static final String K_INNER_RATIO      = "loading.max-inner-weight-ratio";

    private static final Logger log = LoggerFactory.getLogger(LoadingSettings.class);

    final double  ovalityFactor;
    final double  diameterFactor;
    final double  baseClearanceMm;
    final int     maxLevels;
    final boolean preferSameSdr;
    final boolean allowMixedSdr;
    final double  heavyExtractionThresholdKg;
    final double  rowGapMm;
    final int     maxPipesPerOrder;
    final double  minPipeLengthM;
    final double  maxPipeLengthM;
    final double  weightSafetyMarginPct;
    final double  lowUtilizationPct;
    final double  maxInnerWeightRatio;

    private LoadingSettings(Builder b) {
        if (b.ovalityFactor < 0 || b.ovalityFactor >= 1) throw new IllegalArgumentException("ovality-factor fuera de [0,1): " + b.ovalityFactor);
        if (b.diameterFactor < 0) throw new IllegalArgumentException("diameter-factor negativo: " + b.diameterFactor);
        if (b.baseClearanceMm < 0) throw new IllegalArgumentException("base-clearance-mm negativo: " + b.baseClearanceMm);
        if (b.maxLevels < 1) throw new IllegalArgumentException("max-levels debe ser >= 1: " + b.maxLevels);
        if (b.rowGapMm < 0) throw new IllegalArgumentException("row-gap-mm negativo: " + b.rowGapMm);
        if (b.maxPipesPerOrder < 1) throw new IllegalArgumentException("max-pipes-per-order debe ser >= 1");
        if (b.minPipeLengthM <= 0 || b.maxPipeLengthM < b.minPipeLengthM) {
            throw new IllegalArgumentException("Rango de largo inválido: " + b.minPipeLengthM + ".." + b.maxPipeLengthM);
        }
        this.ovalityFactor = b.ovalityFactor;
        this.diameterFactor = b.diameterFactor;
        this.baseClearanceMm = b.baseClearanceMm;
        this.maxLevels = b.maxLevels;
        this.preferSameSdr = b.preferSameSdr;
        this.allowMixedSdr = b.allowMixedSdr;
        this.heavyExtractionThresholdKg = b.heavyExtractionThresholdKg;
        this.rowGapMm = b.rowGapMm;
        this.maxPipesPerOrder = b.maxPipesPerOrder;
        this.minPipeLengthM = b.minPipeLengthM;
        this.maxPipeLengthM = b.maxPipeLengthM;
        this.weightSafetyMarginPct = b.weightSafetyMarginPct;
        this.lowUtilizationPct = b.lowUtilizationPct;
        this.maxInnerWeightRatio = b.maxInnerWeightRatio;
    }

    // valores de fábrica, sin I/O
    public static LoadingSettings defaults() {
        return new Builder().build();
    }

    // lee loading.properties y aplica las propiedades de sistema encima
    public static LoadingSettings load() {
        Properties p = new Properties();
        try (InputStream in = LoadingSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                p.load(in);
            } else {
                log.warn("No se encontró {} en el classpath, se usan valores por defecto", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + RESOURCE, e);
        }
        for (String key : p.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) p.setProperty(key, override);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("loading.") && !p.containsKey(key)) p.setProperty(key, System.getProperty(key));
        }
        return fromProperties(p);
    }

    // construye desde un Properties arbitrario; las claves ausentes toman el valor por defecto
    public static LoadingSettings fromProperties(Properties p) {
        Builder b = new Builder();
        b.ovalityFactor              = dbl(p, K_OVALITY, b.ovalityFactor);
        b.diameterFactor             = dbl(p, K_DIAMETER_FACTOR, b.diameterFactor);
        b.baseClearanceMm            = dbl(p, K_BASE_CLEARANCE, b.baseClearanceMm);
        b.maxLevels                  = (int) dbl(p, K_MAX_LEVELS, b.maxLevels);
        b.preferSameSdr              = bool(p, K_PREFER_SAME_SDR, b.preferSameSdr);
        b.allowMixedSdr              = bool(p, K_ALLOW_MIXED_SDR, b.allowMixedSdr);
        b.heavyExtractionThresholdKg = dbl(p, K_EXTRACTION_KG, b.heavyExtractionThresholdKg);
        b.rowGapMm                   = dbl(p, K_ROW_GAP, b.rowGapMm);
        b.maxPipesPerOrder           = (int) dbl(p, K_MAX_PIPES, b.maxPipesPerOrder);
        b.minPipeLengthM             = dbl(p, K_MIN_LENGTH, b.minPipeLengthM);
        b.maxPipeLengthM             = dbl(p, K_MAX_LENGTH, b.maxPipeLengthM);
        b.weightSafetyMarginPct      = dbl(p, K_SAFETY_MARGIN, b.weightSafetyMarginPct);
        b.lowUtilizationPct          = dbl(p, K_LOW_UTIL, b.lowUtilizationPct);
        b.maxInnerWeightRatio        = dbl(p, K_INNER_RATIO, b.maxInnerWeightRatio);
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.ovalityFactor = ovalityFactor;
        b.diameterFactor = diameterFactor;
        b.baseClearanceMm = baseClearanceMm;
        b.maxLevels = maxLevels;
        b.preferSameSdr = preferSameSdr;
        b.allowMixedSdr = allowMixedSdr;
        b.heavyExtractionThresholdKg = heavyExtractionThresholdKg;
        b.rowGapMm = rowGapMm;
        b.maxPipesPerOrder = maxPipesPerOrder;
        b.minPipeLengthM = minPipeLengthM;
        b.maxPipeLengthM = maxPipeLengthM;
        b.weightSafetyMarginPct = weightSafetyMarginPct;
        b.lowUtilizationPct = lowUtilizationPct;
        b.maxInnerWeightRatio = maxInnerWeightRatio;
        return b;
    }

    public double  ovalityFactor()              { return ovalityFactor; }
    public double  diameterFactor()             { return diameterFactor; }
    public double  baseClearanceMm()            { return baseClearanceMm; }
    public int     maxLevels()                  { return maxLevels; }
    public boolean preferSameSdr()              { return preferSameSdr; }
    public boolean allowMixedSdr()              { return allowMixedSdr; }
    public double  heavyExtractionThresholdKg() { return heavyExtractionThresholdKg; }
    public double  rowGapMm()                   { return rowGapMm; }
    public int     maxPipesPerOrder()           { return maxPipesPerOrder; }
    public double  minPipeLengthM()             { return minPipeLengthM; }
    public double  maxPipeLengthM()             { return maxPipeLengthM; }
    public double  weightSafetyMarginPct()      { return weightSafetyMarginPct; }
    public double  lowUtilizationPct()          { return lowUtilizationPct; }
    public double  maxInnerWeightRatio()        { return maxInnerWeightRatio; }

    private static double dbl(Properties p, String key, double def) {
        String s = p.getProperty(key);
        if (s == null || s.isBlank()) return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor numérico inválido para " + key + ": " + s, e);
        }
    }

    private static boolean bool(Properties p, String key, boolean def) {
        String s = p.getProperty(key);
        if (s == null || s.isBlank()) return def;
        String t = s.trim().toLowerCase(Locale.ROOT);
        if (t.equals("true") || t.equals("1") || t.equals("yes")) return true;
        if (t.equals("false") || t.equals("0") || t.equals("no")) return false;
        throw new IllegalArgumentException("Valor booleano inválido para " + key + ": " + s);
    }

    @Override public String toString() {
        return String.format(Locale.US,
                "LoadingSettings[ovality=%.3f diamFactor=%.3f clearance=%.1fmm maxLevels=%d sameSdr=%b mixedSdr=%b extraction=%.0fkg gap=%.0fmm]",
                ovalityFactor, diameterFactor, baseClearanceMm, maxLevels, preferSameSdr, allowMixedSdr,
                heavyExtractionThresholdKg, rowGapMm);
    }

    public static final class Builder {
        double  ovalityFactor              = 0.04;
        double  diameterFactor             = 0.015;
        double  baseClearanceMm            = 15.0;
        int     maxLevels                  = 4;
        boolean preferSameSdr              = true;
        boolean allowMixedSdr              = true;
        double  heavyExtractionThresholdKg = 2_000.0;
        double  rowGapMm                   = 20.0;
        int     maxPipesPerOrder           = 5_000;
        double  minPipeLengthM             = 6.0;
        double  maxPipeLengthM             = 18.0;
        double  weightSafetyMarginPct      = 2.0;
        double  lowUtilizationPct          = 50.0;
        double  maxInnerWeightRatio        = 2.0;

        public Builder ovalityFactor(double v)              { ovalityFactor = v; return this; }
        public Builder diameterFactor(double v)             { diameterFactor = v; return this; }
        public Builder baseClearanceMm(double v)            { baseClearanceMm = v; return this; }
        public Builder maxLevels(int v)                     { maxLevels = v; return this; }
        public Builder preferSameSdr(boolean v)             { preferSameSdr = v; return this; }
        public Builder allowMixedSdr(boolean v)             { allowMixedSdr = v; return this; }
        public Builder heavyExtractionThresholdKg(double v) { heavyExtractionThresholdKg = v; return this; }
        public Builder rowGapMm(double v)                   { rowGapMm = v; return this; }
        public Builder maxPipesPerOrder(int v)              { maxPipesPerOrder = v; return this; }
        public Builder minPipeLengthM(double v)             { minPipeLengthM = v; return this; }
        public Builder maxPipeLengthM(double v)             { maxPipeLengthM = v; return this; }
        public Builder weightSafetyMarginPct(double v)      { weightSafetyMarginPct = v; return this; }
        public Builder lowUtilizationPct(double v)          { lowUtilizationPct = v; return this; }
        public Builder maxInnerWeightRatio(double v)        { maxInnerWeightRatio = v; return this; }

        public LoadingSettings build() {
            return new LoadingSettings(this);
        }
    }
}
