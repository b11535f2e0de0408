package org.tlc4pipe.loading;

import java.util.Locale;
import java.util.Objects;

public final class TruckSpec {

    public static final TruckSpec STANDARD_24T = new TruckSpec("Standard 24t Romania", 24_000, 13_600, 2_480, 2_700);
    public static final TruckSpec MEGA_TRAILER = new TruckSpec("Mega Trailer Romania", 24_000, 13_600, 2_480, 3_000);
    public static final TruckSpec STANDARD_EU  = new TruckSpec("Standard 24t EU",      24_000, 13_600, 2_450, 2_700);

    final String name;
    final double maxPayloadKg;
    final double internalLengthMm;
    final double internalWidthMm;
    final double internalHeightMm;

    public TruckSpec(String name, double maxPayloadKg, double internalLengthMm, double internalWidthMm, double internalHeightMm) {
        this.name = Objects.requireNonNull(name, "name");
        if (!(maxPayloadKg > 0)) throw new IllegalArgumentException("Carga útil debe ser > 0: " + maxPayloadKg);
        if (!(internalLengthMm > 0) || !(internalWidthMm > 0) || !(internalHeightMm > 0)) {
            throw new IllegalArgumentException("Dimensiones internas deben ser > 0 en " + name);
        }
        this.maxPayloadKg = maxPayloadKg;
        this.internalLengthMm = internalLengthMm;
        this.internalWidthMm = internalWidthMm;
        this.internalHeightMm = internalHeightMm;
    }

    // busca un preset por nombre corto (standard | mega | eu)
    public static TruckSpec preset(String key) {
        switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "standard": return STANDARD_24T;
            case "mega":     return MEGA_TRAILER;
            case "eu":       return STANDARD_EU;
            default: throw new IllegalArgumentException("Camión desconocido: " + key + " (standard | mega | eu)");
        }
    }

    public String name()              { return name; }
    public double maxPayloadKg()      { return maxPayloadKg; }
    public double internalLengthMm()  { return internalLengthMm; }
    public double internalWidthMm()   { return internalWidthMm; }
    public double internalHeightMm()  { return internalHeightMm; }

    @Override public String toString() {
        return String.format(Locale.US, "%s[%.0fkg %.0fx%.0fx%.0fmm]",
                name, maxPayloadKg, internalLengthMm, internalWidthMm, internalHeightMm);
    }
}
