package org.tlc4pipe.loading;

import java.util.Locale;
import java.util.Objects;

/**
 * Tipo de tubo del catálogo (inmutable). Todas las medidas en mm, peso en kg/m.
 */
public final class PipeType {

    final String code;
    final double outerDiameterMm;
    final double innerDiameterMm;
    final double wallMm;
    final String pressureClass;   // PN6 | PN8 | PN10 | PN16
    final int    sdr;
    final double weightPerMeterKg;

    public PipeType(String code, double outerDiameterMm, double innerDiameterMm, double wallMm,
                    String pressureClass, int sdr, double weightPerMeterKg) {
        Objects.requireNonNull(code, "code");
        if (!(outerDiameterMm > 0)) throw new IllegalArgumentException("Diámetro exterior inválido en " + code + ": " + outerDiameterMm);
        if (!(innerDiameterMm > 0) || !(innerDiameterMm < outerDiameterMm)) {
            throw new IllegalArgumentException("Diámetro interior debe ser >0 y < exterior en " + code
                    + " (DE=" + outerDiameterMm + ", DI=" + innerDiameterMm + ")");
        }
        if (!(weightPerMeterKg >= 0)) throw new IllegalArgumentException("Peso por metro inválido en " + code + ": " + weightPerMeterKg);
        this.code = code;
        this.outerDiameterMm = outerDiameterMm;
        this.innerDiameterMm = innerDiameterMm;
        this.wallMm = wallMm;
        this.pressureClass = pressureClass;
        this.sdr = sdr;
        this.weightPerMeterKg = weightPerMeterKg;
    }

    // atajo para tipos de prueba o de importación donde la pared se deriva de los diámetros
    public static PipeType of(String code, double outerDiameterMm, double innerDiameterMm, int sdr, double weightPerMeterKg) {
        double wall = (outerDiameterMm - innerDiameterMm) / 2.0;
        return new PipeType(code, outerDiameterMm, innerDiameterMm, wall, PipeCatalog.pressureClassForSdr(sdr), sdr, weightPerMeterKg);
    }

    public String code()              { return code; }
    public double outerDiameterMm()   { return outerDiameterMm; }
    public double innerDiameterMm()   { return innerDiameterMm; }
    public double wallMm()            { return wallMm; }
    public String pressureClass()     { return pressureClass; }
    public int    sdr()               { return sdr; }
    public double weightPerMeterKg()  { return weightPerMeterKg; }

    // peso de una unidad para un largo dado
    public double unitWeightKg(double pipeLengthM) {
        return weightPerMeterKg * pipeLengthM;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipeType)) return false;
        PipeType p = (PipeType) o;
        return code.equals(p.code)
                && Double.compare(outerDiameterMm, p.outerDiameterMm) == 0
                && Double.compare(innerDiameterMm, p.innerDiameterMm) == 0
                && sdr == p.sdr
                && Double.compare(weightPerMeterKg, p.weightPerMeterKg) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(code, outerDiameterMm, innerDiameterMm, sdr, weightPerMeterKg);
    }

    @Override public String toString() {
        return String.format(Locale.US, "%s[DE=%.1f DI=%.1f SDR%d %.2fkg/m]",
                code, outerDiameterMm, innerDiameterMm, sdr, weightPerMeterKg);
    }
}
