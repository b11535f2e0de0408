package org.tlc4pipe.loading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Regla física de telescopado: ¿cabe el tubo {@code guest} dentro de {@code host}?
 * <p>
 * El diámetro interior del anfitrión se reduce por ovalidad (deformación en almacén y
 * transporte) y el hueco exigido crece con el diámetro exterior del anfitrión, así que los
 * tubos grandes necesitan márgenes proporcionalmente mayores. Funciones puras, nunca fallan.
 */
public final class NestingValidator {

    public static final double DEFAULT_OVALITY_FACTOR  = 0.04;
    public static final double DEFAULT_DIAMETER_FACTOR = 0.015;
    public static final double DEFAULT_BASE_CLEARANCE  = 15.0;

    private NestingValidator() {}

    /* Resultado detallado de la verificación de holgura. */
    public static final class ClearanceCheck {
        final double effectiveInnerMm;
        final double availableGapMm;
        final double requiredGapMm;
        final boolean valid;

        ClearanceCheck(double effectiveInnerMm, double availableGapMm, double requiredGapMm, boolean valid) {
            this.effectiveInnerMm = effectiveInnerMm;
            this.availableGapMm = availableGapMm;
            this.requiredGapMm = requiredGapMm;
            this.valid = valid;
        }

        public double effectiveInnerMm() { return effectiveInnerMm; }
        public double availableGapMm()   { return availableGapMm; }
        public double requiredGapMm()    { return requiredGapMm; }
        public boolean isValid()         { return valid; }

        public String message() {
            if (valid) {
                return String.format(Locale.US, "Valid: %.1fmm gap >= %.1fmm required", availableGapMm, requiredGapMm);
            }
            return String.format(Locale.US, "Invalid: %.1fmm gap < %.1fmm required (deficit: %.1fmm)",
                    availableGapMm, requiredGapMm, requiredGapMm - availableGapMm);
        }

        @Override public String toString() { return message(); }
    }

    public static boolean isCompatible(PipeType host, PipeType guest) {
        return isCompatible(host, guest, DEFAULT_OVALITY_FACTOR, DEFAULT_DIAMETER_FACTOR, DEFAULT_BASE_CLEARANCE);
    }

    public static boolean isCompatible(PipeType host, PipeType guest, LoadingSettings s) {
        return isCompatible(host, guest, s.ovalityFactor, s.diameterFactor, s.baseClearanceMm);
    }

    public static boolean isCompatible(PipeType host, PipeType guest,
                                       double ovalityFactor, double diameterFactor, double baseClearanceMm) {
        return check(host, guest, ovalityFactor, diameterFactor, baseClearanceMm).valid;
    }

    public static ClearanceCheck check(PipeType host, PipeType guest, LoadingSettings s) {
        return check(host, guest, s.ovalityFactor, s.diameterFactor, s.baseClearanceMm);
    }

    // DI_efectivo = DI * (1 - ovalidad); hueco_req = C_base + f * DE_host
    public static ClearanceCheck check(PipeType host, PipeType guest,
                                       double ovalityFactor, double diameterFactor, double baseClearanceMm) {
        double effectiveInner = host.innerDiameterMm * (1.0 - ovalityFactor);
        double required = requiredGapMm(host.outerDiameterMm, diameterFactor, baseClearanceMm);
        double available = effectiveInner - guest.outerDiameterMm;
        // un huésped igual o mayor que el anfitrión nunca entra, aunque los factores sean 0
        boolean ok = guest.outerDiameterMm < host.outerDiameterMm && available >= required;
        return new ClearanceCheck(effectiveInner, available, required, ok);
    }

    static double requiredGapMm(double hostOuterDiameterMm, double diameterFactor, double baseClearanceMm) {
        return baseClearanceMm + diameterFactor * hostOuterDiameterMm;
    }

    // avisos no bloqueantes sobre un par anfitrión/huésped ya compatible
    public static List<String> pairAdvisories(PipeType host, PipeType guest, LoadingSettings s) {
        List<String> out = new ArrayList<>(2);
        double hostW = host.weightPerMeterKg;
        double guestW = guest.weightPerMeterKg;
        double ratio = hostW > 0 ? guestW / hostW : Double.POSITIVE_INFINITY;
        if (ratio > s.maxInnerWeightRatio) {
            out.add(String.format(Locale.US,
                    "Inner pipe %s (%.1f kg/m) is more than %.1fx heavier than outer pipe %s (%.1f kg/m)",
                    guest.code, guestW, s.maxInnerWeightRatio, host.code, hostW));
        }
        // SDR mayor = pared más delgada = menos rígido
        if (host.sdr > guest.sdr && guestW > hostW) {
            out.add(String.format(Locale.US,
                    "Caution: heavier pipe %s (SDR%d) inside lighter pipe %s (SDR%d) may cause outer pipe deformation",
                    guest.code, guest.sdr, host.code, host.sdr));
        }
        return out;
    }

    // valida una cadena ya armada (exterior -> interior). Lista vacía = válida.
    public static List<String> validateChain(List<PipeType> chain, int maxLevels, LoadingSettings s) {
        if (chain.size() < 2) return Collections.emptyList();
        List<String> problems = new ArrayList<>();
        if (chain.size() > maxLevels) {
            problems.add("Exceeds max nesting levels (" + maxLevels + "): " + chain.size());
        }
        for (int i = 0; i + 1 < chain.size(); i++) {
            PipeType outer = chain.get(i);
            PipeType inner = chain.get(i + 1);
            ClearanceCheck c = check(outer, inner, s);
            if (!c.valid) {
                problems.add("Level " + (i + 1) + ": " + outer.code + " -> " + inner.code + " " + c.message());
            }
        }
        return problems;
    }
}
