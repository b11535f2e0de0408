package org.tlc4pipe.loading;

import java.util.List;
import java.util.Optional;

/**
 * Estrategia por defecto: el huésped compatible de mayor diámetro exterior (máximo volumen reutilizado).
 * <p>
 * Desempates: con DE idéntico y {@code preferSameSdr}, gana el que comparte SDR con el anfitrión;
 * luego el de mayor diámetro interior (deja más lugar para el siguiente nivel) y por último el código.
 * Con {@code allowMixedSdr = false} los candidatos de otro SDR quedan excluidos.
 */
public final class LargestFitSelector implements GuestSelector {

    public static final LargestFitSelector INSTANCE = new LargestFitSelector();

    @Override
    public Optional<PipeType> select(PipeType host, List<PipeType> candidates, LoadingSettings s) {
        PipeType best = null;
        for (PipeType c : candidates) {
            if (!s.allowMixedSdr && c.sdr != host.sdr) continue;
            if (!NestingValidator.isCompatible(host, c, s)) continue;
            if (best == null || better(c, best, host, s)) best = c;
        }
        return Optional.ofNullable(best);
    }

    // true si a es preferible a b como huésped de host
    static boolean better(PipeType a, PipeType b, PipeType host, LoadingSettings s) {
        int byDiameter = Double.compare(a.outerDiameterMm, b.outerDiameterMm);
        if (byDiameter != 0) return byDiameter > 0;
        if (s.preferSameSdr) {
            boolean aSame = a.sdr == host.sdr;
            boolean bSame = b.sdr == host.sdr;
            if (aSame != bSame) return aSame;
        }
        int byInner = Double.compare(a.innerDiameterMm, b.innerDiameterMm);
        if (byInner != 0) return byInner > 0;
        return a.code.compareTo(b.code) < 0;
    }
}
