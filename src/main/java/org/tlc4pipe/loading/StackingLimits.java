package org.tlc4pipe.loading;

import java.util.Map;

final class StackingLimits {

    // SDR menor = pared más gruesa = más filas
    static final Map<Integer, Integer> MAX_LAYERS_BY_SDR = Map.of(
            11, 8,   // PN16
            17, 6,   // PN10
            21, 5,   // PN8
            26, 4);  // PN6
    static final int DEFAULT_MAX_LAYERS = 4;

    private StackingLimits() {}

    static int maxLayers(PipeType p) {
        int max = MAX_LAYERS_BY_SDR.getOrDefault(p.sdr, DEFAULT_MAX_LAYERS);
        // los diámetros grandes ovalizan más
        if (p.outerDiameterMm >= 500) max = Math.min(max, 3);
        else if (p.outerDiameterMm >= 315) max -= 1;
        return max;
    }
}
