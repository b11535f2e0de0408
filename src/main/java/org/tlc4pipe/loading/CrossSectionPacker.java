package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Ubicación 2-D por filas hexagonales (escalonadas) en el ancho x alto del camión.
 * <p>
 * Cada paquete ocupa un círculo del DE de su anfitrión. Las filas se llenan a lo ancho con un
 * hueco fijo; cuando el borde derecho se pasa del ancho se abre una fila nueva, alternando el
 * desplazamiento de medio diámetro y subiendo {@code rowMax * sqrt(3)/2}. Ancho y alto se
 * controlan por separado. El estado solo cambia cuando el paquete se acepta.
 */
public final class CrossSectionPacker {

    static final double HEX_ROW_PITCH = Math.sqrt(3.0) / 2.0;
    static final double EPS           = 1e-9;

    private static final Logger log = LoggerFactory.getLogger(CrossSectionPacker.class);

    private final double gapMm;

    public CrossSectionPacker(double gapMm) {
        if (gapMm < 0) throw new IllegalArgumentException("gap negativo: " + gapMm);
        this.gapMm = gapMm;
    }

    public CrossSectionPacker(LoadingSettings settings) {
        this(settings.rowGapMm);
    }

    public double gapMm() { return gapMm; }

    // intenta ubicar el paquete; si entra, actualiza el cursor del camión
    public Optional<PlacedBundle> tryPlace(ContainerState st, Bundle bundle) {
        double d = bundle.footprintDiameterMm();
        double width = st.spec.internalWidthMm;
        double height = st.spec.internalHeightMm;

        double  z       = st.cursorZ;
        double  y       = st.rowBaseY;
        boolean offset  = st.offsetRow;
        double  rowMax  = st.rowMaxDiameter;
        int     row     = st.rowIndex;

        double right = rightEdge(z, d, offset);
        if (right > width + EPS) {
            if (rowMax <= 0) {
                // la fila ya está vacía: abrir otra no cambia nada
                log.debug("Camión {}: DE={} no entra a lo ancho ({} > {})", st.truckNumber, d, right, width);
                return Optional.empty();
            }
            z = 0.0;
            y += rowMax * HEX_ROW_PITCH;
            offset = !offset;
            rowMax = 0.0;
            row++;
            right = rightEdge(z, d, offset);
            if (right > width + EPS) {
                log.debug("Camión {}: DE={} no entra en fila nueva ({} > {})", st.truckNumber, d, right, width);
                return Optional.empty();
            }
        }
        if (y + d > height + EPS) {
            log.debug("Camión {}: DE={} excede la altura ({} > {})", st.truckNumber, d, y + d, height);
            return Optional.empty();
        }

        double zOffset = offset ? d / 2.0 : 0.0;
        PlacedBundle p = new PlacedBundle(bundle, z + zOffset + d / 2.0, y + d / 2.0, row, offset);

        st.cursorZ = z + d + gapMm;
        st.rowBaseY = y;
        st.offsetRow = offset;
        st.rowMaxDiameter = Math.max(rowMax, d);
        st.rowIndex = row;
        st.placements.add(p);

        log.debug("Camión {}: {} en fila {} centro=({}, {})", st.truckNumber, bundle.describe(), row, p.centerZ, p.centerY);
        return Optional.of(p);
    }

    // un camión vacío acepta el paquete si su círculo cabe en ancho y alto
    public static boolean fitsEmpty(TruckSpec spec, Bundle bundle) {
        double d = bundle.footprintDiameterMm();
        return d <= spec.internalWidthMm + EPS && d <= spec.internalHeightMm + EPS;
    }

    static double rightEdge(double z, double d, boolean offset) {
        double zOffset = offset ? d / 2.0 : 0.0;
        return z + d / 2.0 + zOffset + d / 2.0;
    }
}
