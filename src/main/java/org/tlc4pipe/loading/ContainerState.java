package org.tlc4pipe.loading;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Acumulador mutable de un camión durante una corrida: peso cargado, cursor de filas de la
 * sección transversal y paquetes asignados (solo se agregan). Propiedad exclusiva de una corrida,
 * sin sincronización.
 */
public final class ContainerState {

    final int       truckNumber;
    final TruckSpec spec;

    double currentWeightKg;

    // cursor de la sección (ver CrossSectionPacker)
    double  cursorZ;
    double  rowBaseY;
    boolean offsetRow;
    double  rowMaxDiameter;
    int     rowIndex;

    final List<PlacedBundle> placements = new ArrayList<>();

    ContainerState(int truckNumber, TruckSpec spec) {
        this.truckNumber = truckNumber;
        this.spec = spec;
    }

    public int truckNumber()                 { return truckNumber; }
    public TruckSpec spec()                  { return spec; }
    public double currentWeightKg()          { return currentWeightKg; }
    public double remainingCapacityKg()      { return spec.maxPayloadKg - currentWeightKg; }
    public List<PlacedBundle> placements()   { return Collections.unmodifiableList(placements); }
    public boolean isEmpty()                 { return placements.isEmpty(); }

    // sección interna como envolvente JTS (z en [0, ancho], y en [0, alto])
    Envelope crossSection() {
        return new Envelope(0, spec.internalWidthMm, 0, spec.internalHeightMm);
    }

    boolean fitsWeight(Bundle b) {
        return currentWeightKg + b.totalWeightKg <= spec.maxPayloadKg + CrossSectionPacker.EPS;
    }
}
