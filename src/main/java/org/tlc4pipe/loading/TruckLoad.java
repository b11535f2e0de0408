package org.tlc4pipe.loading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TruckLoad {

    final int truckNumber;
    final TruckSpec spec;
    final List<PlacedBundle> placements;
    final double totalWeightKg;
    final int rows;

    TruckLoad(ContainerState st) {
        this.truckNumber = st.truckNumber;
        this.spec = st.spec;
        this.placements = Collections.unmodifiableList(new ArrayList<>(st.placements));
        this.totalWeightKg = st.currentWeightKg;
        this.rows = st.placements.isEmpty() ? 0 : st.rowIndex + 1;
    }

    public int truckNumber()               { return truckNumber; }
    public TruckSpec spec()                { return spec; }
    public List<PlacedBundle> placements() { return placements; }
    public double totalWeightKg()          { return totalWeightKg; }
    public int rows()                      { return rows; }

    public List<Bundle> bundles() {
        List<Bundle> out = new ArrayList<>(placements.size());
        for (PlacedBundle p : placements) out.add(p.bundle);
        return out;
    }

    public int bundleCount() { return placements.size(); }

    public int pipeCount() {
        int n = 0;
        for (PlacedBundle p : placements) n += p.bundle.pipeCount();
        return n;
    }

    public double remainingCapacityKg() {
        return Math.max(0.0, spec.maxPayloadKg - totalWeightKg);
    }

    public double weightUtilizationPct() {
        return totalWeightKg / spec.maxPayloadKg * 100.0;
    }

    // área de círculos de los anfitriones / área de la sección. Solo informativo.
    public double crossSectionUtilizationPct() {
        double area = 0.0;
        for (PlacedBundle p : placements) {
            double r = p.diameterMm() / 2.0;
            area += Math.PI * r * r;
        }
        return area / (spec.internalWidthMm * spec.internalHeightMm) * 100.0;
    }

    // altura ocupada por la pila (tope del círculo más alto)
    public double usedHeightMm() {
        double top = 0.0;
        for (PlacedBundle p : placements) top = Math.max(top, p.centerY + p.diameterMm() / 2.0);
        return top;
    }
}
