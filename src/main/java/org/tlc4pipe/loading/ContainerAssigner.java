package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Asignación de paquetes a camiones por First-Fit-Decreasing sobre el peso.
 * <p>
 * Los paquetes se ordenan por peso y luego por DE del anfitrión, ambos descendentes. Cada uno va
 * al primer camión abierto (en orden de apertura) que acepte su peso y su ubicación en la sección;
 * si ninguno lo acepta se abre un camión nuevo. Los camiones nunca se rebalancean.
 * Un paquete que por sí solo excede la carga útil o la sección de un camión vacío se reporta
 * como no ubicable en vez de abrir camiones sin fin.
 */
public final class ContainerAssigner {

    private static final Logger log = LoggerFactory.getLogger(ContainerAssigner.class);

    static final Comparator<Bundle> HEAVIEST_FIRST = Comparator
            .comparingDouble(Bundle::totalWeightKg).reversed()
            .thenComparing(Comparator.comparingDouble(Bundle::footprintDiameterMm).reversed());

    private final CrossSectionPacker packer;

    public ContainerAssigner(CrossSectionPacker packer) {
        this.packer = packer;
    }

    /* Resultado de la asignación. */
    public static final class AssignmentResult {
        final List<ContainerState> containers;
        final List<Bundle> unplaced;

        AssignmentResult(List<ContainerState> containers, List<Bundle> unplaced) {
            this.containers = Collections.unmodifiableList(containers);
            this.unplaced = Collections.unmodifiableList(unplaced);
        }

        public List<ContainerState> containers() { return containers; }
        public List<Bundle> unplaced()           { return unplaced; }
    }

    public AssignmentResult assign(List<Bundle> bundles, TruckSpec template) {
        List<Bundle> sorted = new ArrayList<>(bundles);
        sorted.sort(HEAVIEST_FIRST);

        List<ContainerState> open = new ArrayList<>();
        List<Bundle> unplaced = new ArrayList<>();

        for (Bundle b : sorted) {
            if (!feasible(b, template)) {
                log.warn("Paquete no ubicable en ningún camión {}: {}", template.name, b);
                unplaced.add(b);
                continue;
            }

            boolean ok = false;
            for (ContainerState c : open) {
                if (place(c, b)) { ok = true; break; }
            }
            if (!ok) {
                ContainerState fresh = new ContainerState(open.size() + 1, template);
                if (!place(fresh, b)) {
                    // feasible() garantiza que un camión vacío lo acepta
                    throw new IllegalStateException("Camión vacío rechazó un paquete factible: " + b);
                }
                open.add(fresh);
                log.debug("Camión {} abierto por {}", fresh.truckNumber, b.describe());
            }
        }
        return new AssignmentResult(open, unplaced);
    }

    // un paquete es factible si entra solo en un camión vacío
    public static boolean feasible(Bundle b, TruckSpec template) {
        return b.totalWeightKg <= template.maxPayloadKg + CrossSectionPacker.EPS
                && CrossSectionPacker.fitsEmpty(template, b);
    }

    private boolean place(ContainerState c, Bundle b) {
        if (!c.fitsWeight(b)) return false;
        if (packer.tryPlace(c, b).isEmpty()) return false;
        c.currentWeightKg += b.totalWeightKg;
        return true;
    }
}
