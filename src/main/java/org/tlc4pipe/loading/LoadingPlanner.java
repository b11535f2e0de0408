package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Punto de entrada del motor de carga: valida el pedido, arma paquetes, los asigna a camiones y
 * devuelve el {@link LoadingPlan}.
 * <p>
 * Sin estado compartido: cada llamada crea sus propios paquetes y camiones, así que varias
 * corridas pueden ejecutarse en paralelo sin coordinación. No hace I/O ni bloquea.
 */
public final class LoadingPlanner {

    private static final Logger log = LoggerFactory.getLogger(LoadingPlanner.class);

    private final LoadingSettings settings;
    private final PipeCatalog catalog;
    private final GuestSelector selector;

    public LoadingPlanner(LoadingSettings settings, PipeCatalog catalog) {
        this(settings, catalog, LargestFitSelector.INSTANCE);
    }

    public LoadingPlanner(LoadingSettings settings, PipeCatalog catalog, GuestSelector selector) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.catalog = catalog;
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    // planificador sin catálogo: solo acepta líneas ya resueltas
    public LoadingPlanner(LoadingSettings settings) {
        this(settings, null);
    }

    public LoadingSettings settings() { return settings; }

    // resuelve los códigos contra el catálogo y planifica
    public LoadingPlan plan(LoadRequest req) {
        return plan(resolve(req), req.pipeLengthM, req.nestingEnabled, req.maxLevels, req.truck);
    }

    // valida y resuelve todos los ítems; junta todos los errores antes de lanzar
    public List<OrderLine> resolve(LoadRequest req) {
        if (catalog == null) throw new IllegalStateException("Planificador sin catálogo de tubos");
        List<String> errors = new ArrayList<>();
        List<OrderLine> lines = new ArrayList<>(req.items.size());
        long totalPipes = 0;
        for (int i = 0; i < req.items.size(); i++) {
            LoadRequest.Item it = req.items.get(i);
            Optional<PipeType> type = catalog.find(it.pipeCode);
            boolean ok = true;
            if (type.isEmpty()) {
                errors.add("Item " + (i + 1) + ": unknown pipe type '" + it.pipeCode + "'");
                ok = false;
            }
            if (it.quantity < 1) {
                errors.add("Item " + (i + 1) + ": quantity must be >= 1 (got " + it.quantity + ")");
                ok = false;
            }
            if (ok) {
                lines.add(new OrderLine(type.get(), it.quantity));
                totalPipes += it.quantity;
            }
        }
        checkRun(errors, req.items.isEmpty(), totalPipes, req.pipeLengthM, req.maxLevels);
        if (!errors.isEmpty()) throw new InvalidOrderException(errors);
        return lines;
    }

    public LoadingPlan plan(List<OrderLine> lines, double pipeLengthM, boolean nestingEnabled, int maxLevels, TruckSpec truck) {
        Objects.requireNonNull(truck, "truck");
        List<String> errors = new ArrayList<>();
        long totalPipes = lines.stream().mapToLong(l -> l.quantity).sum();
        checkRun(errors, lines.isEmpty(), totalPipes, pipeLengthM, maxLevels);
        if (!errors.isEmpty()) throw new InvalidOrderException(errors);

        long t0 = System.currentTimeMillis();
        LoadingSettings run = settings.toBuilder().maxLevels(maxLevels).build();
        log.info("Inicio de cálculo: líneas={} tubos={} largo={}m telescopado={} niveles={} camión={}",
                lines.size(), totalPipes, pipeLengthM, nestingEnabled, maxLevels, truck.name);

        // 1) paquetes
        BundleBuilder builder = new BundleBuilder(run, selector);
        BundleBuilder.NestingResult nesting = nestingEnabled
                ? builder.build(lines, pipeLengthM)
                : builder.singletons(lines, pipeLengthM);

        // 2) camiones + sección transversal
        ContainerAssigner assigner = new ContainerAssigner(new CrossSectionPacker(run));
        ContainerAssigner.AssignmentResult assigned = assigner.assign(nesting.bundles, truck);

        List<TruckLoad> trucks = new ArrayList<>(assigned.containers.size());
        for (ContainerState c : assigned.containers) trucks.add(new TruckLoad(c));

        // 3) avisos
        double totalWeight = nesting.bundles.stream().mapToDouble(Bundle::totalWeightKg).sum();
        List<String> warnings = new ArrayList<>(nesting.warnings);
        warnings.addAll(advisories(trucks, assigned.unplaced, totalWeight, pipeLengthM, truck, run));

        LoadingPlan plan = new LoadingPlan(pipeLengthM, nestingEnabled, truck, trucks, assigned.unplaced,
                warnings, nesting.totalPipes, nesting.nestedPipes, totalWeight, System.currentTimeMillis() - t0);

        log.info("Fin de cálculo: camiones={} peso={}kg no_ubicados={} avisos={}",
                trucks.size(), String.format(Locale.US, "%.2f", totalWeight), assigned.unplaced.size(), warnings.size());
        log.info("\n{}", plan.formatSummary());
        return plan;
    }

    private void checkRun(List<String> errors, boolean empty, long totalPipes, double pipeLengthM, int maxLevels) {
        if (empty) errors.add("Order has no items");
        if (totalPipes > settings.maxPipesPerOrder) {
            errors.add("Order has " + totalPipes + " pipes, limit is " + settings.maxPipesPerOrder);
        }
        if (!(pipeLengthM > 0)) {
            errors.add("Pipe length must be > 0 (got " + pipeLengthM + ")");
        } else if (pipeLengthM < settings.minPipeLengthM || pipeLengthM > settings.maxPipeLengthM) {
            errors.add(String.format(Locale.US, "Pipe length %.2fm outside allowed range %.1f-%.1fm",
                    pipeLengthM, settings.minPipeLengthM, settings.maxPipeLengthM));
        }
        if (maxLevels < 1) errors.add("Max nesting levels must be >= 1 (got " + maxLevels + ")");
    }

    static List<String> advisories(List<TruckLoad> trucks, List<Bundle> unplaced, double totalWeight,
                                   double pipeLengthM, TruckSpec truck, LoadingSettings s) {
        List<String> out = new ArrayList<>();

        for (TruckLoad t : trucks) {
            for (PlacedBundle p : t.placements) {
                Bundle b = p.bundle;
                if (b.extractionWarning) {
                    out.add(String.format(Locale.US,
                            "Truck %d: bundle %s has %.0fkg nested inside %s - requires heavy equipment for extraction",
                            t.truckNumber, b.describe(), b.innerWeightKg, b.host().code));
                }
            }
        }

        for (Bundle b : unplaced) {
            String reason = b.totalWeightKg > truck.maxPayloadKg
                    ? String.format(Locale.US, "weight %.0fkg exceeds payload %.0fkg", b.totalWeightKg, truck.maxPayloadKg)
                    : String.format(Locale.US, "diameter %.0fmm exceeds cross-section %.0fx%.0fmm",
                            b.footprintDiameterMm(), truck.internalWidthMm, truck.internalHeightMm);
            out.add("Bundle " + b.describe() + " cannot be placed in any truck: " + reason);
            if (b.extractionWarning) {
                out.add(String.format(Locale.US,
                        "Unplaced bundle %s has %.0fkg nested inside %s - requires heavy equipment for extraction",
                        b.describe(), b.innerWeightKg, b.host().code));
            }
        }

        if (totalWeight > truck.maxPayloadKg) {
            out.add(String.format(Locale.US, "Order exceeds single truck capacity by %.0fkg", totalWeight - truck.maxPayloadKg));
            log.warn("Pedido excede la carga útil de un camión: peso={}kg", String.format(Locale.US, "%.2f", totalWeight));
        }

        double nearLimit = truck.maxPayloadKg * (1.0 - s.weightSafetyMarginPct / 100.0);
        for (TruckLoad t : trucks) {
            if (t.totalWeightKg >= nearLimit) {
                out.add(String.format(Locale.US, "Truck %d: load %.0fkg is within %.1f%% of payload limit %.0fkg",
                        t.truckNumber, t.totalWeightKg, s.weightSafetyMarginPct, truck.maxPayloadKg));
            }
            if (t.weightUtilizationPct() < s.lowUtilizationPct) {
                out.add(String.format(Locale.US, "Truck %d: only %.1f%% of payload used, %.0fkg capacity remaining",
                        t.truckNumber, t.weightUtilizationPct(), t.remainingCapacityKg()));
            }
            stackingAdvisory(t).ifPresent(out::add);
        }

        if (pipeLengthM * 1000.0 > truck.internalLengthMm) {
            out.add(String.format(Locale.US, "Pipe length %.2fm exceeds truck internal length %.0fmm",
                    pipeLengthM, truck.internalLengthMm));
        }
        return out;
    }

    // la regla más restrictiva entre los anfitriones del camión
    static Optional<String> stackingAdvisory(TruckLoad t) {
        PipeType worst = null;
        int worstLimit = Integer.MAX_VALUE;
        for (PlacedBundle p : t.placements) {
            int limit = StackingLimits.maxLayers(p.bundle.host());
            if (limit < worstLimit) { worstLimit = limit; worst = p.bundle.host(); }
        }
        if (worst == null || t.rows <= worstLimit) return Optional.empty();
        return Optional.of(String.format(Locale.US,
                "Truck %d: %d stacking rows exceed the safe limit of %d for %s (SDR%d)",
                t.truckNumber, t.rows, worstLimit, worst.code, worst.sdr));
    }
}
