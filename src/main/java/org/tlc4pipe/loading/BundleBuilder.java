package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Constructor de paquetes "Matryoshka".
 * <p>
 * Heurística voraz de una sola pasada, no un solucionador óptimo: toma el tubo más grande que
 * queda como anfitrión, le mete el mayor huésped compatible y repite hacia adentro hasta
 * {@code maxLevels}. No hace backtracking si una elección local empeora el resultado global y
 * aloja una sola cadena por anfitrión (sin varios tubos chicos lado a lado).
 */
public final class BundleBuilder {

    private static final Logger log = LoggerFactory.getLogger(BundleBuilder.class);

    // orden de anfitriones: DE desc, DI desc, código
    static final Comparator<PipeType> LARGEST_FIRST = Comparator
            .comparingDouble((PipeType p) -> p.outerDiameterMm).reversed()
            .thenComparing(Comparator.comparingDouble((PipeType p) -> p.innerDiameterMm).reversed())
            .thenComparing(p -> p.code);

    private final LoadingSettings settings;
    private final GuestSelector selector;

    public BundleBuilder(LoadingSettings settings) {
        this(settings, LargestFitSelector.INSTANCE);
    }

    public BundleBuilder(LoadingSettings settings, GuestSelector selector) {
        this.settings = settings;
        this.selector = selector;
    }

    /* Resultado del armado. */
    public static final class NestingResult {
        final List<Bundle> bundles;
        final List<String> warnings;
        final int totalPipes;
        final int nestedPipes;

        NestingResult(List<Bundle> bundles, List<String> warnings) {
            this.bundles = Collections.unmodifiableList(bundles);
            this.warnings = Collections.unmodifiableList(warnings);
            this.totalPipes = bundles.stream().mapToInt(Bundle::pipeCount).sum();
            this.nestedPipes = bundles.stream().mapToInt(Bundle::nestedCount).sum();
        }

        public List<Bundle> bundles()  { return bundles; }
        public List<String> warnings() { return warnings; }
        public int totalPipes()        { return totalPipes; }
        public int nestedPipes()       { return nestedPipes; }

        public List<Bundle> singletons() {
            List<Bundle> out = new ArrayList<>();
            for (Bundle b : bundles) if (b.isSingleton()) out.add(b);
            return out;
        }
    }

    // arma los paquetes para el pedido completo
    public NestingResult build(List<OrderLine> lines, double pipeLengthM) {
        Map<PipeType, Integer> remaining = collect(lines);
        List<PipeType> types = new ArrayList<>(remaining.keySet());
        types.sort(LARGEST_FIRST);

        List<Bundle> bundles = new ArrayList<>();
        Set<String> warnings = new LinkedHashSet<>();
        int maxLevels = settings.maxLevels;

        for (PipeType hostType : types) {
            while (remaining.get(hostType) > 0) {
                take(remaining, hostType);
                List<PipeType> chain = new ArrayList<>(maxLevels);
                chain.add(hostType);

                PipeType host = hostType;
                while (chain.size() < maxLevels) {
                    Optional<PipeType> guest = selector.select(host, available(types, remaining), settings);
                    if (guest.isEmpty()) break;
                    PipeType g = guest.get();
                    take(remaining, g);
                    warnings.addAll(NestingValidator.pairAdvisories(host, g, settings));
                    chain.add(g);
                    host = g;
                }

                Bundle b = new Bundle(chain, pipeLengthM, settings.heavyExtractionThresholdKg);
                if (log.isDebugEnabled()) log.debug("Paquete {}: {}", bundles.size() + 1, b);
                bundles.add(b);
            }
        }

        NestingResult r = new NestingResult(bundles, new ArrayList<>(warnings));
        log.debug("Telescopado: paquetes={} tubos={} anidados={}", bundles.size(), r.totalPipes, r.nestedPipes);
        return r;
    }

    // sin telescopado: cada tubo es su propio paquete
    public NestingResult singletons(List<OrderLine> lines, double pipeLengthM) {
        Map<PipeType, Integer> remaining = collect(lines);
        List<PipeType> types = new ArrayList<>(remaining.keySet());
        types.sort(LARGEST_FIRST);
        List<Bundle> bundles = new ArrayList<>();
        for (PipeType t : types) {
            for (int i = 0; i < remaining.get(t); i++) {
                bundles.add(Bundle.single(t, pipeLengthM, settings.heavyExtractionThresholdKg));
            }
        }
        return new NestingResult(bundles, new ArrayList<>());
    }

    // agrupa líneas repetidas del mismo tipo
    static Map<PipeType, Integer> collect(List<OrderLine> lines) {
        Map<PipeType, Integer> m = new LinkedHashMap<>();
        for (OrderLine l : lines) m.merge(l.pipeType, l.quantity, Integer::sum);
        return m;
    }

    private static List<PipeType> available(List<PipeType> types, Map<PipeType, Integer> remaining) {
        List<PipeType> out = new ArrayList<>();
        for (PipeType t : types) if (remaining.get(t) > 0) out.add(t);
        return out;
    }

    private static void take(Map<PipeType, Integer> remaining, PipeType t) {
        remaining.merge(t, -1, Integer::sum);
    }
}
