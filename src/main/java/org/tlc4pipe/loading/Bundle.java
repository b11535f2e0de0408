package org.tlc4pipe.loading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Paquete telescopado: cadena plana de tipos ordenada de exterior a interior.
 * El primer elemento es el anfitrión; una cadena de largo 1 es un tubo suelto (singleton).
 * Inmutable: pesos y aviso de extracción se calculan al construir.
 */
public final class Bundle {

    final List<PipeType> chain;
    final double pipeLengthM;
    final double totalWeightKg;
    final double innerWeightKg;
    final double extractionThresholdKg;
    final boolean extractionWarning;

    Bundle(List<PipeType> chain, double pipeLengthM, double heavyExtractionThresholdKg) {
        if (chain.isEmpty()) throw new IllegalArgumentException("Un paquete necesita al menos un tubo");
        this.chain = Collections.unmodifiableList(new ArrayList<>(chain));
        this.pipeLengthM = pipeLengthM;
        // de adentro hacia afuera
        double total = 0.0;
        for (int i = this.chain.size() - 1; i >= 0; i--) {
            total += this.chain.get(i).unitWeightKg(pipeLengthM);
        }
        this.totalWeightKg = total;
        this.innerWeightKg = total - this.chain.get(0).unitWeightKg(pipeLengthM);
        this.extractionThresholdKg = heavyExtractionThresholdKg;
        this.extractionWarning = innerWeightKg > heavyExtractionThresholdKg;
    }

    public static Bundle single(PipeType pipe, double pipeLengthM, double heavyExtractionThresholdKg) {
        return new Bundle(List.of(pipe), pipeLengthM, heavyExtractionThresholdKg);
    }

    public static Bundle of(List<PipeType> chain, double pipeLengthM, double heavyExtractionThresholdKg) {
        return new Bundle(chain, pipeLengthM, heavyExtractionThresholdKg);
    }

    public PipeType host()              { return chain.get(0); }
    public List<PipeType> chain()       { return chain; }
    public int depth()                  { return chain.size(); }
    public int pipeCount()              { return chain.size(); }
    public int nestedCount()            { return chain.size() - 1; }
    public boolean isSingleton()        { return chain.size() == 1; }
    public double pipeLengthM()         { return pipeLengthM; }
    public double totalWeightKg()       { return totalWeightKg; }
    public double innerWeightKg()       { return innerWeightKg; }
    public boolean extractionWarning()  { return extractionWarning; }

    // la huella en la sección es la del anfitrión; los huéspedes quedan contenidos
    public double footprintDiameterMm() { return host().outerDiameterMm; }

    // sub-paquete alojado dentro del anfitrión (vacío si es singleton)
    public Optional<Bundle> guest() {
        if (isSingleton()) return Optional.empty();
        return Optional.of(new Bundle(chain.subList(1, chain.size()), pipeLengthM, extractionThresholdKg));
    }

    public String describe() {
        return chain.stream().map(p -> p.code).collect(Collectors.joining(" > "));
    }

    @Override public String toString() {
        return String.format(Locale.US, "Bundle[%s | %.1fkg%s]", describe(), totalWeightKg,
                extractionWarning ? " | EXTRACTION" : "");
    }
}
