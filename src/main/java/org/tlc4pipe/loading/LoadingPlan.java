package org.tlc4pipe.loading;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Plan de carga de un pedido: camiones en orden de apertura, paquetes no ubicables, agregados y avisos.
 * Valor de retorno; el motor no lo conserva.
 */
public final class LoadingPlan {

    final double pipeLengthM;
    final boolean nestingEnabled;
    final TruckSpec truckSpec;
    final List<TruckLoad> trucks;
    final List<Bundle> unplacedBundles;
    final List<String> warnings;
    final int totalPipes;
    final int nestedPipes;
    final double totalWeightKg;
    final long elapsedMs;

    LoadingPlan(double pipeLengthM, boolean nestingEnabled, TruckSpec truckSpec, List<TruckLoad> trucks,
                List<Bundle> unplacedBundles, List<String> warnings, int totalPipes, int nestedPipes,
                double totalWeightKg, long elapsedMs) {
        this.pipeLengthM = pipeLengthM;
        this.nestingEnabled = nestingEnabled;
        this.truckSpec = truckSpec;
        this.trucks = Collections.unmodifiableList(trucks);
        this.unplacedBundles = Collections.unmodifiableList(unplacedBundles);
        this.warnings = Collections.unmodifiableList(warnings);
        this.totalPipes = totalPipes;
        this.nestedPipes = nestedPipes;
        this.totalWeightKg = totalWeightKg;
        this.elapsedMs = elapsedMs;
    }

    public double pipeLengthM()            { return pipeLengthM; }
    public boolean nestingEnabled()        { return nestingEnabled; }
    public TruckSpec truckSpec()           { return truckSpec; }
    public List<TruckLoad> trucks()        { return trucks; }
    public int trucksNeeded()              { return trucks.size(); }
    public List<Bundle> unplacedBundles()  { return unplacedBundles; }
    public List<String> warnings()         { return warnings; }
    public int totalPipes()                { return totalPipes; }
    public int nestedPipes()               { return nestedPipes; }
    public double totalWeightKg()          { return totalWeightKg; }
    public long elapsedMs()                { return elapsedMs; }

    public double placedWeightKg() {
        return trucks.stream().mapToDouble(t -> t.totalWeightKg).sum();
    }

    public int bundleCount() {
        return trucks.stream().mapToInt(TruckLoad::bundleCount).sum() + unplacedBundles.size();
    }

    public int bundlesWithNesting() {
        int n = 0;
        for (TruckLoad t : trucks) for (PlacedBundle p : t.placements) if (!p.bundle.isSingleton()) n++;
        for (Bundle b : unplacedBundles) if (!b.isSingleton()) n++;
        return n;
    }

    public int maxDepthUsed() {
        int max = 0;
        for (TruckLoad t : trucks) for (PlacedBundle p : t.placements) max = Math.max(max, p.bundle.depth());
        for (Bundle b : unplacedBundles) max = Math.max(max, b.depth());
        return max;
    }

    // tubos alojados dentro de otro / total de tubos
    public double nestingEfficiency() {
        return totalPipes > 0 ? (double) nestedPipes / totalPipes : 0.0;
    }

    public double nestingEfficiencyPct() {
        return nestingEfficiency() * 100.0;
    }

    public boolean isComplete() {
        return unplacedBundles.isEmpty();
    }

    // bloque de resumen, con separador de miles y 3 decimales (1,468,792.762)
    public String formatSummary() {
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f1 = new DecimalFormat("#,##0.0", sym);
        DecimalFormat f0 = new DecimalFormat("#,##0", sym);

        StringBuilder sb = new StringBuilder();
        sb.append("------------------------------\n");
        sb.append("LOADING PLAN SUMMARY\n");
        sb.append("Truck template     : ").append(truckSpec.name).append("\n");
        sb.append("Pipe length        : ").append(f3.format(pipeLengthM)).append(" m\n");
        sb.append("Nesting            : ").append(nestingEnabled ? "enabled" : "disabled").append("\n");
        sb.append("Total pipes        : ").append(totalPipes).append("\n");
        sb.append("Nested pipes       : ").append(nestedPipes).append("\n");
        sb.append("Bundles            : ").append(bundleCount()).append(" (with nesting: ").append(bundlesWithNesting()).append(")\n");
        sb.append("Nesting efficiency : ").append(f3.format(nestingEfficiencyPct())).append(" %\n");
        sb.append("Total weight       : ").append(f3.format(totalWeightKg)).append(" kg\n");
        sb.append("Trucks needed      : ").append(trucks.size()).append("\n");
        for (TruckLoad t : trucks) {
            sb.append(String.format(Locale.US, "  Truck %02d         : ", t.truckNumber))
              .append(f3.format(t.totalWeightKg)).append(" kg (").append(f1.format(t.weightUtilizationPct())).append(" %) | ")
              .append(t.bundleCount()).append(" bundles | ").append(t.pipeCount()).append(" pipes | ")
              .append(t.rows).append(" rows | section ").append(f1.format(t.crossSectionUtilizationPct())).append(" %\n");
        }
        sb.append("Unplaced bundles   : ").append(unplacedBundles.size()).append("\n");
        sb.append("Warnings           : ").append(warnings.size()).append("\n");
        sb.append("Elapsed            : ").append(f0.format(elapsedMs)).append(" ms\n");
        sb.append("------------------------------");
        return sb.toString();
    }
}
