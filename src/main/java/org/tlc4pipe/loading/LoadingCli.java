package org.tlc4pipe.loading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Uso: {@code LoadingCli <pedido.csv> [largoM] [dirSalida] [standard|mega|eu] [--no-nesting]}
 */
public class LoadingCli {

    private static final Logger log = LoggerFactory.getLogger(LoadingCli.class);

    public static void main(String[] args) throws Exception {
        boolean nesting = true;
        List<String> positional = new ArrayList<>();
        for (String a : args) {
            if (a.equals("--no-nesting")) nesting = false;
            else positional.add(a);
        }
        if (positional.isEmpty()) {
            System.err.println("Uso: LoadingCli <pedido.csv> [largoM] [dirSalida] [standard|mega|eu] [--no-nesting]");
            System.exit(2);
        }

        Path orderCsv = Paths.get(positional.get(0));
        double pipeLength = positional.size() >= 2 ? Double.parseDouble(positional.get(1)) : 12.0;
        Path outDir = Paths.get(positional.size() >= 3 ? positional.get(2) : "out");
        TruckSpec truck = positional.size() >= 4 ? TruckSpec.preset(positional.get(3)) : TruckSpec.STANDARD_24T;

        // 1) Leer pedido
        OrderCsvReader.ParseResult parsed = OrderCsvReader.parse(orderCsv);
        parsed.warnings().forEach(w -> log.warn("{}", w));
        parsed.errors().forEach(e -> log.warn("{}", e));
        if (parsed.items().isEmpty()) throw new IllegalStateException("No se encontraron líneas válidas en " + orderCsv);

        // 2) Planificar
        LoadingSettings settings = LoadingSettings.load();
        LoadingPlanner planner = new LoadingPlanner(settings, PipeCatalog.loadDefault());
        LoadingPlan plan = planner.plan(new LoadRequest(parsed.toRequestItems(), pipeLength, nesting, settings.maxLevels(), truck));

        plan.warnings().forEach(w -> log.warn("{}", w));

        // 3) Exportar SVG por camión
        for (TruckLoad t : plan.trucks()) {
            Path svg = outDir.resolve(String.format(Locale.ROOT, "truck-%02d.svg", t.truckNumber()));
            SvgWriter.write(t, svg);
            log.info("SVG generado en: {}", svg);
        }
        if (!plan.isComplete()) System.exit(1);
    }
}
