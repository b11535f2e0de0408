package org.tlc4pipe.loading;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LoadingPlannerTest {

    private static PipeCatalog catalog;
    private static LoadingPlanner planner;

    @BeforeAll
    static void setUp() {
        catalog = PipeCatalog.loadDefault();
        planner = new LoadingPlanner(LoadingSettings.defaults(), catalog);
    }

    private static LoadRequest request(double lengthM, boolean nesting, LoadRequest.Item... items) {
        return new LoadRequest(List.of(items), lengthM, nesting, 4, TruckSpec.STANDARD_24T);
    }

    private static LoadRequest mixedOrder() {
        List<LoadRequest.Item> items = new ArrayList<>();
        int i = 0;
        for (PipeType t : catalog.all()) {
            if (t.outerDiameterMm() > 630) continue;
            items.add(new LoadRequest.Item(t.code(), 1 + (i++ % 4)));
        }
        return new LoadRequest(items, 12.0, true, 4, TruckSpec.STANDARD_24T);
    }

    // firma comparable de un plan: contenido de cada camión en orden
    private static List<String> signature(LoadingPlan plan) {
        List<String> out = new ArrayList<>();
        for (TruckLoad t : plan.trucks()) {
            StringBuilder sb = new StringBuilder("T" + t.truckNumber() + ":");
            for (PlacedBundle p : t.placements()) {
                sb.append(p.bundle().describe()).append('@').append(p.row()).append('/').append(p.centerZ()).append(';');
            }
            out.add(sb.toString());
        }
        for (Bundle b : plan.unplacedBundles()) out.add("U:" + b.describe());
        return out;
    }

    @Test
    void testPlanConservesPipesAndRespectsBounds() {
        LoadRequest req = mixedOrder();
        int ordered = req.items().stream().mapToInt(LoadRequest.Item::quantity).sum();

        LoadingPlan plan = planner.plan(req);

        assertTrue(plan.isComplete());
        assertEquals(ordered, plan.totalPipes());
        assertEquals(ordered, plan.trucks().stream().mapToInt(TruckLoad::pipeCount).sum());
        assertEquals(plan.totalWeightKg(), plan.placedWeightKg(), 1e-6);
        for (TruckLoad t : plan.trucks()) {
            assertTrue(t.totalWeightKg() <= TruckSpec.STANDARD_24T.maxPayloadKg() + 1e-6);
            assertTrue(t.usedHeightMm() <= TruckSpec.STANDARD_24T.internalHeightMm() + 1e-6);
            for (Bundle b : t.bundles()) assertTrue(b.depth() <= 4);
        }
        assertTrue(plan.maxDepthUsed() <= 4);
        assertTrue(plan.nestedPipes() > 0);
    }

    @Test
    void testNestingEfficiency() {
        LoadingPlan plan = planner.plan(request(12.0, true,
                new LoadRequest.Item("TPE400/PN6", 1), new LoadRequest.Item("TPE315/PN6", 1),
                new LoadRequest.Item("TPE250/PN6", 1), new LoadRequest.Item("TPE200/PN6", 1),
                new LoadRequest.Item("TPE160/PN6", 1)));

        assertEquals(5, plan.totalPipes());
        assertEquals(3, plan.nestedPipes());
        assertEquals(0.6, plan.nestingEfficiency(), 1e-9);
        assertEquals(2, plan.bundleCount());
        assertEquals(1, plan.bundlesWithNesting());
        assertEquals(4, plan.maxDepthUsed());
        assertEquals(1, plan.trucksNeeded());
    }

    @Test
    void testNestingDisabledShipsEveryPipeAlone() {
        LoadingPlan plan = planner.plan(request(12.0, false,
                new LoadRequest.Item("TPE400/PN6", 2), new LoadRequest.Item("TPE315/PN6", 2)));

        assertEquals(0, plan.nestedPipes());
        assertEquals(4, plan.bundleCount());
        assertEquals(0.0, plan.nestingEfficiency());
        assertFalse(plan.nestingEnabled());
    }

    @Test
    void testOverflowToSecondTruckWithWarnings() {
        PipeType p500 = PipeType.of("P500", 500, 440, 26, 168.7);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        LoadingPlan plan = bare.plan(List.of(new OrderLine(p500, 11)), 13.0, true, 4, TruckSpec.STANDARD_24T);

        assertEquals(2, plan.trucksNeeded());
        assertEquals(10, plan.trucks().get(0).bundleCount());
        assertEquals(1, plan.trucks().get(1).bundleCount());
        assertTrue(plan.warnings().contains("Order exceeds single truck capacity by 124kg"), plan.warnings().toString());
        assertTrue(plan.warnings().stream().anyMatch(w -> w.startsWith("Truck 2: only 9.1% of payload used")));
        assertTrue(plan.warnings().stream().noneMatch(w -> w.startsWith("Truck 1: only")));
        assertTrue(plan.warnings().stream().noneMatch(w -> w.contains("of payload limit")), "91% load is not near the limit");
    }

    @Test
    void testTruckNearPayloadLimitIsFlagged() {
        PipeType heavy = PipeType.of("P200", 200, 160, 11, 200.0);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        LoadingPlan plan = bare.plan(List.of(new OrderLine(heavy, 10)), 11.9, true, 4, TruckSpec.STANDARD_24T);

        assertEquals(1, plan.trucksNeeded());
        assertEquals(23_800.0, plan.trucks().get(0).totalWeightKg(), 1e-6);
        assertTrue(plan.warnings().contains("Truck 1: load 23800kg is within 2.0% of payload limit 24000kg"),
                plan.warnings().toString());
    }

    @Test
    void testUnplacedBundleKeepsExtractionWarning() {
        PipeType host = PipeType.of("H1000", 1000, 900, 26, 1900.0);
        PipeType guest = PipeType.of("G600", 600, 540, 26, 300.0);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        LoadingPlan plan = bare.plan(List.of(new OrderLine(host, 1), new OrderLine(guest, 1)), 12.0, true, 4, TruckSpec.STANDARD_24T);

        assertEquals(1, plan.unplacedBundles().size());
        assertTrue(plan.unplacedBundles().get(0).extractionWarning());
        assertTrue(plan.warnings().contains(
                "Unplaced bundle H1000 > G600 has 3600kg nested inside H1000 - requires heavy equipment for extraction"),
                plan.warnings().toString());
    }

    @Test
    void testUnplaceableBundleIsReported() {
        PipeType monster = PipeType.of("HUGE", 400, 360, 26, 2100.0);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        LoadingPlan plan = bare.plan(List.of(new OrderLine(monster, 1),
                new OrderLine(catalog.find("TPE110/PN6").orElseThrow(), 2)), 12.0, false, 4, TruckSpec.STANDARD_24T);

        assertFalse(plan.isComplete());
        assertEquals(1, plan.unplacedBundles().size());
        assertEquals(1, plan.trucksNeeded());
        assertTrue(plan.warnings().stream().anyMatch(w -> w.startsWith("Bundle HUGE cannot be placed in any truck: weight")));
    }

    @Test
    void testExtractionAndLengthWarnings() {
        PipeType host = PipeType.of("H1000", 1000, 900, 26, 50.0);
        PipeType guest = PipeType.of("G600", 600, 540, 26, 150.0);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        LoadingPlan plan = bare.plan(List.of(new OrderLine(host, 1), new OrderLine(guest, 1)), 18.0, true, 4, TruckSpec.STANDARD_24T);

        // 150 kg/m * 18 m = 2700 kg adentro
        assertTrue(plan.warnings().stream().anyMatch(w -> w.startsWith("Truck 1: bundle H1000 > G600") && w.contains("heavy equipment")));
        assertTrue(plan.warnings().stream().anyMatch(w -> w.startsWith("Pipe length 18.00m exceeds truck internal length")));
    }

    @Test
    void testInvalidRequestCollectsAllErrors() {
        LoadRequest req = new LoadRequest(List.of(
                new LoadRequest.Item("TPE999/PN6", 1),
                new LoadRequest.Item("TPE110/PN6", 0)), -1.0, true, 0, TruckSpec.STANDARD_24T);

        InvalidOrderException e = assertThrows(InvalidOrderException.class, () -> planner.plan(req));

        assertEquals(4, e.getErrors().size(), e.getErrors().toString());
        assertEquals("Item 1: unknown pipe type 'TPE999/PN6'", e.getErrors().get(0));
        assertEquals("Item 2: quantity must be >= 1 (got 0)", e.getErrors().get(1));
        assertTrue(e.getMessage().startsWith("Invalid order: "));
    }

    @Test
    void testEmptyOrderRejected() {
        InvalidOrderException e = assertThrows(InvalidOrderException.class, () -> planner.plan(request(12.0, true)));
        assertEquals(List.of("Order has no items"), e.getErrors());
    }

    @Test
    void testPipeLengthOutsideRangeRejected() {
        InvalidOrderException e = assertThrows(InvalidOrderException.class,
                () -> planner.plan(request(20.0, true, new LoadRequest.Item("TPE110/PN6", 1))));
        assertTrue(e.getErrors().get(0).startsWith("Pipe length 20.00m outside allowed range"));
    }

    @Test
    void testOrderSizeLimit() {
        LoadingPlanner small = new LoadingPlanner(LoadingSettings.defaults().toBuilder().maxPipesPerOrder(10).build(), catalog);

        InvalidOrderException e = assertThrows(InvalidOrderException.class,
                () -> small.plan(request(12.0, true, new LoadRequest.Item("TPE110/PN6", 11))));
        assertEquals("Order has 11 pipes, limit is 10", e.getErrors().get(0));
    }

    @Test
    void testPlannerWithoutCatalogCannotResolveCodes() {
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());
        assertThrows(IllegalStateException.class, () -> bare.plan(request(12.0, true, new LoadRequest.Item("TPE110/PN6", 1))));
    }

    @Test
    void testSameRequestGivesSamePlan() {
        LoadRequest req = mixedOrder();
        assertEquals(signature(planner.plan(req)), signature(planner.plan(req)));
    }

    @Test
    void testConcurrentRunsAreIndependent() throws Exception {
        LoadRequest req = mixedOrder();
        List<String> expected = signature(planner.plan(req));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<LoadingPlan>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) futures.add(pool.submit(() -> planner.plan(req)));
            for (Future<LoadingPlan> f : futures) {
                assertEquals(expected, signature(f.get(30, TimeUnit.SECONDS)));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testSummaryBlock() {
        LoadingPlan plan = planner.plan(request(12.0, true, new LoadRequest.Item("TPE400/PN6", 1), new LoadRequest.Item("TPE315/PN6", 1)));

        String summary = plan.formatSummary();

        assertTrue(summary.contains("LOADING PLAN SUMMARY"));
        assertTrue(summary.contains("Trucks needed      : 1"));
        assertTrue(summary.contains("Total weight       : 366.120 kg"), summary);
    }

    @Test
    void testStackingAdvisory() {
        PipeType thin = PipeType.of("THIN250", 250, 230.8, 26, 0.5);
        LoadingPlanner bare = new LoadingPlanner(LoadingSettings.defaults());

        // 9 x 250 por fila en 2480mm: 60 unidades ocupan varias filas, más de 4 para SDR26
        LoadingPlan plan = bare.plan(List.of(new OrderLine(thin, 60)), 12.0, false, 1, TruckSpec.STANDARD_24T);

        TruckLoad t = plan.trucks().get(0);
        assertTrue(t.rows() > 4);
        assertTrue(LoadingPlanner.stackingAdvisory(t).isPresent());
        assertTrue(plan.warnings().stream().anyMatch(w -> w.contains("stacking rows exceed the safe limit of 4 for THIN250")));
    }
}
