package org.tlc4pipe.loading;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContainerAssignerTest {

    private static final TruckSpec TRUCK = TruckSpec.STANDARD_24T;

    private static Bundle bundle(String code, double od, double kgPerMeter, double lengthM) {
        return Bundle.single(PipeType.of(code, od, od * 0.9, 26, kgPerMeter), lengthM, 2000.0);
    }

    private static ContainerAssigner assigner() {
        return new ContainerAssigner(new CrossSectionPacker(20.0));
    }

    @Test
    void testElevenHeavyBundlesNeedTwoTrucks() {
        List<Bundle> bundles = new ArrayList<>();
        for (int i = 0; i < 11; i++) bundles.add(bundle("P500", 500, 168.7, 13.0));

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, TRUCK);

        assertEquals(2, r.containers().size());
        assertTrue(r.unplaced().isEmpty());
        assertEquals(10, r.containers().get(0).placements().size());
        assertEquals(1, r.containers().get(1).placements().size());
        assertEquals(21_931.0, r.containers().get(0).currentWeightKg(), 1e-6);
        assertEquals(2_193.1, r.containers().get(1).currentWeightKg(), 1e-6);
    }

    @Test
    void testFirstFitRevisitsEarlierTrucks() {
        List<Bundle> bundles = List.of(
                bundle("W3000", 200, 300, 10.0),
                bundle("W15000", 200, 1500, 10.0),
                bundle("W9000", 200, 900, 10.0),
                bundle("W12000", 200, 1200, 10.0));

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, TRUCK);

        assertEquals(2, r.containers().size());
        List<Bundle> first = new TruckLoad(r.containers().get(0)).bundles();
        List<Bundle> second = new TruckLoad(r.containers().get(1)).bundles();
        assertEquals("W15000", first.get(0).describe());
        assertEquals("W9000", first.get(1).describe());
        assertEquals("W12000", second.get(0).describe());
        assertEquals("W3000", second.get(1).describe());
        assertEquals(24_000.0, r.containers().get(0).currentWeightKg(), 1e-9);
    }

    @Test
    void testEqualWeightsPlaceLargerDiameterFirst() {
        List<Bundle> bundles = List.of(bundle("SMALL", 200, 10, 10.0), bundle("LARGE", 300, 10, 10.0));

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, TRUCK);

        assertEquals("LARGE", r.containers().get(0).placements().get(0).bundle().describe());
    }

    @Test
    void testCrossSectionOpensNewTruckBeforeWeight() {
        TruckSpec tiny = new TruckSpec("tiny", 100_000, 13_600, 1_000, 1_000);
        List<Bundle> bundles = List.of(bundle("A", 900, 1, 10.0), bundle("B", 900, 1, 10.0), bundle("C", 900, 1, 10.0));

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, tiny);

        assertEquals(3, r.containers().size());
        for (ContainerState c : r.containers()) assertEquals(1, c.placements().size());
    }

    @Test
    void testOverweightBundleIsReportedNotLooped() {
        Bundle tooHeavy = bundle("HEAVY", 400, 2000, 13.0);
        List<Bundle> bundles = List.of(tooHeavy, bundle("OK", 400, 18.8, 12.0));

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, TRUCK);

        assertFalse(ContainerAssigner.feasible(tooHeavy, TRUCK));
        assertEquals(List.of(tooHeavy), r.unplaced());
        assertEquals(1, r.containers().size());
    }

    @Test
    void testOversizeBundleIsReported() {
        Bundle wide = bundle("WIDE", 2600, 10, 12.0);

        ContainerAssigner.AssignmentResult r = assigner().assign(List.of(wide), TRUCK);

        assertTrue(r.containers().isEmpty());
        assertEquals(1, r.unplaced().size());
    }

    @Test
    void testWeightAndSectionBoundsHold() {
        List<Bundle> bundles = new ArrayList<>();
        double[] sizes = {630, 500, 400, 315, 250, 200, 160, 110};
        for (int i = 0; i < 120; i++) {
            double od = sizes[i % sizes.length];
            bundles.add(bundle("T" + (int) od, od, od / 10.0, 12.0));
        }

        ContainerAssigner.AssignmentResult r = assigner().assign(bundles, TRUCK);

        int placed = 0;
        for (ContainerState c : r.containers()) {
            assertTrue(c.currentWeightKg() <= TRUCK.maxPayloadKg() + 1e-6, "truck " + c.truckNumber());
            for (PlacedBundle p : c.placements()) {
                assertTrue(p.footprint().getMaxY() <= TRUCK.internalHeightMm() + 1e-6);
                assertTrue(p.footprint().getMaxX() <= TRUCK.internalWidthMm() + 1e-6);
            }
            placed += c.placements().size();
        }
        assertEquals(bundles.size(), placed + r.unplaced().size());
        assertTrue(r.unplaced().isEmpty());
    }

    @Test
    void testEmptyInputOpensNoTrucks() {
        ContainerAssigner.AssignmentResult r = assigner().assign(List.of(), TRUCK);
        assertTrue(r.containers().isEmpty());
        assertTrue(r.unplaced().isEmpty());
    }
}
