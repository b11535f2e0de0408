package org.tlc4pipe.loading;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class LoadingSettingsTest {

    @Test
    void testDefaults() {
        LoadingSettings s = LoadingSettings.defaults();

        assertEquals(0.04, s.ovalityFactor());
        assertEquals(0.015, s.diameterFactor());
        assertEquals(15.0, s.baseClearanceMm());
        assertEquals(4, s.maxLevels());
        assertTrue(s.preferSameSdr());
        assertTrue(s.allowMixedSdr());
        assertEquals(2000.0, s.heavyExtractionThresholdKg());
        assertEquals(20.0, s.rowGapMm());
    }

    @Test
    void testClasspathFileMatchesDefaults() {
        LoadingSettings loaded = LoadingSettings.load();
        assertEquals(LoadingSettings.defaults().toString(), loaded.toString());
        assertEquals(5000, loaded.maxPipesPerOrder());
        assertEquals(18.0, loaded.maxPipeLengthM());
    }

    @Test
    void testSystemPropertyOverridesFile() {
        System.setProperty("loading.max-levels", "6");
        System.setProperty("loading.allow-mixed-sdr", "no");
        try {
            LoadingSettings s = LoadingSettings.load();
            assertEquals(6, s.maxLevels());
            assertFalse(s.allowMixedSdr());
        } finally {
            System.clearProperty("loading.max-levels");
            System.clearProperty("loading.allow-mixed-sdr");
        }
    }

    @Test
    void testMissingKeysFallBackToDefaults() {
        Properties p = new Properties();
        p.setProperty("loading.base-clearance-mm", "25");

        LoadingSettings s = LoadingSettings.fromProperties(p);

        assertEquals(25.0, s.baseClearanceMm());
        assertEquals(0.04, s.ovalityFactor());
    }

    @Test
    void testInvalidValuesRejected() {
        Properties p = new Properties();
        p.setProperty("loading.ovality-factor", "abc");
        assertThrows(IllegalArgumentException.class, () -> LoadingSettings.fromProperties(p));

        Properties q = new Properties();
        q.setProperty("loading.prefer-same-sdr", "maybe");
        assertThrows(IllegalArgumentException.class, () -> LoadingSettings.fromProperties(q));

        assertThrows(IllegalArgumentException.class, () -> LoadingSettings.defaults().toBuilder().maxLevels(0).build());
        assertThrows(IllegalArgumentException.class, () -> LoadingSettings.defaults().toBuilder().ovalityFactor(1.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> LoadingSettings.defaults().toBuilder().minPipeLengthM(10).maxPipeLengthM(8).build());
    }

    @Test
    void testTruckPresets() {
        assertSame(TruckSpec.STANDARD_24T, TruckSpec.preset("standard"));
        assertSame(TruckSpec.MEGA_TRAILER, TruckSpec.preset(" MEGA "));
        assertEquals(2450.0, TruckSpec.preset("eu").internalWidthMm());
        assertThrows(IllegalArgumentException.class, () -> TruckSpec.preset("van"));
        assertThrows(IllegalArgumentException.class, () -> new TruckSpec("bad", 0, 1, 1, 1));
    }
}
