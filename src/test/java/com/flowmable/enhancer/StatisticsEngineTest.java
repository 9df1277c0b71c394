package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Channel statistics and detail metrics on synthetic rasters with hand-computed values.
 */
class StatisticsEngineTest {

    private static final double EPS = 1e-9;

    private final StatisticsEngine engine = new StatisticsEngine();

    @Test
    void uniformGray_zeroSpread() {
        PhotoStatistics stats = engine.analyze(TestRasters.uniform(2, 2, 50, 50, 50));

        assertEquals(50.0, stats.brightness(), EPS);
        assertEquals(0.0, stats.contrast(), EPS);
        assertEquals(0.0, stats.greenDominance(), EPS);
        assertTrue(stats.underexposed());
        assertFalse(stats.overexposed());
        assertFalse(stats.hasGreenCast());
    }

    @Test
    void greenTintedUniform_flagsCast() {
        PhotoStatistics stats = engine.analyze(TestRasters.uniform(4, 4, 150, 200, 150));

        assertEquals(50.0, stats.greenDominance(), EPS);
        assertTrue(stats.hasGreenCast());
        assertEquals(500.0 / 3.0, stats.brightness(), EPS);
        assertFalse(stats.overexposed(), "166.7 is not above 180");
    }

    @Test
    void checkerboard_channelMeansAndDeviations() {
        PhotoStatistics stats = engine.analyze(TestRasters.allGood());

        assertEquals(155.0, stats.red().mean(), EPS);
        assertEquals(95.0, stats.red().stdDev(), EPS);
        assertEquals(70.0, stats.green().mean(), EPS);
        assertEquals(60.0, stats.green().stdDev(), EPS);
        assertEquals(130.0, stats.blue().mean(), EPS);
        assertEquals(120.0, stats.blue().stdDev(), EPS);
        assertEquals(355.0 / 3.0, stats.brightness(), EPS);
        assertEquals(275.0 / 3.0, stats.contrast(), EPS);
        assertEquals(-72.5, stats.greenDominance(), EPS);
    }

    @Test
    void checkerboard_detailMetrics() {
        DetailedStatistics stats = engine.analyzeDetailed(TestRasters.allGood());

        // Luma 180 vs 25: every interior Laplacian is ±620, mean 0
        assertEquals(384400.0, stats.sharpness(), 1e-6);
        assertEquals(155, stats.dynamicRange());
        assertEquals((122.4 + 212.5) / 2.0, stats.saturation(), 1e-9);
        assertTrue(stats.noiseLevel() > 0, "Alternating pixels leave a residual against the box blur");
    }

    @Test
    void smallRaster_sharpnessIsZero() {
        DetailedStatistics stats = engine.analyzeDetailed(TestRasters.checkerboard(2, 2,
                new int[]{255, 255, 255}, new int[]{0, 0, 0}));
        assertEquals(0.0, stats.sharpness(), EPS, "No valid Laplacian output below 3×3");
        assertEquals(255, stats.dynamicRange());
    }

    @Test
    void uniform_noNoiseNoSharpness() {
        DetailedStatistics stats = engine.analyzeDetailed(TestRasters.uniform(16, 16, 90, 120, 200));
        assertEquals(0.0, stats.sharpness(), EPS);
        assertEquals(0.0, stats.noiseLevel(), EPS);
        assertEquals(0, stats.dynamicRange());
    }

    @Test
    void blackPixels_contributeZeroSaturation() {
        RasterImage img = TestRasters.uniform(2, 1, 0, 0, 0);
        img.setPixel(1, 0, 255, 0, 0);
        assertEquals(127.5, StatisticsEngine.meanSaturation(img), EPS);
    }

    @Test
    void alphaIsIgnored() {
        PhotoStatistics opaque = engine.analyze(TestRasters.uniform(3, 3, 10, 80, 200));
        PhotoStatistics clear = engine.analyze(TestRasters.uniformRgba(3, 3, 10, 80, 200, 0));
        assertEquals(opaque, clear);
    }

    @Test
    void largeRaster_statisticsAreStable() {
        RasterImage img = TestRasters.random(300, 250, RasterImage.RGB, 42L);
        DetailedStatistics a = engine.analyzeDetailed(img);
        DetailedStatistics b = engine.analyzeDetailed(img);
        assertEquals(a, b);
        assertTrue(a.contrast() > 60, "Uniform noise has a wide spread, got " + a.contrast());
    }

    @Test
    void singleChannel_rejected() {
        RasterImage gray = RasterImage.create(4, 4, 1);
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
                () -> engine.analyze(gray));
        assertEquals(1, e.channels());
        assertEquals(StatisticsEngine.STEP, e.stage());
    }

    @Test
    void zeroWidth_rejected() {
        RasterImage empty = RasterImage.create(0, 5, RasterImage.RGB);
        InvalidDimensionsException e = assertThrows(InvalidDimensionsException.class,
                () -> engine.analyzeDetailed(empty));
        assertTrue(e.getMessage().startsWith("[analysis]"), e.getMessage());
    }

    @Test
    void flagThresholds_areInjectable() {
        EnhancementThresholds strict = new EnhancementThresholds(
                70, 100, 200, 180, 160,
                35, 50, 65,
                25, 15, 8,
                40, 70, 90, 200,
                100, 300, 800,
                100, 150,
                5, 100, 180, 170);
        PhotoStatistics stats = new StatisticsEngine(strict)
                .analyze(TestRasters.uniform(2, 2, 100, 110, 100));
        assertTrue(stats.hasGreenCast(), "Dominance 10 exceeds a cast threshold of 5");
        assertFalse(engine.analyze(TestRasters.uniform(2, 2, 100, 110, 100)).hasGreenCast());
    }
}
