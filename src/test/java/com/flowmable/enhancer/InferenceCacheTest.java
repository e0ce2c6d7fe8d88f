package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InferenceCacheTest {

    private final FuzzyInferenceEngine engine = new FuzzyInferenceEngine();
    private final InferenceCache cache = new InferenceCache(engine);

    @Test
    void repeatedMetrics_returnCachedResult() {
        ImageMetrics m = new ImageMetrics(127, 50, 70, 10);
        InferenceResult first = cache.infer(m);
        assertSame(first, cache.infer(m));
        assertEquals(1, cache.size());
    }

    @Test
    void cachedResult_matchesDirectInference() {
        ImageMetrics m = new ImageMetrics(88.8, 22.2, 33.3, 44.4);
        assertEquals(engine.infer(m), cache.infer(m));
    }

    @Test
    void metricsWithinRounding_shareEntry() {
        InferenceResult a = cache.infer(new ImageMetrics(127.001, 50, 70, 10));
        InferenceResult b = cache.infer(new ImageMetrics(127.004, 50, 70, 10));
        assertSame(a, b);
        assertTrue(cache.contains(new ImageMetrics(127.0, 50, 70, 10)));
        assertFalse(cache.contains(new ImageMetrics(127.01, 50, 70, 10)));
    }

    @Test
    void clear_emptiesCache() {
        cache.infer(new ImageMetrics(10, 20, 30, 40));
        cache.infer(new ImageMetrics(200, 80, 90, 5));
        assertEquals(2, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void key_twoDecimalsPerMetric() {
        assertEquals("127.00-50.00-70.50-10.00", InferenceCache.key(new ImageMetrics(127, 50, 70.5, 10)));
    }
}
