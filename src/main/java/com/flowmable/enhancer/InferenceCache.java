package com.flowmable.enhancer;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes inference results for metrics that agree to two decimals.
 * <p>
 * Sits in front of the engine for callers that re-run inference on visually
 * identical inputs. Clear it when the source image changes.
 */
public class InferenceCache {

    private final FuzzyInferenceEngine engine;
    private final Map<String, InferenceResult> cache = new ConcurrentHashMap<>();

    public InferenceCache(FuzzyInferenceEngine engine) {
        this.engine = engine;
    }

    public InferenceResult infer(ImageMetrics metrics) {
        return cache.computeIfAbsent(key(metrics), k -> engine.infer(metrics));
    }

    public boolean contains(ImageMetrics metrics) {
        return cache.containsKey(key(metrics));
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }

    static String key(ImageMetrics m) {
        return String.format(Locale.ROOT, "%.2f-%.2f-%.2f-%.2f",
                m.brightness(), m.contrast(), m.sharpness(), m.noise());
    }
}
