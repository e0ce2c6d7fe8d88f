package com.flowmable.enhancer;

import java.awt.image.BufferedImage;

/**
 * Pixel packing and luma helpers shared by analysis and enhancement.
 * <p>
 * Luma uses Rec.601 weights on gamma-encoded sRGB channels, which is what
 * the brightness/contrast universes (0–255, 0–100) are calibrated against.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // Rec.601
    private static final double KR = 0.299;
    private static final double KG = 0.587;
    private static final double KB = 0.114;

    /**
     * Rec.601 luma of an sRGB pixel (0–255 per channel). Returns value in [0.0, 255.0].
     */
    public static double luma(int r, int g, int b) {
        return KR * r + KG * g + KB * b;
    }

    public static double luma(int argb) {
        return luma((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    /**
     * Row-major luma plane of the whole image. Alpha is ignored.
     */
    public static double[] lumaPlane(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        double[] gray = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                gray[y * w + x] = luma(img.getRGB(x, y));
            }
        }
        return gray;
    }

    /** Round and clamp to a channel value [0, 255]. */
    public static int clampChannel(double v) {
        if (Double.isNaN(v)) return 0;
        long rounded = Math.round(v);
        return (int) Math.max(0, Math.min(255, rounded));
    }

    public static int packOpaque(int r, int g, int b) {
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }
}
