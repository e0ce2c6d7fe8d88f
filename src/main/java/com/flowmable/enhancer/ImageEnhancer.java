package com.flowmable.enhancer;

import java.awt.image.BufferedImage;
import java.util.function.DoubleUnaryOperator;

/**
 * Applies crisp {@link EnhancementParameters} to pixels.
 * <p>
 * Order: brightness offset, contrast scale, sharpen, denoise. Each step is
 * skipped at its neutral value and otherwise returns a new opaque ARGB image;
 * the source is never modified.
 */
public class ImageEnhancer {

    private static final double MID_GREY = 128.0;
    private static final int MAX_DENOISE_RADIUS = 3;

    public BufferedImage enhance(BufferedImage source, EnhancementParameters params) {
        BufferedImage img = source;
        if (params.brightnessAdj() != 0) {
            img = adjustBrightness(img, params.brightnessAdj());
        }
        if (params.contrastAdj() != 1) {
            img = adjustContrast(img, params.contrastAdj());
        }
        if (params.sharpen() > 0) {
            img = sharpen(img, params.sharpen());
        }
        if (params.denoise() > 0) {
            img = denoise(img, params.denoise());
        }
        return img;
    }

    /** Adds {@code offset} to every colour channel, clamped to [0, 255]. */
    public BufferedImage adjustBrightness(BufferedImage src, double offset) {
        return mapChannels(src, c -> c + offset);
    }

    /** Scales every channel's distance from mid-grey (128) by {@code factor}. */
    public BufferedImage adjustContrast(BufferedImage src, double factor) {
        return mapChannels(src, c -> (c - MID_GREY) * factor + MID_GREY);
    }

    /**
     * 4-neighbour unsharp kernel: centre 1 + 4s, neighbours -s, with s = amount / 100.
     * Border pixels are copied unchanged.
     */
    public BufferedImage sharpen(BufferedImage src, double amount) {
        if (amount == 0) return src;
        double s = amount / 100.0;
        double centre = 1 + 4 * s;
        int w = src.getWidth();
        int h = src.getHeight();
        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (y == 0 || y == h - 1 || x == 0 || x == w - 1) {
                    out[idx] = in[idx] | 0xFF000000;
                    continue;
                }
                int[] rgb = new int[3];
                for (int c = 0; c < 3; c++) {
                    int shift = 16 - 8 * c;
                    double v = channel(in[idx], shift) * centre
                            - s * (channel(in[idx - 1], shift) + channel(in[idx + 1], shift)
                            + channel(in[idx - w], shift) + channel(in[idx + w], shift));
                    rgb[c] = ColorSpaceUtils.clampChannel(v);
                }
                out[idx] = ColorSpaceUtils.packOpaque(rgb[0], rgb[1], rgb[2]);
            }
        }
        return toImage(out, w, h);
    }

    /**
     * Box blur of radius ceil(strength / 100 * 3), clamping at the edges.
     */
    public BufferedImage denoise(BufferedImage src, double strength) {
        if (strength == 0) return src;
        int radius = (int) Math.ceil(strength / 100.0 * MAX_DENOISE_RADIUS);
        int w = src.getWidth();
        int h = src.getHeight();
        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[w * h];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                long rSum = 0, gSum = 0, bSum = 0;
                int count = 0;
                for (int dy = -radius; dy <= radius; dy++) {
                    int ny = Math.min(Math.max(y + dy, 0), h - 1);
                    for (int dx = -radius; dx <= radius; dx++) {
                        int nx = Math.min(Math.max(x + dx, 0), w - 1);
                        int p = in[ny * w + nx];
                        rSum += (p >> 16) & 0xFF;
                        gSum += (p >> 8) & 0xFF;
                        bSum += p & 0xFF;
                        count++;
                    }
                }
                out[y * w + x] = ColorSpaceUtils.packOpaque(
                        ColorSpaceUtils.clampChannel((double) rSum / count),
                        ColorSpaceUtils.clampChannel((double) gSum / count),
                        ColorSpaceUtils.clampChannel((double) bSum / count));
            }
        }
        return toImage(out, w, h);
    }

    private static BufferedImage mapChannels(BufferedImage src, DoubleUnaryOperator op) {
        int w = src.getWidth();
        int h = src.getHeight();
        int[] px = src.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            px[i] = ColorSpaceUtils.packOpaque(
                    ColorSpaceUtils.clampChannel(op.applyAsDouble((p >> 16) & 0xFF)),
                    ColorSpaceUtils.clampChannel(op.applyAsDouble((p >> 8) & 0xFF)),
                    ColorSpaceUtils.clampChannel(op.applyAsDouble(p & 0xFF)));
        }
        return toImage(px, w, h);
    }

    private static int channel(int argb, int shift) {
        return (argb >> shift) & 0xFF;
    }

    private static BufferedImage toImage(int[] argb, int w, int h) {
        BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        dst.setRGB(0, 0, w, h, argb, 0, w);
        return dst;
    }
}
