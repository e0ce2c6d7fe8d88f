package com.flowmable.enhancer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Extracts the four quality metrics the fuzzy engine consumes.
 * <p>
 * All metrics work on the Rec.601 luma plane:
 * - brightness: mean luma [0, 255]
 * - contrast:   luma standard deviation, 128 maps to 100
 * - sharpness:  RMS of the 4-neighbour Laplacian, 50 maps to 100
 * - noise:      mean |centre - mean(4 neighbours)|, 30 maps to 100
 * Sharpness and noise use interior pixels only; images under 3x3 report 0 for both.
 */
public class ImageQualityAnalyzer {

    private static final double CONTRAST_FULL_SCALE = 128.0;
    private static final double SHARPNESS_FULL_SCALE = 50.0;
    private static final double NOISE_FULL_SCALE = 30.0;
    private static final double METRIC_CAP = 100.0;

    private static final int HISTOGRAM_BINS = 256;

    /**
     * @throws IOException if the file cannot be read or decoded
     */
    public ImageMetrics analyze(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        return analyze(image);
    }

    public ImageMetrics analyze(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        int w = image.getWidth();
        int h = image.getHeight();
        double[] gray = ColorSpaceUtils.lumaPlane(image);

        double brightness = mean(gray);
        return new ImageMetrics(
                brightness,
                contrast(gray, brightness),
                sharpness(gray, w, h),
                noise(gray, w, h)
        );
    }

    /**
     * 256-bin histogram of rounded luma values (raw counts).
     */
    public int[] luminanceHistogram(BufferedImage image) {
        int[] histogram = new int[HISTOGRAM_BINS];
        for (double v : ColorSpaceUtils.lumaPlane(image)) {
            histogram[ColorSpaceUtils.clampChannel(v)]++;
        }
        return histogram;
    }

    private static double mean(double[] gray) {
        double sum = 0;
        for (double v : gray) sum += v;
        return sum / gray.length;
    }

    private static double contrast(double[] gray, double mean) {
        double sumSq = 0;
        for (double v : gray) {
            double d = v - mean;
            sumSq += d * d;
        }
        double stdDev = Math.sqrt(sumSq / gray.length);
        return Math.min(stdDev / CONTRAST_FULL_SCALE * 100.0, METRIC_CAP);
    }

    private static double sharpness(double[] gray, int w, int h) {
        double energy = 0;
        int count = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int idx = y * w + x;
                // [0 1 0; 1 -4 1; 0 1 0]
                double laplacian = gray[idx - w] + gray[idx + w] + gray[idx - 1] + gray[idx + 1] - 4 * gray[idx];
                energy += laplacian * laplacian;
                count++;
            }
        }
        if (count == 0) return 0.0;
        double rms = Math.sqrt(energy / count);
        return Math.min(rms / SHARPNESS_FULL_SCALE * 100.0, METRIC_CAP);
    }

    private static double noise(double[] gray, int w, int h) {
        double variation = 0;
        int count = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int idx = y * w + x;
                double neighbours = (gray[idx - 1] + gray[idx + 1] + gray[idx - w] + gray[idx + w]) / 4.0;
                variation += Math.abs(gray[idx] - neighbours);
                count++;
            }
        }
        if (count == 0) return 0.0;
        return Math.min(variation / count / NOISE_FULL_SCALE * 100.0, METRIC_CAP);
    }
}
