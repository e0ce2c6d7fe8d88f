package com.flowmable.enhancer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * CLI driver: analyze each image, run fuzzy inference, apply the result and report.
 * <p>
 * Images come from the command line, or from src/main/resources/images/ when
 * no arguments are given. Each enhanced image is written next to its source
 * as {@code <name>-enhanced.png}.
 */
public class EnhancerDriver {

    private static final String IMAGES_DIR = "images";

    public static void main(String[] args) throws Exception {
        FuzzyInferenceEngine engine = new FuzzyInferenceEngine();
        InferenceCache cache = new InferenceCache(engine);
        ImageEnhancer enhancer = new ImageEnhancer();
        InferenceExplainer explainer = new InferenceExplainer();

        List<Path> imageFiles = findImageFiles(args);
        if (imageFiles.isEmpty()) {
            System.out.println("No images found. Pass paths or place files in src/main/resources/images/");
            return;
        }

        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("  FUZZY IMAGE ENHANCER — Report");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("Rules loaded: " + engine.rules().size());

        auditDeterminism(engine, imageFiles.get(0));

        for (Path file : imageFiles) {
            processImage(engine, cache, enhancer, explainer, file);
        }
    }

    private static void auditDeterminism(FuzzyInferenceEngine engine, Path file) throws IOException {
        System.out.println("\n[Audit] Checking Determinism on " + file.getFileName() + "...");
        InferenceResult run1 = engine.infer(file);
        InferenceResult run2 = engine.infer(file);
        if (run1.equals(run2)) {
            System.out.println("  Determinism Check PASSED");
        } else {
            System.err.println("  MISMATCH: " + run1.parameters() + " vs " + run2.parameters());
            System.out.println("  Determinism Check FAILED");
        }
    }

    private static void processImage(FuzzyInferenceEngine engine, InferenceCache cache,
                                     ImageEnhancer enhancer, InferenceExplainer explainer, Path file) {
        String name = file.getFileName().toString();
        System.out.printf("%n━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━%n");
        System.out.printf("Image: %s%n", name);

        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            System.err.println("  Error reading file: " + e.getMessage());
            return;
        }
        if (image == null) {
            System.err.println("  Unsupported image format.");
            return;
        }

        ImageMetrics before = engine.analyze(image);
        InferenceResult result = cache.infer(before);
        EnhancementParameters params = result.parameters();

        printMetrics("Before", before);
        System.out.println("  " + explainer.interpret(before));

        System.out.printf("%n  Fired rules (%d):%n", result.firedRules().size());
        for (InferenceExplainer.RuleActivation a : explainer.ruleActivations(engine.rules(), result)) {
            if (!a.active()) continue;
            System.out.printf("    #%-3d %.3f  %s%n", a.ruleId(), a.firingStrength(), a.description());
        }

        System.out.printf("%n  Parameters: brightness %+.2f | contrast x%.3f | sharpen %.1f | denoise %.1f%n",
                params.brightnessAdj(), params.contrastAdj(), params.sharpen(), params.denoise());
        for (String action : explainer.recommendedActions(params)) {
            System.out.println("  - " + action);
        }

        BufferedImage enhanced = enhancer.enhance(image, params);
        printMetrics("After", engine.analyze(enhanced));

        Path out = file.resolveSibling(stripExtension(name) + "-enhanced.png");
        try {
            ImageIO.write(enhanced, "png", out.toFile());
            System.out.println("  Wrote " + out);
        } catch (IOException e) {
            System.err.println("  Error writing " + out + ": " + e.getMessage());
        }
    }

    private static void printMetrics(String label, ImageMetrics m) {
        System.out.printf("  %-6s brightness=%6.2f contrast=%6.2f sharpness=%6.2f noise=%6.2f%n",
                label, m.brightness(), m.contrast(), m.sharpness(), m.noise());
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<Path> findImageFiles(String[] args) throws IOException {
        if (args.length > 0) {
            return Arrays.stream(args)
                    .map(Path::of)
                    .filter(Files::isRegularFile)
                    .toList();
        }
        Path resourcesDir = Path.of("src", "main", "resources", IMAGES_DIR);
        if (Files.isDirectory(resourcesDir)) {
            try (Stream<Path> stream = Files.list(resourcesDir)) {
                return stream
                        .filter(p -> {
                            String n = p.getFileName().toString().toLowerCase();
                            return (n.endsWith(".png") || n.endsWith(".jpg") || n.endsWith(".jpeg"))
                                    && !n.contains("-enhanced.");
                        })
                        .sorted()
                        .toList();
            }
        }
        return List.of();
    }
}
