package com.flowmable.enhancer;

/**
 * Piecewise-linear membership function: triangular {@code (a, b, c)} or
 * trapezoidal {@code (a, b, c, d)}.
 * <p>
 * Triangular functions store their apex twice ({@code b == c}) so both shapes
 * share one set of control points. Use the {@link #triangular} and
 * {@link #trapezoidal} factories; they validate point order.
 *
 * @param shape Which of the two shapes this is
 * @param a     Left foot
 * @param b     Left shoulder (apex for triangular)
 * @param c     Right shoulder (apex for triangular)
 * @param d     Right foot
 */
public record MembershipFunction(Shape shape, double a, double b, double c, double d) {

    public enum Shape {
        TRIANGULAR,
        TRAPEZOIDAL
    }

    public MembershipFunction {
        if (shape == null) {
            throw new IllegalArgumentException("Membership function shape is required");
        }
        if (!(a <= b && b <= c && c <= d)) {
            throw new IllegalArgumentException(
                    "Control points out of order for " + shape + ": [" + a + ", " + b + ", " + c + ", " + d + "]");
        }
        if (shape == Shape.TRIANGULAR && b != c) {
            throw new IllegalArgumentException("Triangular function must have a single apex, got b=" + b + ", c=" + c);
        }
    }

    public static MembershipFunction triangular(double a, double b, double c) {
        return new MembershipFunction(Shape.TRIANGULAR, a, b, b, c);
    }

    public static MembershipFunction trapezoidal(double a, double b, double c, double d) {
        return new MembershipFunction(Shape.TRAPEZOIDAL, a, b, c, d);
    }

    /**
     * Degree of membership of {@code x}, always in [0, 1]. NaN maps to 0.
     */
    public double evaluate(double x) {
        return switch (shape) {
            case TRIANGULAR -> evaluateTriangular(x);
            case TRAPEZOIDAL -> evaluateTrapezoidal(x);
        };
    }

    /** Location where the function first reaches 1 (the apex for triangular). */
    public double peak() {
        return b;
    }

    /** Control points in their natural arity: 3 for triangular, 4 for trapezoidal. */
    public double[] points() {
        return shape == Shape.TRIANGULAR
                ? new double[]{a, b, d}
                : new double[]{a, b, c, d};
    }

    private double evaluateTriangular(double x) {
        // a, apex (b), and the right foot (d)
        if (!(x > a && x < d)) return 0.0;
        if (x == b) return 1.0;
        if (x < b) return (x - a) / (b - a);
        return (d - x) / (d - b);
    }

    private double evaluateTrapezoidal(double x) {
        // Plateau first: a degenerate shoulder (a == b or c == d) stays at 1 on the universe edge.
        if (x >= b && x <= c) return 1.0;
        if (!(x > a && x < d)) return 0.0;
        if (x < b) return (x - a) / (b - a);
        return (d - x) / (d - c);
    }

    @Override
    public String toString() {
        return shape == Shape.TRIANGULAR
                ? "Triangular[" + a + ", " + b + ", " + d + "]"
                : "Trapezoidal[" + a + ", " + b + ", " + c + ", " + d + "]";
    }
}
