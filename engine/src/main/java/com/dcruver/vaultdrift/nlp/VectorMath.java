package com.dcruver.vaultdrift.nlp;

import java.util.List;

/**
 * Small dense-vector helpers shared by the cache, the cluster engine and the trajectory analyzer.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(double[] a, double[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] a) {
        double sum = 0.0;
        for (double v : a) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Unit-length copy. Returns {@code null} for the zero vector.
     */
    public static double[] normalize(double[] a) {
        double n = norm(a);
        if (n == 0.0 || !Double.isFinite(n)) {
            return null;
        }
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] / n;
        }
        return out;
    }

    public static double[] toDoubles(float[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }

    /**
     * Cosine similarity in [-1, 1]; zero vectors give 0.
     */
    public static double cosine(double[] a, double[] b) {
        requireSameLength(a, b);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    public static double euclidean(double[] a, double[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public static double[] subtract(double[] a, double[] b) {
        requireSameLength(a, b);
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }

    public static double[] scale(double[] a, double factor) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] * factor;
        }
        return out;
    }

    public static double[] mean(List<double[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list of vectors");
        }
        double[] sum = new double[vectors.get(0).length];
        for (double[] v : vectors) {
            requireSameLength(sum, v);
            for (int i = 0; i < v.length; i++) {
                sum[i] += v[i];
            }
        }
        return scale(sum, 1.0 / vectors.size());
    }

    /**
     * Pearson correlation; 0 when either series has no variance.
     */
    public static double pearson(double[] x, double[] y) {
        requireSameLength(x, y);
        int n = x.length;
        if (n < 2) {
            return 0.0;
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double cov = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            return 0.0;
        }
        return cov / Math.sqrt(varX * varY);
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension: " + a.length + " vs " + b.length);
        }
    }
}
