package io.vulnscan.index;

/**
 * Small vector math helpers shared by index implementations and callers.
 */
public final class Vectors {

    private Vectors() {
    }

    public static float dot(float[] a, float[] b) {
        float sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static float l2Distance(float[] a, float[] b) {
        float sum = 0;
        for (int i = 0; i < a.length; i++) {
            float d = a[i] - b[i];
            sum += d * d;
        }
        return (float) Math.sqrt(sum);
    }

    public static float cosine(float[] a, float[] b) {
        float normA = 0;
        float normB = 0;
        for (int i = 0; i < a.length; i++) {
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot(a, b) / (float) (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Returns a unit-length copy. A zero vector is returned unchanged.
     */
    public static float[] normalized(float[] vector) {
        float[] copy = vector.clone();
        float norm = 0;
        for (float v : copy) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < copy.length; i++) {
                copy[i] /= norm;
            }
        }
        return copy;
    }

    /**
     * Zero-pads or truncates to {@code width}. Changes similarity geometry;
     * only used where a caller explicitly opts in.
     */
    public static float[] fitToWidth(float[] vector, int width) {
        float[] fitted = new float[width];
        System.arraycopy(vector, 0, fitted, 0, Math.min(width, vector.length));
        return fitted;
    }
}
