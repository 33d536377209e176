package dev.interestmap.ai.embedding;

/**
 * Turns processed text into a fixed-size, L2-normalized semantic vector.
 * Implementations must be safe for concurrent use.
 */
public interface EmbeddingProvider {

    /**
     * Identity matched against the artifact's embedder descriptor and the
     * fallback list.
     */
    String getName();

    int getDimension();

    double[] embed(String text);

    static double[] l2Normalize(double[] vector) {
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return vector;
        }
        norm = Math.sqrt(norm);
        double[] normalized = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = vector[i] / norm;
        }
        return normalized;
    }
}
