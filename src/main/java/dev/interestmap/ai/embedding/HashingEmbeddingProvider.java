package dev.interestmap.ai.embedding;

import java.nio.charset.StandardCharsets;

/**
 * Local, dependency-free embedder using signed feature hashing over words and
 * character trigrams. Deterministic across JVMs and runs.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final String name;
    private final int dimension;

    public HashingEmbeddingProvider(String name, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.name = name;
        this.dimension = dimension;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        for (String word : text.trim().split("\\s+")) {
            accumulate(vector, "w:" + word, 1.0);
            String padded = "#" + word + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                accumulate(vector, "t:" + padded.substring(i, i + 3), 0.5);
            }
        }
        return EmbeddingProvider.l2Normalize(vector);
    }

    private void accumulate(double[] vector, String feature, double weight) {
        long hash = fnv1a(feature);
        int index = (int) Math.floorMod(hash, (long) dimension);
        double sign = ((hash >>> 63) == 0) ? 1.0 : -1.0;
        vector[index] += sign * weight;
    }

    static long fnv1a(String value) {
        long hash = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
