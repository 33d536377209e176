package dev.interestmap.ai;

/**
 * Per-feature standardization {@code (x - mean) / scale}. A zero scale is
 * treated as 1 so constant features pass through centred.
 */
public final class StandardScaler {

    private final double[] mean;
    private final double[] scale;

    public StandardScaler(double[] mean, double[] scale) {
        if (mean == null || scale == null || mean.length != scale.length) {
            throw new ModelIncompatibleException("Scaler mean and scale must have the same length");
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    public int dimension() {
        return mean.length;
    }

    public double[] transform(double[] features) {
        if (features.length != mean.length) {
            throw new IllegalArgumentException(
                    "Expected " + mean.length + " features but got " + features.length);
        }
        double[] scaled = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            double divisor = scale[i] == 0.0 ? 1.0 : scale[i];
            scaled[i] = (features[i] - mean[i]) / divisor;
        }
        return scaled;
    }
}
