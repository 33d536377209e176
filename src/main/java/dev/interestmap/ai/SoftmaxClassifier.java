package dev.interestmap.ai;

/**
 * Multinomial linear classifier: one coefficient row and intercept per class,
 * probabilities via a numerically stable softmax.
 */
public final class SoftmaxClassifier {

    private final double[][] coefficients;
    private final double[] intercepts;

    public SoftmaxClassifier(double[][] coefficients, double[] intercepts) {
        if (coefficients == null || intercepts == null || coefficients.length == 0
                || coefficients.length != intercepts.length) {
            throw new ModelIncompatibleException("Classifier needs one intercept per coefficient row");
        }
        int width = coefficients[0].length;
        this.coefficients = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            if (coefficients[i].length != width) {
                throw new ModelIncompatibleException("Classifier coefficient rows differ in length");
            }
            this.coefficients[i] = coefficients[i].clone();
        }
        this.intercepts = intercepts.clone();
    }

    public int classCount() {
        return coefficients.length;
    }

    public int featureDimension() {
        return coefficients[0].length;
    }

    public double[] predictProba(double[] features) {
        if (features.length != featureDimension()) {
            throw new IllegalArgumentException(
                    "Expected " + featureDimension() + " features but got " + features.length);
        }
        double[] logits = new double[coefficients.length];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < coefficients.length; c++) {
            double logit = intercepts[c];
            for (int f = 0; f < features.length; f++) {
                logit += coefficients[c][f] * features[f];
            }
            logits[c] = logit;
            max = Math.max(max, logit);
        }
        double sum = 0.0;
        for (int c = 0; c < logits.length; c++) {
            logits[c] = Math.exp(logits[c] - max);
            sum += logits[c];
        }
        for (int c = 0; c < logits.length; c++) {
            logits[c] /= sum;
        }
        return logits;
    }
}
