package com.vtb.attribution.generator;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * Распределение размера инцидента: бета-биномиальное BB(n = max - min, alpha, beta),
 * сдвинутое на min. При alpha = 1.5, beta = 10 распределение скошено вправо:
 * большинство инцидентов небольшие, крупные встречаются редко.
 */
public class IncidentSizeDistribution {

    public static final double DEFAULT_ALPHA = 1.5;
    public static final double DEFAULT_BETA = 10.0;

    private final int minSize;
    private final int maxSize;
    private final double[] pmf;
    private final AliasSampler sampler;

    public IncidentSizeDistribution(int minSize, int maxSize) {
        this(minSize, maxSize, DEFAULT_ALPHA, DEFAULT_BETA);
    }

    public IncidentSizeDistribution(int minSize, int maxSize, double alpha, double beta) {
        if (minSize < 0 || maxSize <= minSize) {
            throw new IllegalArgumentException(
                String.format("Неверные границы размера инцидента: %d, %d", minSize, maxSize));
        }
        if (alpha <= 0 || beta <= 0) {
            throw new IllegalArgumentException(
                String.format("Параметры распределения должны быть положительными: %s, %s", alpha, beta));
        }
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.pmf = betaBinomialPmf(maxSize - minSize, alpha, beta);
        this.sampler = new AliasSampler(pmf);
    }

    public int sample(RandomGenerator random) {
        return minSize + sampler.sample(random);
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Вероятность размера {@code size}; вне [min, max] равна нулю.
     */
    public double probability(int size) {
        int k = size - minSize;
        return k < 0 || k >= pmf.length ? 0.0 : pmf[k];
    }

    static double[] betaBinomialPmf(int n, double alpha, double beta) {
        double[] values = new double[n + 1];
        double logNormalizer = Beta.logBeta(alpha, beta);
        for (int k = 0; k <= n; k++) {
            double logValue = CombinatoricsUtils.binomialCoefficientLog(n, k)
                + Beta.logBeta(k + alpha, n - k + beta)
                - logNormalizer;
            values[k] = FastMath.exp(logValue);
        }
        return values;
    }
}
