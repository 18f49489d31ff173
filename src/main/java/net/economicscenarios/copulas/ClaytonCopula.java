package net.economicscenarios.copulas;

import org.apache.commons.math3.distribution.ExponentialDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Clayton copula \( C(u) = (\sum_{i} u_{i}^{-\theta} - d + 1)^{-1/\theta} \), \( \theta > 0 \), sampled with the
 * Marshall-Olkin algorithm: \( U_{i} = (1 + E_{i}/V)^{-1/\theta} \) with a Gamma(1/&theta;, 1) frailty V and
 * independent standard exponentials \( E_{i} \). The copula has lower tail dependence.
 *
 * For large &theta; the frailty is frequently tiny, hence the sample is evaluated as
 * \( \exp(-\log(1 + E_{i}/V) / \theta) \) with the logarithm taken without forming \( E_{i}/V \) when that ratio
 * overflows. A frailty which underflows to zero is drawn again. All samples lie in the open interval (0,1).
 */
public class ClaytonCopula implements CopulaInterface {

    private final int dimension;
    private final double theta;

    public ClaytonCopula(int dimension, double theta) {
        super();
        if(dimension < 1) throw new IllegalArgumentException("Dimension must be positive, got " + dimension + ".");
        if(!(theta > 0.0)) throw new IllegalArgumentException("Parameter theta must be positive, got " + theta + ".");
        this.dimension = dimension;
        this.theta = theta;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public double[][] sample(RandomGenerator randomGenerator, int numberOfSamples) {
        GammaDistribution frailty = new GammaDistribution(randomGenerator, 1.0 / theta, 1.0);
        ExponentialDistribution exponential = new ExponentialDistribution(randomGenerator, 1.0);

        double[][] samples = new double[dimension][numberOfSamples];
        for(int sampleIndex = 0; sampleIndex < numberOfSamples; sampleIndex++) {
            double v;
            do {
                v = frailty.sample();
            } while(v == 0.0);
            for(int component = 0; component < dimension; component++) {
                samples[component][sampleIndex] = Math.exp(-getLogOnePlusRatio(exponential.sample(), v) / theta);
            }
        }
        return samples;
    }

    /*
     * log(1 + e/v) for v > 0, also when e/v overflows.
     */
    private static double getLogOnePlusRatio(double e, double v) {
        double ratio = e / v;
        if(Double.isInfinite(ratio)) {
            return Math.log(e) - Math.log(v) + Math.log1p(v / e);
        }
        return Math.log1p(ratio);
    }

    public double getTheta() {
        return theta;
    }
}
