package net.economicscenarios.copulas;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Student-t copula with correlation matrix &rho; and &nu; degrees of freedom. A sample is
 * \( t_{\nu}(x_{i} \sqrt{\nu / W}) \) where x is correlated normal, W is chi-squared with &nu; degrees of freedom and
 * \( t_{\nu} \) is the Student-t distribution function. Compared to the Gaussian copula it shows tail dependence.
 */
public class StudentTCopula extends AbstractEllipticalCopula {

    private final double degreesOfFreedom;
    private final TDistribution tDistribution;

    public StudentTCopula(double[][] correlationMatrix, double degreesOfFreedom) {
        super(correlationMatrix);
        if(!(degreesOfFreedom > 0.0)) throw new IllegalArgumentException("Degrees of freedom must be positive, got " + degreesOfFreedom + ".");
        this.degreesOfFreedom = degreesOfFreedom;
        this.tDistribution = new TDistribution(degreesOfFreedom);
    }

    @Override
    public double[][] sample(RandomGenerator randomGenerator, int numberOfSamples) {
        ChiSquaredDistribution chiSquared = new ChiSquaredDistribution(randomGenerator, degreesOfFreedom);

        double[][] samples = new double[getDimension()][numberOfSamples];
        for(int sampleIndex = 0; sampleIndex < numberOfSamples; sampleIndex++) {
            double[] correlatedNormals = getCorrelatedNormals(randomGenerator);
            double scale = Math.sqrt(degreesOfFreedom / chiSquared.sample());
            for(int component = 0; component < correlatedNormals.length; component++) {
                samples[component][sampleIndex] = tDistribution.cumulativeProbability(correlatedNormals[component] * scale);
            }
        }
        return samples;
    }

    public double getDegreesOfFreedom() {
        return degreesOfFreedom;
    }
}
