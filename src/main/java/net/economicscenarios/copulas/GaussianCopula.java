package net.economicscenarios.copulas;

import org.apache.commons.math3.random.RandomGenerator;

import net.finmath.functions.NormalDistribution;

/**
 * Gaussian copula with a given correlation matrix: the component-wise standard normal distribution
 * function applied to a correlated normal vector.
 */
public class GaussianCopula extends AbstractEllipticalCopula {

    public GaussianCopula(double[][] correlationMatrix) {
        super(correlationMatrix);
    }

    @Override
    public double[][] sample(RandomGenerator randomGenerator, int numberOfSamples) {
        double[][] samples = new double[getDimension()][numberOfSamples];
        for(int sampleIndex = 0; sampleIndex < numberOfSamples; sampleIndex++) {
            double[] correlatedNormals = getCorrelatedNormals(randomGenerator);
            for(int component = 0; component < correlatedNormals.length; component++) {
                samples[component][sampleIndex] = NormalDistribution.cumulativeDistribution(correlatedNormals[component]);
            }
        }
        return samples;
    }
}
