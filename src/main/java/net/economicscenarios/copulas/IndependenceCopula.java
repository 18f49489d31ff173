package net.economicscenarios.copulas;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * The independence copula: components are independent uniforms.
 * The matrix is filled component by component, each component across all samples.
 */
public class IndependenceCopula implements CopulaInterface {

    private final int dimension;

    public IndependenceCopula(int dimension) {
        super();
        if(dimension < 1) throw new IllegalArgumentException("Dimension must be positive, got " + dimension + ".");
        this.dimension = dimension;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public double[][] sample(RandomGenerator randomGenerator, int numberOfSamples) {
        double[][] samples = new double[dimension][numberOfSamples];
        for(int component = 0; component < dimension; component++) {
            for(int sampleIndex = 0; sampleIndex < numberOfSamples; sampleIndex++) {
                samples[component][sampleIndex] = randomGenerator.nextDouble();
            }
        }
        return samples;
    }
}
