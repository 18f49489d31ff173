package net.economicscenarios.copulas;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * A copula, i.e. the joint distribution of a vector of uniform (0,1) random variables, which carries the dependence
 * structure between the components without fixing their marginal distributions.
 */
public interface CopulaInterface {

    /**
     * @return The number of components of a sample.
     */
    int getDimension();

    /**
     * Draws independent samples of the copula. All draws are taken from the given random number generator.
     *
     * @param randomGenerator The source of randomness, which is advanced by the call.
     * @param numberOfSamples The number of samples.
     * @return A matrix <code>double[getDimension()][numberOfSamples]</code>, where column j is the j-th sample.
     */
    double[][] sample(RandomGenerator randomGenerator, int numberOfSamples);
}
