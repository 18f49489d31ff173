package net.economicscenarios.models;

import net.finmath.functions.NormalDistribution;

/**
 * Base class for models driven by a single standard normal shock per time step.
 */
public abstract class AbstractEconomicModel implements EconomicModelInterface {

    private final double initialValue;

    protected AbstractEconomicModel(double initialValue) {
        super();
        this.initialValue = initialValue;
    }

    @Override
    public double getInitialValue() {
        return initialValue;
    }

    /**
     * Maps a uniform variate to a standard normal shock.
     *
     * @param variate A uniform variate in the open interval (0,1).
     * @return The standard normal quantile of the variate.
     * @throws IllegalArgumentException If the variate is not in the open interval (0,1).
     */
    protected static double getStandardNormalShock(double variate) {
        if(!(variate > 0.0 && variate < 1.0)) {
            throw new IllegalArgumentException("Variate " + variate + " is outside of the open interval (0,1).");
        }
        return NormalDistribution.inverseCumulativeDistribution(variate);
    }

    protected static void checkNonNegative(String name, double value) {
        if(!(value >= 0.0)) throw new IllegalArgumentException("Parameter " + name + " must be non-negative, got " + value + ".");
    }
}
