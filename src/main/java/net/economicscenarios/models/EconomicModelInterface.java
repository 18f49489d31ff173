package net.economicscenarios.models;

/**
 * Interface of a stochastic process for an economic state variable (a short rate, an equity price, ...)
 * which is advanced by one time step given a uniform random variate.
 *
 * Implementations are immutable. The uniform variate is interpreted by each model according to its own
 * dynamics, usually by mapping it to a standard normal shock through the inverse cumulative distribution.
 */
public interface EconomicModelInterface {

    /**
     * The starting level of the process.
     *
     * @return The initial value of the process.
     */
    double getInitialValue();

    /**
     * The first value emitted by a generator stepping with the given time step. Models whose published initial
     * observation depends on the first step (e.g. a forward rate over the first period) override this method.
     *
     * @param timeStep The time step of the generator.
     * @return The initial value of the process as seen by a generator using the given time step.
     */
    default double getInitialValue(double timeStep) {
        return getInitialValue();
    }

    /**
     * Advances the process by one time step.
     *
     * @param currentValue The value of the process at <code>currentTime</code>.
     * @param currentTime The current time.
     * @param timeStep The length of the step.
     * @param variate A uniform variate in the open interval (0,1).
     * @return The value of the process at <code>currentTime + timeStep</code>.
     */
    double getNextValue(double currentValue, double currentTime, double timeStep, double variate);

    /**
     * @return The type of the values emitted by this model.
     */
    default Class<? extends Number> getOutputType() {
        return Double.class;
    }
}
