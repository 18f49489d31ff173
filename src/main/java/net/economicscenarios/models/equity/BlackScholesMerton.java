package net.economicscenarios.models.equity;

import java.util.Objects;

import org.apache.commons.math3.distribution.LogNormalDistribution;

import net.economicscenarios.generators.ScenarioGenerator;
import net.economicscenarios.models.AbstractEconomicModel;

/**
 * Black-Scholes-Merton model \( dS = (r - q) S dt + \sigma S dW \) for an equity price, simulated with the exact
 * transition
 * \[ S_{t+\Delta t} = S_{t} \exp\left( (r - q - \tfrac{1}{2}\sigma^2) \Delta t + \sigma \sqrt{\Delta t} \Phi^{-1}(u) \right). \]
 */
public class BlackScholesMerton extends AbstractEconomicModel {

    private final double riskFreeRate;
    private final double dividendYield;
    private final double volatility;

    /**
     * @param riskFreeRate The continuously compounded risk free rate r.
     * @param dividendYield The continuous dividend (or borrow) yield q.
     * @param volatility The volatility &sigma;.
     * @param initialPrice The initial price S<sub>0</sub>.
     */
    public BlackScholesMerton(double riskFreeRate, double dividendYield, double volatility, double initialPrice) {
        super(initialPrice);
        checkNonNegative("volatility", volatility);
        this.riskFreeRate = riskFreeRate;
        this.dividendYield = dividendYield;
        this.volatility = volatility;
    }

    @Override
    public double getNextValue(double currentValue, double currentTime, double timeStep, double variate) {
        double shock = getStandardNormalShock(variate);
        return currentValue * Math.exp((riskFreeRate - dividendYield - 0.5 * volatility * volatility) * timeStep + volatility * Math.sqrt(timeStep) * shock);
    }

    /**
     * The distribution of the price at the horizon of the given generator, as implied by this model.
     * Useful for validating simulated terminal values, it is not used by the simulation itself.
     *
     * @param generator A generator, whose end time is used as horizon.
     * @return The log-normal distribution of the terminal price.
     */
    public LogNormalDistribution getPriceDistribution(ScenarioGenerator generator) {
        return getPriceDistribution(generator.getEndTime());
    }

    /**
     * @param time The horizon T (strictly positive).
     * @return The log-normal distribution of \( S_{T} \).
     */
    public LogNormalDistribution getPriceDistribution(double time) {
        double logMean = Math.log(getInitialValue()) + (riskFreeRate - dividendYield - 0.5 * volatility * volatility) * time;
        double logStandardDeviation = volatility * Math.sqrt(time);
        return new LogNormalDistribution(logMean, logStandardDeviation);
    }

    public double getRiskFreeRate() {
        return riskFreeRate;
    }

    public double getDividendYield() {
        return dividendYield;
    }

    public double getVolatility() {
        return volatility;
    }

    @Override
    public boolean equals(Object other) {
        if(this == other) return true;
        if(!(other instanceof BlackScholesMerton)) return false;
        BlackScholesMerton model = (BlackScholesMerton)other;
        return Double.compare(riskFreeRate, model.riskFreeRate) == 0
                && Double.compare(dividendYield, model.dividendYield) == 0
                && Double.compare(volatility, model.volatility) == 0
                && Double.compare(getInitialValue(), model.getInitialValue()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(riskFreeRate, dividendYield, volatility, getInitialValue());
    }

    @Override
    public String toString() {
        return "BlackScholesMerton [r=" + riskFreeRate + ", q=" + dividendYield + ", sigma=" + volatility + ", initial=" + getInitialValue() + "]";
    }
}
