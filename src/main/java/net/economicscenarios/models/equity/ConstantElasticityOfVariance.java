package net.economicscenarios.models.equity;

import java.util.Objects;

import net.economicscenarios.models.AbstractEconomicModel;

/**
 * Constant elasticity of variance model \( dS = (r - q) S dt + \sigma S^{\gamma} dW \).
 *
 * The step is a log-Euler step with the local volatility \( \sigma S^{\gamma - 1} \) frozen over the period, which
 * keeps prices positive. For \( \gamma = 1 \) the step coincides with {@link BlackScholesMerton}.
 */
public class ConstantElasticityOfVariance extends AbstractEconomicModel {

    private final double riskFreeRate;
    private final double dividendYield;
    private final double volatility;
    private final double elasticity;

    public ConstantElasticityOfVariance(double riskFreeRate, double dividendYield, double volatility, double elasticity, double initialPrice) {
        super(initialPrice);
        checkNonNegative("volatility", volatility);
        if(!(initialPrice > 0.0)) throw new IllegalArgumentException("Parameter initialPrice must be positive, got " + initialPrice + ".");
        this.riskFreeRate = riskFreeRate;
        this.dividendYield = dividendYield;
        this.volatility = volatility;
        this.elasticity = elasticity;
    }

    @Override
    public double getNextValue(double currentValue, double currentTime, double timeStep, double variate) {
        double shock = getStandardNormalShock(variate);
        double localVolatility = volatility * Math.pow(currentValue, elasticity - 1.0);
        return currentValue * Math.exp((riskFreeRate - dividendYield - 0.5 * localVolatility * localVolatility) * timeStep
                + localVolatility * Math.sqrt(timeStep) * shock);
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

    public double getElasticity() {
        return elasticity;
    }

    @Override
    public boolean equals(Object other) {
        if(this == other) return true;
        if(!(other instanceof ConstantElasticityOfVariance)) return false;
        ConstantElasticityOfVariance model = (ConstantElasticityOfVariance)other;
        return Double.compare(riskFreeRate, model.riskFreeRate) == 0
                && Double.compare(dividendYield, model.dividendYield) == 0
                && Double.compare(volatility, model.volatility) == 0
                && Double.compare(elasticity, model.elasticity) == 0
                && Double.compare(getInitialValue(), model.getInitialValue()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(riskFreeRate, dividendYield, volatility, elasticity, getInitialValue());
    }

    @Override
    public String toString() {
        return "ConstantElasticityOfVariance [r=" + riskFreeRate + ", q=" + dividendYield + ", sigma=" + volatility
                + ", gamma=" + elasticity + ", initial=" + getInitialValue() + "]";
    }
}
