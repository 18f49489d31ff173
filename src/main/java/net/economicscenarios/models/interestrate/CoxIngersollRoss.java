package net.economicscenarios.models.interestrate;

import java.util.Objects;

import net.economicscenarios.models.AbstractEconomicModel;

/**
 * Cox-Ingersoll-Ross short rate model \( dr = a (b - r) dt + \sigma \sqrt{r} dW \).
 *
 * The Euler step uses full truncation, i.e. drift and diffusion are evaluated at \( r^{+} = \max(r,0) \),
 * so that a rate which became negative through discretization reverts instead of producing an undefined root.
 */
public class CoxIngersollRoss extends AbstractEconomicModel {

    private final double meanReversionSpeed;
    private final double longTermMean;
    private final double volatility;

    public CoxIngersollRoss(double meanReversionSpeed, double longTermMean, double volatility, double initialRate) {
        super(initialRate);
        checkNonNegative("volatility", volatility);
        this.meanReversionSpeed = meanReversionSpeed;
        this.longTermMean = longTermMean;
        this.volatility = volatility;
    }

    @Override
    public double getNextValue(double currentValue, double currentTime, double timeStep, double variate) {
        double shock = getStandardNormalShock(variate);
        double rate = Math.max(currentValue, 0.0);
        return currentValue + meanReversionSpeed * (longTermMean - rate) * timeStep
                + volatility * Math.sqrt(rate) * Math.sqrt(timeStep) * shock;
    }

    public double getMeanReversionSpeed() {
        return meanReversionSpeed;
    }

    public double getLongTermMean() {
        return longTermMean;
    }

    public double getVolatility() {
        return volatility;
    }

    @Override
    public boolean equals(Object other) {
        if(this == other) return true;
        if(!(other instanceof CoxIngersollRoss)) return false;
        CoxIngersollRoss model = (CoxIngersollRoss)other;
        return Double.compare(meanReversionSpeed, model.meanReversionSpeed) == 0
                && Double.compare(longTermMean, model.longTermMean) == 0
                && Double.compare(volatility, model.volatility) == 0
                && Double.compare(getInitialValue(), model.getInitialValue()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(meanReversionSpeed, longTermMean, volatility, getInitialValue());
    }

    @Override
    public String toString() {
        return "CoxIngersollRoss [a=" + meanReversionSpeed + ", b=" + longTermMean + ", sigma=" + volatility + ", initial=" + getInitialValue() + "]";
    }
}
