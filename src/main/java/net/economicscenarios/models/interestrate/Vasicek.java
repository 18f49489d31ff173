package net.economicscenarios.models.interestrate;

import java.util.Objects;

import net.economicscenarios.models.AbstractEconomicModel;

/**
 * Vasicek short rate model \( dr = a (b - r) dt + \sigma dW \), simulated by an Euler step
 * \[ r_{t+\Delta t} = r_{t} + a (b - r_{t}) \Delta t + \sigma \sqrt{\Delta t} \Phi^{-1}(u). \]
 */
public class Vasicek extends AbstractEconomicModel {

    private final double meanReversionSpeed;
    private final double longTermMean;
    private final double volatility;

    /**
     * @param meanReversionSpeed The speed of mean reversion a.
     * @param longTermMean The long term mean b.
     * @param volatility The volatility &sigma;.
     * @param initialRate The initial short rate.
     */
    public Vasicek(double meanReversionSpeed, double longTermMean, double volatility, double initialRate) {
        super(initialRate);
        checkNonNegative("volatility", volatility);
        this.meanReversionSpeed = meanReversionSpeed;
        this.longTermMean = longTermMean;
        this.volatility = volatility;
    }

    @Override
    public double getNextValue(double currentValue, double currentTime, double timeStep, double variate) {
        double shock = getStandardNormalShock(variate);
        return currentValue + meanReversionSpeed * (longTermMean - currentValue) * timeStep + volatility * Math.sqrt(timeStep) * shock;
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
        if(!(other instanceof Vasicek)) return false;
        Vasicek model = (Vasicek)other;
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
        return "Vasicek [a=" + meanReversionSpeed + ", b=" + longTermMean + ", sigma=" + volatility + ", initial=" + getInitialValue() + "]";
    }
}
