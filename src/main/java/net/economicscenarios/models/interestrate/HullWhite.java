package net.economicscenarios.models.interestrate;

import net.finmath.marketdata.model.AnalyticModel;
import net.finmath.marketdata.model.curves.DiscountCurve;
import net.economicscenarios.models.AbstractEconomicModel;

/**
 * Hull-White short rate model \( dr = (\theta(t) - a r) dt + \sigma dW \) fitted to a given discount curve
 * \( t \mapsto P(0,t) \), where
 * \[ \theta(t) = \frac{\partial f(0,t)}{\partial t} + a f(0,t) + \frac{\sigma^2}{2a} (1 - e^{-2at}) \]
 * and \( f(0,t) = -\frac{\partial}{\partial t} \log P(0,t) \) is the instantaneous forward rate.
 *
 * The discount factors are read from the curve via {@link DiscountCurve#getDiscountFactor(AnalyticModel, double)},
 * using the analytic model given at construction (which may be null for curves which do not depend on other
 * curves). The derivatives of the curve are obtained by finite differences of \( \log P \), hence the curve has to
 * be evaluable for all non-negative times. Building the curve from market data is left to the caller.
 *
 * The value emitted at time zero depends on the time step of the generator: it is the continuously compounded
 * forward rate over the first period, \( -\log P(0,\Delta t) / \Delta t \).
 */
public class HullWhite extends AbstractEconomicModel {

    private static final double DIFFERENTIATION_STEP = 1E-4;

    private final double meanReversionSpeed;
    private final double volatility;
    private final DiscountCurve discountCurve;
    private final AnalyticModel curveModel;

    /**
     * @param meanReversionSpeed The speed of mean reversion a (strictly positive).
     * @param volatility The volatility &sigma;.
     * @param discountCurve The discount curve providing \( P(0,t) \).
     * @param curveModel The analytic model used to evaluate the curve, may be null.
     */
    public HullWhite(double meanReversionSpeed, double volatility, DiscountCurve discountCurve, AnalyticModel curveModel) {
        super(getInstantaneousForward(discountCurve, curveModel, 0.0));
        if(!(meanReversionSpeed > 0.0)) throw new IllegalArgumentException("Parameter meanReversionSpeed must be positive, got " + meanReversionSpeed + ".");
        checkNonNegative("volatility", volatility);
        this.meanReversionSpeed = meanReversionSpeed;
        this.volatility = volatility;
        this.discountCurve = discountCurve;
        this.curveModel = curveModel;
    }

    public HullWhite(double meanReversionSpeed, double volatility, DiscountCurve discountCurve) {
        this(meanReversionSpeed, volatility, discountCurve, null);
    }

    @Override
    public double getInitialValue(double timeStep) {
        return -Math.log(discountCurve.getDiscountFactor(curveModel, timeStep)) / timeStep;
    }

    @Override
    public double getNextValue(double currentValue, double currentTime, double timeStep, double variate) {
        double shock = getStandardNormalShock(variate);
        double theta = getTheta(currentTime);
        return currentValue + (theta - meanReversionSpeed * currentValue) * timeStep + volatility * Math.sqrt(timeStep) * shock;
    }

    /**
     * The drift function &theta; which makes the model reproduce the discount curve.
     *
     * @param time The time t.
     * @return The value of &theta;(t).
     */
    public double getTheta(double time) {
        double forward = getInstantaneousForward(discountCurve, curveModel, time);
        double forwardSlope = getInstantaneousForwardSlope(time);
        return forwardSlope + meanReversionSpeed * forward
                + volatility * volatility / (2.0 * meanReversionSpeed) * (1.0 - Math.exp(-2.0 * meanReversionSpeed * time));
    }

    public double getMeanReversionSpeed() {
        return meanReversionSpeed;
    }

    public double getVolatility() {
        return volatility;
    }

    public DiscountCurve getDiscountCurve() {
        return discountCurve;
    }

    public AnalyticModel getCurveModel() {
        return curveModel;
    }

    private static double getInstantaneousForward(DiscountCurve discountCurve, AnalyticModel curveModel, double time) {
        if(discountCurve == null) throw new IllegalArgumentException("Discount curve must not be null.");

        double h = DIFFERENTIATION_STEP;
        if(time < h) {
            // one sided second order scheme, the curve may not be defined before zero
            return -(-3.0 * Math.log(discountCurve.getDiscountFactor(curveModel, time))
                    + 4.0 * Math.log(discountCurve.getDiscountFactor(curveModel, time + h))
                    - Math.log(discountCurve.getDiscountFactor(curveModel, time + 2 * h))) / (2.0 * h);
        }
        return -(Math.log(discountCurve.getDiscountFactor(curveModel, time + h))
                - Math.log(discountCurve.getDiscountFactor(curveModel, time - h))) / (2.0 * h);
    }

    private double getInstantaneousForwardSlope(double time) {
        double h = DIFFERENTIATION_STEP;
        if(time < h) {
            return -(getLogDiscountFactor(time) - 2.0 * getLogDiscountFactor(time + h) + getLogDiscountFactor(time + 2 * h)) / (h * h);
        }
        return -(getLogDiscountFactor(time + h) - 2.0 * getLogDiscountFactor(time) + getLogDiscountFactor(time - h)) / (h * h);
    }

    private double getLogDiscountFactor(double time) {
        return Math.log(discountCurve.getDiscountFactor(curveModel, time));
    }

    @Override
    public String toString() {
        return "HullWhite [a=" + meanReversionSpeed + ", sigma=" + volatility + ", curve=" + discountCurve.getName() + ", initial=" + getInitialValue() + "]";
    }
}
