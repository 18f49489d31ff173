package net.economicscenarios.models.equity;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ConstantElasticityOfVarianceTest {

    @Test
    public void testUnitElasticityCoincidesWithBlackScholesMerton() {
        ConstantElasticityOfVariance cev = new ConstantElasticityOfVariance(0.01, 0.02, 0.15, 1.0, 100.0);
        BlackScholesMerton bsm = new BlackScholesMerton(0.01, 0.02, 0.15, 100.0);

        for(double variate : new double[] { 0.01, 0.3, 0.5, 0.7, 0.99 }) {
            assertEquals(bsm.getNextValue(95.0, 1.0, 0.5, variate), cev.getNextValue(95.0, 1.0, 0.5, variate), 1e-12);
        }
    }

    @Test
    public void testLocalVolatilityScalesWithPrice() {
        ConstantElasticityOfVariance cev = new ConstantElasticityOfVariance(0.03, 0.0, 2.0, 0.5, 100.0);

        double localVolatility = 2.0 * Math.pow(100.0, -0.5);
        double expected = 100.0 * Math.exp((0.03 - 0.5 * localVolatility * localVolatility) * 1.0);

        assertEquals(localVolatility, 0.2, 1e-15);
        assertEquals(expected, cev.getNextValue(100.0, 0.0, 1.0, 0.5), 1e-10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveInitialPriceIsRejected() {
        new ConstantElasticityOfVariance(0.03, 0.0, 2.0, 0.5, 0.0);
    }
}
