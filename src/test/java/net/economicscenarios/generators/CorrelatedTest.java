package net.economicscenarios.generators;

import net.economicscenarios.copulas.ClaytonCopula;
import net.economicscenarios.copulas.CopulaInterface;
import net.economicscenarios.copulas.GaussianCopula;
import net.economicscenarios.copulas.IndependenceCopula;
import net.economicscenarios.models.equity.BlackScholesMerton;
import net.economicscenarios.models.interestrate.Vasicek;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class CorrelatedTest {

    private final BlackScholesMerton equityModel = new BlackScholesMerton(0.01, 0.02, 0.15, 100.0);
    private final Vasicek rateModel = new Vasicek(0.136, 0.0168, 0.0119, 0.01);
    private final GaussianCopula copula = new GaussianCopula(new double[][] { { 1.0, 0.9 }, { 0.9, 1.0 } });

    @Test
    public void testLengthIsNumberOfGeneratorsAndPathsExcludeInitialValue() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 30.0, equityModel, new MersenneTwister(1));
        Correlated correlated = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(2));

        assertEquals(2, correlated.getLength());
        assertEquals(30, correlated.getPathLength());

        int count = 0;
        for(double[] path : correlated) {
            assertEquals(30, path.length);
            count++;
        }
        assertEquals(2, count);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDifferentTimeStepsAreRejected() {
        new Correlated(Arrays.asList(
                new ScenarioGenerator(1.0, 30.0, equityModel),
                new ScenarioGenerator(0.5, 30.0, equityModel)), copula);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDifferentEndTimesAreRejected() {
        new Correlated(Arrays.asList(
                new ScenarioGenerator(1.0, 30.0, equityModel),
                new ScenarioGenerator(1.0, 20.0, equityModel)), copula);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyGroupIsRejected() {
        new Correlated(Collections.<ScenarioGenerator>emptyList(), copula);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCopulaDimensionMustMatch() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 30.0, equityModel);
        new Correlated(Arrays.asList(generator, generator, generator), copula);
    }

    @Test
    public void testCopulaIsSampledOncePerTraversal() {
        RandomGenerator randomGenerator = new MersenneTwister(3);
        CopulaInterface mockedCopula = mock(CopulaInterface.class);
        when(mockedCopula.getDimension()).thenReturn(2);
        when(mockedCopula.sample(any(RandomGenerator.class), eq(10))).thenReturn(constantMatrix(2, 10, 0.5));

        ScenarioGenerator generator = new ScenarioGenerator(1.0, 10.0, rateModel);
        Correlated correlated = new Correlated(Arrays.asList(generator, generator), mockedCopula, randomGenerator);

        correlated.collect();
        verify(mockedCopula, times(1)).sample(randomGenerator, 10);

        correlated.collect();
        verify(mockedCopula, times(2)).sample(randomGenerator, 10);
    }

    @Test
    public void testPathsReplayModelTransitionOnTheirRow() {
        double[][] variates = new double[][] {
                { 0.1, 0.2, 0.3, 0.4 },
                { 0.9, 0.8, 0.7, 0.6 }
        };
        CopulaInterface mockedCopula = mock(CopulaInterface.class);
        when(mockedCopula.getDimension()).thenReturn(2);
        when(mockedCopula.sample(any(RandomGenerator.class), eq(4))).thenReturn(variates);

        RandomGenerator componentRandomGenerator = mock(RandomGenerator.class);
        Correlated correlated = new Correlated(Arrays.asList(
                new ScenarioGenerator(0.5, 2.0, rateModel, componentRandomGenerator),
                new ScenarioGenerator(0.5, 2.0, equityModel, componentRandomGenerator)), mockedCopula, new MersenneTwister(4));

        double[][] paths = correlated.collect();

        double rate = rateModel.getInitialValue(0.5);
        double price = equityModel.getInitialValue(0.5);
        for(int i = 0; i < 4; i++) {
            rate = rateModel.getNextValue(rate, (i + 1) * 0.5, 0.5, variates[0][i]);
            price = equityModel.getNextValue(price, (i + 1) * 0.5, 0.5, variates[1][i]);
            assertEquals(rate, paths[0][i], 0.0);
            assertEquals(price, paths[1][i], 0.0);
        }
        verifyNoInteractions(componentRandomGenerator);
    }

    @Test
    public void testTraversalKeepsTheMatrixOfItsStart() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 5.0, equityModel);
        RandomGenerator randomGenerator = spy(new MersenneTwister(5));
        Correlated correlated = new Correlated(Arrays.asList(generator, generator), new IndependenceCopula(2), randomGenerator);
        double[][] expected = new Correlated(Arrays.asList(generator, generator), new IndependenceCopula(2), new MersenneTwister(5)).collect();

        IterationStep<double[], Correlated.State> first = correlated.start();
        verify(randomGenerator, times(10)).nextDouble();
        IterationStep<double[], Correlated.State> second = correlated.next(first.getState());

        assertArrayEquals(expected[0], first.getValue(), 0.0);
        assertArrayEquals(expected[1], second.getValue(), 0.0);
        assertEquals(2, second.getState().getNextIndex());
        assertNull(correlated.next(second.getState()));
        verify(randomGenerator, times(10)).nextDouble();
    }

    @Test
    public void testStronglyDependentClaytonGroupTraverses() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 10.0, rateModel);
        Correlated correlated = new Correlated(Arrays.asList(generator, generator), new ClaytonCopula(2, 100.0), new MersenneTwister(1));

        for(int traversal = 0; traversal < 1000; traversal++) {
            double[][] paths = correlated.collect();
            for(double[] path : paths) {
                for(double rate : path) {
                    assertFalse(Double.isNaN(rate));
                }
            }
        }
    }

    @Test(expected = NoSuchElementException.class)
    public void testExhaustedIteratorThrows() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 5.0, equityModel);
        Iterator<double[]> iterator = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(6)).iterator();
        iterator.next();
        iterator.next();
        iterator.next();
    }

    @Test
    public void testIdenticallySeededTraversalsAreReproducible() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 30.0, equityModel);

        double[][] paths1 = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(3141)).collect();
        double[][] paths2 = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(3141)).collect();

        assertArrayEquals(paths1[0], paths2[0], 0.0);
        assertArrayEquals(paths1[1], paths2[1], 0.0);
    }

    @Test
    public void testShocksAreCorrelatedByCopula() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 30.0, equityModel);
        Correlated correlated = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(3141));

        int numberOfTraversals = 200;
        double[] logReturns1 = new double[numberOfTraversals * 30];
        double[] logReturns2 = new double[numberOfTraversals * 30];
        for(int traversal = 0; traversal < numberOfTraversals; traversal++) {
            double[][] paths = correlated.collect();
            for(int i = 0; i < 30; i++) {
                double previous1 = i == 0 ? 100.0 : paths[0][i - 1];
                double previous2 = i == 0 ? 100.0 : paths[1][i - 1];
                logReturns1[traversal * 30 + i] = Math.log(paths[0][i] / previous1);
                logReturns2[traversal * 30 + i] = Math.log(paths[1][i] / previous2);
            }
        }

        double correlation = new PearsonsCorrelation().correlation(logReturns1, logReturns2);
        assertEquals(0.9, correlation, 0.03);
    }

    @Test
    public void testZeroHorizonGivesEmptyPaths() {
        ScenarioGenerator generator = new ScenarioGenerator(1.0, 0.0, equityModel);
        double[][] paths = new Correlated(Arrays.asList(generator, generator), copula, new MersenneTwister(7)).collect();

        assertEquals(2, paths.length);
        assertEquals(0, paths[0].length);
        assertEquals(0, paths[1].length);
    }

    private static double[][] constantMatrix(int rows, int columns, double value) {
        double[][] matrix = new double[rows][columns];
        for(double[] row : matrix) {
            Arrays.fill(row, value);
        }
        return matrix;
    }
}
