package net.economicscenarios.generators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.economicscenarios.copulas.CopulaInterface;
import net.economicscenarios.models.EconomicModelInterface;

/**
 * Correlates the paths of several {@link ScenarioGenerator}s through a copula.
 *
 * At the start of a traversal one matrix of uniform variates is drawn from the copula, with one row per
 * generator and one column per time step. Each model interprets the variates of its row according to its own
 * dynamics, e.g. as the quantile of the normal shock of a diffusion. The copula therefore only determines the
 * dependence between the shocks, not their marginal distributions.
 *
 * A traversal emits one complete path per generator, in the order of the generators (not one cross section per
 * time step). The paths contain the values at the grid points after time zero, i.e., the initial value is not part
 * of a path. The random number generators of the component generators are not used; all randomness comes from the
 * copula sample drawn with the random number generator of this object.
 *
 * <pre>
 * ScenarioGenerator equity = new ScenarioGenerator(1.0, 30.0, new BlackScholesMerton(0.01, 0.02, 0.15, 100.0));
 * Correlated correlated = new Correlated(
 *         Arrays.asList(equity, equity),
 *         new GaussianCopula(new double[][] { { 1.0, 0.9 }, { 0.9, 1.0 } }));
 * double[][] paths = correlated.collect();
 * </pre>
 */
public class Correlated implements ScenarioGeneratorInterface<double[], Correlated.State> {

    private static final Logger logger = LogManager.getLogger(Correlated.class);

    /**
     * Iteration state of a traversal: the variates sampled at its start and the index of the next generator.
     * The variates are owned by the traversal and are not exposed, the paths are the only view on them.
     */
    public static final class State {
        private final double[][] variates;
        private final int nextIndex;

        State(double[][] variates, int nextIndex) {
            this.variates = variates;
            this.nextIndex = nextIndex;
        }

        public int getNextIndex() {
            return nextIndex;
        }
    }

    private final List<ScenarioGenerator> generators;
    private final CopulaInterface copula;
    private final RandomGenerator randomGenerator;

    /**
     * @param generators The generators to correlate, all sharing the same time step and end time.
     * @param copula The copula, whose dimension is the number of generators.
     * @param randomGenerator The source of randomness for the copula samples.
     * @throws IllegalArgumentException If the list is empty, the grids of the generators differ or the dimension of the copula does not match.
     */
    public Correlated(List<ScenarioGenerator> generators, CopulaInterface copula, RandomGenerator randomGenerator) {
        if(generators == null || generators.isEmpty()) {
            throw new IllegalArgumentException("At least one generator is required.");
        }
        if(copula == null) throw new IllegalArgumentException("Copula must not be null.");
        if(randomGenerator == null) throw new IllegalArgumentException("Random number generator must not be null.");

        ScenarioGenerator first = generators.get(0);
        for(ScenarioGenerator generator : generators) {
            if(generator.getTimeStep() != first.getTimeStep()) {
                throw new IllegalArgumentException("All component generators must have the same time step, got "
                        + generator.getTimeStep() + " and " + first.getTimeStep() + ".");
            }
            if(generator.getEndTime() != first.getEndTime()) {
                throw new IllegalArgumentException("All component generators must have the same end time, got "
                        + generator.getEndTime() + " and " + first.getEndTime() + ".");
            }
        }
        if(copula.getDimension() != generators.size()) {
            throw new IllegalArgumentException("Copula of dimension " + copula.getDimension() + " cannot correlate " + generators.size() + " generators.");
        }

        this.generators = Collections.unmodifiableList(new ArrayList<>(generators));
        this.copula = copula;
        this.randomGenerator = randomGenerator;
    }

    /**
     * Creates a correlated generator drawing from its own, randomly seeded {@link MersenneTwister}.
     *
     * @param generators The generators to correlate, all sharing the same time step and end time.
     * @param copula The copula, whose dimension is the number of generators.
     */
    public Correlated(List<ScenarioGenerator> generators, CopulaInterface copula) {
        this(generators, copula, new MersenneTwister());
    }

    /**
     * @return The number of generators, i.e., the number of paths emitted by a traversal.
     */
    @Override
    public int getLength() {
        return generators.size();
    }

    /**
     * @return The number of values of each path, that is the number of grid points after time zero.
     */
    public int getPathLength() {
        return generators.get(0).getLength() - 1;
    }

    @Override
    public IterationStep<double[], State> start() {
        int numberOfSteps = getPathLength();
        double[][] variates = copula.sample(randomGenerator, numberOfSteps);
        if(variates.length != generators.size()) {
            throw new IllegalStateException("Copula returned " + variates.length + " components, expected " + generators.size() + ".");
        }
        logger.debug("Sampled {} x {} variates for correlated traversal", variates.length, numberOfSteps);

        return new IterationStep<>(getPath(0, variates), new State(variates, 1));
    }

    @Override
    public IterationStep<double[], State> next(State state) {
        int index = state.getNextIndex();
        if(index >= generators.size()) {
            return null;
        }
        return new IterationStep<>(getPath(index, state.variates), new State(state.variates, index + 1));
    }

    /**
     * Performs one complete traversal, drawing one copula sample.
     *
     * @return The paths, one row per generator.
     */
    public double[][] collect() {
        double[][] paths = new double[getLength()][];
        int index = 0;
        for(IterationStep<double[], State> step = start(); step != null; step = next(step.getState())) {
            paths[index++] = step.getValue();
        }
        return paths;
    }

    public List<ScenarioGenerator> getGenerators() {
        return generators;
    }

    public CopulaInterface getCopula() {
        return copula;
    }

    public RandomGenerator getRandomGenerator() {
        return randomGenerator;
    }

    private double[] getPath(int generatorIndex, double[][] variates) {
        ScenarioGenerator generator = generators.get(generatorIndex);
        EconomicModelInterface model = generator.getModel();
        double timeStep = generator.getTimeStep();

        double[] path = new double[getPathLength()];
        double value = model.getInitialValue(timeStep);
        for(int timeIndex = 0; timeIndex < path.length; timeIndex++) {
            // the transition is evaluated at the end of the period
            double time = (timeIndex + 1) * timeStep;
            value = model.getNextValue(value, time, timeStep, variates[generatorIndex][timeIndex]);
            path[timeIndex] = value;
        }
        return path;
    }
}
