package net.economicscenarios.generators;

import java.util.Map;

import net.finmath.time.TimeDiscretization;
import net.finmath.time.TimeDiscretizationFromArray;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.economicscenarios.models.EconomicModelFactory;
import net.economicscenarios.models.EconomicModelInterface;

/**
 * Generates one path of an {@link EconomicModelInterface} on the time grid \( 0, \Delta t, 2 \Delta t, \ldots \) up to
 * the end time.
 *
 * A traversal emits the initial value of the model first and then one value per grid point, each obtained from
 * the model transition fed with exactly one uniform draw of the random number generator. The generator does not
 * keep its own copy of the random stream: every traversal, including {@link #getElement(int)}, continues to consume
 * the shared random number generator. Two traversals are identical only if they start from identically seeded
 * random number generators.
 *
 * The number of grid points is determined with a relative tolerance, so that rounding in \( T / \Delta t \) neither
 * drops nor adds the last grid point. A traversal counts its steps, the time of step i being \( i \Delta t \),
 * hence it always emits exactly {@link #getLength()} values.
 *
 * <pre>
 * ScenarioGenerator generator = new ScenarioGenerator(
 *         1.0,  // time step
 *         30.0, // horizon
 *         new Vasicek(0.136, 0.0168, 0.0119, 0.01),
 *         new MersenneTwister(3141));
 * double[] path = generator.collect();
 * </pre>
 */
public class ScenarioGenerator implements ScenarioGeneratorInterface<Double, ScenarioGenerator.State> {

    private static final Logger logger = LogManager.getLogger(ScenarioGenerator.class);

    private static final double RELATIVE_TOLERANCE = Math.sqrt(Math.ulp(1.0));

    /**
     * Iteration state of a traversal: the grid index and time of the last emitted value and the value itself.
     */
    public static final class State {
        private final int stepIndex;
        private final double time;
        private final double value;

        State(int stepIndex, double time, double value) {
            this.stepIndex = stepIndex;
            this.time = time;
            this.value = value;
        }

        public int getStepIndex() {
            return stepIndex;
        }

        public double getTime() {
            return time;
        }

        public double getValue() {
            return value;
        }
    }

    private final double timeStep;
    private final double endTime;
    private final EconomicModelInterface model;
    private final RandomGenerator randomGenerator;
    private final int numberOfTimeSteps;

    /**
     * @param timeStep The time step (strictly positive).
     * @param endTime The horizon (non-negative).
     * @param model The model generating the values.
     * @param randomGenerator The source of uniform variates, advanced by every traversal.
     */
    public ScenarioGenerator(double timeStep, double endTime, EconomicModelInterface model, RandomGenerator randomGenerator) {
        if(!(timeStep > 0.0)) throw new IllegalArgumentException("Time step must be positive, got " + timeStep + ".");
        if(!(endTime >= 0.0)) throw new IllegalArgumentException("End time must be non-negative, got " + endTime + ".");
        if(model == null) throw new IllegalArgumentException("Model must not be null.");
        if(randomGenerator == null) throw new IllegalArgumentException("Random number generator must not be null.");

        this.timeStep = timeStep;
        this.endTime = endTime;
        this.model = model;
        this.randomGenerator = randomGenerator;
        this.numberOfTimeSteps = getNumberOfTimeSteps(endTime, timeStep);

        double numberOfSteps = endTime / timeStep;
        if(!isApproximatelyEqual(numberOfSteps, Math.rint(numberOfSteps))) {
            logger.warn("End time {} is not a multiple of the time step {}, the grid stops at {}", endTime, timeStep, (getLength() - 1) * timeStep);
        }
        logger.debug("Created generator for {} with time step {} and end time {}", model, timeStep, endTime);
    }

    /**
     * Creates a generator with its own, randomly seeded {@link MersenneTwister}.
     *
     * @param timeStep The time step (strictly positive).
     * @param endTime The horizon (non-negative).
     * @param model The model generating the values.
     */
    public ScenarioGenerator(double timeStep, double endTime, EconomicModelInterface model) {
        this(timeStep, endTime, model, new MersenneTwister());
    }

    /**
     * Creates a generator from a property map. The keys <code>timeStep</code> and <code>endTime</code> define the grid,
     * the model is created by {@link EconomicModelFactory#createModel(Map)} from the same map.
     *
     * @param properties The property map.
     * @param randomGenerator The source of uniform variates.
     */
    public ScenarioGenerator(Map<String, ?> properties, RandomGenerator randomGenerator) {
        this(
                EconomicModelFactory.getParameter(properties, "timeStep"),
                EconomicModelFactory.getParameter(properties, "endTime"),
                EconomicModelFactory.createModel(properties),
                randomGenerator);
    }

    /**
     * The number of grid points in [0, endTime], i.e., \( 1 + \lfloor endTime / \Delta t \rfloor \), where a ratio
     * within rounding distance of an integer counts as that integer.
     */
    @Override
    public int getLength() {
        return numberOfTimeSteps + 1;
    }

    @Override
    public IterationStep<Double, State> start() {
        double initialValue = model.getInitialValue(timeStep);
        return new IterationStep<>(initialValue, new State(0, 0.0, initialValue));
    }

    @Override
    public IterationStep<Double, State> next(State state) {
        if(state.getStepIndex() >= numberOfTimeSteps) {
            return null;
        }

        double variate = randomGenerator.nextDouble();
        double value = model.getNextValue(state.getValue(), state.getTime(), timeStep, variate);
        int stepIndex = state.getStepIndex() + 1;
        State nextState = new State(stepIndex, stepIndex * timeStep, value);
        return new IterationStep<>(value, nextState);
    }

    /**
     * Returns the value at the given grid index by running a new traversal of <code>index</code> steps.
     *
     * The result is not cached: each call consumes <code>index</code> fresh draws from the random number generator,
     * hence two calls with the same index will in general return different values. Use {@link #collect()} to
     * obtain all values of one path.
     *
     * @param index The grid index, 0 being the initial value.
     * @return The value emitted at the given index by a new traversal.
     * @throws IndexOutOfBoundsException If the index is outside [0, getLength()).
     */
    public double getElement(int index) {
        if(index < 0 || index >= getLength()) {
            throw new IndexOutOfBoundsException("Index " + index + " outside of path of length " + getLength() + ".");
        }

        IterationStep<Double, State> step = start();
        for(int stepIndex = 0; stepIndex < index; stepIndex++) {
            step = next(step.getState());
        }
        return step.getValue();
    }

    /**
     * Performs one complete traversal.
     *
     * @return The values of one path, including the initial value.
     */
    public double[] collect() {
        double[] values = new double[getLength()];
        int index = 0;
        for(IterationStep<Double, State> step = start(); step != null; step = next(step.getState())) {
            values[index++] = step.getValue();
        }
        return values;
    }

    /**
     * The grid as finmath time discretization. Its times are rounded to the time tick of
     * {@link TimeDiscretizationFromArray}, hence grids finer than that tick are not representable.
     *
     * @return The time discretization \( i \Delta t \), i = 0, ..., getLength()-1.
     */
    public TimeDiscretization getTimes() {
        return new TimeDiscretizationFromArray(0.0, numberOfTimeSteps, timeStep);
    }

    /**
     * @return The type of the emitted values, as declared by the model.
     */
    public Class<? extends Number> getValueType() {
        return model.getOutputType();
    }

    public double getTimeStep() {
        return timeStep;
    }

    public double getEndTime() {
        return endTime;
    }

    public EconomicModelInterface getModel() {
        return model;
    }

    public RandomGenerator getRandomGenerator() {
        return randomGenerator;
    }

    private static int getNumberOfTimeSteps(double endTime, double timeStep) {
        double numberOfSteps = endTime / timeStep;
        double nearestInteger = Math.rint(numberOfSteps);
        long steps = isApproximatelyEqual(numberOfSteps, nearestInteger) ? (long)nearestInteger : (long)Math.floor(numberOfSteps);
        return Math.toIntExact(steps);
    }

    static boolean isApproximatelyEqual(double x, double y) {
        return x == y || Math.abs(x - y) <= RELATIVE_TOLERANCE * Math.max(Math.abs(x), Math.abs(y));
    }
}
