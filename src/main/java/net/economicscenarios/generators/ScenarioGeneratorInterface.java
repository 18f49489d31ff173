package net.economicscenarios.generators;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A finite, lazily evaluated sequence of scenario values, exposed as an explicit pull protocol:
 * {@link #start()} begins a traversal and {@link #next(Object)} continues it from a given state.
 *
 * Pulls may consume draws from a shared random number generator, hence a traversal is not repeatable: starting a
 * new traversal continues with the draws where the previous one stopped. Implementations are not thread safe.
 *
 * @param <V> The type of the emitted values.
 * @param <S> The type of the iteration state.
 */
public interface ScenarioGeneratorInterface<V, S> extends Iterable<V> {

    /**
     * @return The number of values emitted by a complete traversal.
     */
    int getLength();

    /**
     * Starts a new traversal.
     *
     * @return The first value together with the state to continue from, or <code>null</code> if the sequence is empty.
     */
    IterationStep<V, S> start();

    /**
     * Continues a traversal.
     *
     * @param state The state returned by the previous pull.
     * @return The next value together with the state to continue from, or <code>null</code> if the traversal is complete.
     */
    IterationStep<V, S> next(S state);

    /**
     * Returns an iterator performing a new traversal. Values are computed on demand, i.e., random draws are only
     * taken when the next value is requested.
     */
    @Override
    default Iterator<V> iterator() {
        return new Iterator<V>() {
            private IterationStep<V, S> step;
            private boolean isStarted = false;
            private boolean isStepPending = true;

            @Override
            public boolean hasNext() {
                if(isStepPending) {
                    step = isStarted ? ScenarioGeneratorInterface.this.next(step.getState()) : start();
                    isStarted = true;
                    isStepPending = false;
                }
                return step != null;
            }

            @Override
            public V next() {
                if(!hasNext()) throw new NoSuchElementException("Scenario traversal is complete.");
                isStepPending = true;
                return step.getValue();
            }
        };
    }
}
