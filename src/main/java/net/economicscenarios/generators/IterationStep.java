package net.economicscenarios.generators;

/**
 * The result of one pull on a scenario generator: the emitted value and the iteration state from which the
 * next pull continues.
 *
 * @param <V> The type of the emitted values.
 * @param <S> The type of the iteration state.
 */
public final class IterationStep<V, S> {

    private final V value;
    private final S state;

    public IterationStep(V value, S state) {
        this.value = value;
        this.state = state;
    }

    public V getValue() {
        return value;
    }

    public S getState() {
        return state;
    }
}
