package org.deadstore.dataflow.analysis;

/**
 * {@code TransferResult} is used as the result type of the individual transfer functions of a
 * {@link TransferFunction}.
 *
 * @param <S> the {@link Store} used to keep track of intermediate results
 */
public abstract class TransferResult<S extends Store<S>> {

    /** The regular result store. */
    protected final S store;

    protected TransferResult(S resultStore) {
        this.store = resultStore;
    }

    /** @return the regular result store produced if no exception is thrown */
    public S getRegularStore() {
        return store;
    }
}
