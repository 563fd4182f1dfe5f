package org.deadstore.dataflow.analysis;

/**
 * Implementation of a {@link TransferResult} with just one non-exceptional store.
 *
 * @param <S> the {@link Store} used to keep track of intermediate results
 */
public class RegularTransferResult<S extends Store<S>> extends TransferResult<S> {

    /**
     * Create a {@code TransferResult} with {@code resultStore} as the resulting store.
     *
     * <p><em>Aliasing</em>: {@code resultStore} is not allowed to be used anywhere outside of this
     * class (including use through aliases). Complete control over the object is transferred to
     * this class.
     *
     * @param resultStore the result store
     */
    public RegularTransferResult(S resultStore) {
        super(resultStore);
    }

    @Override
    public String toString() {
        return "RegularTransferResult(" + store + ")";
    }
}
