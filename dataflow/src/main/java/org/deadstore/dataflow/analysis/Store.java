package org.deadstore.dataflow.analysis;

/**
 * A store is used to keep track of the information that the dataflow analysis has accumulated at
 * any given point in time.
 *
 * @param <S> the type of the store returned by {@code copy} and that is used in {@code
 *     leastUpperBound}. Usually it is the implementing class itself, e.g. in {@code T extends
 *     Store<T>}.
 */
public interface Store<S extends Store<S>> {

    /** @return an exact copy of this store */
    S copy();

    /**
     * Compute the least upper bound of two stores.
     *
     * <p><em>Important</em>: This method must fulfill the following contract:
     *
     * <ul>
     *   <li>Does not change {@code this}.
     *   <li>Does not change {@code other}.
     *   <li>Returns a fresh object which is not aliased yet.
     *   <li>Returns an object of the same (dynamic) type as {@code this}, even if the signature is
     *       more permissive.
     *   <li>Is commutative up to {@link #lessOrEqual}: {@code a.leastUpperBound(b)} and {@code
     *       b.leastUpperBound(a)} are each less or equal to the other. Information the order does
     *       not compare may depend on the argument order.
     * </ul>
     *
     * @param other the other store
     * @return the least upper bound of {@code this} and {@code other}
     */
    S leastUpperBound(S other);

    /**
     * Compute an upper bound of two stores that is wider than the least upper bound of the two
     * stores. Used to jump to a higher abstraction to allow faster termination of the fixed point
     * computations in {@link Analysis}. {@code previous} must be the previous store.
     *
     * <p>A particular analysis might not require widening and should implement this method by
     * calling leastUpperBound.
     *
     * @param previous must be the previous store
     * @return an upper bound of {@code this} and {@code previous}
     */
    S widenedUpperBound(S previous);

    /**
     * The partial order of the lattice. The analysis treats a block as converged when the store
     * merged into it is less or equal to the store it already had.
     *
     * @param other the store to compare to
     * @return true if {@code this} carries no information that {@code other} lacks
     */
    boolean lessOrEqual(S other);
}
