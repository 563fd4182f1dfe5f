package org.deadstore.dataflow.analysis;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.deadstore.dataflow.cfg.node.Node;

/**
 * {@code TransferInput} is used as the input type of the individual transfer functions of a
 * {@link TransferFunction}. It also contains a reference to the node for which the transfer
 * function will be applied.
 *
 * <p>A {@code TransferInput} contains one store. The store is owned by the transfer function it is
 * passed to, which may modify it.
 *
 * @param <S> the {@link Store} used to keep track of intermediate results
 */
public class TransferInput<S extends Store<S>> {

    /** The corresponding node, or {@code null} for the input of a block. */
    protected final @Nullable Node node;

    /** The regular result store. */
    protected final S store;

    /**
     * Create a {@link TransferInput}, given a store.
     *
     * @param node the corresponding node
     * @param store the regular result store
     */
    public TransferInput(@Nullable Node node, S store) {
        this.node = node;
        this.store = store;
    }

    /** @return the {@link Node} for this {@link TransferInput}, if any */
    public @Nullable Node getNode() {
        return node;
    }

    /** @return the regular result store produced if no exception is thrown */
    public S getRegularStore() {
        return store;
    }

    /** @return an exact copy of this store */
    public TransferInput<S> copy() {
        return new TransferInput<>(node, store.copy());
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (!(o instanceof TransferInput)) {
            return false;
        }
        TransferInput<?> other = (TransferInput<?>) o;
        return Objects.equals(store, other.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "[" + store + "]";
    }
}
