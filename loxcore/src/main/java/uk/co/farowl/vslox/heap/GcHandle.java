// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import java.util.Objects;

/**
 * Common base of the non-owning handles into a {@link Heap}. A handle
 * is a slot index and the generation of that slot at the time the
 * handle was made. It stays valid until the slot is reclaimed, after
 * which the generations no longer agree and every attempt to upgrade
 * the handle fails.
 * <p>
 * Two handles are equal if they designate the same slot in the same
 * generation of the same heap.
 *
 * @param <T> type of object in the heap
 */
public abstract class GcHandle<T> {

    /** The heap holding the referent. */
    final Heap<T> heap;
    /** Slot number in {@link #heap}. */
    final int index;
    /** Generation of the slot when this handle was created. */
    final int generation;

    GcHandle(Heap<T> heap, int index, int generation) {
        this.heap = heap;
        this.index = index;
        this.generation = generation;
    }

    /**
     * Whether the referent is still present in the heap, that is,
     * whether an upgrade would succeed.
     *
     * @return {@code true} iff the slot has not been reclaimed
     */
    public boolean isLive() { return heap.isLive(index, generation); }

    /**
     * The heap in which the referent is (or was) stored.
     *
     * @return the heap
     */
    public Heap<T> heap() { return heap; }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof GcHandle<?> h) {
            return heap == h.heap && index == h.index
                    && generation == h.generation;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(heap), index,
                generation);
    }

    @Override
    public String toString() {
        return String.format("<%s %s#%d.%d>", kind(), heap.getName(),
                index, generation);
    }

    /** @return short name of the kind of handle for messages */
    abstract String kind();
}
