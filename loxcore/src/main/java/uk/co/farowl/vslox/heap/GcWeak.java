// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import uk.co.farowl.vslox.support.InterpreterError;

/**
 * A non-owning handle giving read access to an object in a
 * {@link Heap}. A closure refers to its function this way.
 *
 * @param <T> type of object in the heap
 */
public final class GcWeak<T> extends GcHandle<T> {

    GcWeak(Heap<T> heap, int index, int generation) {
        super(heap, index, generation);
    }

    /**
     * Return the referent. Inside a correctly working run-time this
     * never fails while the handle is reachable.
     *
     * @return the referent
     * @throws InterpreterError if the referent has been reclaimed
     */
    public T upgrade() throws InterpreterError {
        return heap.get(index, generation);
    }

    @Override
    String kind() { return "weak"; }
}
