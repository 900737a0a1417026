// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

/**
 * Receiver of the references held by a run-time object, presented by
 * that object so that a collector may trace reachability without the
 * object knowing how the collector works.
 */
public interface Tracer {

    /**
     * Report an owning reference. The holder keeps the cell alive.
     *
     * @param cell referred to
     */
    void owning(SharedCell<?> cell);

    /**
     * Report a non-owning reference. The holder does not keep the
     * referent alive.
     *
     * @param handle referred to
     */
    void weak(GcHandle<?> handle);
}
