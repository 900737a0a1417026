// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.heap;

import java.util.function.Supplier;

/**
 * A storage location holding one object, that may be read and
 * replaced. Every holder of the same cell observes a write made through
 * any of them.
 *
 * @param <T> type of object held
 */
public interface Cell<T> extends Supplier<T> {

    /**
     * Replace the object held.
     *
     * @param value new content
     */
    void set(T value);
}
