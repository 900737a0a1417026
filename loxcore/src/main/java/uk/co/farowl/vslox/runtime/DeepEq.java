// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vslox.runtime;

/**
 * Field-by-field comparison of compiler output, for use in tests that
 * compare what a compiler produced with what was expected. It is
 * distinct from both Java {@code equals} and the run-time equality
 * operator {@link Value#isEqual(Value)}, and no program semantics
 * depend on it.
 *
 * @param <T> type of object compared
 */
public interface DeepEq<T> {

    /**
     * Compare this object with another by content, including the
     * content of the objects it refers to.
     *
     * @param other to compare with
     * @return whether the content is the same
     */
    boolean deepEquals(T other);
}
