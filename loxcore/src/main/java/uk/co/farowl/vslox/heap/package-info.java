/**
 * The reference primitives the run-time values are built from: an arena
 * of generation-tagged slots ({@link uk.co.farowl.vslox.heap.Heap}),
 * non-owning handles into it that fail to upgrade once their referent
 * is reclaimed, and the owning, reference-counted
 * {@link uk.co.farowl.vslox.heap.SharedCell}.
 * <p>
 * No strong cycle can form through these shapes: handles never own, and
 * a shared cell holds no reference back to its holders.
 */
package uk.co.farowl.vslox.heap;
