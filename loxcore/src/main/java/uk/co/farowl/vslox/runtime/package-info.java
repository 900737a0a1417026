/**
 * The run-time values of Lox and the compiler output they are made
 * from.
 * <p>
 * {@link uk.co.farowl.vslox.runtime.Value} is the tagged union the
 * dispatch loop manipulates. Instruction handlers inspect and change
 * values only through its methods, through
 * {@link uk.co.farowl.vslox.runtime.Coerce}, and through
 * {@link uk.co.farowl.vslox.runtime.Closures} when a closure is made.
 * {@link uk.co.farowl.vslox.runtime.Function},
 * {@link uk.co.farowl.vslox.runtime.Chunk} and
 * {@link uk.co.farowl.vslox.runtime.Upvalue} are produced by the
 * compiler and never change afterwards.
 */
package uk.co.farowl.vslox.runtime;
