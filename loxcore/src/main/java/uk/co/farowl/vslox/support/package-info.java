/**
 * The {@code support} package contains classes that support the
 * run-time without depending on any other part of it. In particular
 * {@link InterpreterError} is the single way the core reports a broken
 * internal invariant.
 */
package uk.co.farowl.vslox.support;
