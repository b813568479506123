/**
 * Marlea reaction network parser.
 *
 * <p>
 * Translates the comma-delimited chemical reaction network notation into a
 * {@code ReactionNetwork} for a stochastic simulator. The {@code grammar} package parses text, the
 * {@code lowering} package turns the parse tree into {@code model} types, and the {@code parser}
 * package exposes the result to callers.
 * </p>
 */
package io.github.yok.marlea;
