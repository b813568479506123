/**
 * Reaction network domain types.
 *
 * <p>
 * {@code Name}, {@code Count}, {@code Term} and {@code Reaction} are immutable values with
 * content-based equality. {@code Solution} and {@code ReactionNetwork} are the output handed to a
 * simulator.
 * </p>
 */
package io.github.yok.marlea.model;
