/**
 * Lowering of reaction network parse trees into domain types.
 *
 * <p>
 * {@code NetworkLowering} owns every semantic check and the merge policy for species declarations.
 * Failures are reported as {@code LoweringException} with a {@code LoweringErrorKind}.
 * </p>
 */
package io.github.yok.marlea.lowering;
