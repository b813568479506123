/**
 * Utility package.
 *
 * <p>
 * Provides stateless helpers for the command-line layer: error reporting with exit codes and
 * rendering of reaction networks back into source notation.
 * </p>
 */
package io.github.yok.marlea.util;
