/**
 * Reaction network parsers.
 *
 * <p>
 * Defines the {@code NetworkParser} abstraction, its implementation for the comma-delimited
 * notation, and {@code NetworkLoader}, which reads a source file and selects a parser through
 * {@code SourceFormat}. All failures surface as {@code NetworkParseException}.
 * </p>
 */
package io.github.yok.marlea.parser;
