/**
 * Grammar of the reaction network notation.
 *
 * <p>
 * The lexer and parser are generated by ANTLR from {@code Crn.g4}. {@code CrnGrammar} wires them
 * together and reports the first syntax error as a {@code GrammarSyntaxException}.
 * </p>
 */
package io.github.yok.marlea.grammar;
