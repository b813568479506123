package io.github.yok.marlea.lowering;

/**
 * Semantic failures detected while lowering a parse tree.
 *
 * <p>
 * The grammar rules out all of these for trees produced by {@code CrnGrammar}, except
 * {@link #UNPARSABLE_NUMBER} for literals too large for a {@code long}. They are still checked for
 * every node.
 * </p>
 *
 * @author marlea-parser contributors
 */
public enum LoweringErrorKind {
    // A term or name node without the parts it needs
    MALFORMED,
    // A numeric literal that is not a non-negative long
    UNPARSABLE_NUMBER,
    // A reaction node missing its reactants, products or rate
    INCOMPLETE_REACTION,
    // A species-count node missing its name or count
    INCOMPLETE_DECLARATION,
    // A line node of a kind the lowering does not know
    UNEXPECTED_NODE
}
