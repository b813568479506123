package io.github.yok.marlea.grammar;

import com.google.common.base.Preconditions;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Entry point to the reaction network grammar ({@code Crn.g4}).
 *
 * <p>
 * Turns source text into a concrete parse tree. Every node of the tree keeps its start token, so
 * line and column information is available to later stages. Parsing stops at the first error; ANTLR
 * error recovery never produces a partial tree.
 * </p>
 *
 * <p>
 * The class holds no state and may be used from any number of threads.
 * </p>
 *
 * @author marlea-parser contributors
 */
public final class CrnGrammar {

    private CrnGrammar() {
        // Utility class; do not instantiate.
    }

    /**
     * Parses the whole source text.
     *
     * @param source reaction network source
     * @return root node of the parse tree
     * @throws GrammarSyntaxException if the source does not match the grammar
     * @throws NullPointerException if {@code source} is {@code null}
     */
    public static CrnParser.ReactionNetworkContext parse(String source)
            throws GrammarSyntaxException {
        Preconditions.checkNotNull(source, "source must not be null");

        CrnLexer lexer = new CrnLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CrnParser parser = new CrnParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        try {
            return parser.reactionNetwork();
        } catch (ParseCancellationException ex) {
            if (ex.getCause() instanceof GrammarSyntaxException) {
                throw (GrammarSyntaxException) ex.getCause();
            }
            // Only reachable if something other than ThrowingErrorListener cancelled the parse.
            throw new GrammarSyntaxException(0, 0, null, String.valueOf(ex.getMessage()),
                    List.of());
        }
    }
}
