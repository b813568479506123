package io.github.yok.marlea.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * ANTLR error listener that aborts on the first lexer or parser error.
 *
 * <p>
 * The {@link GrammarSyntaxException} describing the error travels as the cause of a
 * {@link ParseCancellationException}, which is unwrapped by {@link CrnGrammar}.
 * </p>
 *
 * @author marlea-parser contributors
 */
final class ThrowingErrorListener extends BaseErrorListener {

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
            int charPositionInLine, String msg, RecognitionException e) {
        List<String> ruleChain = new ArrayList<>();
        if (recognizer instanceof Parser) {
            ruleChain.addAll(((Parser) recognizer).getRuleInvocationStack());
            Collections.reverse(ruleChain);
        }
        String offendingText =
                offendingSymbol instanceof Token ? ((Token) offendingSymbol).getText() : null;
        throw new ParseCancellationException(new GrammarSyntaxException(line,
                charPositionInLine + 1, offendingText, msg, ruleChain));
    }
}
