package io.github.yok.marlea.grammar;

import java.util.List;
import lombok.Getter;

/**
 * Thrown when source text does not match the reaction network grammar.
 *
 * <p>
 * Carries the position of the offending token, its text, ANTLR's description of what was expected
 * and the chain of grammar rules that were being matched, outermost first (for example
 * {@code [reactionNetwork, line, reaction, products, term]}). The chain is empty for errors raised
 * by the lexer.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Getter
public class GrammarSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    // 1-based line number
    private final int line;

    // 1-based column number
    private final int column;

    // Text of the offending token, or null when the lexer could not form a token
    private final String offendingText;

    private final String detail;

    private final List<String> ruleChain;

    /**
     * Creates a new exception.
     *
     * @param line 1-based line of the offending token
     * @param column 1-based column of the offending token
     * @param offendingText offending token text, may be {@code null}
     * @param detail description produced by the parser
     * @param ruleChain rule invocation chain, outermost first
     */
    public GrammarSyntaxException(int line, int column, String offendingText, String detail,
            List<String> ruleChain) {
        super(buildMessage(line, column, detail, ruleChain));
        this.line = line;
        this.column = column;
        this.offendingText = offendingText;
        this.detail = detail;
        this.ruleChain = List.copyOf(ruleChain);
    }

    /**
     * Returns the innermost rule being matched when the error occurred.
     *
     * @return rule name, or {@code null} for lexer errors
     */
    public String getRule() {
        return ruleChain.isEmpty() ? null : ruleChain.get(ruleChain.size() - 1);
    }

    private static String buildMessage(int line, int column, String detail,
            List<String> ruleChain) {
        StringBuilder sb = new StringBuilder();
        sb.append("line ").append(line).append(':').append(column).append(' ').append(detail);
        if (!ruleChain.isEmpty()) {
            sb.append(" (while matching ").append(String.join(" > ", ruleChain)).append(')');
        }
        return sb.toString();
    }
}
