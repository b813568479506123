package io.github.yok.marlea.lowering;

import lombok.Getter;

/**
 * Thrown when a parse tree violates a rule the grammar cannot express.
 *
 * @author marlea-parser contributors
 */
@Getter
public class LoweringException extends Exception {

    private static final long serialVersionUID = 1L;

    private final LoweringErrorKind kind;

    // 1-based; 0 when the node carries no token
    private final int line;

    // 1-based; 0 when the node carries no token
    private final int column;

    // Source text involved in the failure, may be null
    private final String text;

    /**
     * Creates a new exception.
     *
     * @param kind failure kind
     * @param line line of the offending node
     * @param column column of the offending node
     * @param text offending source text, may be {@code null}
     * @param description human readable description
     */
    public LoweringException(LoweringErrorKind kind, int line, int column, String text,
            String description) {
        super("line " + line + ":" + column + " " + description);
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.text = text;
    }
}
