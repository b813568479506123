package io.github.yok.marlea.parser;

import lombok.Getter;

/**
 * The single failure type returned to callers of {@link NetworkParser} and {@link NetworkLoader}.
 *
 * <p>
 * For {@link ParseErrorKind#PARSE_FAILED} the cause is the underlying
 * {@code GrammarSyntaxException} or {@code LoweringException}, and the message contains its line
 * and column.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Getter
public class NetworkParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ParseErrorKind kind;

    /**
     * Creates a new exception without a cause.
     *
     * @param kind error kind
     * @param message detail message
     */
    public NetworkParseException(ParseErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates a new exception.
     *
     * @param kind error kind
     * @param message detail message
     * @param cause underlying failure
     */
    public NetworkParseException(ParseErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
