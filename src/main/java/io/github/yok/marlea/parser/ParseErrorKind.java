package io.github.yok.marlea.parser;

/**
 * Classification of {@link NetworkParseException}.
 *
 * <ul>
 * <li>PARSE_FAILED: the source text has a syntax error or could not be lowered</li>
 * <li>UNSUPPORTED_EXT: the source file extension has no registered parser</li>
 * <li>INVALID_FILE: no source could be obtained (missing path, no extension, unreadable)</li>
 * </ul>
 *
 * @author marlea-parser contributors
 */
public enum ParseErrorKind {
    PARSE_FAILED,
    UNSUPPORTED_EXT,
    INVALID_FILE
}
