package io.github.yok.marlea.parser;

import io.github.yok.marlea.model.ReactionNetwork;

/**
 * Interface for parsing reaction network source text into a {@link ReactionNetwork}.
 *
 * <p>
 * Implementations are pure: they read nothing but the given text and keep no state between calls.
 * </p>
 */
public interface NetworkParser {

    /**
     * Parses the whole source text.
     *
     * @param source source text
     * @return the parsed network
     * @throws NetworkParseException with {@link ParseErrorKind#PARSE_FAILED} if the source is
     *         malformed
     */
    ReactionNetwork parse(String source) throws NetworkParseException;
}
