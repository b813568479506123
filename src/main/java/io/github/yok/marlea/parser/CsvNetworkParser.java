package io.github.yok.marlea.parser;

import com.google.common.base.Preconditions;
import io.github.yok.marlea.grammar.CrnGrammar;
import io.github.yok.marlea.grammar.CrnParser;
import io.github.yok.marlea.grammar.GrammarSyntaxException;
import io.github.yok.marlea.lowering.LoweringException;
import io.github.yok.marlea.lowering.NetworkLowering;
import io.github.yok.marlea.model.ReactionNetwork;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of {@link NetworkParser} for the comma-delimited reaction notation.
 *
 * <p>
 * Runs {@link CrnGrammar} and then {@link NetworkLowering}. Either failure is reported as
 * {@link ParseErrorKind#PARSE_FAILED}.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Slf4j
public class CsvNetworkParser implements NetworkParser {

    @Override
    public ReactionNetwork parse(String source) throws NetworkParseException {
        Preconditions.checkNotNull(source, "source must not be null");

        CrnParser.ReactionNetworkContext tree;
        try {
            tree = CrnGrammar.parse(source);
        } catch (GrammarSyntaxException e) {
            throw new NetworkParseException(ParseErrorKind.PARSE_FAILED,
                    "Syntax error at " + e.getMessage(), e);
        }

        ReactionNetwork network;
        try {
            network = NetworkLowering.lower(tree);
        } catch (LoweringException e) {
            throw new NetworkParseException(ParseErrorKind.PARSE_FAILED,
                    e.getKind() + " at " + e.getMessage(), e);
        }

        log.debug("Parsed reaction network: reactions={}, species={}",
                network.getReactions().size(), network.getSolution().size());
        return network;
    }
}
