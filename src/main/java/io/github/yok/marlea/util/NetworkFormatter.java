package io.github.yok.marlea.util;

import io.github.yok.marlea.model.Count;
import io.github.yok.marlea.model.Name;
import io.github.yok.marlea.model.Reaction;
import io.github.yok.marlea.model.ReactionNetwork;
import io.github.yok.marlea.model.Term;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link ReactionNetwork} back into the comma-delimited notation.
 *
 * <p>
 * Reactions come first in the network's iteration order, followed by one species-count line per
 * species sorted by name. Parsing the output yields a network equal to the input.
 * </p>
 *
 * <pre>
 * a =&gt; b,1,
 * 2 a =&gt; 2 b,5,
 * a,0,
 * b,0,
 * c,10,
 * </pre>
 *
 * @author marlea-parser contributors
 */
public final class NetworkFormatter {

    private NetworkFormatter() {
        // Utility class; do not instantiate.
    }

    /**
     * Formats the whole network, one line per reaction or species, each line ending with a line
     * feed.
     *
     * @param network network to render
     * @return the source text
     */
    public static String format(ReactionNetwork network) {
        StringBuilder sb = new StringBuilder();
        for (Reaction reaction : network.getReactions()) {
            sb.append(formatReaction(reaction)).append('\n');
        }
        network.getSolution().asMap().entrySet().stream().sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(formatSpecies(e.getKey(), e.getValue())).append('\n'));
        return sb.toString();
    }

    /**
     * Formats one reaction, e.g. {@code 2 a + b => c,5,}.
     *
     * @param reaction reaction to render
     * @return the reaction line without line terminator
     */
    public static String formatReaction(Reaction reaction) {
        return formatTerms(reaction.getReactants()) + " => " + formatTerms(reaction.getProducts())
                + "," + reaction.getRate() + ",";
    }

    /**
     * Formats one term. A coefficient of one is omitted.
     *
     * @param term term to render
     * @return the term text
     */
    public static String formatTerm(Term term) {
        if (Count.ONE.equals(term.getCoefficient())) {
            return term.getName().getValue();
        }
        return term.getCoefficient() + " " + term.getName();
    }

    private static String formatSpecies(Name name, Count count) {
        return name + "," + count + ",";
    }

    private static String formatTerms(List<Term> terms) {
        return terms.stream().map(NetworkFormatter::formatTerm)
                .collect(Collectors.joining(" + "));
    }
}
