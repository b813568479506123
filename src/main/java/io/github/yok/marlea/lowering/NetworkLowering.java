package io.github.yok.marlea.lowering;

import com.google.common.base.Preconditions;
import io.github.yok.marlea.grammar.CrnBaseVisitor;
import io.github.yok.marlea.grammar.CrnParser;
import io.github.yok.marlea.model.Count;
import io.github.yok.marlea.model.Name;
import io.github.yok.marlea.model.Reaction;
import io.github.yok.marlea.model.ReactionNetwork;
import io.github.yok.marlea.model.Solution;
import io.github.yok.marlea.model.Term;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.apache.commons.lang3.StringUtils;

/**
 * Lowers a parse tree produced by {@code CrnGrammar} into a {@link ReactionNetwork}.
 *
 * <p>
 * Lines are processed once, top to bottom:
 * </p>
 * <ul>
 * <li>Reaction lines add a {@link Reaction} to the reaction set. Identical reactions collapse into
 * one entry. Every species the reaction names is registered with a count of zero unless it already
 * has a count.</li>
 * <li>Species-count lines set the initial count of a species, replacing whatever was there. The
 * last declaration in the source wins.</li>
 * <li>Separator and blank lines are skipped.</li>
 * </ul>
 *
 * <p>
 * Terms naming the same species on one side of a reaction are merged by adding their
 * coefficients, so {@code b + b} becomes {@code 2 b}.
 * </p>
 *
 * <p>
 * The first failure aborts lowering. No partial network is returned.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Slf4j
public final class NetworkLowering {

    private NetworkLowering() {
        // Utility class; do not instantiate.
    }

    /**
     * Lowers the whole tree.
     *
     * @param tree root node from {@code CrnGrammar.parse}
     * @return the reaction network
     * @throws LoweringException if a node violates a lowering rule
     */
    public static ReactionNetwork lower(CrnParser.ReactionNetworkContext tree)
            throws LoweringException {
        Preconditions.checkNotNull(tree, "tree must not be null");

        Accumulator acc = new Accumulator();
        LineDispatcher dispatcher = new LineDispatcher();
        for (CrnParser.LineContext line : tree.line()) {
            line.accept(dispatcher).applyTo(acc);
        }

        ReactionNetwork network = new ReactionNetwork(acc.reactions, acc.solution.build());
        log.debug("Lowered {} lines into {} reactions and {} species", tree.line().size(),
                network.getReactions().size(), network.getSolution().size());
        return network;
    }

    /**
     * Lowers a reaction node.
     *
     * @param ctx reaction node
     * @return the reaction
     * @throws LoweringException if a child is missing or a term or number is invalid
     */
    static Reaction lowerReaction(CrnParser.ReactionContext ctx) throws LoweringException {
        if (ctx.reactants() == null) {
            throw incompleteReaction(ctx, "reactants");
        }
        if (ctx.products() == null) {
            throw incompleteReaction(ctx, "products");
        }
        if (ctx.reactionRate() == null) {
            throw incompleteReaction(ctx, "rate");
        }
        List<Term> reactants = lowerTerms(ctx.reactants(), ctx.reactants().term(), "reactants");
        List<Term> products = lowerTerms(ctx.products(), ctx.products().term(), "products");
        Count rate = lowerCount(ctx.reactionRate(), ctx.reactionRate().INTEGER());
        return new Reaction(reactants, products, rate);
    }

    /**
     * Lowers a species-count node.
     *
     * @param ctx species-count node
     * @return the declared species and its count
     * @throws LoweringException if a child is missing or the count is invalid
     */
    static Map.Entry<Name, Count> lowerSpeciesCount(CrnParser.SpeciesCountContext ctx)
            throws LoweringException {
        if (ctx.name() == null) {
            throw new LoweringException(LoweringErrorKind.INCOMPLETE_DECLARATION, lineOf(ctx),
                    columnOf(ctx), ctx.getText(), "species declaration is missing its name");
        }
        if (ctx.coefficient() == null) {
            throw new LoweringException(LoweringErrorKind.INCOMPLETE_DECLARATION, lineOf(ctx),
                    columnOf(ctx), ctx.getText(), "species declaration is missing its count");
        }
        return Map.entry(lowerName(ctx.name()),
                lowerCount(ctx.coefficient(), ctx.coefficient().INTEGER()));
    }

    /**
     * Lowers a term node. A missing coefficient means one.
     *
     * @param ctx term node
     * @return the term
     * @throws LoweringException if the name is missing or the coefficient is invalid
     */
    static Term lowerTerm(CrnParser.TermContext ctx) throws LoweringException {
        if (ctx.name() == null) {
            throw new LoweringException(LoweringErrorKind.MALFORMED, lineOf(ctx), columnOf(ctx),
                    ctx.getText(), "term has no species name");
        }
        Name name = lowerName(ctx.name());
        if (ctx.coefficient() == null) {
            return Term.of(name);
        }
        return Term.of(name, lowerCount(ctx.coefficient(), ctx.coefficient().INTEGER()));
    }

    /**
     * Lowers a name node.
     *
     * @param ctx name node
     * @return the name
     * @throws LoweringException if the node carries no text (defensive only)
     */
    static Name lowerName(CrnParser.NameContext ctx) throws LoweringException {
        TerminalNode token = ctx.NAME();
        if (token == null || StringUtils.isBlank(token.getText())) {
            throw new LoweringException(LoweringErrorKind.MALFORMED, lineOf(ctx), columnOf(ctx),
                    ctx.getText(), "name node has no text");
        }
        return Name.of(token.getText());
    }

    /**
     * Lowers a coefficient or rate literal.
     *
     * @param ctx coefficient or rate node, used for the error position
     * @param literal integer token, may be {@code null}
     * @return the count
     * @throws LoweringException if the literal is absent or not a non-negative {@code long}
     */
    static Count lowerCount(ParserRuleContext ctx, TerminalNode literal)
            throws LoweringException {
        String text = literal == null ? "" : literal.getText();
        try {
            return Count.parse(text);
        } catch (NumberFormatException e) {
            throw new LoweringException(LoweringErrorKind.UNPARSABLE_NUMBER, lineOf(ctx),
                    columnOf(ctx), text, "'" + text + "' is not a valid non-negative integer");
        }
    }

    private static List<Term> lowerTerms(ParserRuleContext side,
            List<CrnParser.TermContext> terms, String sideName) throws LoweringException {
        if (terms.isEmpty()) {
            throw incompleteReaction(side, sideName);
        }
        Map<Name, Count> merged = new LinkedHashMap<>();
        for (CrnParser.TermContext termCtx : terms) {
            Term term = lowerTerm(termCtx);
            Count previous = merged.get(term.getName());
            if (previous == null) {
                merged.put(term.getName(), term.getCoefficient());
                continue;
            }
            try {
                merged.put(term.getName(), previous.plus(term.getCoefficient()));
            } catch (ArithmeticException e) {
                throw new LoweringException(LoweringErrorKind.UNPARSABLE_NUMBER, lineOf(termCtx),
                        columnOf(termCtx), termCtx.getText(),
                        "combined coefficient of " + term.getName() + " is too large");
            }
        }
        List<Term> result = new ArrayList<>(merged.size());
        merged.forEach((name, count) -> result.add(Term.of(name, count)));
        return result;
    }

    private static LoweringException incompleteReaction(ParserRuleContext ctx, String part) {
        return new LoweringException(LoweringErrorKind.INCOMPLETE_REACTION, lineOf(ctx),
                columnOf(ctx), ctx.getText(), "reaction is missing its " + part);
    }

    private static int lineOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return start == null ? 0 : start.getLine();
    }

    private static int columnOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return start == null ? 0 : start.getCharPositionInLine() + 1;
    }

    /**
     * Work produced for one line; applied to the network being assembled.
     */
    @FunctionalInterface
    interface LineStep {

        void applyTo(Accumulator acc) throws LoweringException;
    }

    /**
     * Reaction set and species counts of the network being assembled.
     */
    static final class Accumulator {

        private final Set<Reaction> reactions = new LinkedHashSet<>();

        private final Solution.Builder solution = Solution.builder();

        void addReaction(Reaction reaction, int line) {
            if (!reactions.add(reaction)) {
                log.debug("Line {}: duplicate reaction ignored", line);
            }
            reaction.species().forEach(solution::reference);
        }

        void declare(Map.Entry<Name, Count> declaration) {
            solution.declare(declaration.getKey(), declaration.getValue());
        }
    }

    /**
     * Maps each kind of line node to its lowering step.
     */
    static final class LineDispatcher extends CrnBaseVisitor<LineStep> {

        private static final LineStep NO_OP = acc -> {
        };

        @Override
        public LineStep visitReactionLine(CrnParser.ReactionLineContext ctx) {
            return acc -> {
                if (ctx.reaction() == null) {
                    throw incompleteReaction(ctx, "reactants, products and rate");
                }
                acc.addReaction(lowerReaction(ctx.reaction()), lineOf(ctx));
            };
        }

        @Override
        public LineStep visitSpeciesCountLine(CrnParser.SpeciesCountLineContext ctx) {
            return acc -> {
                if (ctx.speciesCount() == null) {
                    throw new LoweringException(LoweringErrorKind.INCOMPLETE_DECLARATION,
                            lineOf(ctx), columnOf(ctx), ctx.getText(),
                            "species declaration is missing its name and count");
                }
                acc.declare(lowerSpeciesCount(ctx.speciesCount()));
            };
        }

        @Override
        public LineStep visitSeparatorLine(CrnParser.SeparatorLineContext ctx) {
            return NO_OP;
        }

        @Override
        public LineStep visitBlankLine(CrnParser.BlankLineContext ctx) {
            return NO_OP;
        }

        // Reached only for line nodes that are none of the labeled alternatives above.
        @Override
        protected LineStep defaultResult() {
            return acc -> {
                throw new LoweringException(LoweringErrorKind.UNEXPECTED_NODE, 0, 0, null,
                        "unexpected line node");
            };
        }
    }
}
