package io.github.yok.marlea.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.NonNull;
import lombok.Value;

/**
 * A reaction turning a list of reactant terms into a list of product terms at a given rate.
 *
 * <p>
 * Equality compares both term lists in order together with the rate, so {@code a + b => c} and
 * {@code b + a => c} are distinct reactions.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Value
public class Reaction {

    List<Term> reactants;

    List<Term> products;

    Count rate;

    /**
     * Creates a reaction.
     *
     * @param reactants terms consumed, in source order
     * @param products terms produced, in source order
     * @param rate rate constant
     */
    public Reaction(@NonNull List<Term> reactants, @NonNull List<Term> products,
            @NonNull Count rate) {
        this.reactants = List.copyOf(reactants);
        this.products = List.copyOf(products);
        this.rate = rate;
    }

    /**
     * Returns every species named on either side, reactants first, in order of first appearance.
     *
     * @return the referenced species
     */
    public Set<Name> species() {
        return Stream.concat(reactants.stream(), products.stream()).map(Term::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
