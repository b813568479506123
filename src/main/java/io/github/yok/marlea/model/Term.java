package io.github.yok.marlea.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A species with its multiplicity on one side of a reaction, e.g. {@code 2 next_value}.
 *
 * @author marlea-parser contributors
 */
@Value
public class Term {

    @NonNull
    Name name;

    @NonNull
    Count coefficient;

    /**
     * Creates a term with an explicit coefficient.
     *
     * @param name species name
     * @param coefficient number of copies consumed or produced
     * @return the term
     */
    public static Term of(Name name, Count coefficient) {
        return new Term(name, coefficient);
    }

    /**
     * Creates a term with the default coefficient of one.
     *
     * @param name species name
     * @return the term
     */
    public static Term of(Name name) {
        return new Term(name, Count.ONE);
    }
}
