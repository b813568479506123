package io.github.yok.marlea.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Initial amount of every species known to a reaction network.
 *
 * <p>
 * Instances are immutable. They are assembled through {@link Builder}, which implements the two
 * update rules of the notation:
 * </p>
 * <ul>
 * <li>{@link Builder#declare(Name, Count)}: an explicit species-count line, always overwrites.</li>
 * <li>{@link Builder#reference(Name)}: a species seen in a reaction, added with zero only when it is
 * not known yet.</li>
 * </ul>
 *
 * @author marlea-parser contributors
 */
@EqualsAndHashCode
@ToString
public final class Solution {

    private final Map<Name, Count> counts;

    private Solution(Map<Name, Count> counts) {
        this.counts = Collections.unmodifiableMap(new HashMap<>(counts));
    }

    /**
     * Returns a builder for a new solution.
     *
     * @return empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the initial count of {@code name}.
     *
     * @param name species name
     * @return the count, or empty if the species is unknown
     */
    public Optional<Count> get(Name name) {
        return Optional.ofNullable(counts.get(name));
    }

    /**
     * Returns whether {@code name} has an entry.
     *
     * @param name species name
     * @return {@code true} if the species is known
     */
    public boolean contains(Name name) {
        return counts.containsKey(name);
    }

    /**
     * Returns the number of species.
     *
     * @return species count
     */
    public int size() {
        return counts.size();
    }

    /**
     * Returns a read-only view of all entries.
     *
     * @return unmodifiable map of species to initial count
     */
    public Map<Name, Count> asMap() {
        return counts;
    }

    /**
     * Mutable accumulator used while a source is being lowered. Not thread-safe.
     */
    @Slf4j
    public static final class Builder {

        private final Map<Name, Count> counts = new HashMap<>();

        private Builder() {}

        /**
         * Sets the initial count of {@code name}, replacing any earlier value.
         *
         * @param name species name
         * @param count declared initial count
         * @return this builder
         */
        public Builder declare(Name name, Count count) {
            Count previous = counts.put(name, count);
            if (previous != null && !previous.equals(count)) {
                log.debug("Species {} redeclared: {} -> {}", name, previous, count);
            }
            return this;
        }

        /**
         * Registers {@code name} with a count of zero unless it already has an entry.
         *
         * @param name species name
         * @return this builder
         */
        public Builder reference(Name name) {
            counts.putIfAbsent(name, Count.ZERO);
            return this;
        }

        /**
         * Creates the immutable solution. The builder may keep being used afterwards without
         * affecting the returned instance.
         *
         * @return the solution
         */
        public Solution build() {
            return new Solution(counts);
        }
    }
}
