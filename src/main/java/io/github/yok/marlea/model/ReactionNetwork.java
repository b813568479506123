package io.github.yok.marlea.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.NonNull;
import lombok.Value;

/**
 * A set of reactions together with the initial amount of every species.
 *
 * <p>
 * Reactions keep the order in which they first appeared in the source. Equality is content-based,
 * so parsing the same text twice gives equal networks.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Value
public class ReactionNetwork {

    Set<Reaction> reactions;

    Solution solution;

    /**
     * Creates a network.
     *
     * @param reactions distinct reactions
     * @param solution initial species counts
     */
    public ReactionNetwork(@NonNull Set<Reaction> reactions, @NonNull Solution solution) {
        this.reactions = Collections.unmodifiableSet(new LinkedHashSet<>(reactions));
        this.solution = solution;
    }
}
