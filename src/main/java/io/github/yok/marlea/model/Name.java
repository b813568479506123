package io.github.yok.marlea.model;

import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Identifier of a chemical species.
 *
 * <p>
 * Names are compared by their exact text, so {@code a.b} and {@code A.b} are different species.
 * Dot-segmented names such as {@code destruct.done.partial.0} are kept as a single opaque value.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Value
public class Name implements Comparable<Name> {

    String value;

    private Name(String value) {
        this.value = value;
    }

    /**
     * Creates a name from the given text.
     *
     * @param value species text as written in the source
     * @return the name
     * @throws IllegalArgumentException if {@code value} is null or blank
     */
    public static Name of(String value) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Species name must not be blank");
        }
        return new Name(value);
    }

    @Override
    public int compareTo(Name other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
