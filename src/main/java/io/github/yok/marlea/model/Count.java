package io.github.yok.marlea.model;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * Non-negative integer quantity.
 *
 * <p>
 * Used both for molecule counts (initial species amounts, term coefficients) and for reaction rate
 * constants. Zero is a legal value everywhere; a zero rate describes a reaction that never fires.
 * </p>
 *
 * @author marlea-parser contributors
 */
@Value
public class Count implements Comparable<Count> {

    public static final Count ZERO = new Count(0L);

    public static final Count ONE = new Count(1L);

    long value;

    private Count(long value) {
        this.value = value;
    }

    /**
     * Returns a count holding the given value.
     *
     * @param value non-negative amount
     * @return the count
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static Count of(long value) {
        Preconditions.checkArgument(value >= 0, "Count must not be negative: %s", value);
        if (value == 0L) {
            return ZERO;
        }
        if (value == 1L) {
            return ONE;
        }
        return new Count(value);
    }

    /**
     * Parses a decimal literal made only of ASCII digits.
     *
     * @param text literal text
     * @return the parsed count
     * @throws NumberFormatException if {@code text} is not a digit-only literal that fits in a
     *         {@code long}
     */
    public static Count parse(String text) {
        if (text == null || text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new NumberFormatException("Not a non-negative integer literal: " + text);
        }
        return of(Long.parseLong(text));
    }

    /**
     * Returns the sum of this count and {@code other}.
     *
     * @param other count to add
     * @return the sum
     * @throws ArithmeticException if the sum overflows a {@code long}
     */
    public Count plus(Count other) {
        return of(Math.addExact(value, other.value));
    }

    @Override
    public int compareTo(Count other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
