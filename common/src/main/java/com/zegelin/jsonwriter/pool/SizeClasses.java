package com.zegelin.jsonwriter.pool;

/**
 * Power-of-two size classes shared by the pooling implementations.
 */
final class SizeClasses {
    static final int MIN_LENGTH_SHIFT = 4;
    static final int MIN_LENGTH = 1 << MIN_LENGTH_SHIFT;
    static final int MAX_LENGTH = 1 << 20;

    static final int COUNT = indexFor(MAX_LENGTH) + 1;

    private SizeClasses() {}

    /**
     * The index of the smallest size class holding {@code minimumLength} chars.
     * Values above {@link #MAX_LENGTH} yield an index {@code >= COUNT}.
     */
    static int indexFor(final int minimumLength) {
        if (minimumLength <= MIN_LENGTH) {
            return 0;
        }

        return (Integer.SIZE - Integer.numberOfLeadingZeros(minimumLength - 1)) - MIN_LENGTH_SHIFT;
    }

    static int lengthOf(final int index) {
        return MIN_LENGTH << index;
    }

    /**
     * The index of the size class {@code array} belongs to, or -1 if its length isn't exactly one of the classes.
     */
    static int indexOf(final char[] array) {
        final int length = array.length;

        if (length < MIN_LENGTH || length > MAX_LENGTH || Integer.bitCount(length) != 1) {
            return -1;
        }

        return Integer.numberOfTrailingZeros(length) - MIN_LENGTH_SHIFT;
    }
}
