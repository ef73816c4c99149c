package com.zegelin.jsonwriter;

/**
 * Buffer growth policy shared by the writers.
 */
public final class Growth {
    /** The largest array length the JVMs in use reliably allocate. */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private Growth() {}

    /**
     * Returns the capacity to grow to when {@code required} more units must fit after {@code used} units in a buffer
     * of {@code capacity}: at least double the current capacity, never less than what is needed, capped at
     * {@link #MAX_ARRAY_LENGTH}.
     *
     * @throws OutOfMemoryError if {@code used + required} exceeds {@link #MAX_ARRAY_LENGTH}
     */
    public static int nextCapacity(final int used, final int required, final int capacity) {
        final long needed = (long) used + required;

        if (needed > MAX_ARRAY_LENGTH) {
            throw new OutOfMemoryError(String.format("Required buffer length %d exceeds the maximum of %d.", needed, MAX_ARRAY_LENGTH));
        }

        final long doubled = Math.min((long) capacity * 2, MAX_ARRAY_LENGTH);

        return (int) Math.max(needed, doubled);
    }
}
