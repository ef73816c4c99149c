package com.zegelin.jsonwriter.pool;

/**
 * A reservoir of reusable {@code char[]} buffers.
 * <p>
 * An array handed out by {@link #rent(int)} is exclusively owned by the caller until it is passed to
 * {@link #giveBack(char[])}. Once given back, the caller must not touch it again as the pool may hand it
 * to another borrower.
 * <p>
 * Implementations must be safe for concurrent use from multiple threads.
 */
public interface CharArrayPool {
    /**
     * Rents an array of at least {@code minimumLength} chars. The contents of the array are undefined.
     *
     * @throws IllegalArgumentException if {@code minimumLength} is not positive
     */
    char[] rent(int minimumLength);

    /**
     * Returns an array previously obtained from {@link #rent(int)}. Arrays the pool does not recognise are dropped.
     */
    void giveBack(char[] array);
}
