package com.zegelin.jsonwriter.pool;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Utility implementations of {@link CharArrayPool}.
 */
public final class CharArrayPools {
    static final int DEFAULT_MAX_ARRAYS_PER_BUCKET = 32;

    private CharArrayPools() {}

    private static final class UnpooledCharArrayPool implements CharArrayPool {
        @Override
        public char[] rent(final int minimumLength) {
            checkArgument(minimumLength > 0, "minimumLength must be positive, was %s", minimumLength);

            return new char[minimumLength];
        }

        @Override
        public void giveBack(final char[] array) {}

        @Override
        public String toString() {
            return "unpooled";
        }
    }

    private static final CharArrayPool UNPOOLED = new UnpooledCharArrayPool();

    private static final BucketedCharArrayPool SHARED = new BucketedCharArrayPool(DEFAULT_MAX_ARRAYS_PER_BUCKET);

    private static final ThreadLocalCharArrayPool THREAD_LOCAL = new ThreadLocalCharArrayPool(DEFAULT_MAX_ARRAYS_PER_BUCKET / 4);

    /**
     * The process-wide thread-safe pool.
     */
    public static BucketedCharArrayPool shared() {
        return SHARED;
    }

    /**
     * A pool that keeps a small cache per thread.
     * An array given back on a thread other than the one that rented it is cached by the returning thread.
     */
    public static ThreadLocalCharArrayPool threadLocal() {
        return THREAD_LOCAL;
    }

    /**
     * A {@link CharArrayPool} that does no caching whatsoever.
     */
    public static CharArrayPool unpooled() {
        return UNPOOLED;
    }

    /**
     * A new, private thread-safe pool retaining at most {@code maxArraysPerBucket} arrays per size class.
     */
    public static BucketedCharArrayPool bucketed(final int maxArraysPerBucket) {
        return new BucketedCharArrayPool(maxArraysPerBucket);
    }
}
