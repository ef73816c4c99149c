package com.zegelin.jsonwriter.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link CharArrayPool} with an independent cache per thread. No state is shared between threads.
 */
public class ThreadLocalCharArrayPool implements CharArrayPool {
    private static final Logger logger = LoggerFactory.getLogger(ThreadLocalCharArrayPool.class);

    private final int maxArraysPerBucket;

    private final ThreadLocal<ArrayDeque<char[]>[]> buckets = ThreadLocal.withInitial(ThreadLocalCharArrayPool::newBuckets);

    ThreadLocalCharArrayPool(final int maxArraysPerBucket) {
        checkArgument(maxArraysPerBucket >= 0, "maxArraysPerBucket must not be negative, was %s", maxArraysPerBucket);

        this.maxArraysPerBucket = maxArraysPerBucket;
    }

    @SuppressWarnings("unchecked")
    private static ArrayDeque<char[]>[] newBuckets() {
        final ArrayDeque<char[]>[] buckets = new ArrayDeque[SizeClasses.COUNT];

        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new ArrayDeque<>();
        }

        return buckets;
    }

    @Override
    public char[] rent(final int minimumLength) {
        checkArgument(minimumLength > 0, "minimumLength must be positive, was %s", minimumLength);

        final int index = SizeClasses.indexFor(minimumLength);

        if (index >= SizeClasses.COUNT) {
            logger.debug("Requested {} chars exceeds the largest size class. Allocating unpooled.", minimumLength);
            return new char[minimumLength];
        }

        final char[] array = buckets.get()[index].pollLast();

        return array != null ? array : new char[SizeClasses.lengthOf(index)];
    }

    @Override
    public void giveBack(final char[] array) {
        checkNotNull(array);

        final int index = SizeClasses.indexOf(array);

        if (index < 0) {
            logger.debug("Dropping returned array of length {}, it does not belong to any size class.", array.length);
            return;
        }

        final ArrayDeque<char[]> bucket = buckets.get()[index];

        if (bucket.size() >= maxArraysPerBucket) {
            logger.debug("Dropping returned array of length {}, its size class is full.", array.length);
            return;
        }

        bucket.addLast(array);
    }

    /** The number of arrays cached for the calling thread. */
    public int retainedArrayCount() {
        int count = 0;

        for (final ArrayDeque<char[]> bucket : buckets.get()) {
            count += bucket.size();
        }

        return count;
    }

    @Override
    public String toString() {
        return String.format("thread-local (max %d arrays per size class per thread)", maxArraysPerBucket);
    }
}
