package com.zegelin.jsonwriter.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A thread-safe {@link CharArrayPool} keeping arrays in power-of-two size classes.
 * <p>
 * Each size class retains at most {@code maxArraysPerBucket} arrays. Requests larger than the biggest size class
 * are served by plain allocation and such arrays are dropped when given back.
 */
public class BucketedCharArrayPool implements CharArrayPool {
    private static final Logger logger = LoggerFactory.getLogger(BucketedCharArrayPool.class);

    private static final class Bucket {
        final int arrayLength;
        final Queue<char[]> arrays = new ConcurrentLinkedQueue<>();
        final AtomicInteger retained = new AtomicInteger();

        Bucket(final int arrayLength) {
            this.arrayLength = arrayLength;
        }
    }

    private final int maxArraysPerBucket;
    private final Bucket[] buckets = new Bucket[SizeClasses.COUNT];

    private final LongAdder rentCount = new LongAdder();
    private final LongAdder allocationCount = new LongAdder();

    BucketedCharArrayPool(final int maxArraysPerBucket) {
        checkArgument(maxArraysPerBucket >= 0, "maxArraysPerBucket must not be negative, was %s", maxArraysPerBucket);

        this.maxArraysPerBucket = maxArraysPerBucket;

        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new Bucket(SizeClasses.lengthOf(i));
        }
    }

    @Override
    public char[] rent(final int minimumLength) {
        checkArgument(minimumLength > 0, "minimumLength must be positive, was %s", minimumLength);

        rentCount.increment();

        final int index = SizeClasses.indexFor(minimumLength);

        if (index >= buckets.length) {
            logger.debug("Requested {} chars exceeds the largest size class. Allocating unpooled.", minimumLength);

            allocationCount.increment();
            return new char[minimumLength];
        }

        final Bucket bucket = buckets[index];

        final char[] array = bucket.arrays.poll();
        if (array != null) {
            bucket.retained.decrementAndGet();
            return array;
        }

        allocationCount.increment();
        return new char[bucket.arrayLength];
    }

    @Override
    public void giveBack(final char[] array) {
        checkNotNull(array);

        final int index = SizeClasses.indexOf(array);

        if (index < 0) {
            logger.debug("Dropping returned array of length {}, it does not belong to any size class.", array.length);
            return;
        }

        final Bucket bucket = buckets[index];

        // reserve a slot first so concurrent returns can't overfill the bucket
        if (bucket.retained.incrementAndGet() > maxArraysPerBucket) {
            bucket.retained.decrementAndGet();

            logger.debug("Dropping returned array of length {}, its size class is full.", array.length);
            return;
        }

        bucket.arrays.offer(array);
    }

    /** The number of arrays currently held by the pool, across all size classes. */
    public int retainedArrayCount() {
        int count = 0;

        for (final Bucket bucket : buckets) {
            count += bucket.retained.get();
        }

        return count;
    }

    /** The total number of chars held by the pool, across all size classes. */
    public long retainedCharCount() {
        long count = 0;

        for (final Bucket bucket : buckets) {
            count += (long) bucket.retained.get() * bucket.arrayLength;
        }

        return count;
    }

    /** The number of {@link #rent(int)} calls served since construction. */
    public long rentCount() {
        return rentCount.sum();
    }

    /** The number of {@link #rent(int)} calls that could not be served from a retained array. */
    public long allocationCount() {
        return allocationCount.sum();
    }

    @Override
    public String toString() {
        return String.format("bucketed (max %d arrays per size class)", maxArraysPerBucket);
    }
}
