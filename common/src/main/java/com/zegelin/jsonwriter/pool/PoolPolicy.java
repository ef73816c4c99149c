package com.zegelin.jsonwriter.pool;

import java.util.function.Supplier;

public enum PoolPolicy {
    SHARED(CharArrayPools::shared),
    THREAD_LOCAL(CharArrayPools::threadLocal),
    NONE(CharArrayPools::unpooled);

    private final Supplier<CharArrayPool> poolSupplier;

    PoolPolicy(final Supplier<CharArrayPool> poolSupplier) {
        this.poolSupplier = poolSupplier;
    }

    public CharArrayPool pool() {
        return poolSupplier.get();
    }
}
