package com.zegelin.jsonwriter;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.zegelin.jsonwriter.cli.Encoding;
import com.zegelin.jsonwriter.cli.WorkloadOptions;
import com.zegelin.jsonwriter.netty.Utf8JsonWriter;
import com.zegelin.jsonwriter.pool.BucketedCharArrayPool;
import com.zegelin.jsonwriter.pool.CharArrayPool;
import com.zegelin.jsonwriter.pool.PoolPolicy;
import com.zegelin.jsonwriter.pool.ThreadLocalCharArrayPool;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufAllocatorMetric;
import io.netty.buffer.ByteBufAllocatorMetricProvider;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocatorMetric;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

@Command(name = "json-writer", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Writes synthetic JSON documents and reports how long it took.")
public class Application implements Callable<Void> {
    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(Application.class);

    private static final List<Level> LOGGER_LEVELS = ImmutableList.of(Level.INFO, Level.DEBUG, Level.TRACE);

    @Spec
    private Model.CommandSpec commandSpec;

    @Mixin
    private WorkloadOptions workloadOptions;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging. Multiple invocations increase the verbosity.")
    boolean[] verbosity = {};


    @Override
    public Void call() throws Exception {
        setRootLoggerLevel();

        if (workloadOptions.initialCapacity <= 0) {
            throw new ParameterException(commandSpec.commandLine(), "--initial-capacity must be positive.");
        }

        if (workloadOptions.records < 0 || workloadOptions.iterations <= 0) {
            throw new ParameterException(commandSpec.commandLine(), "--records must not be negative and --iterations must be positive.");
        }

        final List<SampleRecord> records = SampleRecord.generate(workloadOptions.records, workloadOptions.seed);

        logger.info("Writing {} records {} times as {} with pool policy {}.",
                records.size(), workloadOptions.iterations, workloadOptions.encoding, workloadOptions.poolPolicy);

        final CharArrayPool pool = workloadOptions.poolPolicy.pool();
        final ByteBufAllocator allocator = (workloadOptions.poolPolicy == PoolPolicy.NONE ?
                UnpooledByteBufAllocator.DEFAULT : PooledByteBufAllocator.DEFAULT);

        byte[] document = null;

        final Stopwatch total = Stopwatch.createStarted();

        for (int i = 0; i < workloadOptions.iterations; i++) {
            final Stopwatch stopwatch = Stopwatch.createStarted();

            switch (workloadOptions.encoding) {
                case UTF16:
                    try (final JsonWriter writer = new JsonWriter(workloadOptions.initialCapacity, pool)) {
                        SampleDocument.write(records, writer);
                        document = writer.finish().getBytes(UTF_8);
                    }
                    break;

                case UTF8:
                    try (final Utf8JsonWriter writer = new Utf8JsonWriter(workloadOptions.initialCapacity, allocator)) {
                        SampleDocument.write(records, writer);
                        document = writer.finish();
                    }
                    break;

                default:
                    throw new IllegalStateException("Unhandled encoding " + workloadOptions.encoding);
            }

            logger.debug("Iteration {} wrote {} bytes in {}.", i, document.length, stopwatch);
        }

        total.stop();

        final long totalMicros = total.elapsed(TimeUnit.MICROSECONDS);

        logger.info("Wrote {} documents of {} bytes in {} ({} µs per document).",
                workloadOptions.iterations, document.length, total, totalMicros / workloadOptions.iterations);

        if (workloadOptions.encoding == Encoding.UTF16) {
            logger.info("Pool: {}.", describePool(pool));

        } else {
            logger.info("Allocator: {}.", describeAllocator(allocator));
        }

        if (workloadOptions.output != null) {
            Files.write(workloadOptions.output, document);

            logger.info("Wrote last document to {}.", workloadOptions.output);
        }

        return null;
    }


    static String describePool(final CharArrayPool pool) {
        if (pool instanceof BucketedCharArrayPool) {
            final BucketedCharArrayPool bucketedPool = (BucketedCharArrayPool) pool;

            return String.format("%s, %d rents, %d allocations, %d arrays (%d chars) retained",
                    bucketedPool, bucketedPool.rentCount(), bucketedPool.allocationCount(),
                    bucketedPool.retainedArrayCount(), bucketedPool.retainedCharCount());
        }

        if (pool instanceof ThreadLocalCharArrayPool) {
            final ThreadLocalCharArrayPool threadLocalPool = (ThreadLocalCharArrayPool) pool;

            return String.format("%s, %d arrays retained by the calling thread",
                    threadLocalPool, threadLocalPool.retainedArrayCount());
        }

        return pool.toString();
    }

    static String describeAllocator(final ByteBufAllocator allocator) {
        if (allocator instanceof PooledByteBufAllocator) {
            final PooledByteBufAllocatorMetric metric = ((PooledByteBufAllocator) allocator).metric();

            return String.format("pooled, %d heap arenas, %d direct arenas, %d thread-local caches, %d heap bytes used, %d direct bytes used",
                    metric.numHeapArenas(), metric.numDirectArenas(), metric.numThreadLocalCaches(),
                    metric.usedHeapMemory(), metric.usedDirectMemory());
        }

        if (allocator instanceof ByteBufAllocatorMetricProvider) {
            final ByteBufAllocatorMetric metric = ((ByteBufAllocatorMetricProvider) allocator).metric();

            return String.format("unpooled, %d heap bytes used, %d direct bytes used",
                    metric.usedHeapMemory(), metric.usedDirectMemory());
        }

        return allocator.toString();
    }


    private void setRootLoggerLevel() {
        final int verbosity = Math.min(this.verbosity.length, LOGGER_LEVELS.size() - 1);

        final Level level = LOGGER_LEVELS.get(verbosity);

        final Logger rootLogger = (Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(level);
    }

    public static void main(String[] args) {
        final CommandLine commandLine = new CommandLine(new Application());

        commandLine.setCaseInsensitiveEnumValuesAllowed(true);

        commandLine.parseWithHandler(new RunLast(), args);
    }
}
