package com.zegelin.jsonwriter.cli;

import com.zegelin.jsonwriter.pool.PoolPolicy;
import picocli.CommandLine.Option;

import java.nio.file.Path;

public class WorkloadOptions {

    @Option(names = "--pool",
            paramLabel = "POLICY",
            defaultValue = "SHARED",
            description = "Buffer pooling policy used when a writer grows. " +
                    "Valid policies: ${COMPLETION-CANDIDATES}. " +
                    "For UTF8, NONE selects an unpooled allocator and any other policy the pooled allocator. " +
                    "Defaults to ${DEFAULT-VALUE}.")
    public PoolPolicy poolPolicy = PoolPolicy.SHARED;

    @Option(names = "--initial-capacity",
            paramLabel = "LENGTH",
            defaultValue = "256",
            description = "Initial buffer capacity of each writer, in chars or bytes. " +
                    "Defaults to '${DEFAULT-VALUE}'")
    public int initialCapacity = 256;

    @Option(names = "--encoding",
            paramLabel = "ENCODING",
            defaultValue = "UTF16",
            description = "Output encoding. Valid encodings: ${COMPLETION-CANDIDATES}. " +
                    "Defaults to ${DEFAULT-VALUE}.")
    public Encoding encoding = Encoding.UTF16;

    @Option(names = "--records",
            paramLabel = "COUNT",
            defaultValue = "1000",
            description = "Number of synthetic records written to each document. " +
                    "Defaults to '${DEFAULT-VALUE}'")
    public int records = 1000;

    @Option(names = "--iterations",
            paramLabel = "COUNT",
            defaultValue = "100",
            description = "Number of times the document is written. " +
                    "Defaults to '${DEFAULT-VALUE}'")
    public int iterations = 100;

    @Option(names = "--seed",
            paramLabel = "SEED",
            defaultValue = "0",
            description = "Seed for the synthetic record generator. " +
                    "Defaults to '${DEFAULT-VALUE}'")
    public long seed = 0;

    @Option(names = {"-o", "--output"},
            paramLabel = "FILE",
            description = "Write the last document to FILE.")
    public Path output;
}
