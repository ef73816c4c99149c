package com.zegelin.jsonwriter;

import com.google.common.collect.ImmutableList;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * A synthetic record exercising every kind of value the writers support.
 */
public final class SampleRecord {
    private static final String[] WORDS = {
            "plain", "tab\tseparated", "\"quoted\"", "back\\slash", "line\nbreak", "bell\u0007",
            "åäö", "日本語", "emoji 😀", "path/to/file"
    };

    private static final long[] BOUNDARIES = {
            0, 9, 10, 99, 1024, -1024, Integer.MAX_VALUE, Integer.MIN_VALUE, Long.MAX_VALUE, Long.MIN_VALUE
    };

    public final long id;
    public final String name;
    public final List<String> tags;
    public final long counter;
    public final long unsignedCounter;
    public final double score;
    public final boolean active;
    public final LocalDate date;
    public final Instant created;
    public final Duration elapsed;
    public final UUID uuid;
    public final URI link;
    public final String note;

    private SampleRecord(final long id, final Random random) {
        this.id = id;
        this.name = WORDS[random.nextInt(WORDS.length)] + " " + id;

        final ImmutableList.Builder<String> tagsBuilder = ImmutableList.builder();
        for (int i = random.nextInt(4); i > 0; i--) {
            tagsBuilder.add(WORDS[random.nextInt(WORDS.length)]);
        }
        this.tags = tagsBuilder.build();

        this.counter = BOUNDARIES[random.nextInt(BOUNDARIES.length)];
        this.unsignedCounter = random.nextLong();
        this.score = random.nextInt(10) == 0 ? Double.NaN : random.nextGaussian() * 1e3;
        this.active = random.nextBoolean();
        this.date = LocalDate.ofEpochDay(random.nextInt(100_000) - 50_000);
        this.created = Instant.ofEpochSecond(random.nextInt(Integer.MAX_VALUE), random.nextInt(1_000_000_000));
        this.elapsed = Duration.ofMillis(random.nextInt(10_000_000));
        this.uuid = new UUID(random.nextLong(), random.nextLong());
        this.link = URI.create("https://example.com/records/" + id);
        this.note = random.nextBoolean() ? null : "note " + WORDS[random.nextInt(WORDS.length)];
    }

    public static List<SampleRecord> generate(final int count, final long seed) {
        final Random random = new Random(seed);

        final ImmutableList.Builder<SampleRecord> records = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            records.add(new SampleRecord(i, random));
        }

        return records.build();
    }
}
