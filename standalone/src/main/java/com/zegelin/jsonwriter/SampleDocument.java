package com.zegelin.jsonwriter;

import com.zegelin.jsonwriter.netty.Utf8JsonWriter;

import java.util.List;

/**
 * Writes a list of {@link SampleRecord}s as {@code {"count":N,"records":[...]}}.
 *
 * Both writers are driven with the same sequence of calls so their output is identical text.
 */
public final class SampleDocument {
    private SampleDocument() {}

    public static void write(final List<SampleRecord> records, final JsonWriter writer) {
        writer.writeObjectStart();
        writer.writeName("count");
        writer.writeInt(records.size());
        writer.writeValueSeparator();
        writer.writeName("records");
        writer.writeArrayStart();

        for (int i = 0; i < records.size(); i++) {
            if (i > 0) {
                writer.writeValueSeparator();
            }

            final SampleRecord record = records.get(i);

            writer.writeObjectStart();

            writer.writeName("id");
            writer.writeLong(record.id);
            writer.writeValueSeparator();

            writer.writeName("name");
            writer.writeString(record.name);
            writer.writeValueSeparator();

            writer.writeName("tags");
            writer.writeArrayStart();
            for (int t = 0; t < record.tags.size(); t++) {
                if (t > 0) {
                    writer.writeValueSeparator();
                }
                writer.writeString(record.tags.get(t));
            }
            writer.writeArrayEnd();
            writer.writeValueSeparator();

            writer.writeName("counter");
            writer.writeLong(record.counter);
            writer.writeValueSeparator();

            writer.writeName("unsigned_counter");
            writer.writeUnsignedLong(record.unsignedCounter);
            writer.writeValueSeparator();

            writer.writeName("score");
            writer.writeDouble(record.score);
            writer.writeValueSeparator();

            writer.writeName("active");
            writer.writeBoolean(record.active);
            writer.writeValueSeparator();

            writer.writeName("date");
            writer.writeLocalDate(record.date);
            writer.writeValueSeparator();

            writer.writeName("created");
            writer.writeInstant(record.created);
            writer.writeValueSeparator();

            writer.writeName("elapsed");
            writer.writeDuration(record.elapsed);
            writer.writeValueSeparator();

            writer.writeName("uuid");
            writer.writeUuid(record.uuid);
            writer.writeValueSeparator();

            writer.writeName("link");
            writer.writeUri(record.link);
            writer.writeValueSeparator();

            writer.writeName("note");
            writer.writeString(record.note);

            writer.writeObjectEnd();
        }

        writer.writeArrayEnd();
        writer.writeObjectEnd();
    }

    public static void write(final List<SampleRecord> records, final Utf8JsonWriter writer) {
        writer.writeObjectStart();
        writer.writeName("count");
        writer.writeInt(records.size());
        writer.writeValueSeparator();
        writer.writeName("records");
        writer.writeArrayStart();

        for (int i = 0; i < records.size(); i++) {
            if (i > 0) {
                writer.writeValueSeparator();
            }

            final SampleRecord record = records.get(i);

            writer.writeObjectStart();

            writer.writeName("id");
            writer.writeLong(record.id);
            writer.writeValueSeparator();

            writer.writeName("name");
            writer.writeString(record.name);
            writer.writeValueSeparator();

            writer.writeName("tags");
            writer.writeArrayStart();
            for (int t = 0; t < record.tags.size(); t++) {
                if (t > 0) {
                    writer.writeValueSeparator();
                }
                writer.writeString(record.tags.get(t));
            }
            writer.writeArrayEnd();
            writer.writeValueSeparator();

            writer.writeName("counter");
            writer.writeLong(record.counter);
            writer.writeValueSeparator();

            writer.writeName("unsigned_counter");
            writer.writeUnsignedLong(record.unsignedCounter);
            writer.writeValueSeparator();

            writer.writeName("score");
            writer.writeDouble(record.score);
            writer.writeValueSeparator();

            writer.writeName("active");
            writer.writeBoolean(record.active);
            writer.writeValueSeparator();

            writer.writeName("date");
            writer.writeLocalDate(record.date);
            writer.writeValueSeparator();

            writer.writeName("created");
            writer.writeInstant(record.created);
            writer.writeValueSeparator();

            writer.writeName("elapsed");
            writer.writeDuration(record.elapsed);
            writer.writeValueSeparator();

            writer.writeName("uuid");
            writer.writeUuid(record.uuid);
            writer.writeValueSeparator();

            writer.writeName("link");
            writer.writeUri(record.link);
            writer.writeValueSeparator();

            writer.writeName("note");
            writer.writeString(record.note);

            writer.writeObjectEnd();
        }

        writer.writeArrayEnd();
        writer.writeObjectEnd();
    }
}
