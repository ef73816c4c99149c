package com.zegelin.jsonwriter.netty;

import com.zegelin.jsonwriter.Digits;
import com.zegelin.jsonwriter.Formats;
import com.zegelin.jsonwriter.Growth;
import com.zegelin.jsonwriter.JsonEscapes;
import com.zegelin.jsonwriter.JsonToken;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.PooledByteBufAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.CharBuffer;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The UTF-8 counterpart of {@link com.zegelin.jsonwriter.JsonWriter}, appending to a Netty {@link ByteBuf}.
 * <p>
 * The written region is the buffer's readable bytes. Growth follows the same policy as the char writer:
 * a replacement of at least twice the capacity is allocated from the {@link ByteBufAllocator}, the readable
 * bytes are copied over and the previous buffer is released if this writer allocated it.
 * A caller-supplied buffer is never released.
 * <p>
 * Instances are <b>not</b> thread-safe.
 */
public final class Utf8JsonWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Utf8JsonWriter.class);

    private static final byte[] TRUE = "true".getBytes(UTF_8);
    private static final byte[] FALSE = "false".getBytes(UTF_8);
    private static final byte[] NULL = "null".getBytes(UTF_8);

    private static final int MAX_QUOTED_CHAR_LENGTH = Math.max(JsonEscapes.UNICODE_ESCAPE_LENGTH, 3) + 2;

    private ByteBufAllocator allocator;
    private ByteBuf buffer;
    private ByteBuf owned;

    // formatter output is staged here before being copied as ASCII
    private char[] scratch = new char[Math.max(Formats.MAX_OFFSET_DATE_TIME_LENGTH, Digits.MAX_UNSIGNED_LONG_DIGITS)];

    /**
     * Creates a writer appending to a caller-owned buffer. Growth allocates from the pooled allocator.
     */
    public Utf8JsonWriter(final ByteBuf initialBuffer) {
        this(initialBuffer, PooledByteBufAllocator.DEFAULT);
    }

    public Utf8JsonWriter(final ByteBuf initialBuffer, final ByteBufAllocator allocator) {
        this.allocator = checkNotNull(allocator);
        this.buffer = checkNotNull(initialBuffer);
        this.owned = null;
    }

    public Utf8JsonWriter(final int initialCapacity) {
        this(initialCapacity, PooledByteBufAllocator.DEFAULT);
    }

    public Utf8JsonWriter(final int initialCapacity, final ByteBufAllocator allocator) {
        checkArgument(initialCapacity > 0, "initialCapacity must be positive, was %s", initialCapacity);

        this.allocator = checkNotNull(allocator);
        this.buffer = this.owned = allocator.buffer(initialCapacity);
    }

    /** The number of bytes written so far. */
    public int position() {
        return buffer.readableBytes();
    }

    public int capacity() {
        return buffer.capacity();
    }

    /**
     * Returns a copy of the written bytes and releases the writer.
     */
    public byte[] finish() {
        final byte[] bytes = ByteBufUtil.getBytes(buffer);

        close();

        return bytes;
    }

    /**
     * Returns the written text decoded as UTF-8 and releases the writer.
     */
    public String finishAsString() {
        final String text = buffer.toString(UTF_8);

        close();

        return text;
    }

    @Override
    public void close() {
        final ByteBuf toRelease = owned;

        this.allocator = null;
        this.buffer = null;
        this.owned = null;
        this.scratch = null;

        if (toRelease != null) {
            toRelease.release();
        }
    }

    private void ensureCapacity(final int required) {
        if (buffer.writableBytes() < required) {
            grow(required);
        }
    }

    private void grow(final int required) {
        final int readable = buffer.readableBytes();
        final int minimumCapacity = Growth.nextCapacity(readable, required, buffer.capacity());

        final ByteBuf replacement = allocator.buffer(minimumCapacity);

        logger.trace("Growing buffer from {} to {} bytes.", buffer.capacity(), replacement.capacity());

        replacement.writeBytes(buffer, buffer.readerIndex(), readable);

        final ByteBuf toRelease = owned;
        buffer = owned = replacement;

        if (toRelease != null) {
            toRelease.release();
        }
    }

    private void writeLiteral(final byte[] literal) {
        ensureCapacity(literal.length);

        buffer.writeBytes(literal);
    }

    private void writeToken(final JsonToken token) {
        ensureCapacity(1);

        buffer.writeByte(token.encoded);
    }

    // callers must have ensured capacity
    private void writeAscii(final char[] source, final int start, final int end) {
        for (int i = start; i < end; i++) {
            buffer.writeByte(source[i]);
        }
    }

    private void writeAscii(final String text) {
        ensureCapacity(text.length());

        ByteBufUtil.writeAscii(buffer, text);
    }


    public void writeByte(final byte value) {
        writeLong(value);
    }

    public void writeShort(final short value) {
        writeLong(value);
    }

    public void writeInt(final int value) {
        writeLong(value);
    }

    public void writeLong(final long value) {
        if (value == Long.MIN_VALUE) {
            ensureCapacity(Digits.LONG_MIN_VALUE.length);
            writeAscii(Digits.LONG_MIN_VALUE, 0, Digits.LONG_MIN_VALUE.length);
            return;
        }

        if (value < 0) {
            ensureCapacity(1);
            buffer.writeByte('-');

            writeUnsignedLong(-value);
            return;
        }

        writeUnsignedLong(value);
    }

    public void writeUnsignedByte(final byte value) {
        writeUnsignedLong(Byte.toUnsignedLong(value));
    }

    public void writeUnsignedShort(final short value) {
        writeUnsignedLong(Short.toUnsignedLong(value));
    }

    public void writeUnsignedInt(final int value) {
        writeUnsignedLong(Integer.toUnsignedLong(value));
    }

    public void writeUnsignedLong(final long value) {
        if (value >= 0 && value < 10) {
            ensureCapacity(1);
            buffer.writeByte('0' + (int) value);
            return;
        }

        final int digits = Digits.countUnsigned(value);
        ensureCapacity(digits);

        Digits.writeUnsigned(scratch, digits, value);
        writeAscii(scratch, 0, digits);
    }

    public void writeFloat(final float value) {
        if (!Float.isFinite(value)) {
            writeString(Formats.nonFiniteText(value));
            return;
        }

        writeAscii(Float.toString(value));
    }

    /**
     * Writes {@code value} using {@link Double#toString(double)}. Non-finite values are written as strings.
     * <p>
     * On JDK 17 the text always parses back to {@code value} but is not always the shortest such text,
     * e.g. {@code 2e23} prints as {@code 1.9999999999999998E23}.
     */
    public void writeDouble(final double value) {
        if (!Double.isFinite(value)) {
            writeString(Formats.nonFiniteText(value));
            return;
        }

        writeAscii(Double.toString(value));
    }

    public void writeBigDecimal(final BigDecimal value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeAscii(value.toString());
    }

    public void writeBoolean(final boolean value) {
        writeLiteral(value ? TRUE : FALSE);
    }

    public void writeNull() {
        writeLiteral(NULL);
    }

    public void writeObjectStart() {
        writeToken(JsonToken.OBJECT_START);
    }

    public void writeObjectEnd() {
        writeToken(JsonToken.OBJECT_END);
    }

    public void writeArrayStart() {
        writeToken(JsonToken.ARRAY_START);
    }

    public void writeArrayEnd() {
        writeToken(JsonToken.ARRAY_END);
    }

    public void writeValueSeparator() {
        writeToken(JsonToken.VALUE_SEPARATOR);
    }

    public void writeNameSeparator() {
        writeToken(JsonToken.NAME_SEPARATOR);
    }

    public void writeDoubleQuote() {
        writeToken(JsonToken.DOUBLE_QUOTE);
    }

    // callers must have ensured capacity for the escape's length
    private void writeEscape(final char c, final char escape) {
        buffer.writeByte(JsonToken.ESCAPE.encoded);

        if (escape == JsonEscapes.UNICODE) {
            buffer.writeByte(JsonEscapes.UNICODE);
            buffer.writeByte('0');
            buffer.writeByte('0');
            buffer.writeByte(JsonEscapes.highHexDigit(c));
            buffer.writeByte(JsonEscapes.lowHexDigit(c));
            return;
        }

        buffer.writeByte(escape);
    }

    /**
     * Writes {@code value} as a single-character JSON string. A lone surrogate is written as {@code ?}.
     */
    public void writeChar(final char value) {
        ensureCapacity(MAX_QUOTED_CHAR_LENGTH);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);

        final char escape = JsonEscapes.escapeFor(value);
        if (escape == 0) {
            ByteBufUtil.writeUtf8(buffer, String.valueOf(value));

        } else {
            writeEscape(value, escape);
        }

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
    }

    // encodes value[start, end) in one pass, escapable characters are all ASCII so a run never splits a surrogate pair
    private void writeRun(final String value, final int start, final int end) {
        if (start == end) {
            return;
        }

        ensureCapacity(ByteBufUtil.utf8MaxBytes(end - start));

        ByteBufUtil.writeUtf8(buffer, value, start, end);
    }

    /**
     * Writes {@code value} as a quoted, escaped, UTF-8 encoded JSON string.
     */
    public void writeString(final String value) {
        if (value == null) {
            writeNull();
            return;
        }

        final int length = value.length();

        // UTF-8 never takes fewer bytes than UTF-16 code units
        ensureCapacity(length + 2);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);

        int remaining = 0;

        for (int i = 0; i < length; i++) {
            final char c = value.charAt(i);
            final char escape = JsonEscapes.escapeFor(c);

            if (escape == 0) {
                continue;
            }

            writeRun(value, remaining, i);

            ensureCapacity(JsonEscapes.escapeLength(escape));
            writeEscape(c, escape);

            remaining = i + 1;
        }

        writeRun(value, remaining, length);

        ensureCapacity(1);
        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
    }

    /**
     * Writes {@code "escapedName":}. {@code escapedName} <b>must already be escaped</b>; it is encoded as-is.
     */
    public void writeName(final String escapedName) {
        ensureCapacity(ByteBufUtil.utf8MaxBytes(escapedName) + 3);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
        ByteBufUtil.writeUtf8(buffer, escapedName);
        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
        buffer.writeByte(JsonToken.NAME_SEPARATOR.encoded);
    }

    public void writeEscapedName(final String name) {
        writeString(checkNotNull(name));
        writeNameSeparator();
    }

    private void writeTemporal(final TemporalAccessor value, final DateTimeFormatter formatter, final int maxLength) {
        if (value == null) {
            writeNull();
            return;
        }

        ensureCapacity(maxLength + 2);

        final CharBuffer region = CharBuffer.wrap(scratch, 0, maxLength);
        formatter.formatTo(value, region);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
        writeAscii(scratch, 0, region.position());
        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
    }

    public void writeLocalDate(final LocalDate value) {
        writeTemporal(value, Formats.LOCAL_DATE, Formats.MAX_LOCAL_DATE_LENGTH);
    }

    public void writeLocalTime(final LocalTime value) {
        writeTemporal(value, Formats.LOCAL_TIME, Formats.MAX_LOCAL_TIME_LENGTH);
    }

    public void writeLocalDateTime(final LocalDateTime value) {
        writeTemporal(value, Formats.LOCAL_DATE_TIME, Formats.MAX_LOCAL_DATE_TIME_LENGTH);
    }

    public void writeOffsetDateTime(final OffsetDateTime value) {
        writeTemporal(value, Formats.OFFSET_DATE_TIME, Formats.MAX_OFFSET_DATE_TIME_LENGTH);
    }

    public void writeInstant(final Instant value) {
        writeTemporal(value, Formats.INSTANT, Formats.MAX_INSTANT_LENGTH);
    }

    public void writeDuration(final Duration value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeQuotedAscii(value.toString());
    }

    public void writeUuid(final UUID value) {
        if (value == null) {
            writeNull();
            return;
        }

        ensureCapacity(Formats.UUID_LENGTH + 2);

        Formats.writeUuid(scratch, 0, value);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
        writeAscii(scratch, 0, Formats.UUID_LENGTH);
        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
    }

    public void writeVersion(final Runtime.Version value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeQuotedAscii(value.toString());
    }

    public void writeUri(final URI value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeString(value.toString());
    }

    private void writeQuotedAscii(final String text) {
        ensureCapacity(text.length() + 2);

        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
        ByteBufUtil.writeAscii(buffer, text);
        buffer.writeByte(JsonToken.DOUBLE_QUOTE.encoded);
    }
}
