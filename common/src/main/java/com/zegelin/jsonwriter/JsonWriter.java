package com.zegelin.jsonwriter;

import com.zegelin.jsonwriter.pool.CharArrayPool;
import com.zegelin.jsonwriter.pool.CharArrayPools;
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

/**
 * An append-only JSON writer producing UTF-16 text into a growable {@code char[]}.
 * <p>
 * The caller is responsible for document structure: values, names and separators are written in the order given,
 * nothing is validated. Each write first ensures the worst-case size of its output fits, growing the buffer by
 * renting a larger array from the {@link CharArrayPool} if required.
 * <p>
 * A writer is finished with {@link #finish()}, which returns the text, or abandoned with {@link #close()}.
 * Either returns any rented array to the pool and resets the writer, so writing afterwards fails with a
 * {@link NullPointerException}. Use try-with-resources to guarantee the release on every path.
 * <p>
 * Reference-typed values that are {@code null} are written as the {@code null} literal.
 * <p>
 * Instances are <b>not</b> thread-safe.
 */
public final class JsonWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JsonWriter.class);

    private static final char[] TRUE = "true".toCharArray();
    private static final char[] FALSE = "false".toCharArray();
    private static final char[] NULL = "null".toCharArray();

    // quote + longest escape + quote
    private static final int MAX_QUOTED_CHAR_LENGTH = JsonEscapes.UNICODE_ESCAPE_LENGTH + 2;

    private CharArrayPool pool;
    private char[] chars;
    private char[] rented;
    private int position;

    /**
     * Creates a writer over a caller-owned buffer. The buffer is never given to the pool,
     * it is replaced by a rented array from the shared pool if it runs out of space.
     */
    public JsonWriter(final char[] initialBuffer) {
        this(initialBuffer, CharArrayPools.shared());
    }

    public JsonWriter(final char[] initialBuffer, final CharArrayPool pool) {
        this.pool = checkNotNull(pool);
        this.chars = checkNotNull(initialBuffer);
        this.rented = null;
        this.position = 0;
    }

    /**
     * Creates a writer over an array of at least {@code initialCapacity} chars rented from the shared pool.
     */
    public JsonWriter(final int initialCapacity) {
        this(initialCapacity, CharArrayPools.shared());
    }

    public JsonWriter(final int initialCapacity, final CharArrayPool pool) {
        checkArgument(initialCapacity > 0, "initialCapacity must be positive, was %s", initialCapacity);

        this.pool = checkNotNull(pool);
        this.chars = this.rented = pool.rent(initialCapacity);
        this.position = 0;
    }

    /** The number of chars written so far. */
    public int position() {
        return position;
    }

    /** The length of the current buffer. */
    public int capacity() {
        return chars.length;
    }

    /**
     * Returns the written text and releases the writer.
     */
    public String finish() {
        final String text = new String(chars, 0, position);

        close();

        return text;
    }

    /**
     * Releases the writer without extracting its text. Calling this more than once has no further effect.
     */
    @Override
    public void close() {
        final char[] toReturn = rented;
        final CharArrayPool pool = this.pool;

        this.pool = null;
        this.chars = null;
        this.rented = null;
        this.position = 0;

        if (toReturn != null) {
            pool.giveBack(toReturn);
        }
    }

    private void ensureCapacity(final int required) {
        if (position > chars.length - required) {
            grow(required);
        }
    }

    private void grow(final int required) {
        final int minimumLength = Growth.nextCapacity(position, required, chars.length);

        final char[] replacement = pool.rent(minimumLength);

        logger.trace("Growing buffer from {} to {} chars.", chars.length, replacement.length);

        System.arraycopy(chars, 0, replacement, 0, position);

        final char[] toReturn = rented;
        chars = rented = replacement;

        if (toReturn != null) {
            pool.giveBack(toReturn);
        }
    }

    private void writeLiteral(final char[] literal) {
        ensureCapacity(literal.length);

        System.arraycopy(literal, 0, chars, position, literal.length);
        position += literal.length;
    }

    private void writeToken(final JsonToken token) {
        ensureCapacity(1);

        chars[position++] = token.character;
    }

    // callers must have ensured capacity
    private void writeRaw(final String text) {
        text.getChars(0, text.length(), chars, position);
        position += text.length();
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
            writeLiteral(Digits.LONG_MIN_VALUE);
            return;
        }

        if (value < 0) {
            ensureCapacity(1);
            chars[position++] = '-';

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

    /**
     * Writes {@code value} interpreted as an unsigned 64-bit integer.
     */
    public void writeUnsignedLong(final long value) {
        if (value >= 0 && value < 10) {
            ensureCapacity(1);
            chars[position++] = (char) ('0' + value);
            return;
        }

        final int digits = Digits.countUnsigned(value);
        ensureCapacity(digits);

        Digits.writeUnsigned(chars, position + digits, value);
        position += digits;
    }

    public void writeFloat(final float value) {
        if (!Float.isFinite(value)) {
            writeString(Formats.nonFiniteText(value));
            return;
        }

        final String text = Float.toString(value);
        ensureCapacity(text.length());
        writeRaw(text);
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

        final String text = Double.toString(value);
        ensureCapacity(text.length());
        writeRaw(text);
    }

    public void writeBigDecimal(final BigDecimal value) {
        if (value == null) {
            writeNull();
            return;
        }

        final String text = value.toString();
        ensureCapacity(text.length());
        writeRaw(text);
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
        chars[position++] = JsonToken.ESCAPE.character;

        if (escape == JsonEscapes.UNICODE) {
            chars[position++] = JsonEscapes.UNICODE;
            chars[position++] = '0';
            chars[position++] = '0';
            chars[position++] = JsonEscapes.highHexDigit(c);
            chars[position++] = JsonEscapes.lowHexDigit(c);
            return;
        }

        chars[position++] = escape;
    }

    /**
     * Writes {@code value} as a single-character JSON string.
     */
    public void writeChar(final char value) {
        ensureCapacity(MAX_QUOTED_CHAR_LENGTH);

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;

        final char escape = JsonEscapes.escapeFor(value);
        if (escape == 0) {
            chars[position++] = value;

        } else {
            writeEscape(value, escape);
        }

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
    }

    /**
     * Writes {@code value} as a quoted, escaped JSON string.
     * <p>
     * Runs of characters that need no escaping are copied in bulk, each input character is examined once.
     */
    public void writeString(final String value) {
        if (value == null) {
            writeNull();
            return;
        }

        final int length = value.length();

        // escaping never shrinks, so this is a lower bound
        ensureCapacity(length + 2);

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;

        // start of the remaining, not yet copied, slice
        int remaining = 0;

        for (int i = 0; i < length; i++) {
            final char c = value.charAt(i);
            final char escape = JsonEscapes.escapeFor(c);

            if (escape == 0) {
                continue;
            }

            value.getChars(remaining, i, chars, position);
            position += i - remaining;

            // the escape plus everything still unscanned plus the closing quote
            ensureCapacity(JsonEscapes.escapeLength(escape) + (length - i - 1) + 1);

            writeEscape(c, escape);

            remaining = i + 1;
        }

        value.getChars(remaining, length, chars, position);
        position += length - remaining;

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
    }

    /**
     * Writes {@code "escapedName":}.
     * <p>
     * {@code escapedName} is written verbatim and <b>must already be escaped</b> (see {@link JsonEscapes#escaper()}),
     * otherwise the output is invalid JSON. Use {@link #writeEscapedName(String)} for untrusted names.
     */
    public void writeName(final String escapedName) {
        final int length = escapedName.length();

        ensureCapacity(length + 3);

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
        escapedName.getChars(0, length, chars, position);
        position += length;
        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
        chars[position++] = JsonToken.NAME_SEPARATOR.character;
    }

    /**
     * Writes {@code "name":}, escaping {@code name}.
     */
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

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;

        final CharBuffer region = CharBuffer.wrap(chars, position, maxLength);
        formatter.formatTo(value, region);
        position = region.position();

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
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

    /**
     * Writes {@code value} in its ISO-8601 form, e.g. {@code "PT8H6M12.345S"}.
     */
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

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
        Formats.writeUuid(chars, position, value);
        position += Formats.UUID_LENGTH;
        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
    }

    public void writeVersion(final Runtime.Version value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeQuotedAscii(value.toString());
    }

    /**
     * URIs may contain characters that need escaping, so they go through {@link #writeString(String)}.
     */
    public void writeUri(final URI value) {
        if (value == null) {
            writeNull();
            return;
        }

        writeString(value.toString());
    }

    // for formatter output known to need no escaping
    private void writeQuotedAscii(final String text) {
        ensureCapacity(text.length() + 2);

        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
        writeRaw(text);
        chars[position++] = JsonToken.DOUBLE_QUOTE.character;
    }
}
