package com.zegelin.jsonwriter;

import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Locale-invariant text forms of the non-integer value types and their worst-case lengths.
 * <p>
 * The lengths exclude the surrounding quotes and follow from the printers' rules:
 * years print as 4-10 digits with a sign once above 9999 (an {@link java.time.Instant} year may reach 10 digits
 * plus sign), the fraction prints at most 9 digits and offsets print as {@code +HH:MM:ss} at their longest.
 */
public final class Formats {
    public static final int MAX_LOCAL_DATE_LENGTH = 16;         // +999999999-12-31
    public static final int MAX_LOCAL_TIME_LENGTH = 18;         // 23:59:59.999999999
    public static final int MAX_LOCAL_DATE_TIME_LENGTH = MAX_LOCAL_DATE_LENGTH + 1 + MAX_LOCAL_TIME_LENGTH;
    public static final int MAX_OFFSET_DATE_TIME_LENGTH = MAX_LOCAL_DATE_TIME_LENGTH + 9;
    public static final int MAX_INSTANT_LENGTH = 37;            // +1000000000-12-31T23:59:59.999999999Z

    public static final int UUID_LENGTH = 36;

    public static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    public static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ISO_LOCAL_TIME;
    public static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    public static final DateTimeFormatter OFFSET_DATE_TIME = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    public static final DateTimeFormatter INSTANT = DateTimeFormatter.ISO_INSTANT;

    private static final char[] LOWER_HEX_DIGITS = "0123456789abcdef".toCharArray();

    private Formats() {}

    /**
     * JSON has no representation for NaN or the infinities. They are written as strings that
     * {@link Double#parseDouble(String)} accepts.
     */
    public static String nonFiniteText(final double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }

        return value < 0 ? "-Infinity" : "Infinity";
    }

    /**
     * Writes the canonical 8-4-4-4-12 lower-case form of {@code uuid} at {@code offset}.
     * {@code dest} must have {@link #UUID_LENGTH} chars available from {@code offset}.
     */
    public static void writeUuid(final char[] dest, final int offset, final UUID uuid) {
        final long msb = uuid.getMostSignificantBits();
        final long lsb = uuid.getLeastSignificantBits();

        writeHex(dest, offset, msb >>> 32, 8);
        dest[offset + 8] = '-';
        writeHex(dest, offset + 9, msb >>> 16, 4);
        dest[offset + 13] = '-';
        writeHex(dest, offset + 14, msb, 4);
        dest[offset + 18] = '-';
        writeHex(dest, offset + 19, lsb >>> 48, 4);
        dest[offset + 23] = '-';
        writeHex(dest, offset + 24, lsb, 12);
    }

    // writes the low `digits` nibbles of `bits`, most significant first
    private static void writeHex(final char[] dest, final int offset, long bits, final int digits) {
        for (int i = offset + digits - 1; i >= offset; i--) {
            dest[i] = LOWER_HEX_DIGITS[(int) (bits & 0xF)];
            bits >>>= 4;
        }
    }
}
