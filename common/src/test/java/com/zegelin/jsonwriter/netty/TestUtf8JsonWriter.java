package com.zegelin.jsonwriter.netty;

import com.zegelin.jsonwriter.JsonWriter;
import com.zegelin.jsonwriter.pool.CharArrayPools;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.Unpooled;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.map.ObjectMapper;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestUtf8JsonWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordingByteBufAllocator allocator;

    @BeforeMethod
    public void before() {
        allocator = new RecordingByteBufAllocator();
    }

    private String write(final Consumer<Utf8JsonWriter> script) {
        final Utf8JsonWriter writer = new Utf8JsonWriter(64, allocator);
        script.accept(writer);
        return new String(writer.finish(), UTF_8);
    }

    @Test
    public void testExamples() {
        assertThat(write(w -> w.writeString("\tab\"A"))).isEqualTo("\"\\tab\\\"A\"");
        assertThat(write(w -> w.writeUnsignedLong(1024))).isEqualTo("1024");
        assertThat(write(w -> w.writeLong(-1024))).isEqualTo("-1024");
        assertThat(write(w -> w.writeLong(Long.MIN_VALUE))).isEqualTo("-9223372036854775808");
        assertThat(write(w -> w.writeUnsignedLong(-1L))).isEqualTo("18446744073709551615");
        assertThat(write(w -> w.writeUnsignedLong(7))).isEqualTo("7");

        assertThat(allocator.allReleased()).isTrue();
    }

    @Test
    public void testNonAsciiIsEncodedVerbatim() {
        final String value = "åäö € 😀 \u0001 日本";

        final Utf8JsonWriter writer = new Utf8JsonWriter(1, allocator);
        writer.writeString(value);
        writer.writeChar('€');

        assertThat(writer.finish()).isEqualTo("\"åäö € 😀 \\u0001 日本\"\"€\"".getBytes(UTF_8));
    }

    /**
     * The operations both writers share, so the same document can be written to each.
     */
    interface JsonWriterOps {
        void objectStart();

        void objectEnd();

        void name(String name);

        void separator();

        void string(String value);

        void integer(long value);

        void decimal(double value);

        void uuid(UUID value);

        void instant(Instant value);

        void character(char value);
    }

    private static void document(final JsonWriterOps w) {
        w.objectStart();

        for (int i = 0; i < 150; i++) {
            if (i > 0) {
                w.separator();
            }

            w.name("k" + i);
            w.objectStart();
            w.name("s");
            w.string("välue \"" + i + "\"\n\u0007" + "ß".repeat(i));
            w.separator();
            w.name("n");
            w.integer(Long.MAX_VALUE - i);
            w.separator();
            w.name("d");
            w.decimal(i * 1.25e-3);
            w.separator();
            w.name("u");
            w.uuid(new UUID(i * 31L, ~i));
            w.separator();
            w.name("t");
            w.instant(Instant.ofEpochSecond(i * 86_400L, i));
            w.separator();
            w.name("c");
            w.character((char) (i + 0x10));
            w.objectEnd();
        }

        w.objectEnd();
    }

    private static JsonWriterOps ops(final Utf8JsonWriter w) {
        return new JsonWriterOps() {
            public void objectStart() { w.writeObjectStart(); }
            public void objectEnd() { w.writeObjectEnd(); }
            public void name(final String name) { w.writeName(name); }
            public void separator() { w.writeValueSeparator(); }
            public void string(final String value) { w.writeString(value); }
            public void integer(final long value) { w.writeLong(value); }
            public void decimal(final double value) { w.writeDouble(value); }
            public void uuid(final UUID value) { w.writeUuid(value); }
            public void instant(final Instant value) { w.writeInstant(value); }
            public void character(final char value) { w.writeChar(value); }
        };
    }

    private static JsonWriterOps ops(final JsonWriter w) {
        return new JsonWriterOps() {
            public void objectStart() { w.writeObjectStart(); }
            public void objectEnd() { w.writeObjectEnd(); }
            public void name(final String name) { w.writeName(name); }
            public void separator() { w.writeValueSeparator(); }
            public void string(final String value) { w.writeString(value); }
            public void integer(final long value) { w.writeLong(value); }
            public void decimal(final double value) { w.writeDouble(value); }
            public void uuid(final UUID value) { w.writeUuid(value); }
            public void instant(final Instant value) { w.writeInstant(value); }
            public void character(final char value) { w.writeChar(value); }
        };
    }

    @Test
    public void testMatchesCharWriterAcrossGrowth() throws IOException {
        final JsonWriter charWriter = new JsonWriter(1, CharArrayPools.unpooled());
        document(ops(charWriter));
        final String expected = charWriter.finish();

        final Utf8JsonWriter tiny = new Utf8JsonWriter(1, allocator);
        document(ops(tiny));
        assertThat(tiny.finishAsString()).isEqualTo(expected);

        final Utf8JsonWriter ample = new Utf8JsonWriter(1 << 20, PooledByteBufAllocator.DEFAULT);
        document(ops(ample));
        assertThat(ample.finish()).isEqualTo(expected.getBytes(UTF_8));

        assertThat(allocator.allocated.size()).isGreaterThan(1);
        assertThat(allocator.allReleased()).isTrue();

        final JsonNode node = MAPPER.readTree(expected);
        assertThat(node.get("k3").get("s").getTextValue()).isEqualTo("välue \"3\"\n\u0007ßßß");
    }

    @Test
    public void testCallerBufferIsNeverReleased() {
        final ByteBuf callerBuffer = Unpooled.buffer(4);
        callerBuffer.writeByte('[');

        final Utf8JsonWriter writer = new Utf8JsonWriter(callerBuffer, allocator);
        writer.writeString("does not fit in four bytes");
        writer.writeArrayEnd();

        assertThat(writer.finishAsString()).isEqualTo("[\"does not fit in four bytes\"]");

        assertThat(callerBuffer.refCnt()).isEqualTo(1);
        assertThat(callerBuffer.toString(UTF_8)).isEqualTo("[");
        assertThat(allocator.allReleased()).isTrue();

        callerBuffer.release();
    }

    @Test
    public void testCallerBufferIsWrittenInPlaceWhenItFits() {
        final ByteBuf callerBuffer = Unpooled.buffer(64);

        final Utf8JsonWriter writer = new Utf8JsonWriter(callerBuffer, allocator);
        writer.writeBoolean(true);
        writer.close();

        assertThat(callerBuffer.toString(UTF_8)).isEqualTo("true");
        assertThat(allocator.allocated).isEmpty();

        callerBuffer.release();
    }

    @Test
    public void testPoisonedAfterClose() {
        final Utf8JsonWriter writer = new Utf8JsonWriter(8, allocator);
        writer.close();
        writer.close();

        assertThat(allocator.allReleased()).isTrue();
        assertThatThrownBy(writer::writeNull).isInstanceOf(NullPointerException.class);
    }

    private static String expectedEscape(final char c) {
        switch (c) {
            case '"': return "\\\"";
            case '\\': return "\\\\";
            case '\b': return "\\b";
            case '\f': return "\\f";
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            default: return String.format("\\u%04X", (int) c);
        }
    }

    @Test
    public void testEscapingCompleteness() throws IOException {
        final StringBuilder escapable = new StringBuilder();

        for (char c = 0; c < 0x20; c++) {
            escapable.append(c);
        }
        escapable.append('"').append('\\');

        for (int i = 0; i < escapable.length(); i++) {
            final char c = escapable.charAt(i);

            final String string = write(w -> w.writeString("x" + c + "y"));
            final String character = write(w -> w.writeChar(c));

            assertThat(string).isEqualTo("\"x" + expectedEscape(c) + "y\"");
            assertThat(character).isEqualTo("\"" + expectedEscape(c) + "\"");

            assertThat(MAPPER.readTree(string).getTextValue()).isEqualTo("x" + c + "y");
            assertThat(MAPPER.readTree(character).getTextValue()).isEqualTo(String.valueOf(c));
        }

        final Utf8JsonWriter tiny = new Utf8JsonWriter(1, allocator);
        tiny.writeString(escapable.toString());

        assertThat(MAPPER.readTree(tiny.finishAsString()).getTextValue()).isEqualTo(escapable.toString());
        assertThat(allocator.allReleased()).isTrue();
    }

    @Test
    public void testEscapingMinimality() throws IOException {
        final StringBuilder printable = new StringBuilder();

        for (char c = 0x20; c < 0x7F; c++) {
            if (c != '"' && c != '\\') {
                printable.append(c);
            }
        }
        printable.append("åäö €😀 \u007F /");

        final String json = write(w -> w.writeString(printable.toString()));

        assertThat(json).isEqualTo("\"" + printable + "\"");
        assertThat(MAPPER.readTree(json).getTextValue()).isEqualTo(printable.toString());

        for (int i = 0; i < printable.length(); i++) {
            final char c = printable.charAt(i);

            if (Character.isSurrogate(c)) {
                continue;
            }

            assertThat(write(w -> w.writeChar(c))).isEqualTo("\"" + c + "\"");
        }
    }

    @Test
    public void testIntegerBoundaries() {
        BigInteger power = BigInteger.ONE;

        for (int digits = 1; digits <= 20; digits++) {
            for (final BigInteger value : new BigInteger[] {power, power.subtract(BigInteger.ONE)}) {
                final long bits = value.longValue();

                assertThat(write(w -> w.writeUnsignedLong(bits))).isEqualTo(value.toString());
            }

            power = power.multiply(BigInteger.TEN);
        }

        assertThat(write(w -> w.writeUnsignedLong(-1L))).isEqualTo("18446744073709551615");
        assertThat(write(w -> w.writeUnsignedLong(Long.MIN_VALUE))).isEqualTo("9223372036854775808");

        assertThat(write(w -> w.writeLong(Long.MIN_VALUE + 1))).isEqualTo("-9223372036854775807");
        assertThat(write(w -> w.writeLong(Long.MAX_VALUE))).isEqualTo("9223372036854775807");
        assertThat(write(w -> w.writeLong(-9))).isEqualTo("-9");
        assertThat(write(w -> w.writeLong(-10))).isEqualTo("-10");
        assertThat(write(w -> w.writeInt(Integer.MIN_VALUE))).isEqualTo("-2147483648");
        assertThat(write(w -> w.writeUnsignedInt(-1))).isEqualTo("4294967295");
        assertThat(write(w -> w.writeUnsignedShort((short) -1))).isEqualTo("65535");
        assertThat(write(w -> w.writeByte(Byte.MIN_VALUE))).isEqualTo("-128");

        final Utf8JsonWriter tiny = new Utf8JsonWriter(1, allocator);
        tiny.writeArrayStart();
        tiny.writeLong(Long.MIN_VALUE);
        tiny.writeValueSeparator();
        tiny.writeUnsignedLong(-1L);
        tiny.writeArrayEnd();

        assertThat(tiny.finishAsString()).isEqualTo("[-9223372036854775808,18446744073709551615]");
        assertThat(allocator.allReleased()).isTrue();
    }

    @Test
    public void testDoublesParseBack() throws IOException {
        for (final double value : new double[] {2e23, 1e23, 0.1, -Double.MIN_VALUE, Double.MAX_VALUE}) {
            final JsonNode node = MAPPER.readTree(write(w -> w.writeDouble(value)));

            assertThat(node.isNumber()).isTrue();
            assertThat(node.getDoubleValue()).isEqualTo(value);
        }
    }

    @Test
    public void testOtherValueTypes() {
        assertThat(write(w -> {
            w.writeArrayStart();
            w.writeBoolean(false);
            w.writeValueSeparator();
            w.writeNull();
            w.writeValueSeparator();
            w.writeFloat(Float.NaN);
            w.writeValueSeparator();
            w.writeBigDecimal(new BigDecimal("1.50"));
            w.writeValueSeparator();
            w.writeLocalDate(LocalDate.of(2020, 2, 29));
            w.writeValueSeparator();
            w.writeLocalTime(LocalTime.NOON);
            w.writeValueSeparator();
            w.writeLocalDateTime(LocalDateTime.of(2020, 2, 29, 12, 0, 1));
            w.writeValueSeparator();
            w.writeOffsetDateTime(OffsetDateTime.of(2020, 2, 29, 12, 0, 1, 0, ZoneOffset.UTC));
            w.writeValueSeparator();
            w.writeDuration(Duration.ofMinutes(90));
            w.writeValueSeparator();
            w.writeVersion(Runtime.Version.parse("11.0.1"));
            w.writeValueSeparator();
            w.writeUri(URI.create("http://example.com/a?b=c"));
            w.writeValueSeparator();
            w.writeUnsignedByte((byte) -1);
            w.writeValueSeparator();
            w.writeEscapedName("na\tme");
            w.writeInt(1);
            w.writeArrayEnd();
        })).isEqualTo("[false,null,\"NaN\",1.50,\"2020-02-29\",\"12:00:00\",\"2020-02-29T12:00:01\"," +
                "\"2020-02-29T12:00:01Z\",\"PT1H30M\",\"11.0.1\",\"http://example.com/a?b=c\",255,\"na\\tme\":1]");
    }
}
