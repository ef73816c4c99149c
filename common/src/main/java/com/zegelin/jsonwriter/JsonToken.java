package com.zegelin.jsonwriter;

public enum JsonToken {
    OBJECT_START('{'),
    OBJECT_END('}'),
    ARRAY_START('['),
    ARRAY_END(']'),
    DOUBLE_QUOTE('"'),
    VALUE_SEPARATOR(','),
    NAME_SEPARATOR(':'),
    ESCAPE('\\');

    public final char character;
    public final byte encoded;

    JsonToken(final char c) {
        this.character = c;
        this.encoded = (byte) c;
    }
}
