package com.zegelin.jsonwriter.cli;

public enum Encoding {
    /** {@link com.zegelin.jsonwriter.JsonWriter}, pooled {@code char[]} output. */
    UTF16,

    /** {@link com.zegelin.jsonwriter.netty.Utf8JsonWriter}, {@code ByteBuf} output. */
    UTF8
}
