package org.muma.kv.protocol;

import java.nio.charset.StandardCharsets;

// $<len> - null content encodes as $-1
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Byte-for-byte view of a key or member: each byte maps to the char of the same value (ISO-8859-1),
     * so distinct byte sequences never collapse into one string.
     */
    public static BulkString ofBinary(String s) {
        return new BulkString(s == null ? null : s.getBytes(StandardCharsets.ISO_8859_1));
    }

    public String asBinaryString() {
        return content == null ? null : new String(content, StandardCharsets.ISO_8859_1);
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    public boolean isNull() {
        return content == null;
    }
}
