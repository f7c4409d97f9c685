package org.muma.kv.protocol;

import java.nio.charset.StandardCharsets;

/**
 * RESP message. Sealed so that the encoder can switch over every reply shape.
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    default byte[] toBytes(String content) {
        return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
    }
}
