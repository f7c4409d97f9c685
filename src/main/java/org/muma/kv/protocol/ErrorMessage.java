package org.muma.kv.protocol;

// -ERR ...
public record ErrorMessage(String content) implements RedisMessage {
}
