package org.muma.kv.protocol;

// :1
public record RedisInteger(long value) implements RedisMessage {
}
