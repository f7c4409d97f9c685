package org.muma.kv.protocol;

// +OK
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");
}
