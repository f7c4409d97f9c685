package org.muma.kv.exception;

// key or member absent
public class NotFoundException extends RedisException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException noSuchKey() {
        return new NotFoundException("no such key");
    }

    public static NotFoundException noSuchMember() {
        return new NotFoundException("no such member");
    }
}
