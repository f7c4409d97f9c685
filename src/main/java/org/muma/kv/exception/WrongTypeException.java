package org.muma.kv.exception;

public class WrongTypeException extends RedisException {

    public WrongTypeException() {
        super("Operation against a key holding the wrong kind of value");
    }

    @Override
    public String errorPrefix() {
        return "WRONGTYPE";
    }
}
