package org.muma.kv.exception;

public class InvalidArgumentException extends RedisException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public static InvalidArgumentException syntaxError() {
        return new InvalidArgumentException("syntax error");
    }

    public static InvalidArgumentException notAnInteger() {
        return new InvalidArgumentException("value is not an integer or out of range");
    }

    public static InvalidArgumentException notAFloat() {
        return new InvalidArgumentException("value is not a valid float");
    }
}
