package org.muma.kv.exception;

public class UnknownOptionException extends RedisException {

    public UnknownOptionException(String option) {
        super("syntax error, unknown option '" + option + "'");
    }
}
