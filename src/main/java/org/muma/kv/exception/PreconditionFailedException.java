package org.muma.kv.exception;

/**
 * An NX / XX / GT / LT guard did not hold, so the gated mutation was not applied.
 */
public class PreconditionFailedException extends RedisException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
