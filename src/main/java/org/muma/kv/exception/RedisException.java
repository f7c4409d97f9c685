package org.muma.kv.exception;

/**
 * Base type of every error the engine reports to a caller.
 * <p>
 * An engine error only fails the single invocation that raised it; the dispatcher turns it into
 * an error reply of the form {@code <prefix> <message>} and the connection stays open.
 */
public abstract class RedisException extends RuntimeException {

    protected RedisException(String message) {
        super(message);
    }

    /**
     * First word of the error reply, e.g. {@code ERR} or {@code WRONGTYPE}.
     */
    public String errorPrefix() {
        return "ERR";
    }

    public String toReply() {
        return errorPrefix() + " " + getMessage();
    }
}
