package org.muma.kv.command.option;

import org.muma.kv.exception.InvalidArgumentException;

/**
 * SET key value [NX | XX] [GET] [EX seconds | PX milliseconds | EXAT unix-time-seconds | PXAT unix-time-milliseconds | KEEPTTL]
 */
public class SetOptions extends CommandOptions {

    public static final String NX = "NX";
    public static final String XX = "XX";
    public static final String GET = "GET";
    public static final String EX = "EX";
    public static final String PX = "PX";
    public static final String EXAT = "EXAT";
    public static final String PXAT = "PXAT";
    public static final String KEEPTTL = "KEEPTTL";

    private long expiryValue;

    public SetOptions() {
        registry.register(NX, XX)
                .register(XX, NX)
                .register(GET)
                .register(EX, PX, EXAT, PXAT, KEEPTTL)
                .register(PX, EX, EXAT, PXAT, KEEPTTL)
                .register(EXAT, EX, PX, PXAT, KEEPTTL)
                .register(PXAT, EX, PX, EXAT, KEEPTTL)
                .register(KEEPTTL, EX, PX, EXAT, PXAT);
    }

    public static boolean takesValue(String name) {
        return switch (name) {
            case EX, PX, EXAT, PXAT -> true;
            default -> false;
        };
    }

    /**
     * Activates one of EX / PX / EXAT / PXAT together with its argument.
     */
    public void setExpiry(String type, long value) {
        if (!takesValue(type)) {
            throw InvalidArgumentException.syntaxError();
        }
        if (value <= 0) {
            throw invalidExpireTime();
        }
        if (EX.equals(type) || EXAT.equals(type)) {
            // seconds must still be representable once converted to millis
            toMillis(value);
        }
        registry.activate(type);
        this.expiryValue = value;
    }

    public boolean isNx() {
        return isSet(NX);
    }

    public boolean isXx() {
        return isSet(XX);
    }

    public boolean isGet() {
        return isSet(GET);
    }

    public boolean isKeepTtl() {
        return isSet(KEEPTTL);
    }

    public boolean hasExplicitExpiry() {
        return isSet(EX) || isSet(PX) || isSet(EXAT) || isSet(PXAT);
    }

    /**
     * Absolute expiry in epoch millis, or -1 when no EX/PX/EXAT/PXAT was given.
     *
     * @throws InvalidArgumentException when the expiry does not fit in epoch millis
     */
    public long resolveExpireAt(long nowMillis) {
        try {
            if (isSet(EX)) return Math.addExact(nowMillis, toMillis(expiryValue));
            if (isSet(PX)) return Math.addExact(nowMillis, expiryValue);
        } catch (ArithmeticException e) {
            throw invalidExpireTime();
        }
        if (isSet(EXAT)) return toMillis(expiryValue);
        if (isSet(PXAT)) return expiryValue;
        return -1;
    }

    private static long toMillis(long seconds) {
        try {
            return Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            throw invalidExpireTime();
        }
    }

    private static InvalidArgumentException invalidExpireTime() {
        return new InvalidArgumentException("invalid expire time in 'set' command");
    }
}
