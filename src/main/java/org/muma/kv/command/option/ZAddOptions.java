package org.muma.kv.command.option;

/**
 * ZADD key [NX | XX] [GT | LT] [CH] [INCR] score member [score member ...]
 */
public class ZAddOptions extends CommandOptions {

    public static final String NX = "NX";
    public static final String XX = "XX";
    public static final String GT = "GT";
    public static final String LT = "LT";
    public static final String CH = "CH";
    public static final String INCR = "INCR";

    public ZAddOptions() {
        registry.register(NX, XX, GT, LT, INCR)
                .register(XX, NX, INCR)
                .register(GT, LT, NX, INCR)
                .register(LT, GT, NX, INCR)
                .register(CH)
                .register(INCR, NX, XX, GT, LT);
    }

    public boolean isNx() {
        return isSet(NX);
    }

    public boolean isXx() {
        return isSet(XX);
    }

    public boolean isGt() {
        return isSet(GT);
    }

    public boolean isLt() {
        return isSet(LT);
    }

    public boolean isCh() {
        return isSet(CH);
    }

    public boolean isIncr() {
        return isSet(INCR);
    }
}
