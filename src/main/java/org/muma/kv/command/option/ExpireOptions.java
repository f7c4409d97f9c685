package org.muma.kv.command.option;

/**
 * EXPIRE key seconds [NX | XX | GT | LT]
 */
public class ExpireOptions extends CommandOptions {

    public static final String NX = "NX";
    public static final String XX = "XX";
    public static final String GT = "GT";
    public static final String LT = "LT";

    public ExpireOptions() {
        registry.register(NX, XX, GT, LT)
                .register(XX, NX, GT, LT)
                .register(GT, NX, XX, LT)
                .register(LT, NX, XX, GT);
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
}
