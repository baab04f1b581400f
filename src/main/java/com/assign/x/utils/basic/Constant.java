package com.assign.x.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String HUNGARIAN = "HUNGARIAN";
    public static final String BRUTE_FORCE = "BRUTE_FORCE";
    public static final String STRATEGY = "strategy";
    public static final String SIZE = "size";
    public static final String TYPE = "type";
    public static final String OUTCOME = "outcome";
    public static final int NONE = -1;
}
