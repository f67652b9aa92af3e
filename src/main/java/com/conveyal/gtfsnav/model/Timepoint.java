package com.conveyal.gtfsnav.model;

public enum Timepoint {
    APPROXIMATE(0),
    EXACT(1);

    public final int code;

    Timepoint(int code) {
        this.code = code;
    }

    public static Timepoint forCode(int code) {
        return code == 0 ? APPROXIMATE : EXACT;
    }
}
