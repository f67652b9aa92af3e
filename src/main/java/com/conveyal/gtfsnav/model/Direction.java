package com.conveyal.gtfsnav.model;

/** The two directions of travel of trips.txt direction_id. The meaning of each is up to the feed producer. */
public enum Direction {
    A(0),
    B(1);

    public final int code;

    Direction(int code) {
        this.code = code;
    }

    public static Direction forCode(int code) {
        return code == 0 ? A : B;
    }
}
