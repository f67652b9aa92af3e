package com.conveyal.gtfsnav.model;

/** The stop_times.txt pickup_type and drop_off_type values. */
public enum StopPolicy {
    REGULARLY_SCHEDULED(0),
    UNAVAILABLE(1),
    PHONE_AGENCY(2),
    COORDINATE_WITH_DRIVER(3);

    public final int code;

    StopPolicy(int code) {
        this.code = code;
    }

    public static StopPolicy forCode(int code) {
        for (StopPolicy policy : values()) {
            if (policy.code == code) return policy;
        }
        throw new IllegalArgumentException("Invalid pickup or drop off type " + code);
    }
}
