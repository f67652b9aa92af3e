package com.conveyal.gtfsnav.model;

/**
 * Whether riders can board or alight anywhere along the vehicle's path between stops. Used by both routes.txt and
 * stop_times.txt continuous_pickup / continuous_drop_off.
 */
public enum ContinuityPolicy {
    CONTINUOUS(0),
    NOT_CONTINUOUS(1),
    PHONE_AGENCY(2),
    COORDINATE_WITH_DRIVER(3);

    public final int code;

    ContinuityPolicy(int code) {
        this.code = code;
    }

    public static ContinuityPolicy forCode(int code) {
        for (ContinuityPolicy policy : values()) {
            if (policy.code == code) return policy;
        }
        throw new IllegalArgumentException("Invalid continuity policy " + code);
    }
}
