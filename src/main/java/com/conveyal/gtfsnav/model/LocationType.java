package com.conveyal.gtfsnav.model;

/**
 * The GTFS stops.txt location_type values. Each one carries a different set of required fields, see
 * {@link LocationDetails}.
 */
public enum LocationType {
    STOP(0),
    STATION(1),
    ENTRANCE_EXIT(2),
    GENERIC_NODE(3),
    BOARDING_AREA(4);

    public final int code;

    LocationType(int code) {
        this.code = code;
    }

    public static LocationType forCode(int code) {
        for (LocationType type : values()) {
            if (type.code == code) return type;
        }
        throw new IllegalArgumentException("Invalid location_type " + code);
    }
}
