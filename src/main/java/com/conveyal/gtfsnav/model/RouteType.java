package com.conveyal.gtfsnav.model;

/** The basic GTFS route types, numbered as they appear in routes.txt. Extended route types are not supported. */
public enum RouteType {
    TRAM_STREETCAR_LIGHT_RAIL(0),
    SUBWAY_METRO(1),
    RAIL(2),
    BUS(3),
    FERRY(4),
    CABLE_TRAM(5),
    AERIAL_LIFT(6),
    FUNICULAR(7),
    TROLLEYBUS(11),
    MONORAIL(12);

    public final int code;

    RouteType(int code) {
        this.code = code;
    }

    public static RouteType forCode(int code) {
        for (RouteType type : values()) {
            if (type.code == code) return type;
        }
        throw new IllegalArgumentException("Invalid route_type " + code);
    }

    /** Subway, tram, streetcar, light rail, cable tram and rail lines. Funiculars and monorails are not included. */
    public boolean isRail() {
        switch (this) {
            case TRAM_STREETCAR_LIGHT_RAIL:
            case SUBWAY_METRO:
            case RAIL:
            case CABLE_TRAM:
                return true;
            default:
                return false;
        }
    }

    public static boolean isValidCode(int code) {
        for (RouteType type : values()) {
            if (type.code == code) return true;
        }
        return false;
    }
}
