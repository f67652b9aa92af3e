package com.conveyal.gtfsnav.model;

import java.io.Serializable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The part of a stops.txt record whose shape depends on its location_type. The GTFS reference imposes different
 * required fields on each kind of location: a station may not have a parent, an entrance must have one, a generic
 * node or boarding area need not have a name or coordinates. Each subclass holds exactly the fields its kind allows,
 * with required fields checked at construction, so an invalid combination cannot be represented.
 *
 * The set of subclasses is closed; the accessors on this class give a uniform view over all of them and return
 * null where a kind of location has no such field.
 */
public abstract class LocationDetails implements Serializable {

    private static final long serialVersionUID = 1L;

    private LocationDetails() { }

    public abstract LocationType getLocationType();

    public abstract String getName();

    public abstract Double getLat();

    public abstract Double getLon();

    /** @return the stop_id of the parent station, or null for stations and for stops outside any station. */
    public abstract String getParentStation();

    /** A stop or platform where passengers board or alight (location_type 0). */
    public static final class StopDetails extends LocationDetails {
        private static final long serialVersionUID = 1L;

        public final String stop_name;
        public final double stop_lat;
        public final double stop_lon;
        public final String parent_station;

        public StopDetails(String stop_name, double stop_lat, double stop_lon, String parent_station) {
            this.stop_name = checkNotNull(stop_name, "stop_name");
            this.stop_lat = stop_lat;
            this.stop_lon = stop_lon;
            this.parent_station = parent_station;
        }

        @Override public LocationType getLocationType() { return LocationType.STOP; }
        @Override public String getName() { return stop_name; }
        @Override public Double getLat() { return stop_lat; }
        @Override public Double getLon() { return stop_lon; }
        @Override public String getParentStation() { return parent_station; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StopDetails)) return false;
            StopDetails that = (StopDetails) o;
            return Double.compare(that.stop_lat, stop_lat) == 0 &&
                Double.compare(that.stop_lon, stop_lon) == 0 &&
                stop_name.equals(that.stop_name) &&
                Objects.equals(parent_station, that.parent_station);
        }

        @Override
        public int hashCode() {
            return Objects.hash(stop_name, stop_lat, stop_lon, parent_station);
        }
    }

    /** A station containing other locations (location_type 1). Stations are always at the top of the hierarchy. */
    public static final class StationDetails extends LocationDetails {
        private static final long serialVersionUID = 1L;

        public final String stop_name;
        public final double stop_lat;
        public final double stop_lon;

        public StationDetails(String stop_name, double stop_lat, double stop_lon) {
            this.stop_name = checkNotNull(stop_name, "stop_name");
            this.stop_lat = stop_lat;
            this.stop_lon = stop_lon;
        }

        @Override public LocationType getLocationType() { return LocationType.STATION; }
        @Override public String getName() { return stop_name; }
        @Override public Double getLat() { return stop_lat; }
        @Override public Double getLon() { return stop_lon; }
        @Override public String getParentStation() { return null; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StationDetails)) return false;
            StationDetails that = (StationDetails) o;
            return Double.compare(that.stop_lat, stop_lat) == 0 &&
                Double.compare(that.stop_lon, stop_lon) == 0 &&
                stop_name.equals(that.stop_name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(stop_name, stop_lat, stop_lon);
        }
    }

    /** A way into or out of a station (location_type 2). */
    public static final class EntranceExitDetails extends LocationDetails {
        private static final long serialVersionUID = 1L;

        public final String stop_name;
        public final double stop_lat;
        public final double stop_lon;
        public final String parent_station;

        public EntranceExitDetails(String stop_name, double stop_lat, double stop_lon, String parent_station) {
            this.stop_name = checkNotNull(stop_name, "stop_name");
            this.stop_lat = stop_lat;
            this.stop_lon = stop_lon;
            this.parent_station = checkNotNull(parent_station, "parent_station");
        }

        @Override public LocationType getLocationType() { return LocationType.ENTRANCE_EXIT; }
        @Override public String getName() { return stop_name; }
        @Override public Double getLat() { return stop_lat; }
        @Override public Double getLon() { return stop_lon; }
        @Override public String getParentStation() { return parent_station; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EntranceExitDetails)) return false;
            EntranceExitDetails that = (EntranceExitDetails) o;
            return Double.compare(that.stop_lat, stop_lat) == 0 &&
                Double.compare(that.stop_lon, stop_lon) == 0 &&
                stop_name.equals(that.stop_name) &&
                parent_station.equals(that.parent_station);
        }

        @Override
        public int hashCode() {
            return Objects.hash(stop_name, stop_lat, stop_lon, parent_station);
        }
    }

    /**
     * Shared fields of the two kinds of location that only exist inside a station and need neither a name nor
     * coordinates.
     */
    public abstract static class InsideStationDetails extends LocationDetails {
        private static final long serialVersionUID = 1L;

        public final String stop_name;
        public final Double stop_lat;
        public final Double stop_lon;
        public final String parent_station;

        InsideStationDetails(String stop_name, Double stop_lat, Double stop_lon, String parent_station) {
            this.stop_name = stop_name;
            this.stop_lat = stop_lat;
            this.stop_lon = stop_lon;
            this.parent_station = checkNotNull(parent_station, "parent_station");
        }

        @Override public String getName() { return stop_name; }
        @Override public Double getLat() { return stop_lat; }
        @Override public Double getLon() { return stop_lon; }
        @Override public String getParentStation() { return parent_station; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            InsideStationDetails that = (InsideStationDetails) o;
            return Objects.equals(stop_name, that.stop_name) &&
                Objects.equals(stop_lat, that.stop_lat) &&
                Objects.equals(stop_lon, that.stop_lon) &&
                parent_station.equals(that.parent_station);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getLocationType(), stop_name, stop_lat, stop_lon, parent_station);
        }
    }

    /** A pathway node inside a station (location_type 3). */
    public static final class GenericNodeDetails extends InsideStationDetails {
        private static final long serialVersionUID = 1L;

        public GenericNodeDetails(String stop_name, Double stop_lat, Double stop_lon, String parent_station) {
            super(stop_name, stop_lat, stop_lon, parent_station);
        }

        @Override public LocationType getLocationType() { return LocationType.GENERIC_NODE; }
    }

    /** A specific place on a platform where passengers board (location_type 4). Its parent is the platform. */
    public static final class BoardingAreaDetails extends InsideStationDetails {
        private static final long serialVersionUID = 1L;

        public BoardingAreaDetails(String stop_name, Double stop_lat, Double stop_lon, String parent_station) {
            super(stop_name, stop_lat, stop_lon, parent_station);
        }

        @Override public LocationType getLocationType() { return LocationType.BOARDING_AREA; }
    }
}
