package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;

import java.net.URL;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;

/**
 * A GTFS stop, station, entrance, pathway node or boarding area. The fields common to every kind of location are
 * held here; the fields whose presence depends on location_type are held in {@link #location}.
 */
public class Stop extends Entity {

    private static final long serialVersionUID = 464065335273514677L;

    public String stop_id;
    public String stop_code;
    public String tts_stop_name;
    public String stop_desc;
    public String zone_id;
    public URL    stop_url;
    public ZoneId stop_timezone;
    /** True if some boarding is possible by wheelchair, false if not, null if unknown. */
    public Boolean wheelchair_boarding;
    public String level_id;
    public String platform_code;
    public LocationDetails location;

    public Stop () { }

    public Stop (String stop_id, LocationDetails location) {
        this.stop_id = stop_id;
        this.location = location;
    }

    @Override
    public String getId () {
        return stop_id;
    }

    public LocationType getLocationType () {
        return location.getLocationType();
    }

    /** @return the stop name, or null for unnamed generic nodes and boarding areas. */
    public String getStopName () {
        return location.getName();
    }

    public Double getStopLat () {
        return location.getLat();
    }

    public Double getStopLon () {
        return location.getLon();
    }

    public String getParentStation () {
        return location.getParentStation();
    }

    @Override
    public Stop clone () {
        return (Stop) super.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Stop stop = (Stop) o;
        return Objects.equals(stop_id, stop.stop_id) &&
            Objects.equals(stop_code, stop.stop_code) &&
            Objects.equals(tts_stop_name, stop.tts_stop_name) &&
            Objects.equals(stop_desc, stop.stop_desc) &&
            Objects.equals(zone_id, stop.zone_id) &&
            Objects.equals(stop_url, stop.stop_url) &&
            Objects.equals(stop_timezone, stop.stop_timezone) &&
            Objects.equals(wheelchair_boarding, stop.wheelchair_boarding) &&
            Objects.equals(level_id, stop.level_id) &&
            Objects.equals(platform_code, stop.platform_code) &&
            Objects.equals(location, stop.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stop_id, location);
    }

    public static class Loader extends Entity.Loader<Stop> {

        private final Map<String, Stop> stops;

        public Loader(Map<String, Stop> stops) {
            super("stops");
            this.stops = stops;
        }

        @Override
        protected void loadOneRow() throws GTFSLoadException {
            Stop s = new Stop();
            s.sourceFileLine = getLineNumber();
            s.stop_id       = getStringField("stop_id", true);
            s.stop_code     = getStringField("stop_code", false);
            s.tts_stop_name = getStringField("tts_stop_name", false);
            s.stop_desc     = getStringField("stop_desc", false);
            s.zone_id       = getStringField("zone_id", false);
            s.stop_url      = getUrlField("stop_url", false);
            s.stop_timezone = getTimeZoneField("stop_timezone", false);
            s.wheelchair_boarding = getTriStateField("wheelchair_boarding");
            s.level_id      = getStringField("level_id", false);
            s.platform_code = getStringField("platform_code", false);
            s.location      = loadLocationDetails();
            if (stops.containsKey(s.stop_id)) {
                throw error(LoadErrorType.DUPLICATE_ID, "stop_id", s.stop_id);
            }
            stops.put(s.stop_id, s);
        }

        /** The location_type decides which fields are required; a missing location_type means a plain stop. */
        private LocationDetails loadLocationDetails() throws GTFSLoadException {
            int code = getIntField("location_type", 0, 4, 0);
            switch (LocationType.forCode(code)) {
                case STOP:
                    return new LocationDetails.StopDetails(
                        getStringField("stop_name", true),
                        getDoubleField("stop_lat", true, -90D, 90D),
                        getDoubleField("stop_lon", true, -180D, 180D),
                        getStringField("parent_station", false));
                case STATION:
                    // Stations are the top of the hierarchy, any parent_station given for one is ignored.
                    return new LocationDetails.StationDetails(
                        getStringField("stop_name", true),
                        getDoubleField("stop_lat", true, -90D, 90D),
                        getDoubleField("stop_lon", true, -180D, 180D));
                case ENTRANCE_EXIT:
                    return new LocationDetails.EntranceExitDetails(
                        getStringField("stop_name", true),
                        getDoubleField("stop_lat", true, -90D, 90D),
                        getDoubleField("stop_lon", true, -180D, 180D),
                        getStringField("parent_station", true));
                case GENERIC_NODE:
                    return new LocationDetails.GenericNodeDetails(
                        getStringField("stop_name", false),
                        getDoubleField("stop_lat", false, -90D, 90D),
                        getDoubleField("stop_lon", false, -180D, 180D),
                        getStringField("parent_station", true));
                case BOARDING_AREA:
                default:
                    return new LocationDetails.BoardingAreaDetails(
                        getStringField("stop_name", false),
                        getDoubleField("stop_lat", false, -90D, 90D),
                        getDoubleField("stop_lon", false, -180D, 180D),
                        getStringField("parent_station", true));
            }
        }
    }
}
