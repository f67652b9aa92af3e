package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;

import java.util.Map;
import java.util.Objects;

public class Trip extends Entity {

    private static final long serialVersionUID = -4869384750974542712L;

    public String trip_id;
    public String route_id;
    /** References the service calendar, which is not loaded. */
    public String service_id;
    public String trip_headsign;
    public String trip_short_name;
    public Direction direction_id;
    public String block_id;
    public String shape_id;
    /** Tri-states: true if allowed, false if not, null if unknown. */
    public Boolean wheelchair_accessible;
    public Boolean bikes_allowed;

    public Trip () { }

    public Trip (String trip_id, String route_id, String service_id) {
        this.trip_id = trip_id;
        this.route_id = route_id;
        this.service_id = service_id;
    }

    @Override
    public String getId () {
        return trip_id;
    }

    /** The headsign if there is one, otherwise the short name, otherwise null. */
    public String getName () {
        return trip_headsign != null ? trip_headsign : trip_short_name;
    }

    @Override
    public Trip clone () {
        return (Trip) super.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Trip trip = (Trip) o;
        return Objects.equals(trip_id, trip.trip_id) &&
            Objects.equals(route_id, trip.route_id) &&
            Objects.equals(service_id, trip.service_id) &&
            Objects.equals(trip_headsign, trip.trip_headsign) &&
            Objects.equals(trip_short_name, trip.trip_short_name) &&
            direction_id == trip.direction_id &&
            Objects.equals(block_id, trip.block_id) &&
            Objects.equals(shape_id, trip.shape_id) &&
            Objects.equals(wheelchair_accessible, trip.wheelchair_accessible) &&
            Objects.equals(bikes_allowed, trip.bikes_allowed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trip_id, route_id, service_id);
    }

    public static class Loader extends Entity.Loader<Trip> {

        private final Map<String, Trip> trips;

        public Loader(Map<String, Trip> trips) {
            super("trips");
            this.trips = trips;
        }

        @Override
        protected void loadOneRow() throws GTFSLoadException {
            Trip t = new Trip();
            t.sourceFileLine = getLineNumber();
            t.trip_id         = getStringField("trip_id", true);
            t.route_id        = getStringField("route_id", true);
            t.service_id      = getStringField("service_id", true);
            t.trip_headsign   = getStringField("trip_headsign", false);
            t.trip_short_name = getStringField("trip_short_name", false);
            Integer direction = getIntField("direction_id", false, 0, 1);
            if (direction != null) t.direction_id = Direction.forCode(direction);
            t.block_id        = getStringField("block_id", false);
            t.shape_id        = getStringField("shape_id", false);
            t.wheelchair_accessible = getTriStateField("wheelchair_accessible");
            t.bikes_allowed   = getTriStateField("bikes_allowed");
            if (trips.containsKey(t.trip_id)) throw error(LoadErrorType.DUPLICATE_ID, "trip_id", t.trip_id);
            trips.put(t.trip_id, t);
        }
    }
}
