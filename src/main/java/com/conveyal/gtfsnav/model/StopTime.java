package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.google.common.collect.ListMultimap;

import java.time.LocalTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Represents a GTFS StopTime. Stop times have no key of their own; a Schedule groups them by trip_id, in the order
 * they were read. They are not sorted by stop_sequence unless a caller sorts them with {@link #BY_STOP_SEQUENCE}.
 */
public class StopTime extends Entity {

    private static final long serialVersionUID = -8883780047901081832L;

    /* StopTime does not directly reference its Trip or Stop so that it can be copied between Schedules. */
    public String trip_id;
    /** Null when the vehicle serves a GTFS Flex location group or location area instead of a stop. */
    public String stop_id;
    public String location_group_id;
    public String location_id;
    /** Times of day. Hours past midnight have been wrapped, so these say nothing about which service day it is. */
    public LocalTime arrival_time;
    public LocalTime departure_time;
    public int    stop_sequence;
    public String stop_headsign;
    public LocalTime start_pickup_drop_off_window;
    public LocalTime end_pickup_drop_off_window;
    public StopPolicy pickup_type;
    public StopPolicy drop_off_type;
    public ContinuityPolicy continuous_pickup;
    public ContinuityPolicy continuous_drop_off;
    public Double shape_dist_traveled;
    public Timepoint timepoint;

    // GTFS Flex booking rule fields.
    public String pickup_booking_rule_id;
    public String drop_off_booking_rule_id;

    public static final Comparator<StopTime> BY_STOP_SEQUENCE = Comparator.comparingInt(st -> st.stop_sequence);

    public StopTime () { }

    public StopTime (String trip_id, String stop_id, int stop_sequence) {
        this.trip_id = trip_id;
        this.stop_id = stop_id;
        this.stop_sequence = stop_sequence;
    }

    @Override
    public String getId() {
        return trip_id; // Needs sequence number to be unique
    }

    /** The departure time if known, otherwise the arrival time, otherwise null. */
    public LocalTime getDepartureOrArrivalTime() {
        return departure_time != null ? departure_time : arrival_time;
    }

    @Override
    public StopTime clone () {
        return (StopTime) super.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StopTime stopTime = (StopTime) o;
        return stop_sequence == stopTime.stop_sequence &&
            Objects.equals(trip_id, stopTime.trip_id) &&
            Objects.equals(stop_id, stopTime.stop_id) &&
            Objects.equals(location_group_id, stopTime.location_group_id) &&
            Objects.equals(location_id, stopTime.location_id) &&
            Objects.equals(arrival_time, stopTime.arrival_time) &&
            Objects.equals(departure_time, stopTime.departure_time) &&
            Objects.equals(stop_headsign, stopTime.stop_headsign) &&
            Objects.equals(start_pickup_drop_off_window, stopTime.start_pickup_drop_off_window) &&
            Objects.equals(end_pickup_drop_off_window, stopTime.end_pickup_drop_off_window) &&
            pickup_type == stopTime.pickup_type &&
            drop_off_type == stopTime.drop_off_type &&
            continuous_pickup == stopTime.continuous_pickup &&
            continuous_drop_off == stopTime.continuous_drop_off &&
            Objects.equals(shape_dist_traveled, stopTime.shape_dist_traveled) &&
            timepoint == stopTime.timepoint &&
            Objects.equals(pickup_booking_rule_id, stopTime.pickup_booking_rule_id) &&
            Objects.equals(drop_off_booking_rule_id, stopTime.drop_off_booking_rule_id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trip_id, stop_id, stop_sequence, arrival_time, departure_time);
    }

    public static class Loader extends Entity.Loader<StopTime> {

        private final ListMultimap<String, StopTime> stopTimes;

        public Loader(ListMultimap<String, StopTime> stopTimes) {
            super("stop_times");
            this.stopTimes = stopTimes;
        }

        @Override
        protected void loadOneRow() throws GTFSLoadException {
            StopTime st = new StopTime();
            st.sourceFileLine = getLineNumber();
            st.trip_id        = getStringField("trip_id", true);
            st.arrival_time   = getTimeField("arrival_time", false);
            st.departure_time = getTimeField("departure_time", false);
            st.stop_id        = getStringField("stop_id", false);
            st.location_group_id = getStringField("location_group_id", false);
            st.location_id    = getStringField("location_id", false);
            st.stop_sequence  = getIntField("stop_sequence", true, 0, Integer.MAX_VALUE);
            st.stop_headsign  = getStringField("stop_headsign", false);
            st.start_pickup_drop_off_window = getTimeField("start_pickup_drop_off_window", false);
            st.end_pickup_drop_off_window = getTimeField("end_pickup_drop_off_window", false);
            Integer pickupType = getIntField("pickup_type", false, 0, 3);
            if (pickupType != null) st.pickup_type = StopPolicy.forCode(pickupType);
            Integer dropOffType = getIntField("drop_off_type", false, 0, 3);
            if (dropOffType != null) st.drop_off_type = StopPolicy.forCode(dropOffType);
            Integer continuousPickup = getIntField("continuous_pickup", false, 0, 3);
            if (continuousPickup != null) st.continuous_pickup = ContinuityPolicy.forCode(continuousPickup);
            Integer continuousDropOff = getIntField("continuous_drop_off", false, 0, 3);
            if (continuousDropOff != null) st.continuous_drop_off = ContinuityPolicy.forCode(continuousDropOff);
            st.shape_dist_traveled = getDoubleField("shape_dist_traveled", false, 0D, Double.MAX_VALUE);
            Integer timepoint = getIntField("timepoint", false, 0, 1);
            if (timepoint != null) st.timepoint = Timepoint.forCode(timepoint);
            st.pickup_booking_rule_id = getStringField("pickup_booking_rule_id", false);
            st.drop_off_booking_rule_id = getStringField("drop_off_booking_rule_id", false);
            stopTimes.put(st.trip_id, st);
        }
    }
}
