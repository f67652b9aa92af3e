package com.conveyal.gtfsnav.stats;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.io.PrintStream;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Trip and stop time counts for the rail lines of a Schedule: every route whose type is subway, tram, cable tram or
 * rail. For each stop a line serves, the report shows how many of the line's stop times are at that stop and the
 * first few of their times.
 */
public class RailLineStats {

    /** How many times are printed for each stop before the rest are elided. */
    public static final int TIMES_PER_STOP = 5;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Schedule schedule;

    public RailLineStats (Schedule schedule) {
        this.schedule = schedule;
    }

    public List<Route> getRailLines () {
        List<Route> railLines = new ArrayList<>();
        for (Route route : schedule.routes.values()) {
            if (route.route_type != null && route.route_type.isRail()) railLines.add(route);
        }
        return railLines;
    }

    public List<Trip> getTripsForRoute (String route_id) {
        List<Trip> trips = new ArrayList<>();
        for (Trip trip : schedule.trips.values()) {
            if (route_id.equals(trip.route_id)) trips.add(trip);
        }
        return trips;
    }

    /**
     * Group the stop times of a route's trips by the stop they are at, with stops in the order the trips first reach
     * them. Stop times at flex locations and at stops missing from the Schedule are left out.
     */
    public ListMultimap<String, StopTime> getStopTimesByStop (String route_id) {
        ListMultimap<String, StopTime> stopTimesForStop = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (Trip trip : getTripsForRoute(route_id)) {
            for (StopTime stopTime : schedule.getOrderedStopTimesForTrip(trip.trip_id)) {
                if (stopTime.stop_id != null && schedule.stops.containsKey(stopTime.stop_id)) {
                    stopTimesForStop.put(stopTime.stop_id, stopTime);
                }
            }
        }
        return stopTimesForStop;
    }

    public void print (PrintStream out) {
        List<Route> railLines = getRailLines();
        out.println(String.format("Rail lines: %d", railLines.size()));
        for (Route route : railLines) {
            ListMultimap<String, StopTime> stopTimesForStop = getStopTimesByStop(route.route_id);
            out.println(String.format("%s (%s): %d trips, %d stops", route.getName(), route.route_id,
                    getTripsForRoute(route.route_id).size(), stopTimesForStop.keySet().size()));
            for (String stop_id : stopTimesForStop.keySet()) {
                List<StopTime> stopTimes = stopTimesForStop.get(stop_id);
                Stop stop = schedule.stops.get(stop_id);
                String name = stop.getStopName() == null ? "Stop ID " + stop_id : stop.getStopName();
                out.println(String.format("  %s (%s): %d stop times", name, stop_id, stopTimes.size()));
                for (StopTime stopTime : stopTimes.subList(0, Math.min(TIMES_PER_STOP, stopTimes.size()))) {
                    LocalTime time = stopTime.getDepartureOrArrivalTime();
                    out.println("    " + (time == null ? "unknown stop time" : time.format(TIME_FORMAT)));
                }
                if (stopTimes.size() > TIMES_PER_STOP) out.println("    ...");
            }
        }
    }
}
