package com.conveyal.gtfsnav;

import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The stops, routes, trips and stop times of a whole GTFS feed, or of a projection of one onto a single route or
 * stop. A Schedule is immutable once built. Collections keep the order in which entities were added, which for a
 * loaded feed is the order of the CSV files.
 *
 * A Schedule loaded straight from a feed may contain stop times whose trip or stop is missing; a projected Schedule
 * never does.
 */
public class Schedule {

    public final ImmutableMap<String, Stop> stops;
    public final ImmutableMap<String, Route> routes;
    public final ImmutableMap<String, Trip> trips;
    /* Stop times grouped by trip_id. Trips and the stop times within each trip are both in insertion order. */
    public final ImmutableListMultimap<String, StopTime> stop_times;

    public Schedule(Map<String, Stop> stops, Map<String, Route> routes, Map<String, Trip> trips,
                    ListMultimap<String, StopTime> stopTimes) {
        this.stops = ImmutableMap.copyOf(stops);
        this.routes = ImmutableMap.copyOf(routes);
        this.trips = ImmutableMap.copyOf(trips);
        this.stop_times = ImmutableListMultimap.copyOf(stopTimes);
    }

    /**
     * For the given trip ID, fetch all the stop times in order of increasing stop_sequence. The Schedule itself
     * keeps them in the order they were loaded, so this returns a sorted copy.
     */
    public List<StopTime> getOrderedStopTimesForTrip(String trip_id) {
        List<StopTime> stopTimes = new ArrayList<>(stop_times.get(trip_id));
        stopTimes.sort(StopTime.BY_STOP_SEQUENCE);
        return stopTimes;
    }

    /** Aggregate counts, one per line, as printed by the info command. */
    public String getSummary() {
        return String.join("\n",
            String.format("Stops: %d", stops.size()),
            String.format("Routes: %d", routes.size()),
            String.format("Trips: %d", trips.size()),
            String.format("Stop times: %d", stop_times.size()));
    }

    @Override
    public String toString() {
        return String.format("Schedule with %d stops, %d routes, %d trips and %d stop times",
            stops.size(), routes.size(), trips.size(), stop_times.size());
    }
}
