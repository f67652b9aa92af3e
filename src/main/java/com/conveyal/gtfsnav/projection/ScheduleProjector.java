package com.conveyal.gtfsnav.projection;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.error.ProjectionErrorType;
import com.conveyal.gtfsnav.error.ProjectionException;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives a smaller Schedule from a larger one, containing exactly the entities connected to a single route or stop.
 * The result is referentially closed: every stop time belongs to a trip in the result, and every trip to a route in
 * it. The source Schedule is never modified, and the result holds copies of its entities rather than sharing them.
 *
 * A selector that reaches nothing is not an error; only a selector ID missing from the source Schedule is.
 */
public class ScheduleProjector {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleProjector.class);

    private ScheduleProjector() { }

    /**
     * Project onto one route: the route itself, all of its trips, their stop times, and the stops those stop times
     * visit.
     */
    public static Schedule projectByRoute(Schedule schedule, String routeId) throws ProjectionException {
        Route route = schedule.routes.get(routeId);
        if (route == null) throw new ProjectionException(ProjectionErrorType.NO_SUCH_ROUTE, routeId);

        Map<String, Trip> trips = new LinkedHashMap<>();
        for (Trip trip : schedule.trips.values()) {
            if (routeId.equals(trip.route_id)) trips.put(trip.trip_id, trip.clone());
        }

        // Group the stop times by stop to select stops, and by trip for the result.
        ListMultimap<String, StopTime> stopTimesForStop = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        ListMultimap<String, StopTime> stopTimesForTrip = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (StopTime stopTime : schedule.stop_times.values()) {
            if (!trips.containsKey(stopTime.trip_id)) continue;
            StopTime copy = stopTime.clone();
            stopTimesForTrip.put(copy.trip_id, copy);
            // Stop times at GTFS Flex locations belong to the trip but do not reach any stop.
            if (copy.stop_id != null) stopTimesForStop.put(copy.stop_id, copy);
        }

        Map<String, Stop> stops = new LinkedHashMap<>();
        for (Stop stop : schedule.stops.values()) {
            if (stopTimesForStop.containsKey(stop.stop_id)) stops.put(stop.stop_id, stop.clone());
        }

        Schedule projection = new Schedule(stops, ImmutableMap.of(routeId, route.clone()), trips, stopTimesForTrip);
        LOG.debug("Projected route {}: {}", routeId, projection);
        return projection;
    }

    /**
     * Project onto one stop: the stop and every stop below it in the station hierarchy, the stop times at any of
     * those stops, the trips of those stop times, and the routes of those trips. Stops above the selected one are
     * not included.
     */
    public static Schedule projectByStop(Schedule schedule, String stopId) throws ProjectionException {
        StopHierarchy hierarchy = new StopHierarchy(schedule.stops);
        Map<String, Stop> stops = hierarchy.getStopAndDescendants(stopId);

        ListMultimap<String, StopTime> stopTimesForTrip = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (StopTime stopTime : schedule.stop_times.values()) {
            if (stopTime.stop_id != null && stops.containsKey(stopTime.stop_id)) {
                stopTimesForTrip.put(stopTime.trip_id, stopTime.clone());
            }
        }

        ListMultimap<String, Trip> tripsForRoute = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        Map<String, Trip> trips = new LinkedHashMap<>();
        for (Trip trip : schedule.trips.values()) {
            if (stopTimesForTrip.containsKey(trip.trip_id)) {
                Trip copy = trip.clone();
                trips.put(copy.trip_id, copy);
                tripsForRoute.put(copy.route_id, copy);
            }
        }
        // A root Schedule may have stop times for trips it does not contain. Those cannot be reached from a route.
        stopTimesForTrip.keySet().retainAll(trips.keySet());

        Map<String, Route> routes = new LinkedHashMap<>();
        for (Route route : schedule.routes.values()) {
            if (tripsForRoute.containsKey(route.route_id)) routes.put(route.route_id, route.clone());
        }

        Schedule projection = new Schedule(stops, routes, trips, stopTimesForTrip);
        LOG.debug("Projected stop {}: {}", stopId, projection);
        return projection;
    }
}
