package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandErrorType;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.conveyal.gtfsnav.navigation.ScheduleNode;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * The trips collection. Trips are not navigated into; a selected trip can only be reported on, with "info" for its
 * attributes or "stoptimes" for its stop times in stop_sequence order.
 */
public class TripsCommandInterpreter extends EntityCollectionInterpreter<Trip> {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    public TripsCommandInterpreter(ScheduleNode node, PrintStream out) {
        super(node, out);
    }

    @Override
    protected String getLabel() {
        return "Trips";
    }

    @Override
    protected Map<String, Trip> getEntities() {
        return node.schedule.trips;
    }

    @Override
    protected String describe(Trip trip) {
        String name = trip.getName();
        return name == null ? "Unnamed Trip" : name;
    }

    @Override
    protected void interpretEntity(String tripId, CommandPath rest) throws CommandException {
        try {
            interpretTripCommand(node.schedule.trips.get(tripId), rest);
        } catch (CommandException e) {
            throw new CommandException(CommandErrorType.ERROR_EXECUTING_COMMAND_FOR_TRIP, tripId, e);
        }
    }

    private void interpretTripCommand(Trip trip, CommandPath command) throws CommandException {
        if (command.isEmpty()) throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, trip.trip_id);
        switch (command.first()) {
            case "info":
                tripInfo(trip);
                return;
            case "stoptimes":
                stopTimes(trip);
                return;
            default:
                throw new CommandException(CommandErrorType.INVALID_COMMAND, command.toString());
        }
    }

    private void tripInfo(Trip trip) {
        Route route = node.schedule.routes.get(trip.route_id);
        out.println(String.format("Trip %s: %s", trip.trip_id, describe(trip)));
        out.println(String.format("  Route: %s", route == null ? trip.route_id
            : String.format("%s (%s)", trip.route_id, route.getName())));
        out.println(String.format("  Service: %s", trip.service_id));
        if (trip.trip_short_name != null) out.println(String.format("  Short name: %s", trip.trip_short_name));
        if (trip.direction_id != null) out.println(String.format("  Direction: %s", trip.direction_id));
        if (trip.block_id != null) out.println(String.format("  Block: %s", trip.block_id));
        if (trip.shape_id != null) out.println(String.format("  Shape: %s", trip.shape_id));
        out.println(String.format("  Wheelchair accessible: %s", triState(trip.wheelchair_accessible)));
        out.println(String.format("  Bikes allowed: %s", triState(trip.bikes_allowed)));
        out.println(String.format("  Stop times: %d", node.schedule.stop_times.get(trip.trip_id).size()));
    }

    private void stopTimes(Trip trip) {
        List<StopTime> stopTimes = node.schedule.getOrderedStopTimesForTrip(trip.trip_id);
        for (StopTime stopTime : stopTimes) {
            String time = stopTime.getDepartureOrArrivalTime() == null
                ? "unknown stop time"
                : stopTime.getDepartureOrArrivalTime().format(TIME_FORMAT);
            out.println(String.format("%d: %s %s", stopTime.stop_sequence, time, describeLocation(stopTime)));
        }
    }

    private String describeLocation(StopTime stopTime) {
        if (stopTime.stop_id == null) {
            String flexLocation = stopTime.location_group_id != null
                ? stopTime.location_group_id
                : stopTime.location_id;
            return String.format("at location %s", flexLocation);
        }
        Stop stop = node.schedule.stops.get(stopTime.stop_id);
        if (stop == null || stop.getStopName() == null) return String.format("at stop %s", stopTime.stop_id);
        return String.format("at %s (%s)", stop.getStopName(), stopTime.stop_id);
    }

    private static String triState(Boolean value) {
        if (value == null) return "unknown";
        return value ? "yes" : "no";
    }
}
