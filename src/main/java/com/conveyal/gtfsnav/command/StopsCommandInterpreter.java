package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandErrorType;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.error.ProjectionException;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.navigation.ScheduleNode;

import java.io.PrintStream;
import java.util.Map;

/**
 * The stops collection. Selecting a stop navigates into the Schedule projected onto that stop and everything below
 * it in its station.
 */
public class StopsCommandInterpreter extends EntityCollectionInterpreter<Stop> {

    public StopsCommandInterpreter(ScheduleNode node, PrintStream out) {
        super(node, out);
    }

    @Override
    protected String getLabel() {
        return "Stops";
    }

    @Override
    protected Map<String, Stop> getEntities() {
        return node.schedule.stops;
    }

    @Override
    protected String describe(Stop stop) {
        String name = stop.getStopName();
        return name == null ? "Unnamed Location" : name;
    }

    @Override
    protected void interpretEntity(String stopId, CommandPath rest) throws CommandException {
        ScheduleNode child;
        try {
            child = node.forStop(stopId);
        } catch (ProjectionException e) {
            throw new CommandException(CommandErrorType.ERROR_GETTING_STOP, stopId, e);
        }
        try {
            new ScheduleCommandInterpreter(child, out).interpret(rest);
        } catch (CommandException e) {
            throw new CommandException(CommandErrorType.ERROR_EXECUTING_COMMAND_FOR_STOP, stopId, e);
        }
    }
}
