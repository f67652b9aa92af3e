package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandErrorType;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.error.ProjectionException;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.navigation.ScheduleNode;
import com.conveyal.gtfsnav.stats.RailLineStats;

import java.io.PrintStream;
import java.util.Map;

/**
 * The routes collection. Selecting a route navigates into the Schedule projected onto that route. "rail" prints the
 * rail line report for the current Schedule and is matched before route IDs.
 */
public class RoutesCommandInterpreter extends EntityCollectionInterpreter<Route> {

    public RoutesCommandInterpreter(ScheduleNode node, PrintStream out) {
        super(node, out);
    }

    @Override
    public void interpret(CommandPath command) throws CommandException {
        if (!command.isEmpty() && "rail".equals(command.first())) {
            new RailLineStats(node.schedule).print(out);
            return;
        }
        super.interpret(command);
    }

    @Override
    protected String getLabel() {
        return "Routes";
    }

    @Override
    protected Map<String, Route> getEntities() {
        return node.schedule.routes;
    }

    @Override
    protected String describe(Route route) {
        return route.getDisplayName();
    }

    @Override
    protected void interpretEntity(String routeId, CommandPath rest) throws CommandException {
        ScheduleNode child;
        try {
            child = node.forRoute(routeId);
        } catch (ProjectionException e) {
            throw new CommandException(CommandErrorType.ERROR_GETTING_ROUTE, routeId, e);
        }
        try {
            new ScheduleCommandInterpreter(child, out).interpret(rest);
        } catch (CommandException e) {
            throw new CommandException(CommandErrorType.ERROR_EXECUTING_COMMAND_FOR_ROUTE, routeId, e);
        }
    }
}
