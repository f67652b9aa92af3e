package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandErrorType;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.navigation.ScheduleNode;

import java.io.PrintStream;

/**
 * Interprets commands against a whole Schedule: the root of the feed, or a route or stop that has been navigated
 * into. The first segment is "info" or the name of an entity collection, which needs at least one more segment.
 */
public class ScheduleCommandInterpreter implements CommandInterpreter {

    private final ScheduleNode node;
    private final PrintStream out;

    public ScheduleCommandInterpreter(ScheduleNode node, PrintStream out) {
        this.node = node;
        this.out = out;
    }

    @Override
    public void interpret(CommandPath command) throws CommandException {
        if (command.isEmpty()) {
            throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, node.toString());
        }
        CommandPath rest = command.rest();
        switch (command.first()) {
            case "info":
                info();
                return;
            case "stops":
                if (rest.isEmpty()) throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, "stops");
                try {
                    new StopsCommandInterpreter(node, out).interpret(rest);
                } catch (CommandException e) {
                    throw CommandException.wrap(CommandErrorType.STOPS_COMMAND_ERROR, e);
                }
                return;
            case "routes":
                if (rest.isEmpty()) throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, "routes");
                try {
                    new RoutesCommandInterpreter(node, out).interpret(rest);
                } catch (CommandException e) {
                    throw CommandException.wrap(CommandErrorType.ROUTES_COMMAND_ERROR, e);
                }
                return;
            case "trips":
                if (rest.isEmpty()) throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, "trips");
                try {
                    new TripsCommandInterpreter(node, out).interpret(rest);
                } catch (CommandException e) {
                    throw CommandException.wrap(CommandErrorType.TRIPS_COMMAND_ERROR, e);
                }
                return;
            default:
                throw new CommandException(CommandErrorType.INVALID_COMMAND, command.toString());
        }
    }

    private void info() {
        if (!node.isRoot()) out.println(node.getHeader());
        out.println(node.schedule.getSummary());
    }
}
