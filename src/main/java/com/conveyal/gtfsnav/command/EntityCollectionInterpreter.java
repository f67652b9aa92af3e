package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandErrorType;
import com.conveyal.gtfsnav.error.CommandException;
import com.conveyal.gtfsnav.model.Entity;
import com.conveyal.gtfsnav.navigation.ScheduleNode;

import java.io.PrintStream;
import java.util.Map;

/**
 * Shared handling of one entity collection (stops, routes or trips) of the current node's Schedule. "list" prints
 * every member, "info" prints how many there are, and any other first segment must be the exact ID of a member,
 * which is handed to {@link #interpretEntity(String, CommandPath)} with the rest of the path. "list" and "info" end
 * the command; anything after them is ignored.
 */
public abstract class EntityCollectionInterpreter<E extends Entity> implements CommandInterpreter {

    protected final ScheduleNode node;
    protected final PrintStream out;

    protected EntityCollectionInterpreter(ScheduleNode node, PrintStream out) {
        this.node = node;
        this.out = out;
    }

    /** The label printed by info, e.g. "Routes". */
    protected abstract String getLabel();

    protected abstract Map<String, E> getEntities();

    /** The name shown after the ID in a listing. */
    protected abstract String describe(E entity);

    protected abstract void interpretEntity(String id, CommandPath rest) throws CommandException;

    @Override
    public void interpret(CommandPath command) throws CommandException {
        if (command.isEmpty()) throw new CommandException(CommandErrorType.SUBCOMMAND_REQUIRED, getLabel());
        switch (command.first()) {
            case "list":
                list();
                return;
            case "info":
                info();
                return;
            default:
                String id = command.first();
                if (!getEntities().containsKey(id)) {
                    throw new CommandException(CommandErrorType.INVALID_COMMAND, command.toString());
                }
                interpretEntity(id, command.rest());
        }
    }

    protected void list() {
        for (E entity : getEntities().values()) {
            out.println(String.format("%s: %s", entity.getId(), describe(entity)));
        }
    }

    protected void info() {
        out.println(String.format("%s: %d", getLabel(), getEntities().size()));
    }
}
