package com.conveyal.gtfsnav.command;

import com.conveyal.gtfsnav.error.CommandException;

/**
 * Interprets a command path at one level of the navigation hierarchy. Reports are written to the interpreter's
 * output stream; failures are thrown, never printed.
 */
public interface CommandInterpreter {

    void interpret(CommandPath command) throws CommandException;

}
