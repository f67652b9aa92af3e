package com.conveyal.gtfsnav.error;

public enum CommandErrorType {
    INVALID_COMMAND("Invalid command"),
    SUBCOMMAND_REQUIRED("Subcommand required"),
    ERROR_GETTING_ROUTE("Error getting route"),
    ERROR_GETTING_STOP("Error getting stop"),
    ERROR_EXECUTING_COMMAND_FOR_TRIP("Error executing command for trip"),
    ERROR_EXECUTING_COMMAND_FOR_ROUTE("Error executing command for route"),
    ERROR_EXECUTING_COMMAND_FOR_STOP("Error executing command for stop"),
    ROUTES_COMMAND_ERROR("Error interpreting routes command"),
    STOPS_COMMAND_ERROR("Error interpreting stops subcommand"),
    TRIPS_COMMAND_ERROR("Error interpreting trips command");

    public final String englishMessage;

    CommandErrorType(String englishMessage) {
        this.englishMessage = englishMessage;
    }
}
