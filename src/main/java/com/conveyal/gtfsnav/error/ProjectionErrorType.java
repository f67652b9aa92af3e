package com.conveyal.gtfsnav.error;

public enum ProjectionErrorType {
    NO_SUCH_ROUTE("No such route"),
    NO_SUCH_STOP("No such stop"),
    ERROR_GETTING_DESCENDANTS("Error getting descendants for stop"),
    STOP_HIERARCHY_CYCLE("Stop hierarchy contains a cycle at stop");

    public final String englishMessage;

    ProjectionErrorType(String englishMessage) {
        this.englishMessage = englishMessage;
    }
}
