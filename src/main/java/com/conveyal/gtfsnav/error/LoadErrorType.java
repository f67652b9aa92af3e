package com.conveyal.gtfsnav.error;

/**
 * The kinds of problem that abort loading a GTFS feed. Anything other than a missing table, an unreadable
 * archive or a broken stop hierarchy is a single record that failed to parse.
 */
public enum LoadErrorType {
    MISSING_TABLE("This table is required by the GTFS specification but is missing."),
    UNREADABLE_FEED("The feed could not be opened or read as a zip archive."),
    WRONG_NUMBER_OF_FIELDS("A row did not have the same number of fields as there are headers in its table."),
    MISSING_FIELD("A required field was missing or empty in a particular row."),
    NUMBER_PARSING("Unable to parse number from value."),
    NUMBER_OUT_OF_RANGE("Number was outside the allowed range."),
    TIME_FORMAT("Time format should be HH:MM:SS."),
    URL_FORMAT("URL format should be <scheme>://<authority><path>?<query>#<fragment>"),
    TIME_ZONE_FORMAT("Time zone should be a valid IANA time zone identifier."),
    COLOR_FORMAT("A color should be specified with six-characters (three two-digit hexadecimal numbers)."),
    DUPLICATE_ID("More than one entity in a table had the same ID."),
    ILLEGAL_FIELD_VALUE("Field value is not one of the values allowed for this field."),
    STOP_HIERARCHY_CYCLE("The parent_station references among stops form a cycle.");

    public final String englishMessage;

    LoadErrorType(String englishMessage) {
        this.englishMessage = englishMessage;
    }
}
