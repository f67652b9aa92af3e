package com.conveyal.gtfsnav.error;

/**
 * Thrown when a GTFS feed cannot be turned into a Schedule. Loading is all or nothing: the first table that is
 * missing or the first record that fails to parse stops the load.
 */
public class GTFSLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    public final LoadErrorType errorType;
    /** The table file name, e.g. stops.txt, or null when the problem is not specific to one table. */
    public final String file;
    /** One-based line number in the CSV file, or -1. */
    public final long line;
    public final String field;
    public final String badValue;

    public GTFSLoadException(LoadErrorType errorType, String file, long line, String field, String badValue,
                             Throwable cause) {
        super(errorType.englishMessage, cause);
        this.errorType = errorType;
        this.file = file;
        this.line = line;
        this.field = field;
        this.badValue = badValue;
    }

    public GTFSLoadException(LoadErrorType errorType, String file, long line, String field, String badValue) {
        this(errorType, file, line, field, badValue, null);
    }

    public static GTFSLoadException forTable(LoadErrorType errorType, String file, Throwable cause) {
        return new GTFSLoadException(errorType, file, -1, null, null, cause);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (file != null) {
            sb.append(file);
            if (line >= 0) {
                sb.append(" line ");
                sb.append(line);
            }
            if (field != null) {
                sb.append(", field '");
                sb.append(field);
                sb.append('\'');
            }
            sb.append(": ");
        }
        sb.append(errorType.englishMessage);
        if (badValue != null) {
            sb.append(" (bad value: '");
            sb.append(badValue);
            sb.append("')");
        }
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(" Caused by: ");
            sb.append(getCause().getMessage());
        }
        return sb.toString();
    }
}
