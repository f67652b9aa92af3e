package com.conveyal.gtfsnav.error;

/**
 * Signals that a Schedule could not be projected onto a route or stop. Only a missing selector or a corrupt stop
 * hierarchy produces one of these; a selector that reaches nothing yields an empty projection instead.
 */
public class ProjectionException extends Exception {

    private static final long serialVersionUID = 1L;

    public final ProjectionErrorType errorType;
    /** The route or stop id the error is about. */
    public final String entityId;

    public ProjectionException(ProjectionErrorType errorType, String entityId) {
        this(errorType, entityId, null);
    }

    public ProjectionException(ProjectionErrorType errorType, String entityId, ProjectionException cause) {
        super(errorType.englishMessage, cause);
        this.errorType = errorType;
        this.entityId = entityId;
    }

    @Override
    public String getMessage() {
        if (getCause() == null) return String.format("%s: %s", errorType.englishMessage, entityId);
        return String.format("%s %s: %s", errorType.englishMessage, entityId, getCause().getMessage());
    }
}
