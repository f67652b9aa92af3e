package com.conveyal.gtfsnav.error;

/** Thrown when a remote GTFS feed cannot be retrieved. */
public class FeedFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    public final String url;

    public FeedFetchException(String url, String message) {
        super(String.format("Could not fetch %s: %s", url, message));
        this.url = url;
    }

    public FeedFetchException(String url, Throwable cause) {
        super(String.format("Could not fetch %s: %s", url, cause.getMessage()), cause);
        this.url = url;
    }
}
