package com.conveyal.gtfsnav;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.io.File;
import java.util.List;

/**
 * Where to read the feed from and what to do with it once loaded. A local file takes precedence over the URL.
 * When commands are given they are run in order and the program exits; otherwise an interactive session starts.
 */
public class NavigatorConfig {

    public static final String DEFAULT_FEED_URL = "https://cdn.mbta.com/MBTA_GTFS.zip";

    public final String feedUrl;
    /** A GTFS zip on the local filesystem, or null to download from feedUrl. */
    public final File localFeed;
    public final List<String> commands;

    public NavigatorConfig(String feedUrl, File localFeed, List<String> commands) {
        this.feedUrl = feedUrl == null ? DEFAULT_FEED_URL : feedUrl;
        this.localFeed = localFeed;
        this.commands = commands == null ? ImmutableList.of() : ImmutableList.copyOf(commands);
    }

    public boolean isInteractive() {
        return commands.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("feedUrl", feedUrl)
                .add("localFeed", localFeed)
                .add("commands", commands)
                .toString();
    }
}
