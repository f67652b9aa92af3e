package com.conveyal.gtfsnav.command;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A line of navigation input parsed into its dot-separated segments, e.g. "stops.A.routes.list" becomes
 * [stops, A, routes, list]. Each level of the command hierarchy looks at the first segment and hands the rest of
 * the path to the next level. Empty segments (from "stops..list" or a trailing dot) are kept so that they are
 * reported as invalid rather than silently skipped.
 */
public class CommandPath {

    private static final Splitter SPLITTER = Splitter.on('.').trimResults();
    private static final Joiner JOINER = Joiner.on('.');

    private final ImmutableList<String> segments;

    private CommandPath(List<String> segments) {
        this.segments = ImmutableList.copyOf(segments);
    }

    /** Parse one line of input. A blank line gives an empty path. */
    public static CommandPath parse(String line) {
        if (line == null || line.trim().isEmpty()) return new CommandPath(ImmutableList.of());
        return new CommandPath(SPLITTER.splitToList(line.trim()));
    }

    public static CommandPath of(String... segments) {
        return new CommandPath(ImmutableList.copyOf(segments));
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /** @return the segment that selects the action or entity at the current level. */
    public String first() {
        if (segments.isEmpty()) throw new IllegalStateException("Empty command path has no first segment");
        return segments.get(0);
    }

    /** @return everything after the first segment, possibly empty. */
    public CommandPath rest() {
        if (segments.isEmpty()) return this;
        return new CommandPath(segments.subList(1, segments.size()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return segments.equals(((CommandPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return JOINER.join(segments);
    }
}
