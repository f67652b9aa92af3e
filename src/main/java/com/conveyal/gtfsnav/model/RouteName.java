package com.conveyal.gtfsnav.model;

import java.io.Serializable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A route must have a short name, a long name, or both. Rather than two independently optional strings that could
 * both be missing, a route name is exactly one of these three shapes.
 */
public abstract class RouteName implements Serializable {

    private static final long serialVersionUID = 1L;

    private RouteName() { }

    /** @return the route_short_name, or null if this route only has a long name. */
    public abstract String getShortName();

    /** @return the route_long_name, or null if this route only has a short name. */
    public abstract String getLongName();

    /** The long name if there is one, otherwise the short name. */
    public String getLongOrShortName() {
        return getLongName() != null ? getLongName() : getShortName();
    }

    /**
     * @return the name variant matching which of the two names are present.
     * @throws IllegalArgumentException if both names are null or empty.
     */
    public static RouteName of(String shortName, String longName) {
        boolean hasShort = shortName != null && !shortName.isEmpty();
        boolean hasLong = longName != null && !longName.isEmpty();
        if (hasShort && hasLong) return new LongAndShort(longName, shortName);
        if (hasShort) return new Short(shortName);
        if (hasLong) return new Long(longName);
        throw new IllegalArgumentException("route_short_name or route_long_name is required");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RouteName that = (RouteName) o;
        return Objects.equals(getShortName(), that.getShortName()) &&
            Objects.equals(getLongName(), that.getLongName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getShortName(), getLongName());
    }

    @Override
    public String toString() {
        return getLongOrShortName();
    }

    public static final class Short extends RouteName {
        private static final long serialVersionUID = 1L;
        public final String shortName;

        public Short(String shortName) {
            this.shortName = checkNotNull(shortName);
        }

        @Override public String getShortName() { return shortName; }
        @Override public String getLongName() { return null; }
    }

    public static final class Long extends RouteName {
        private static final long serialVersionUID = 1L;
        public final String longName;

        public Long(String longName) {
            this.longName = checkNotNull(longName);
        }

        @Override public String getShortName() { return null; }
        @Override public String getLongName() { return longName; }
    }

    public static final class LongAndShort extends RouteName {
        private static final long serialVersionUID = 1L;
        public final String longName;
        public final String shortName;

        public LongAndShort(String longName, String shortName) {
            this.longName = checkNotNull(longName);
            this.shortName = checkNotNull(shortName);
        }

        @Override public String getShortName() { return shortName; }
        @Override public String getLongName() { return longName; }
    }
}
