package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;

import java.net.URL;
import java.util.Map;
import java.util.Objects;

public class Route extends Entity {

    private static final long serialVersionUID = -819444896818029068L;

    public String route_id;
    public String agency_id;
    public RouteName route_name;
    public String route_desc;
    public RouteType route_type;
    public URL    route_url;
    /** Six hex digits, without the leading '#'. */
    public String route_color;
    public String route_text_color;
    public Integer route_sort_order;
    public ContinuityPolicy continuous_pickup;
    public ContinuityPolicy continuous_drop_off;
    public String network_id;

    public Route () { }

    public Route (String route_id, RouteName route_name, RouteType route_type) {
        this.route_id = route_id;
        this.route_name = route_name;
        this.route_type = route_type;
    }

    @Override
    public String getId () {
        return route_id;
    }

    public String getRouteShortName () {
        return route_name.getShortName();
    }

    public String getRouteLongName () {
        return route_name.getLongName();
    }

    /** The name riders know this route by: the long name when there is one, otherwise the short name. */
    public String getName () {
        return route_name.getLongOrShortName();
    }

    /** Both names as "Long (Short)" when the route has both, otherwise whichever one it has. */
    public String getDisplayName () {
        if (route_name.getLongName() != null && route_name.getShortName() != null) {
            return String.format("%s (%s)", route_name.getLongName(), route_name.getShortName());
        }
        return getName();
    }

    @Override
    public Route clone () {
        return (Route) super.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Route route = (Route) o;
        return Objects.equals(route_id, route.route_id) &&
            Objects.equals(agency_id, route.agency_id) &&
            Objects.equals(route_name, route.route_name) &&
            Objects.equals(route_desc, route.route_desc) &&
            route_type == route.route_type &&
            Objects.equals(route_url, route.route_url) &&
            Objects.equals(route_color, route.route_color) &&
            Objects.equals(route_text_color, route.route_text_color) &&
            Objects.equals(route_sort_order, route.route_sort_order) &&
            continuous_pickup == route.continuous_pickup &&
            continuous_drop_off == route.continuous_drop_off &&
            Objects.equals(network_id, route.network_id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(route_id, route_name, route_type);
    }

    public static class Loader extends Entity.Loader<Route> {

        private final Map<String, Route> routes;

        public Loader(Map<String, Route> routes) {
            super("routes");
            this.routes = routes;
        }

        @Override
        protected void loadOneRow() throws GTFSLoadException {
            Route r = new Route();
            r.sourceFileLine = getLineNumber();
            r.route_id   = getStringField("route_id", true);
            r.agency_id  = getStringField("agency_id", false);
            String shortName = getStringField("route_short_name", false);
            String longName = getStringField("route_long_name", false);
            if (shortName == null && longName == null) {
                throw error(LoadErrorType.MISSING_FIELD, "route_short_name", null);
            }
            r.route_name = RouteName.of(shortName, longName);
            r.route_desc = getStringField("route_desc", false);
            int routeType = getIntField("route_type", 0, 12, 0);
            if (!RouteType.isValidCode(routeType)) {
                throw error(LoadErrorType.ILLEGAL_FIELD_VALUE, "route_type", Integer.toString(routeType));
            }
            r.route_type = RouteType.forCode(routeType);
            r.route_url  = getUrlField("route_url", false);
            r.route_color = getColorField("route_color", false);
            r.route_text_color = getColorField("route_text_color", false);
            r.route_sort_order = getIntField("route_sort_order", false, 0, Integer.MAX_VALUE);
            Integer continuousPickup = getIntField("continuous_pickup", false, 0, 3);
            if (continuousPickup != null) r.continuous_pickup = ContinuityPolicy.forCode(continuousPickup);
            Integer continuousDropOff = getIntField("continuous_drop_off", false, 0, 3);
            if (continuousDropOff != null) r.continuous_drop_off = ContinuityPolicy.forCode(continuousDropOff);
            r.network_id = getStringField("network_id", false);
            if (routes.containsKey(r.route_id)) throw error(LoadErrorType.DUPLICATE_ID, "route_id", r.route_id);
            routes.put(r.route_id, r);
        }
    }
}
