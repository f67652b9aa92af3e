package com.conveyal.gtfsnav.navigation;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.error.ProjectionException;
import com.conveyal.gtfsnav.projection.ScheduleProjector;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One position in a navigation from the whole feed down to a route or stop. Each node owns the Schedule projected
 * for it: the projection holds copies of the parent's entities and shares no collections with the parent's Schedule.
 * Nodes are never modified: navigating into an entity creates a new child node.
 *
 * The parent reference is for looking back up the path (e.g. to describe where a node is); it is never used to
 * modify the parent. Because of it, a node keeps all of its ancestors and their Schedules reachable. Code that only
 * needs a node's own data should hold its {@link #schedule} rather than the node.
 */
public class ScheduleNode {

    public final Schedule schedule;
    public final ScheduleNode parent;
    public final NodeType nodeType;
    /** The route or stop ID this node was selected by, or the empty string for the root. */
    public final String nodeId;
    /** The display name of the selected route or stop, or null for the root and for unnamed stops. */
    public final String nodeName;

    private ScheduleNode(Schedule schedule, ScheduleNode parent, NodeType nodeType, String nodeId, String nodeName) {
        this.schedule = schedule;
        this.parent = parent;
        this.nodeType = nodeType;
        this.nodeId = nodeId;
        this.nodeName = nodeName;
    }

    /** The top of a navigation, holding the entire loaded feed. */
    public static ScheduleNode root(Schedule schedule) {
        return new ScheduleNode(schedule, null, NodeType.ROOT, "", null);
    }

    /**
     * Create a child node holding this node's Schedule projected onto the given route.
     * @throws ProjectionException if the route is not in this node's Schedule. No node is created in that case.
     */
    public ScheduleNode forRoute(String routeId) throws ProjectionException {
        Schedule projection = ScheduleProjector.projectByRoute(schedule, routeId);
        String name = schedule.routes.get(routeId).getName();
        return new ScheduleNode(projection, this, NodeType.ROUTE, routeId, name);
    }

    /**
     * Create a child node holding this node's Schedule projected onto the given stop and its descendants.
     * @throws ProjectionException if the stop is not in this node's Schedule or its hierarchy is corrupt.
     */
    public ScheduleNode forStop(String stopId) throws ProjectionException {
        Schedule projection = ScheduleProjector.projectByStop(schedule, stopId);
        String name = schedule.stops.get(stopId).getStopName();
        return new ScheduleNode(projection, this, NodeType.STOP, stopId, name);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** A one-line description of this node, e.g. "Route 1: Red Line", or "Feed" for the root. */
    public String getHeader() {
        switch (nodeType) {
            case ROUTE:
                return String.format("Route %s: %s", nodeId, nodeName);
            case STOP:
                return String.format("Stop %s: %s", nodeId, nodeName == null ? "Unnamed Location" : nodeName);
            default:
                return "Feed";
        }
    }

    /** The navigation path from the root to this node as a command prefix, e.g. "stops.A.routes.1". */
    public String getPath() {
        Deque<String> segments = new ArrayDeque<>();
        for (ScheduleNode node = this; node.parent != null; node = node.parent) {
            segments.push(node.nodeId);
            segments.push(node.nodeType == NodeType.ROUTE ? "routes" : "stops");
        }
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return isRoot() ? getHeader() : getPath();
    }
}
