package com.conveyal.gtfsnav.projection;

import com.conveyal.gtfsnav.error.ProjectionErrorType;
import com.conveyal.gtfsnav.error.ProjectionException;
import com.conveyal.gtfsnav.model.Stop;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The tree of stops formed by parent_station references: stations at the top, with platforms, entrances, pathway
 * nodes and boarding areas below them. The index from each parent to its children is built in one pass over every
 * stop when this object is constructed. Parent IDs that do not match any stop are still indexed, so that they can be
 * reported.
 */
public class StopHierarchy {

    private final Map<String, Stop> stops;
    private final ListMultimap<String, String> childrenForParent = ArrayListMultimap.create();

    public StopHierarchy(Map<String, Stop> stops) {
        this.stops = stops;
        for (Stop stop : stops.values()) {
            String parent = stop.getParentStation();
            if (parent != null) childrenForParent.put(parent, stop.stop_id);
        }
    }

    /** @return the IDs of the stops whose parent_station is the given ID, in the order they were loaded. */
    public List<String> getChildren(String stopId) {
        return ImmutableList.copyOf(childrenForParent.get(stopId));
    }

    /** @return parent_station values that do not reference any stop_id in the table. */
    public Set<String> getUnresolvedParents() {
        return Sets.difference(childrenForParent.keySet(), stops.keySet()).immutableCopy();
    }

    /**
     * Follow the parent_station chain upward from every stop.
     * @return the ID of a stop that is its own ancestor, or null if the hierarchy has no cycles.
     */
    public String findCycle() {
        Set<String> acyclic = new HashSet<>();
        for (String start : stops.keySet()) {
            Set<String> chain = new HashSet<>();
            String current = start;
            while (current != null && !acyclic.contains(current)) {
                if (!chain.add(current)) return current;
                Stop stop = stops.get(current);
                current = stop == null ? null : stop.getParentStation();
            }
            acyclic.addAll(chain);
        }
        return null;
    }

    /**
     * Collect the given stop and all of its descendants: children, grandchildren and so on. Ancestors are never
     * included. The traversal is depth first, using an explicit stack, and the result is in visiting order.
     *
     * @return copies of the collected stops, keyed on stop_id.
     * @throws ProjectionException NO_SUCH_STOP if the stop does not exist, or ERROR_GETTING_DESCENDANTS wrapping the
     *         path to a child that is missing from the stop table or that was already visited through a cycle.
     */
    public Map<String, Stop> getStopAndDescendants(String stopId) throws ProjectionException {
        Stop root = stops.get(stopId);
        if (root == null) throw new ProjectionException(ProjectionErrorType.NO_SUCH_STOP, stopId);

        Map<String, Stop> descendants = new LinkedHashMap<>();
        // Which stop each visited stop was reached from, used to describe the path to a failure.
        Map<String, String> reachedFrom = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(stopId);
        while (!stack.isEmpty()) {
            String currentId = stack.pop();
            descendants.put(currentId, stops.get(currentId).clone());
            List<String> children = childrenForParent.get(currentId);
            // Push in reverse so children are visited in load order.
            for (int i = children.size() - 1; i >= 0; i--) {
                String childId = children.get(i);
                if (!stops.containsKey(childId)) {
                    throw pathError(new ProjectionException(ProjectionErrorType.NO_SUCH_STOP, childId),
                        currentId, reachedFrom);
                }
                if (descendants.containsKey(childId) || stack.contains(childId)) {
                    throw pathError(new ProjectionException(ProjectionErrorType.STOP_HIERARCHY_CYCLE, childId),
                        currentId, reachedFrom);
                }
                reachedFrom.put(childId, currentId);
                stack.push(childId);
            }
        }
        return descendants;
    }

    /** Wrap a failure found below the given stop once for each stop on the path back up to the root. */
    private static ProjectionException pathError(ProjectionException cause, String parentId,
                                                 Map<String, String> reachedFrom) {
        ProjectionException error = cause;
        for (String id = parentId; id != null; id = reachedFrom.get(id)) {
            error = new ProjectionException(ProjectionErrorType.ERROR_GETTING_DESCENDANTS, id, error);
        }
        return error;
    }
}
