package com.conveyal.gtfsnav.projection;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.TestUtils.ScheduleBuilder;
import com.conveyal.gtfsnav.error.ProjectionErrorType;
import com.conveyal.gtfsnav.error.ProjectionException;
import org.junit.jupiter.api.Test;

import static com.conveyal.gtfsnav.TestUtils.genericNode;
import static com.conveyal.gtfsnav.TestUtils.platform;
import static com.conveyal.gtfsnav.TestUtils.station;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StopHierarchyTest {

    private static Schedule stationSchedule() {
        return new ScheduleBuilder()
            .stops(
                station("A", "Downtown"),
                platform("A1", "Platform 1", "A"),
                platform("A2", "Platform 2", "A"),
                genericNode("A1-N", "A1"),
                platform("B", "Park Street", null))
            .build();
    }

    @Test
    public void collectsDescendantsDepthFirst() throws ProjectionException {
        StopHierarchy hierarchy = new StopHierarchy(stationSchedule().stops);
        assertThat(hierarchy.getStopAndDescendants("A").keySet(), contains("A", "A1", "A1-N", "A2"));
        assertThat(hierarchy.getStopAndDescendants("A1").keySet(), contains("A1", "A1-N"));
        // Never includes ancestors.
        assertThat(hierarchy.getStopAndDescendants("A1-N").keySet(), contains("A1-N"));
        assertThat(hierarchy.getChildren("A"), contains("A1", "A2"));
        assertThat(hierarchy.getChildren("B"), empty());
    }

    @Test
    public void returnsCopies() throws ProjectionException {
        Schedule schedule = stationSchedule();
        StopHierarchy hierarchy = new StopHierarchy(schedule.stops);
        assertThat(hierarchy.getStopAndDescendants("A").get("A"), not(sameInstance(schedule.stops.get("A"))));
        assertThat(hierarchy.getStopAndDescendants("A").get("A"), equalTo(schedule.stops.get("A")));
    }

    @Test
    public void missingStop() {
        ProjectionException e = assertThrows(ProjectionException.class,
            () -> new StopHierarchy(stationSchedule().stops).getStopAndDescendants("Z"));
        assertThat(e.errorType, equalTo(ProjectionErrorType.NO_SUCH_STOP));
        assertThat(e.entityId, equalTo("Z"));
    }

    @Test
    public void unresolvedParentsAreReported() {
        Schedule schedule = new ScheduleBuilder()
            .stops(platform("P", "Orphan", "GONE"), platform("Q", "Plain", null))
            .build();
        StopHierarchy hierarchy = new StopHierarchy(schedule.stops);
        assertThat(hierarchy.getUnresolvedParents(), containsInAnyOrder("GONE"));
        assertThat(hierarchy.findCycle(), nullValue());
    }

    @Test
    public void cycleIsFoundAndReportedThroughPath() {
        // N1 and N2 are each other's parent.
        Schedule schedule = new ScheduleBuilder()
            .stops(station("A", "Downtown"), genericNode("N1", "N2"), genericNode("N2", "N1"))
            .build();
        StopHierarchy hierarchy = new StopHierarchy(schedule.stops);
        assertThat(hierarchy.findCycle(), equalTo("N1"));

        ProjectionException e = assertThrows(ProjectionException.class,
            () -> hierarchy.getStopAndDescendants("N1"));
        assertThat(e.errorType, equalTo(ProjectionErrorType.ERROR_GETTING_DESCENDANTS));
        ProjectionException innermost = e;
        while (innermost.getCause() != null) innermost = (ProjectionException) innermost.getCause();
        assertThat(innermost.errorType, equalTo(ProjectionErrorType.STOP_HIERARCHY_CYCLE));
        assertThat(innermost.entityId, equalTo("N1"));
        assertThat(e.getMessage(), equalTo("Error getting descendants for stop N1: "
            + "Error getting descendants for stop N2: Stop hierarchy contains a cycle at stop: N1"));
    }
}
