package com.conveyal.gtfsnav.loader;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.TestUtils;
import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;
import com.conveyal.gtfsnav.model.LocationType;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Loads the fixture feeds under src/test/resources.
 */
public class ZipFeedLoaderTest {

    private static Schedule schedule;

    @BeforeAll
    public static void setUpClass() throws IOException, GTFSLoadException {
        String zipFileName = TestUtils.zipFolderFiles("fake-agency");
        schedule = new ZipFeedLoader(new File(zipFileName)).load();
    }

    @Test
    public void loadsAllFourTables() {
        assertThat(schedule.stops.size(), equalTo(8));
        assertThat(schedule.routes.size(), equalTo(3));
        assertThat(schedule.trips.size(), equalTo(3));
        assertThat(schedule.stop_times.size(), equalTo(7));
    }

    @Test
    public void skipsByteOrderMark() {
        // With the BOM left in place the first header would not be "stop_id" and every stop_id would be missing.
        assertThat(schedule.stops.keySet(), contains("A", "A1", "A2", "A-E", "A-N", "A1-B", "B", "C"));
    }

    @Test
    public void readsEveryLocationVariant() {
        assertThat(schedule.stops.get("A").getLocationType(), equalTo(LocationType.STATION));
        assertThat(schedule.stops.get("A1").getLocationType(), equalTo(LocationType.STOP));
        assertThat(schedule.stops.get("A-E").getLocationType(), equalTo(LocationType.ENTRANCE_EXIT));
        assertThat(schedule.stops.get("A-N").getLocationType(), equalTo(LocationType.GENERIC_NODE));
        assertThat(schedule.stops.get("A1-B").getLocationType(), equalTo(LocationType.BOARDING_AREA));
        // An absent location_type is a plain stop.
        assertThat(schedule.stops.get("C").getLocationType(), equalTo(LocationType.STOP));

        Stop node = schedule.stops.get("A-N");
        assertThat(node.getStopName(), nullValue());
        assertThat(node.getStopLat(), nullValue());
        assertThat(node.getParentStation(), equalTo("A"));
        assertThat(schedule.stops.get("A1-B").getParentStation(), equalTo("A1"));
    }

    @Test
    public void convertsOptionalStopFields() {
        Stop parkStreet = schedule.stops.get("B");
        assertThat(parkStreet.stop_timezone, equalTo(ZoneId.of("America/New_York")));
        assertThat(parkStreet.stop_url.toString(), equalTo("http://example.com/stops/B"));
        assertThat(parkStreet.wheelchair_boarding, nullValue());
        assertThat(schedule.stops.get("A1").wheelchair_boarding, equalTo(true));
        assertThat(schedule.stops.get("A2").wheelchair_boarding, equalTo(false));
        assertThat(parkStreet.sourceFileLine, equalTo(8L));
    }

    @Test
    public void convertsRouteFields() {
        Route red = schedule.routes.get("R1");
        assertThat(red.getName(), equalTo("Red Line"));
        assertThat(red.getDisplayName(), equalTo("Red Line (RL)"));
        assertThat(red.route_color, equalTo("DA291C"));
        assertThat(red.route_sort_order, equalTo(1));
        assertThat(schedule.routes.get("R2").route_color, equalTo("00843D"));
        assertThat(schedule.routes.get("R3").getName(), equalTo("77"));
    }

    @Test
    public void convertsTripFields() {
        Trip t1 = schedule.trips.get("T1");
        assertThat(t1.getName(), equalTo("Alewife"));
        assertThat(t1.wheelchair_accessible, equalTo(true));
        assertThat(t1.bikes_allowed, equalTo(false));
        assertThat(t1.shape_id, nullValue());
        assertThat(schedule.trips.get("T3").getName(), equalTo("77X"));
    }

    @Test
    public void wrapsTimesPastMidnight() {
        StopTime late = schedule.stop_times.get("T2").get(0);
        assertThat(late.arrival_time, equalTo(LocalTime.of(1, 30)));
        StopTime untimed = schedule.stop_times.get("T3").get(1);
        assertThat(untimed.arrival_time, nullValue());
        assertThat(schedule.stop_times.get("T3").get(0).departure_time, equalTo(LocalTime.of(9, 0)));
    }

    @Test
    public void findsTablesInSubdirectory() throws IOException, GTFSLoadException {
        String zipFileName = TestUtils.zipFolderFiles("fake-agency", true);
        Schedule nested = new ZipFeedLoader(new File(zipFileName)).load();
        assertThat(nested.stops.size(), equalTo(schedule.stops.size()));
        assertThat(nested.stop_times.size(), equalTo(schedule.stop_times.size()));
    }

    @Test
    public void postsLoadEvents() throws IOException, GTFSLoadException {
        List<TableLoadEvent> events = new ArrayList<>();
        EventBus eventBus = new EventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void record(TableLoadEvent event) {
                events.add(event);
            }
        });
        new ZipFeedLoader(new File(TestUtils.zipFolderFiles("fake-agency")), eventBus).load();
        assertThat(events, hasSize(8));
        assertThat(events.get(0).tableFileName, equalTo("stops.txt"));
        assertThat(events.get(0).stage, equalTo(TableLoadEvent.Stage.OPENED));
        assertThat(events.get(1).stage, equalTo(TableLoadEvent.Stage.LOADED));
        assertThat(events.get(1).value, equalTo(8L));
        assertThat(events.get(7).tableFileName, equalTo("stop_times.txt"));
        assertThat(events.get(7).value, equalTo(7L));
    }

    @Test
    public void stopTimesKeepTripOrderOfFile() throws IOException, GTFSLoadException {
        Schedule ferry = new ZipFeedLoader(new File(TestUtils.zipFolderFiles("fake-agency-trip-order"))).load();
        assertThat(ferry.stop_times.keySet(), contains("Z9", "A1", "M5"));
        assertThat(ferry.trips.keySet(), contains("Z9", "A1", "M5"));
        assertThat(ferry.stop_times.get("M5").get(0).stop_id, equalTo("S2"));
    }

    @Test
    public void failsOnMissingTable() throws IOException {
        File zip = new File(TestUtils.zipFolderFiles("fake-agency-missing-stop-times"));
        GTFSLoadException e = assertThrows(GTFSLoadException.class, () -> new ZipFeedLoader(zip).load());
        assertThat(e.errorType, equalTo(LoadErrorType.MISSING_TABLE));
        assertThat(e.file, equalTo("stop_times.txt"));
    }

    @Test
    public void failsOnBadRouteType() throws IOException {
        File zip = new File(TestUtils.zipFolderFiles("fake-agency-bad-route-type"));
        GTFSLoadException e = assertThrows(GTFSLoadException.class, () -> new ZipFeedLoader(zip).load());
        assertThat(e.errorType, equalTo(LoadErrorType.ILLEGAL_FIELD_VALUE));
        assertThat(e.file, equalTo("routes.txt"));
        assertThat(e.line, equalTo(3L));
        assertThat(e.field, equalTo("route_type"));
        assertThat(e.getMessage(), containsString("(bad value: '9')"));
    }

    @Test
    public void failsOnStopHierarchyCycle() throws IOException {
        File zip = new File(TestUtils.zipFolderFiles("fake-agency-stop-cycle"));
        GTFSLoadException e = assertThrows(GTFSLoadException.class, () -> new ZipFeedLoader(zip).load());
        assertThat(e.errorType, equalTo(LoadErrorType.STOP_HIERARCHY_CYCLE));
        assertThat(e.line, equalTo(3L));
        assertThat(e.badValue, equalTo("N1"));
    }

    @Test
    public void failsOnFileThatIsNotAZip() throws IOException {
        File notAZip = File.createTempFile("not-a-zip", ".zip");
        notAZip.deleteOnExit();
        Files.writeString(notAZip.toPath(), "stop_id,stop_name\n");
        GTFSLoadException e = assertThrows(GTFSLoadException.class, () -> new ZipFeedLoader(notAZip).load());
        assertThat(e.errorType, equalTo(LoadErrorType.UNREADABLE_FEED));
    }
}
