package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests to verify the conversion of GTFS field values as the entity loaders read them.
 */
public class FieldTests {

    private static InputStream csv(String... lines) {
        return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Stop> loadStops(String... lines) throws IOException, GTFSLoadException {
        Map<String, Stop> stops = new LinkedHashMap<>();
        new Stop.Loader(stops).loadTable(csv(lines));
        return stops;
    }

    private static Map<String, Route> loadRoutes(String... lines) throws IOException, GTFSLoadException {
        Map<String, Route> routes = new LinkedHashMap<>();
        new Route.Loader(routes).loadTable(csv(lines));
        return routes;
    }

    private static ListMultimap<String, StopTime> loadStopTimes(String... lines)
            throws IOException, GTFSLoadException {
        ListMultimap<String, StopTime> stopTimes = ArrayListMultimap.create();
        new StopTime.Loader(stopTimes).loadTable(csv(lines));
        return stopTimes;
    }

    private static GTFSLoadException stopsError(String... lines) {
        return assertThrows(GTFSLoadException.class, () -> loadStops(lines));
    }

    /**
     * Make sure times are read with the hour taken modulo 24 and that malformed times are rejected.
     */
    @Test
    public void timeFieldParseTest() throws IOException, GTFSLoadException {
        String header = "trip_id,arrival_time,departure_time,stop_id,stop_sequence";
        String[] badTimes = {
            "08:00", // only two segments
            "08:00:00:00", // four segments
            "eight:00:00", // not a number
            "08:61:00", // minute out of range
            "-1:00:00" // negative hour
        };
        for (String badTime : badTimes) {
            GTFSLoadException e = assertThrows(GTFSLoadException.class,
                () -> loadStopTimes(header, String.format("T1,%s,,A,1", badTime)));
            assertThat("Error type should be time-related.", e.errorType, equalTo(LoadErrorType.TIME_FORMAT));
            assertThat("Error's bad value should be the input time.", e.badValue, equalTo(badTime));
        }

        ListMultimap<String, StopTime> stopTimes = loadStopTimes(header,
            "T1,7:05:09,07:05:30,A,1",
            "T1,24:00:00,47:59:59,B,2");
        assertThat(stopTimes.get("T1").get(0).arrival_time, equalTo(LocalTime.of(7, 5, 9)));
        assertThat(stopTimes.get("T1").get(1).arrival_time, equalTo(LocalTime.MIDNIGHT));
        assertThat(stopTimes.get("T1").get(1).departure_time, equalTo(LocalTime.of(23, 59, 59)));
    }

    @Test
    public void stopSequenceIsRequiredAndNonNegative() {
        String header = "trip_id,arrival_time,departure_time,stop_id,stop_sequence";
        GTFSLoadException missing = assertThrows(GTFSLoadException.class,
            () -> loadStopTimes(header, "T1,,,A,"));
        assertThat(missing.errorType, equalTo(LoadErrorType.MISSING_FIELD));
        assertThat(missing.field, equalTo("stop_sequence"));
        GTFSLoadException negative = assertThrows(GTFSLoadException.class,
            () -> loadStopTimes(header, "T1,,,A,-1"));
        assertThat(negative.errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
    }

    @Test
    public void flexStopTimeHasNoStop() throws IOException, GTFSLoadException {
        ListMultimap<String, StopTime> stopTimes = loadStopTimes(
            "trip_id,stop_id,location_group_id,stop_sequence,pickup_type,timepoint",
            "T1,,LG1,1,2,0");
        StopTime stopTime = stopTimes.get("T1").get(0);
        assertThat(stopTime.stop_id, nullValue());
        assertThat(stopTime.location_group_id, equalTo("LG1"));
        assertThat(stopTime.pickup_type, equalTo(StopPolicy.PHONE_AGENCY));
        assertThat(stopTime.timepoint, equalTo(Timepoint.APPROXIMATE));
    }

    @Test
    public void triStateFieldParseTest() throws IOException, GTFSLoadException {
        Map<String, Stop> stops = loadStops(
            "stop_id,stop_name,stop_lat,stop_lon,wheelchair_boarding",
            "S0,Zero,1,1,0",
            "S1,One,1,1,1",
            "S2,Two,1,1,2",
            "S3,Empty,1,1,");
        assertThat(stops.get("S0").wheelchair_boarding, nullValue());
        assertThat(stops.get("S1").wheelchair_boarding, equalTo(true));
        assertThat(stops.get("S2").wheelchair_boarding, equalTo(false));
        assertThat(stops.get("S3").wheelchair_boarding, nullValue());

        GTFSLoadException e = stopsError("stop_id,stop_name,stop_lat,stop_lon,wheelchair_boarding", "S,S,1,1,3");
        assertThat(e.errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
    }

    @Test
    public void stopFieldErrors() {
        String header = "stop_id,stop_name,stop_lat,stop_lon,location_type,parent_station,stop_url,stop_timezone";
        assertThat(stopsError(header, "S,Name,1,1,5,,,").errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
        assertThat(stopsError(header, "S,Name,north,1,0,,,").errorType, equalTo(LoadErrorType.NUMBER_PARSING));
        assertThat(stopsError(header, "S,Name,91,1,0,,,").errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
        assertThat(stopsError(header, "S,Name,1,1,0,,not a url,").errorType, equalTo(LoadErrorType.URL_FORMAT));
        assertThat(stopsError(header, "S,Name,1,1,0,,,Mars/Olympus").errorType,
            equalTo(LoadErrorType.TIME_ZONE_FORMAT));
        // A plain stop needs a name and coordinates.
        GTFSLoadException noName = stopsError(header, "S,,1,1,0,,,");
        assertThat(noName.errorType, equalTo(LoadErrorType.MISSING_FIELD));
        assertThat(noName.field, equalTo("stop_name"));
        assertThat(noName.line, equalTo(2L));
        // Entrances, generic nodes and boarding areas need a parent station.
        for (int locationType = 2; locationType <= 4; locationType++) {
            GTFSLoadException noParent = stopsError(header, String.format("S,Name,1,1,%d,,,", locationType));
            assertThat(noParent.errorType, equalTo(LoadErrorType.MISSING_FIELD));
            assertThat(noParent.field, equalTo("parent_station"));
        }
        GTFSLoadException duplicate = stopsError(header, "S,Name,1,1,0,,,", "S,Again,1,1,0,,,");
        assertThat(duplicate.errorType, equalTo(LoadErrorType.DUPLICATE_ID));
        assertThat(duplicate.line, equalTo(3L));
    }

    @Test
    public void stationIgnoresParentStation() throws IOException, GTFSLoadException {
        Map<String, Stop> stops = loadStops(
            "stop_id,stop_name,stop_lat,stop_lon,location_type,parent_station",
            "ST,Station,1,1,1,OTHER");
        assertThat(stops.get("ST").getParentStation(), nullValue());
    }

    @Test
    public void rowWithWrongNumberOfFields() {
        GTFSLoadException e = stopsError("stop_id,stop_name,stop_lat,stop_lon", "S,Name,1");
        assertThat(e.errorType, equalTo(LoadErrorType.WRONG_NUMBER_OF_FIELDS));
    }

    @Test
    public void routeFieldParseTest() throws IOException, GTFSLoadException {
        String header = "route_id,route_short_name,route_long_name,route_type,route_color,route_sort_order";
        Map<String, Route> routes = loadRoutes(header,
            "R0,,Default Type,,,",
            "R11,TB,,11,ffcc00,0");
        assertThat(routes.get("R0").route_type, equalTo(RouteType.TRAM_STREETCAR_LIGHT_RAIL));
        assertThat(routes.get("R11").route_type, equalTo(RouteType.TROLLEYBUS));
        assertThat(routes.get("R11").route_color, equalTo("FFCC00"));

        String[] badColors = { "#FFCC00", "FFCC0", "GGGGGG" };
        for (String badColor : badColors) {
            GTFSLoadException e = assertThrows(GTFSLoadException.class,
                () -> loadRoutes(header, String.format("R,R,,3,%s,", badColor)));
            assertThat(e.errorType, equalTo(LoadErrorType.COLOR_FORMAT));
        }
        GTFSLoadException noName = assertThrows(GTFSLoadException.class, () -> loadRoutes(header, "R,,,3,,"));
        assertThat(noName.errorType, equalTo(LoadErrorType.MISSING_FIELD));
        GTFSLoadException sortOrder = assertThrows(GTFSLoadException.class,
            () -> loadRoutes(header, "R,R,,3,,-2"));
        assertThat(sortOrder.errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
    }

    /**
     * Only the standard route_type codes are loaded. Trolleybus is 11 and monorail is 12, so 8, 9 and 10 are rejected
     * as unknown rather than read as aliases.
     */
    @Test
    public void routeTypeCodes() throws IOException, GTFSLoadException {
        String header = "route_id,route_short_name,route_type";
        int[] accepted = { 0, 1, 2, 3, 4, 5, 6, 7, 11, 12 };
        for (int code : accepted) {
            Route route = loadRoutes(header, String.format("R,R,%d", code)).get("R");
            assertThat(route.route_type, equalTo(RouteType.forCode(code)));
            assertThat(route.route_type.code, equalTo(code));
        }
        for (String illegal : new String[] { "8", "9", "10" }) {
            GTFSLoadException e = assertThrows(GTFSLoadException.class,
                () -> loadRoutes(header, String.format("R,R,%s", illegal)));
            assertThat(e.errorType, equalTo(LoadErrorType.ILLEGAL_FIELD_VALUE));
            assertThat(e.field, equalTo("route_type"));
        }
        for (String outOfRange : new String[] { "13", "-1", "100" }) {
            GTFSLoadException e = assertThrows(GTFSLoadException.class,
                () -> loadRoutes(header, String.format("R,R,%s", outOfRange)));
            assertThat(e.errorType, equalTo(LoadErrorType.NUMBER_OUT_OF_RANGE));
        }
        assertThat(assertThrows(GTFSLoadException.class, () -> loadRoutes(header, "R,R,bus")).errorType,
            equalTo(LoadErrorType.NUMBER_PARSING));
    }

    @Test
    public void tripRequiresRouteAndService() {
        String header = "route_id,service_id,trip_id,shape_id";
        GTFSLoadException e = assertThrows(GTFSLoadException.class,
            () -> new Trip.Loader(new LinkedHashMap<>()).loadTable(csv(header, "R1,,T1,")));
        assertThat(e.errorType, equalTo(LoadErrorType.MISSING_FIELD));
        assertThat(e.field, equalTo("service_id"));
        assertThat(e.getMessage(), equalTo("trips.txt line 2, field 'service_id': " + LoadErrorType.MISSING_FIELD.englishMessage));
    }
}
