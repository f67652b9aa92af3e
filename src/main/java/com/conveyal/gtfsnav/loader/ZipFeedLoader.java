package com.conveyal.gtfsnav.loader;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;
import com.conveyal.gtfsnav.model.Entity;
import com.conveyal.gtfsnav.model.Route;
import com.conveyal.gtfsnav.model.Stop;
import com.conveyal.gtfsnav.model.StopTime;
import com.conveyal.gtfsnav.model.Trip;
import com.conveyal.gtfsnav.projection.StopHierarchy;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static com.conveyal.gtfsnav.util.Util.human;

/**
 * Loads the stops, routes, trips and stop_times tables of a GTFS zip file into a Schedule. All four tables are
 * required. Loading stops at the first record that cannot be converted; there is no partial Schedule.
 *
 * Any object registered on the EventBus with {@code @Subscribe} methods taking a {@link TableLoadEvent} is told as
 * each table is opened and finished.
 */
public class ZipFeedLoader implements FeedLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ZipFeedLoader.class);

    private final File file;
    public final EventBus eventBus;

    public ZipFeedLoader(File file) {
        this(file, new EventBus("gtfs-load"));
    }

    public ZipFeedLoader(File file, EventBus eventBus) {
        this.file = file;
        this.eventBus = eventBus;
    }

    @Override
    public Schedule load() throws GTFSLoadException {
        LOG.info("Loading GTFS feed from {}", file);
        try (ZipFile zip = new ZipFile(file)) {
            Map<String, Stop> stops = new LinkedHashMap<>();
            Map<String, Route> routes = new LinkedHashMap<>();
            Map<String, Trip> trips = new LinkedHashMap<>();
            ListMultimap<String, StopTime> stopTimes = MultimapBuilder.linkedHashKeys().arrayListValues().build();

            loadTable(zip, new Stop.Loader(stops));
            checkStopHierarchy(stops);
            loadTable(zip, new Route.Loader(routes));
            loadTable(zip, new Trip.Loader(trips));
            loadTable(zip, new StopTime.Loader(stopTimes));

            Schedule schedule = new Schedule(stops, routes, trips, stopTimes);
            LOG.info("Finished loading {}: {} stops, {} routes, {} trips, {} stop times", file.getName(),
                    human(stops.size()), human(routes.size()), human(trips.size()), human(stopTimes.size()));
            return schedule;
        } catch (IOException e) {
            throw GTFSLoadException.forTable(LoadErrorType.UNREADABLE_FEED, file.getName(), e);
        }
    }

    private void loadTable(ZipFile zip, Entity.Loader<?> loader) throws IOException, GTFSLoadException {
        ZipEntry entry = findEntry(zip, loader.tableFileName);
        if (entry == null) {
            throw GTFSLoadException.forTable(LoadErrorType.MISSING_TABLE, loader.tableFileName, null);
        }
        LOG.info("Loading GTFS table {} from {}", loader.tableName, entry.getName());
        eventBus.post(new TableLoadEvent(loader.tableFileName, TableLoadEvent.Stage.OPENED, entry.getSize()));
        int count;
        try (InputStream inputStream = zip.getInputStream(entry)) {
            count = loader.loadTable(inputStream);
        }
        eventBus.post(new TableLoadEvent(loader.tableFileName, TableLoadEvent.Stage.LOADED, count));
    }

    /** Find a table at the root of the zip, or failing that, nested in a subdirectory. */
    static ZipEntry findEntry(ZipFile zip, String tableFileName) {
        ZipEntry entry = zip.getEntry(tableFileName);
        if (entry != null) return entry;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry e = entries.nextElement();
            if (!e.isDirectory() && e.getName().endsWith("/" + tableFileName)) {
                LOG.warn("Table {} is nested in a subdirectory: {}", tableFileName, e.getName());
                return e;
            }
        }
        return null;
    }

    private static void checkStopHierarchy(Map<String, Stop> stops) throws GTFSLoadException {
        StopHierarchy hierarchy = new StopHierarchy(stops);
        String cycleStopId = hierarchy.findCycle();
        if (cycleStopId != null) {
            Stop stop = stops.get(cycleStopId);
            throw new GTFSLoadException(LoadErrorType.STOP_HIERARCHY_CYCLE, "stops.txt",
                    stop.sourceFileLine, "parent_station", cycleStopId);
        }
        Set<String> unresolved = hierarchy.getUnresolvedParents();
        if (!unresolved.isEmpty()) {
            LOG.warn("{} parent_station values do not reference a stop, e.g. {}", unresolved.size(),
                    unresolved.iterator().next());
        }
    }
}
