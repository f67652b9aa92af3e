package com.conveyal.gtfsnav.loader;

import com.conveyal.gtfsnav.Schedule;
import com.conveyal.gtfsnav.error.GTFSLoadException;

/** Something that can produce a complete, validated Schedule. */
public interface FeedLoader {

    Schedule load() throws GTFSLoadException;

}
