package com.conveyal.gtfsnav.loader;

/**
 * Posted to the loader's EventBus as each GTFS table is read. OPENED carries the uncompressed size of the zip entry
 * in bytes (or -1 if the archive does not record it), LOADED carries the number of records read.
 */
public class TableLoadEvent {

    public enum Stage { OPENED, LOADED }

    public final String tableFileName;
    public final Stage stage;
    public final long value;

    public TableLoadEvent(String tableFileName, Stage stage, long value) {
        this.tableFileName = tableFileName;
        this.stage = stage;
        this.value = value;
    }

    @Override
    public String toString() {
        return String.format("%s %s (%d)", tableFileName, stage, value);
    }
}
