package com.conveyal.gtfsnav.model;

import com.conveyal.gtfsnav.error.GTFSLoadException;
import com.conveyal.gtfsnav.error.LoadErrorType;
import com.csvreader.CsvReader;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Pattern;

import static com.conveyal.gtfsnav.util.Util.human;

/**
 * An abstract base class for all GTFS entities. Once loaded into a Schedule, entities are by convention immutable:
 * the projection engine copies them with {@link #clone()} rather than sharing them between Schedules.
 */
public abstract class Entity implements Cloneable, Serializable {

    private static final long serialVersionUID = -3576441868127607448L;

    /** The one-based line of the CSV file this entity was read from, or zero if it was built in code. */
    public long sourceFileLine;

    /**
     * @return the key this entity is stored under in its Schedule collection. For stop times this is the trip ID,
     * which is not unique on its own.
     */
    public abstract String getId();

    @Override
    public Entity clone() {
        try {
            return (Entity) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Reads one GTFS table from a CSV input stream, converting each row into an entity. Subclasses implement
     * {@link #loadOneRow()} using the typed field getters here, which fail the whole load on the first value that
     * cannot be converted.
     */
    public abstract static class Loader<E extends Entity> {

        private static final Logger LOG = LoggerFactory.getLogger(Loader.class);
        private static final Pattern COLOR_PATTERN = Pattern.compile("[0-9A-Fa-f]{6}");

        public final String tableName;
        public final String tableFileName;

        protected CsvReader reader;
        /** Zero-based index of the current record, not counting the header row. */
        protected long row;
        private int nRecordsLoaded;

        protected Loader(String tableName) {
            this.tableName = tableName;
            this.tableFileName = tableName + ".txt";
        }

        /**
         * Load every record of this table from the supplied stream, which is not closed.
         * @return the number of records loaded.
         */
        public int loadTable(InputStream inputStream) throws IOException, GTFSLoadException {
            // Files must be UTF-8, but the GTFS spec says that "files that include the UTF byte order mark are
            // acceptable".
            InputStream bomInputStream = BOMInputStream.builder().setInputStream(inputStream).get();
            reader = new CsvReader(bomInputStream, ',', StandardCharsets.UTF_8);
            if (!reader.readHeaders()) {
                LOG.warn("Table {} is empty.", tableFileName);
                return 0;
            }
            int headerCount = reader.getHeaderCount();
            nRecordsLoaded = 0;
            while (reader.readRecord()) {
                row = reader.getCurrentRecord();
                if (reader.getColumnCount() != headerCount) {
                    String badValues = String.format("expected=%d; found=%d", headerCount, reader.getColumnCount());
                    throw new GTFSLoadException(LoadErrorType.WRONG_NUMBER_OF_FIELDS, tableFileName,
                            getLineNumber(), null, badValues);
                }
                loadOneRow();
                nRecordsLoaded++;
                if (nRecordsLoaded % 500_000 == 0) LOG.info("Record number {}", human(nRecordsLoaded));
            }
            LOG.info("Loaded {} records from {}", human(nRecordsLoaded), tableFileName);
            return nRecordsLoaded;
        }

        /** Convert the current CSV record into an entity and store it. */
        protected abstract void loadOneRow() throws GTFSLoadException;

        /** The line of the CSV file holding the current record, counting the header as line one. */
        protected long getLineNumber() {
            return row + 2;
        }

        protected GTFSLoadException error(LoadErrorType errorType, String column, String badValue) {
            return new GTFSLoadException(errorType, tableFileName, getLineNumber(), column, badValue);
        }

        protected GTFSLoadException error(LoadErrorType errorType, String column, String badValue, Throwable cause) {
            return new GTFSLoadException(errorType, tableFileName, getLineNumber(), column, badValue, cause);
        }

        /** @return the trimmed field value, or null if the column is absent or the value is empty. */
        protected String getStringField(String column, boolean required) throws GTFSLoadException {
            String str;
            try {
                str = reader.get(column);
            } catch (IOException e) {
                throw error(LoadErrorType.UNREADABLE_FEED, column, null, e);
            }
            if (str == null || str.isEmpty()) {
                if (required) throw error(LoadErrorType.MISSING_FIELD, column, null);
                return null;
            }
            return str;
        }

        protected Integer getIntField(String column, boolean required, int min, int max) throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            int val;
            try {
                val = Integer.parseInt(str);
            } catch (NumberFormatException e) {
                throw error(LoadErrorType.NUMBER_PARSING, column, str, e);
            }
            if (val < min || val > max) throw error(LoadErrorType.NUMBER_OUT_OF_RANGE, column, str);
            return val;
        }

        /** An optional integer field that takes the given value when absent. */
        protected int getIntField(String column, int min, int max, int defaultValue) throws GTFSLoadException {
            Integer val = getIntField(column, false, min, max);
            return val == null ? defaultValue : val;
        }

        protected Double getDoubleField(String column, boolean required, double min, double max)
                throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            double val;
            try {
                val = Double.parseDouble(str);
            } catch (NumberFormatException e) {
                throw error(LoadErrorType.NUMBER_PARSING, column, str, e);
            }
            if (Double.isNaN(val) || val < min || val > max) {
                throw error(LoadErrorType.NUMBER_OUT_OF_RANGE, column, str);
            }
            return val;
        }

        /**
         * Parse a time of day in the format H:MM:SS or HH:MM:SS. Service that runs past midnight is written with
         * hours of 24 or more; those wrap around, so 25:30:00 is read as 01:30.
         */
        protected LocalTime getTimeField(String column, boolean required) throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            String[] fields = str.split(":");
            if (fields.length != 3) throw error(LoadErrorType.TIME_FORMAT, column, str);
            try {
                int h = Integer.parseInt(fields[0]);
                int m = Integer.parseInt(fields[1]);
                int s = Integer.parseInt(fields[2]);
                if (h < 0) throw error(LoadErrorType.TIME_FORMAT, column, str);
                return LocalTime.of(h % 24, m, s);
            } catch (NumberFormatException | DateTimeException e) {
                throw error(LoadErrorType.TIME_FORMAT, column, str, e);
            }
        }

        /** Read a GTFS tri-state: empty or 0 means unknown, 1 means yes and 2 means no. */
        protected Boolean getTriStateField(String column) throws GTFSLoadException {
            Integer val = getIntField(column, false, 0, 2);
            if (val == null || val == 0) return null;
            return val == 1;
        }

        protected URL getUrlField(String column, boolean required) throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            try {
                return new URI(str).toURL();
            } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
                throw error(LoadErrorType.URL_FORMAT, column, str, e);
            }
        }

        protected ZoneId getTimeZoneField(String column, boolean required) throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            try {
                return ZoneId.of(str);
            } catch (DateTimeException e) {
                throw error(LoadErrorType.TIME_ZONE_FORMAT, column, str, e);
            }
        }

        /** @return the six hex digit color, upper-cased, without a leading '#'. */
        protected String getColorField(String column, boolean required) throws GTFSLoadException {
            String str = getStringField(column, required);
            if (str == null) return null;
            if (!COLOR_PATTERN.matcher(str).matches()) throw error(LoadErrorType.COLOR_FORMAT, column, str);
            return str.toUpperCase();
        }
    }
}
