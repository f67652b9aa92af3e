package com.conveyal.gtfsnav.loader;

import com.conveyal.gtfsnav.error.FeedFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Duration;
import java.util.function.LongConsumer;

import static com.conveyal.gtfsnav.util.Util.humanBytes;

/**
 * Downloads a GTFS zip over HTTP into a temporary file. The body is streamed to disk rather than held in memory,
 * and the running total of bytes written is reported to a progress callback after every buffer.
 */
public class FeedFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(FeedFetcher.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final HttpClient client;

    public FeedFetcher() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    public FeedFetcher(HttpClient client) {
        this.client = client;
    }

    /**
     * @param progress receives the cumulative number of bytes downloaded. May be null.
     * @return a temporary file holding the feed, deleted when the JVM exits.
     */
    public File fetch(String url, LongConsumer progress) throws FeedFetchException {
        LOG.info("Fetching GTFS feed from {}", url);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url)).GET().build();
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException(url, e);
        }
        File tempFile = null;
        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200) {
                    throw new FeedFetchException(url, "HTTP " + response.statusCode());
                }
                tempFile = File.createTempFile("gtfs", ".zip");
                tempFile.deleteOnExit();
                long total = copy(body, tempFile, progress);
                LOG.info("Downloaded {} from {}", humanBytes(total), url);
                return tempFile;
            }
        } catch (IOException e) {
            if (tempFile != null && !tempFile.delete()) LOG.warn("Could not delete partial download {}", tempFile);
            throw new FeedFetchException(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException(url, e);
        }
    }

    private static long copy(InputStream in, File file, LongConsumer progress) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(file.toPath())) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
                total += n;
                if (progress != null) progress.accept(total);
            }
        }
        return total;
    }
}
