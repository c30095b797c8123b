package com.phillippitts.voicedispatch.service.purpleair;

import com.phillippitts.voicedispatch.exception.SensorDataException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fetches sensor reports over HTTP and keeps the last document per sensor in a file cache.
 *
 * <p>The service refuses clients that poll too often and then answers with no data, so a
 * cached document younger than the TTL is served without a request. Cache write failures are
 * logged and the fresh document is still returned.
 */
public class PurpleAirClient {

    private static final Logger LOG = LogManager.getLogger(PurpleAirClient.class);

    /** Performs the HTTP GET; replaceable in tests. */
    @FunctionalInterface
    interface Fetcher {
        String get(URI uri, Duration timeout) throws IOException, InterruptedException;
    }

    static final class HttpClientFetcher implements Fetcher {
        private final HttpClient http;

        HttpClientFetcher(Duration connectTimeout) {
            this.http = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
        }

        @Override
        public String get(URI uri, Duration timeout) throws IOException, InterruptedException {
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("HTTP " + response.statusCode() + " from " + uri);
            }
            return response.body();
        }
    }

    private final String baseUrl;
    private final Duration cacheTtl;
    private final Path cacheDir;
    private final Duration timeout;
    private final Fetcher fetcher;
    private final Clock clock;

    public PurpleAirClient(String baseUrl, Duration cacheTtl, Path cacheDir, Duration timeout) {
        this(baseUrl, cacheTtl, cacheDir, timeout, new HttpClientFetcher(timeout), Clock.systemUTC());
    }

    // Package-private for tests
    PurpleAirClient(String baseUrl, Duration cacheTtl, Path cacheDir, Duration timeout,
                    Fetcher fetcher, Clock clock) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param sensorId sensor to read
     * @return the parsed reading
     * @throws SensorDataException if the document cannot be fetched or parsed
     */
    public SensorReading read(long sensorId) {
        String json = cached(sensorId);
        if (json == null) {
            json = download(sensorId);
            store(sensorId, json);
        }
        try {
            return PurpleAirJsonParser.parse(json);
        } catch (JSONException | NumberFormatException e) {
            throw new SensorDataException(sensorId, "Malformed sensor document", e);
        }
    }

    Path cacheFile(long sensorId) {
        return cacheDir.resolve("voicedispatch_purpleair_" + sensorId + ".json");
    }

    private String cached(long sensorId) {
        Path file = cacheFile(sensorId);
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            if (Duration.between(modified, clock.instant()).compareTo(cacheTtl) >= 0) {
                return null;
            }
            String json = Files.readString(file, StandardCharsets.UTF_8);
            LOG.debug("Using cached sensor document {}", file);
            return json.isBlank() ? null : json;
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable cache file {}: {}", file, e.toString());
            return null;
        }
    }

    private String download(long sensorId) {
        URI uri = URI.create(baseUrl + (baseUrl.contains("?") ? "&" : "?") + "show=" + sensorId);
        LOG.info("Fetching sensor data from {}", uri);
        try {
            return fetcher.get(uri, timeout);
        } catch (IOException e) {
            throw new SensorDataException(sensorId, "Failed to fetch sensor data", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SensorDataException(sensorId, "Interrupted while fetching sensor data", e);
        }
    }

    private void store(long sensorId, String json) {
        Path file = cacheFile(sensorId);
        try {
            Files.createDirectories(cacheDir);
            Files.writeString(file, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Failed to cache sensor document in {}: {}", file, e.toString());
        }
    }
}
