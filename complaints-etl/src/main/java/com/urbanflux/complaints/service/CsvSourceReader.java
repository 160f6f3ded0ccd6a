package com.urbanflux.complaints.service;

import com.urbanflux.complaints.exception.SourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Opens the service request CSV and hands back a {@link CsvChunkReader} over it.
 *
 * Input may be a local path or an http(s) URL such as the NYC Open Data export:
 *   https://data.cityofnewyork.us/api/views/erm2-nwe9/rows.csv?accessType=DOWNLOAD
 *
 * URLs are streamed straight into the CSV reader, never downloaded whole.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CsvSourceReader {

    private static final int BUFFER_SIZE = 65536;

    private final ServiceRequestParser parser;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .build();

    /**
     * @throws SourceException when the input cannot be opened or has no usable header
     */
    public CsvChunkReader open(String input, int chunkSize, RejectedRowSink rejects) {
        if (input == null || input.isBlank()) {
            throw new SourceException("No input path or URL given");
        }

        Reader reader = isUrl(input) ? openUrl(input.trim()) : openFile(input.trim());
        try {
            return new CsvChunkReader(reader, chunkSize, parser, rejects);
        } catch (RuntimeException e) {
            closeQuietly(reader, e);
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Reader openFile(String input) {
        Path path = Path.of(input);
        log.info("Opening CSV file for streaming: {}", path.toAbsolutePath());
        try {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new SourceException("Input file not found: " + path, e);
        } catch (IOException e) {
            throw new SourceException("Cannot open input file " + path + ": " + e.getMessage(), e);
        }
    }

    private Reader openUrl(String url) {
        log.info("Streaming CSV from: {}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMinutes(30))
                .GET()
                .build();

        try {
            HttpResponse<InputStream> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofInputStream());

            if (response.statusCode() != 200) {
                response.body().close();
                throw new SourceException("Failed to open " + url + " - HTTP " + response.statusCode());
            }

            return new BufferedReader(
                    new InputStreamReader(response.body(), StandardCharsets.UTF_8), BUFFER_SIZE);

        } catch (IOException e) {
            throw new SourceException("Cannot open " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException("Interrupted while opening " + url, e);
        }
    }

    private static boolean isUrl(String input) {
        String s = input.trim().toLowerCase(Locale.ROOT);
        return s.startsWith("http://") || s.startsWith("https://");
    }

    private static void closeQuietly(Reader reader, RuntimeException primary) {
        try {
            reader.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
