package com.urbanflux.complaints.service;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvMultilineLimitBrokenException;
import com.opencsv.exceptions.CsvValidationException;
import com.urbanflux.complaints.exception.EtlException;
import com.urbanflux.complaints.exception.SourceException;
import com.urbanflux.complaints.model.Chunk;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.RawServiceRequest;
import com.urbanflux.complaints.model.ServiceRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass sequence of {@link Chunk}s over a CSV source.
 *
 * Only the current row and the chunk being filled are held in memory. Rows that cannot be
 * split into fields or fail {@link ServiceRequestParser} are counted as parse errors and
 * dropped; they never end the stream. A quoted field left open is cut off after
 * {@link #MAX_LINES_PER_RECORD} lines or at end of source, whichever comes first; the line it
 * started on is dropped and reading resumes on the line after it. A chunk is emitted when it holds chunkSize records,
 * or at end of source when it holds at least one. Counters for trailing rows that produced
 * no record are available from {@link #remainder()} once the iterator is exhausted.
 *
 * Not restartable and not thread-safe.
 */
@Slf4j
public class CsvChunkReader implements Iterator<Chunk>, Closeable {

    static final String COL_UNIQUE_KEY     = "unique_key";
    static final String COL_CREATED_DATE   = "created_date";
    static final String COL_CLOSED_DATE    = "closed_date";
    static final String COL_COMPLAINT_TYPE = "complaint_type";
    static final String COL_DESCRIPTOR     = "descriptor";
    static final String COL_BOROUGH        = "borough";
    static final String COL_LATITUDE       = "latitude";
    static final String COL_LONGITUDE      = "longitude";

    private static final List<String> REQUIRED_COLUMNS =
            List.of(COL_UNIQUE_KEY, COL_CREATED_DATE, COL_COMPLAINT_TYPE);

    static final int MAX_LINES_PER_RECORD = 20;
    private static final int MAX_RECORD_CHARS = 1 << 20;

    private final BufferedReader source;
    private CSVReader csv;
    private final int chunkSize;
    private final ServiceRequestParser parser;
    private final RejectedRowSink rejects;

    private final Map<String, Integer> columns;
    private final int headerWidth;

    private final EtlStats remainder = EtlStats.empty();
    private Chunk next;
    private boolean exhausted;
    private long lineNumber;
    private int chunksEmitted;

    public CsvChunkReader(Reader source, int chunkSize, ServiceRequestParser parser, RejectedRowSink rejects) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.source = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        this.csv = csvOver(this.source);
        this.chunkSize = chunkSize;
        this.parser = parser;
        this.rejects = rejects;

        String[] header = readHeader();
        this.headerWidth = header == null ? 0 : header.length;
        this.columns = header == null ? Map.of() : indexColumns(header);
        this.exhausted = header == null;
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            next = fill();
        }
        return next != null;
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("CSV source exhausted");
        }
        Chunk chunk = next;
        next = null;
        return chunk;
    }

    /** Counters for rows after the last emitted chunk that yielded no record. */
    public EtlStats remainder() {
        return remainder.copy();
    }

    @Override
    public void close() throws IOException {
        source.close();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Chunk fill() {
        List<ServiceRequest> records = new ArrayList<>(Math.min(chunkSize, 1024));
        EtlStats stats = EtlStats.empty();

        while (records.size() < chunkSize) {
            String[] row = readRow(stats);
            if (row == null) {
                exhausted = true;
                break;
            }
            if (isBlankLine(row)) continue;

            stats.setRowsRead(stats.getRowsRead() + 1);
            lineNumber++;

            if (row.length != headerWidth) {
                reject(stats, row, String.format("expected %d fields, found %d", headerWidth, row.length));
                continue;
            }

            try {
                records.add(parser.parse(toRaw(row)));
                stats.setRowsParsed(stats.getRowsParsed() + 1);
            } catch (EtlException e) {
                reject(stats, row, e.getMessage());
            }
        }

        if (records.isEmpty()) {
            remainder.merge(stats);
            log.debug("End of source, {} trailing rows without a record", stats.getRowsRead());
            return null;
        }

        chunksEmitted++;
        log.debug("Chunk {} complete: {} records, {} rows read, {} parse errors",
                chunksEmitted, records.size(), stats.getRowsRead(), stats.getParseErrors());
        return new Chunk(records, stats);
    }

    private String[] readRow(EtlStats stats) {
        while (true) {
            try {
                source.mark(MAX_RECORD_CHARS);
                return csv.readNext();
            } catch (CsvValidationException e) {
                countUnreadable(stats, new String[0], e.getMessage());
            } catch (CsvMalformedLineException | CsvMultilineLimitBrokenException e) {
                countUnreadable(stats, new String[] {skipBrokenLine()}, e.getMessage());
            } catch (IOException e) {
                throw new SourceException("CSV source read failed after line " + lineNumber, e);
            }
        }
    }

    private void countUnreadable(EtlStats stats, String[] row, String reason) {
        stats.setRowsRead(stats.getRowsRead() + 1);
        stats.setParseErrors(stats.getParseErrors() + 1);
        lineNumber++;
        log.warn("CSV decode error near line {}: {}", lineNumber, reason);
        rejects.reject(RejectedRowSink.Stage.PARSE, lineNumber, row, reason);
    }

    /**
     * Rewinds to the start of the broken record, drops its first line and restarts the
     * parser on the next one. The old parser still holds the open quote so it is discarded.
     */
    private String skipBrokenLine() {
        try {
            source.reset();
            String dropped = source.readLine();
            csv = csvOver(source);
            return dropped == null ? "" : dropped;
        } catch (IOException e) {
            throw new SourceException("Cannot resume CSV source after malformed line " + (lineNumber + 1), e);
        }
    }

    private void reject(EtlStats stats, String[] row, String reason) {
        stats.setParseErrors(stats.getParseErrors() + 1);
        log.warn("Skipping line {}: {}", lineNumber, reason);
        rejects.reject(RejectedRowSink.Stage.PARSE, lineNumber, row, reason);
    }

    private RawServiceRequest toRaw(String[] row) {
        return RawServiceRequest.builder()
                .lineNumber(lineNumber)
                .uniqueKey(field(row, COL_UNIQUE_KEY))
                .createdDate(field(row, COL_CREATED_DATE))
                .closedDate(field(row, COL_CLOSED_DATE))
                .complaintType(field(row, COL_COMPLAINT_TYPE))
                .descriptor(field(row, COL_DESCRIPTOR))
                .borough(field(row, COL_BOROUGH))
                .latitude(field(row, COL_LATITUDE))
                .longitude(field(row, COL_LONGITUDE))
                .build();
    }

    private String field(String[] row, String column) {
        Integer idx = columns.get(column);
        return idx == null ? null : row[idx];
    }

    private String[] readHeader() {
        try {
            String[] header = csv.readNext();
            while (header != null && isBlankLine(header)) {
                header = csv.readNext();
            }
            if (header == null) {
                log.warn("CSV source is empty, no header row");
            }
            return header;
        } catch (CsvValidationException | IOException e) {
            throw new SourceException("Cannot read CSV header: " + e.getMessage(), e);
        }
    }

    // verifyReader calls mark/reset on the stream itself and would discard our mark
    private static CSVReader csvOver(BufferedReader source) {
        return new CSVReaderBuilder(source)
                .withMultilineLimit(MAX_LINES_PER_RECORD)
                .withVerifyReader(false)
                .build();
    }

    /**
     * "Unique Key", "unique_key" and "UNIQUE KEY" all map to unique_key.
     */
    static Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            index.putIfAbsent(normaliseColumn(header[i]), i);
        }
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !index.containsKey(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new SourceException("CSV header is missing required columns " + missing);
        }
        return index;
    }

    static String normaliseColumn(String name) {
        if (name == null) return "";
        return name.replace("\uFEFF", "")
                .trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
    }

    private static boolean isBlankLine(String[] row) {
        return row.length == 0 || (row.length == 1 && (row[0] == null || row[0].isBlank()));
    }
}
