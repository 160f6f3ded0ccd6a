package com.urbanflux.complaints.output;

import com.opencsv.CSVWriter;
import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.service.RejectedRowSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Writes rows dropped during a run to CSV for later inspection or replay.
 *
 * Output path pattern: {badRowsDir}/bad_rows_{runLabel}.csv
 * e.g. /app/bad_rows/bad_rows_3f2c9a6e-....csv
 *
 * The file is only created once the first row is rejected.
 */
@Component
@RequiredArgsConstructor
public class BadRowWriter {

    static final String[] HEADERS = {
            "stage", "line_number", "reason",
            "unique_key", "created_date", "closed_date", "complaint_type",
            "descriptor", "borough", "latitude", "longitude"
    };

    private final EtlProperties properties;

    public BadRowFile open(String runLabel) {
        Path outputDir = Paths.get(properties.getEtl().getBadRowsDir());
        return new BadRowFile(outputDir.resolve(String.format("bad_rows_%s.csv", runLabel)));
    }

    /**
     * Bad-row file for one run. A write failure disables the file for the rest of the run
     * and is logged; it never fails the run.
     */
    @Slf4j
    public static class BadRowFile implements RejectedRowSink, Closeable {

        private final Path outputPath;
        private CSVWriter writer;
        private boolean disabled;
        private long written;

        BadRowFile(Path outputPath) {
            this.outputPath = outputPath;
        }

        @Override
        public void reject(Stage stage, long lineNumber, String[] fields, String reason) {
            if (disabled) return;
            try {
                if (writer == null) {
                    Files.createDirectories(outputPath.getParent());
                    writer = new CSVWriter(Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8));
                    writer.writeNext(HEADERS);
                }
                writer.writeNext(toRow(stage, lineNumber, fields, reason));
                written++;
            } catch (IOException e) {
                log.warn("Cannot write bad rows to {}, disabling for this run: {}", outputPath, e.getMessage());
                disabled = true;
            }
        }

        public long written() {
            return written;
        }

        public Path path() {
            return outputPath;
        }

        @Override
        public void close() throws IOException {
            if (writer != null) {
                writer.close();
                log.info("Written {} rejected rows to CSV: {}", written, outputPath);
            }
        }

        private static String[] toRow(Stage stage, long lineNumber, String[] fields, String reason) {
            String[] row = new String[HEADERS.length];
            row[0] = stage.name().toLowerCase(Locale.ROOT);
            row[1] = lineNumber > 0 ? String.valueOf(lineNumber) : "";
            row[2] = reason == null ? "" : reason;
            for (int i = 3; i < row.length; i++) {
                int src = i - 3;
                row[i] = src < fields.length && fields[src] != null ? fields[src] : "";
            }
            return row;
        }
    }
}
